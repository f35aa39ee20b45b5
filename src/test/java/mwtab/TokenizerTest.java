package mwtab;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenizerTest {

    @Test
    void tokenize_headerLine_yieldsHeaderFields() {
        var tokens = Tokenizer.tokenizeAll("#METABOLOMICS WORKBENCH STUDY_ID:ST000001 ANALYSIS_ID:AN000001 PROJECT_ID:PR000001");

        assertEquals(Token.Type.SECTION_START, tokens.get(0).getType());
        assertEquals(MwTabDocument.HEADER, tokens.get(0).getName());
        assertEquals("STUDY_ID", tokens.get(1).getKey());
        assertEquals("ST000001", tokens.get(1).getValue());
        assertEquals("AN000001", tokens.get(2).getValue());
        assertEquals("PROJECT_ID", tokens.get(3).getKey());
        assertEquals("PR000001", tokens.get(3).getValue());
    }

    @Test
    void tokenize_withoutEndMarker_stillEndsWithEndOfFile() {
        var tokens = Tokenizer.tokenizeAll("#METABOLOMICS WORKBENCH STUDY_ID:ST000001\nVERSION\t1\n#PROJECT\nPR:PROJECT_TITLE\tTitle");

        assertEquals(Token.Type.END_OF_FILE, tokens.get(tokens.size() - 1).getType());
        assertEquals(Token.Type.END_OF_SECTION, tokens.get(tokens.size() - 2).getType());
    }

    @Test
    void tokenize_emptyText_yieldsOnlyTerminators() {
        var tokens = Tokenizer.tokenizeAll("");

        assertEquals(2, tokens.size());
        assertEquals(Token.Type.END_OF_FILE, tokens.get(1).getType());
    }

    @Test
    void tokenize_prefixedKey_dropsSectionPrefix() {
        var tokens = Tokenizer.tokenizeAll("#PROJECT\nPR:PROJECT_TITLE                 \tLiver study");
        var item = find(tokens, Token.Type.KEY_VALUE);

        assertEquals("PROJECT_TITLE", item.getKey());
        assertEquals("Liver study", item.getValue());
    }

    @Test
    void tokenize_unitsLine_usesUnitsKey() {
        var tokens = Tokenizer.tokenizeAll("#MS_METABOLITE_DATA\nMS_METABOLITE_DATA:UNITS         \tPeak area");
        var item = find(tokens, Token.Type.KEY_VALUE);

        assertEquals(DataSection.UNITS, item.getKey());
        assertEquals("Peak area", item.getValue());
    }

    @Test
    void tokenize_subjectSampleFactors_splitsFactorsAndAdditionalData() {
        var line = "SUBJECT_SAMPLE_FACTORS           \tM1\tS001\tTreatment:Control | Time:0\tRAW_FILE_NAME=S001.raw; Weight=21";
        var tokens = Tokenizer.tokenizeAll("#SUBJECT_SAMPLE_FACTORS:         \theader\n" + line);
        var row = find(tokens, Token.Type.SUBJECT_SAMPLE_FACTORS);

        assertEquals("M1", row.getSubjectId());
        assertEquals("S001", row.getSampleId());
        assertEquals(List.of("Treatment", "Time"), row.getFactors().keys());
        assertEquals("0", row.getFactors().get("Time"));
        assertEquals("21", row.getAdditionalData().get("Weight"));
    }

    @Test
    void tokenize_subjectSampleFactorsWithoutAdditionalData_leavesItNull() {
        var tokens = Tokenizer.tokenizeAll("SUBJECT_SAMPLE_FACTORS           \t-\tS001\tGroup:A\t");
        var row = find(tokens, Token.Type.SUBJECT_SAMPLE_FACTORS);

        assertNull(row.getAdditionalData());
    }

    @Test
    void tokenize_factorWithExtraColon_throws() {
        var error = assertThrows(TokenizeException.class,
                () -> Tokenizer.tokenizeAll("SUBJECT_SAMPLE_FACTORS           \t-\tS001\tGroup:A:B"));

        assertEquals(1, error.getLineNumber());
        assertTrue(error.getMessage().contains("'Group:A:B'"));
    }

    @Test
    void tokenize_dataBlock_yieldsRowsBetweenMarkers() {
        var tokens = Tokenizer.tokenizeAll("#MS_METABOLITE_DATA\nMS_METABOLITE_DATA_START\nSamples\tS001\t\"S002\"\n"
                + "alanine\t1.5\t2.5\nMS_METABOLITE_DATA_END\n#END");

        var start = find(tokens, Token.Type.DATA_START);
        assertEquals("MS_METABOLITE_DATA", start.getName());
        var header = find(tokens, Token.Type.KEY_VALUE_LIST);
        assertEquals(List.of("Samples", "S001", "S002"), header.getValues());
        assertEquals("MS_METABOLITE_DATA", find(tokens, Token.Type.DATA_END).getName());
    }

    @Test
    void tokenize_valueEndingWithStartSuffix_isNotABlockMarker() {
        var tokens = Tokenizer.tokenizeAll("#PROJECT\nPR:PROJECT_TITLE\tsee RUN_START\n#STUDY\nST:STUDY_TITLE\tFasting");

        assertEquals("see RUN_START", find(tokens, Token.Type.KEY_VALUE).getValue());
        assertEquals(0, count(tokens, Token.Type.DATA_START));
        assertEquals(2, count(tokens, Token.Type.SECTION_START));
    }

    @Test
    void tokenize_rowEndingWithEndSuffix_staysInsideBlock() {
        var tokens = Tokenizer.tokenizeAll("#MS_METABOLITE_DATA\nMS_METABOLITE_DATA_START\nSamples\tS001\n"
                + "alanine\tBATCH_END\nglycine\t2.0\nMS_METABOLITE_DATA_END\n#END");

        assertEquals(3, count(tokens, Token.Type.KEY_VALUE_LIST));
        assertEquals(1, count(tokens, Token.Type.DATA_END));
        assertEquals(6, find(tokens, Token.Type.DATA_END).getLineNumber());
    }

    @Test
    void tokenize_unclosedBlock_throwsWithOpeningLine() {
        var error = assertThrows(TokenizeException.class,
                () -> Tokenizer.tokenizeAll("#METABOLITES\nMETABOLITES_START\nmetabolite_name\tkegg_id\nalanine\tC00041"));

        assertEquals(2, error.getLineNumber());
    }

    @Test
    void tokenize_lineWithoutTab_throws() {
        var error = assertThrows(TokenizeException.class, () -> Tokenizer.tokenizeAll("#PROJECT\nPR:PROJECT_TITLE Liver"));

        assertEquals(2, error.getLineNumber());
        assertEquals("PR:PROJECT_TITLE Liver", error.getLine());
    }

    @Test
    void tokenize_isLazy() {
        var tokens = Tokenizer.tokenize("#PROJECT\nPR:PROJECT_TITLE\tLiver\nbroken line");

        assertEquals(Token.Type.END_OF_SECTION, tokens.next().getType());
        assertEquals(Token.Type.SECTION_START, tokens.next().getType());
        assertEquals(Token.Type.KEY_VALUE, tokens.next().getType());
        assertThrows(TokenizeException.class, tokens::next);
    }

    private static int count(List<Token> tokens, Token.Type type) {
        int count = 0;
        for (Token token : tokens) {
            if (token.getType() == type) {
                count++;
            }
        }
        return count;
    }

    private static Token find(List<Token> tokens, Token.Type type) {
        for (Token token : tokens) {
            if (token.getType() == type) {
                return token;
            }
        }
        throw new AssertionError("No " + type + " token");
    }
}

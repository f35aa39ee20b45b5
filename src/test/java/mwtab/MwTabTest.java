package mwtab;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MwTabTest {

    private final MwTab mwTab = new MwTab();

    @Test
    void build_sniffsTextAndJson() throws Exception {
        var text = Files.readString(Paths.get(DocumentBuilderTest.MS_FILE));
        var fromText = mwTab.build("txt", text);
        var fromJson = mwTab.build("json", mwTab.writeString(fromText, MwTabDocument.FORMAT_JSON));

        assertEquals(MwTabDocument.FORMAT_MWTAB, fromText.getInputFormat());
        assertEquals(MwTabDocument.FORMAT_JSON, fromJson.getInputFormat());
        assertEquals("json", fromJson.getSource());
    }

    @Test
    void build_windowsLineEndingsAndBlankLines_areAccepted() throws Exception {
        var text = Files.readString(Paths.get(DocumentBuilderTest.MS_FILE));
        var doc = mwTab.build("crlf", text.replace("\n", "\r\n\r\n"));

        assertTrue(doc.sameContent(mwTab.build("lf", text)));
    }

    @Test
    void build_tokenizeError_reportsLineOfOriginalText() {
        var text = "#METABOLOMICS WORKBENCH STUDY_ID:ST000001\n\n  \n\n#PROJECT\nPR:PROJECT_TITLE no tab here\n#END";

        var error = assertThrows(TokenizeException.class, () -> mwTab.build("blank-lines", text));

        assertEquals(6, error.getLineNumber());
        assertEquals("PR:PROJECT_TITLE no tab here", error.getLine());
    }

    @Test
    void build_valuesEndingWithBlockSuffix_surviveTextRoundTrip() throws Exception {
        var text = Files.readString(Paths.get(DocumentBuilderTest.MS_FILE))
                .replace("\tFasting response of mouse liver metabolism\n", "\tFasting response, see RUN_START\n");
        var doc = mwTab.build("suffix", text);
        doc.getItemSection("PROJECT").put("PROJECT_COMMENTS", "Stage STEP_START");

        var rebuilt = mwTab.build("again", mwTab.writeString(doc, MwTabDocument.FORMAT_MWTAB));

        assertEquals("Fasting response, see RUN_START", rebuilt.getItemSection("PROJECT").get("PROJECT_TITLE"));
        assertEquals("Stage STEP_START", rebuilt.getItemSection("PROJECT").get("PROJECT_COMMENTS"));
        assertEquals(3, rebuilt.getDataSection().getMetabolites().getRows().size());
    }

    @Test
    void build_unrecognizedInput_throwsUnknownFormat() {
        assertThrows(UnknownFormatException.class, () -> mwTab.build("empty", ""));
        assertThrows(UnknownFormatException.class, () -> mwTab.build("blank", "  \n\n"));
        assertThrows(UnknownFormatException.class, () -> mwTab.build("csv", "Samples,S001\nalanine,1.0"));
        assertThrows(UnknownFormatException.class, () -> mwTab.build("broken json", "{\"METABOLOMICS WORKBENCH\": "));
    }

    @Test
    void serialize_txtAndMwtab_areTheSameText() throws Exception {
        var doc = mwTab.build("txt", Files.readString(Paths.get(DocumentBuilderTest.MS_FILE)));

        var bytes = mwTab.serialize(doc, MwTab.FORMAT_TXT);

        assertArrayEquals(mwTab.writeString(doc, MwTabDocument.FORMAT_MWTAB).getBytes(StandardCharsets.UTF_8), bytes);
    }

    @Test
    void serialize_unknownFormat_throws() throws Exception {
        var doc = mwTab.build("txt", Files.readString(Paths.get(DocumentBuilderTest.MS_FILE)));

        assertThrows(UnknownFormatException.class, () -> mwTab.serialize(doc, "xml"));
        assertThrows(UnknownFormatException.class, () -> mwTab.writeString(doc, null));
    }

    @Test
    void headerAccessors_updateTheHeaderLine() throws Exception {
        var doc = mwTab.build("txt", Files.readString(Paths.get(DocumentBuilderTest.MS_FILE)));
        doc.setStudyId("ST000777");
        doc.setHeader("#METABOLOMICS WORKBENCH STUDY_ID:ST000777 ANALYSIS_ID:AN000888");

        assertEquals("AN000888", doc.getAnalysisId());
        assertEquals("#METABOLOMICS WORKBENCH STUDY_ID:ST000777 ANALYSIS_ID:AN000888 PROJECT_ID:PR000001", doc.getHeader());
        assertThrows(IllegalArgumentException.class, () -> doc.setHeader("METABOLOMICS WORKBENCH"));
    }
}

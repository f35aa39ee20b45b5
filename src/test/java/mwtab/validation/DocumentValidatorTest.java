package mwtab.validation;

import mwtab.DuplicatesMap;
import mwtab.ItemSection;
import mwtab.MwTab;
import mwtab.MwTabConfig;
import mwtab.MwTabDocument;
import mwtab.SubjectSampleFactor;
import mwtab.Table;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DocumentValidatorTest {

    private static final String MS_FILE = "src/test/resources/mwtab/ST000001_AN000001.txt";

    private final MwTab mwTab = new MwTab();
    private final DocumentValidator validator = new DocumentValidator(MwTabConfig.load());

    @Test
    void validate_cleanDocument_passes() throws Exception {
        var report = validator.validate(load());

        assertTrue(report.isPassing(), report.toText());
        assertEquals("ST000001", report.getStudyId());
        assertEquals(MwTabDocument.FORMAT_MWTAB, report.getFileFormat());
        assertTrue(report.toText().contains("Status: Passing"));
    }

    @Test
    void validate_cleanDocumentReadFromJson_passes() throws Exception {
        var json = mwTab.writeString(load(), MwTabDocument.FORMAT_JSON);

        var report = mwTab.validate(mwTab.build("json", json));

        assertTrue(report.isPassing(), report.toText());
    }

    @Test
    void validate_duplicateSampleId_warnsOnce() throws Exception {
        var doc = load();
        doc.getSubjectSampleFactors().get(1).setSampleId("S001");

        var duplicates = matching(validator.validate(doc), "duplicate Sample ID");

        assertEquals(1, duplicates.size());
        assertEquals(Severity.WARNING, duplicates.get(0).getSeverity());
        assertEquals("SUBJECT_SAMPLE_FACTORS entry #2 has a duplicate Sample ID.", duplicates.get(0).getMessage());
    }

    @Test
    void validate_sampleMissingFromSubjectSampleFactors_isError() throws Exception {
        var doc = load();
        doc.getSubjectSampleFactors().remove(1);

        var missing = matching(validator.validate(doc), "missing sample ID(s)");

        assertEquals(1, missing.size());
        assertTrue(missing.get(0).isError());
        assertEquals(Stage.CROSS_REFERENCE, missing.get(0).getStage());
        assertTrue(missing.get(0).getMessage().endsWith("but not in the SUBJECT_SAMPLE_FACTORS:\n\t\"S002\""));
    }

    @Test
    void validate_extraSubjectWithoutData_isNotFlagged() throws Exception {
        var doc = load();
        doc.getSubjectSampleFactors().add(SubjectSampleFactor.builder()
                .subjectId("M5")
                .sampleId("S005")
                .factors(DuplicatesMap.of("Treatment", "Control"))
                .build());

        assertTrue(validator.validate(doc).isPassing());
    }

    @Test
    void validate_metaboliteOnlyInMetabolitesTable_warnsOnce() throws Exception {
        var doc = load();
        doc.getDataSection().getData().getRows().remove(2);

        var report = validator.validate(doc);
        var absent = matching(report, "were not found in the");

        assertEquals(1, absent.size());
        assertEquals(Severity.WARNING, absent.get(0).getSeverity());
        assertEquals("The following metabolites in the METABOLITES table were not found in the MS_METABOLITE_DATA table:\n\t\"citrate\"",
                absent.get(0).getMessage());
        assertFalse(report.hasErrors(), report.toText());
    }

    @Test
    void validate_columnResemblingStandardName_suggestsRename() throws Exception {
        var text = Files.readString(Paths.get(MS_FILE)).replace("\tretention_time\n", "\trt\n");

        var rename = matching(validator.validate(mwTab.build("rt", text)), "should be renamed");

        assertEquals(1, rename.size());
        assertEquals(Stage.COLUMN_SEMANTICS, rename.get(0).getStage());
        assertTrue(rename.get(0).getMessage().startsWith("The \"rt\" column at position 4 in the METABOLITES table, "
                + "matches a standard column name, \"retention_time\"."));
    }

    @Test
    void validate_badValuesInStandardColumn_areListed() throws Exception {
        var doc = load();
        doc.getDataSection().getMetabolites().getRows().get(0).set("kegg_id", "alanine");

        var bad = matching(validator.validate(doc), "do not match the expected type or format");

        assertEquals(1, bad.size());
        assertTrue(bad.get(0).getMessage().endsWith("The non-matching values are:\n\t\"alanine\""));
    }

    @Test
    void validate_otherIdWithoutType_warnsAboutCompanionAndLumping() throws Exception {
        var doc = load();
        var ids = List.of("X-1", "X-2", "X-3");
        var rows = doc.getDataSection().getMetabolites().getRows();
        for (int i = 0; i < rows.size(); i++) {
            rows.get(i).add("other_id", ids.get(i));
        }

        var report = validator.validate(doc);

        assertEquals(1, matching(report, "implies that another column, \"other_id_type\"").size());
        assertEquals(1, matching(report, "it is recommended to make individual columns").size());
    }

    @Test
    void validate_mixedPolarity_isError() throws Exception {
        var doc = load();
        var values = List.of("positive", "negative", "positive");
        var rows = doc.getDataSection().getMetabolites().getRows();
        for (int i = 0; i < rows.size(); i++) {
            rows.get(i).add("polarity", values.get(i));
        }

        var polarity = matching(validator.validate(doc), "multiple polarities");

        assertEquals(1, polarity.size());
        assertEquals(Stage.POLARITY, polarity.get(0).getStage());
        assertTrue(polarity.get(0).isError());
    }

    @Test
    void validate_missingRequiredKeyAndUnknownKey_areSchemaErrors() throws Exception {
        var doc = load();
        var project = doc.getItemSection("PROJECT");
        project.getItems().remove("EMAIL");
        project.put("PROJECT_COLOR", "blue");

        var report = validator.validate(doc);

        assertEquals(1, matching(report, "The required property, \"EMAIL\", in the \"PROJECT\" section is missing.").size());
        assertEquals(1, matching(report, "Unknown or invalid subsection, \"PROJECT_COLOR\", in the \"PROJECT\" section.").size());
        assertEquals(Finding.Kind.SCHEMA, report.getErrors().get(0).getKind());
    }

    @Test
    void validate_blankRequiredValue_isDistinguishedFromBlankOptionalValue() throws Exception {
        var doc = load();
        doc.getItemSection("PROJECT").put("INSTITUTE", "N/A");
        doc.getItemSection("PROJECT").put("DEPARTMENT", "");

        var report = validator.validate(doc);

        assertEquals(1, matching(report, "\"INSTITUTE\", in the \"PROJECT\" section. A legitimate value should be provided "
                + "for this required subsection.").size());
        assertEquals(1, matching(report, "\"DEPARTMENT\", in the \"PROJECT\" section. Either a legitimate value should be "
                + "provided for this subsection, or it should be removed altogether.").size());
    }

    @Test
    void validate_valuePatterns_areChecked() throws Exception {
        var doc = load();
        doc.getItemSection("PROJECT").put("EMAIL", "nobody");
        doc.getItemSection("ANALYSIS").put("ANALYSIS_TYPE", "GC");
        doc.getItemSection("CHROMATOGRAPHY").put("FLOW_RATE", "fast");

        var report = validator.validate(doc);

        assertEquals(1, matching(report, "\"nobody\", for the subsection, \"EMAIL\", in the \"PROJECT\" section is not a valid email.").size());
        assertEquals(1, matching(report, "\"GC\", for the subsection, \"ANALYSIS_TYPE\", in the \"ANALYSIS\" section is not one of ['MS', 'NMR'].").size());
        assertEquals(1, matching(report, "\"FLOW_RATE\", in the \"CHROMATOGRAPHY\" section should be a number or range").size());
    }

    @Test
    void validate_bothAnalysisSections_isError() throws Exception {
        var doc = load();
        doc.putSection(new ItemSection(MwTabDocument.NM, DuplicatesMap.of("INSTRUMENT_NAME", "Bruker")));

        var report = validator.validate(doc);

        assertEquals(1, matching(report, "Both an \"MS\" and \"NM\" section were found.").size());
        assertEquals(1, matching(report, "Unknown or invalid section, \"NM\".").size());
    }

    @Test
    void validate_noAnalysisSection_assumesMassSpec() throws Exception {
        var doc = load();
        doc.removeSection(MwTabDocument.MS);

        var report = validator.validate(doc);

        assertEquals("No \"MS\" or \"NM\" section was found, so analysis type could not be determined. Mass spec will be assumed.",
                report.getErrors().get(0).getMessage());
        assertEquals(1, matching(report, "The required section, \"MS\", is missing.").size());
    }

    @Test
    void validate_noDataAndNoResultsFile_isError() throws Exception {
        var doc = load();
        doc.removeSection("MS_METABOLITE_DATA");

        var report = validator.validate(doc);

        assertEquals(1, matching(report, "There must be either a \"MS_METABOLITE_DATA\" section or a \"MS_RESULTS_FILE\"").size());
    }

    @Test
    void validate_factorsRowDisagreeingWithSubjectSampleFactors_isError() throws Exception {
        var doc = load();
        doc.getFactors().get("S004").set("Treatment", "Control");

        var mismatch = matching(validator.validate(doc), "do not match");

        assertEquals(1, mismatch.size());
        assertEquals("The factors in the MS_METABOLITE_DATA section and SUBJECT_SAMPLE_FACTORS section do not match.",
                mismatch.get(0).getMessage());
    }

    @Test
    void validate_tableProblems_areReported() throws Exception {
        var doc = load();
        var data = doc.getDataSection().getData();
        data.getRows().add(new DuplicatesMap(data.getRows().get(0)));
        data.getRows().add(DuplicatesMap.of(Table.LABEL, "Samples", "S001", "1", "S002", "2", "S003", "3", "S004", "4"));
        for (DuplicatesMap row : doc.getDataSection().getMetabolites().getRows()) {
            row.add("comment", "");
        }

        var report = validator.validate(doc);

        assertEquals(1, matching(report, "There are duplicate rows in the MS_METABOLITE_DATA table.").size());
        assertEquals(1, matching(report, "There is a metabolite name, \"Samples\", in the MS_METABOLITE_DATA table").size());
        assertEquals(1, matching(report, "The \"comment\" column at position 5 in the METABOLITES table has all null values.").size());
        assertEquals(1, matching(report, "The following metabolites in the MS_METABOLITE_DATA table appear more than once").size());
    }

    @Test
    void validate_dominatedColumn_warns() throws Exception {
        var doc = load();
        var data = doc.getDataSection().getData();
        data.getRows().clear();
        for (int i = 0; i < 20; i++) {
            data.getRows().add(DuplicatesMap.of(Table.LABEL, "metabolite " + i, "S001", i == 0 ? "2.0" : "1.0",
                    "S002", String.valueOf(i), "S003", String.valueOf(i + 10), "S004", String.valueOf(i + 20)));
        }

        var dominated = matching(validator.validate(doc), "may have incorrect values");

        assertEquals(1, dominated.size());
        assertTrue(dominated.get(0).getMessage().startsWith("The \"S001\" column at position 2 in the MS_METABOLITE_DATA table"));
    }

    @Test
    void validate_shortHeaderAndDuplicateSubSection_areReported() throws Exception {
        var doc = load();
        doc.recordShortHeader("MS_METABOLITE_DATA");
        doc.recordDuplicateSubSection("PROJECT", "INSTITUTE", "University of Kentucky");

        var report = validator.validate(doc);

        assertTrue(matching(report, "has a mismatch between the number of headers").get(0).isError());
        assertEquals(Severity.WARNING, matching(report, "has a sub-section, INSTITUTE, that is duplicated.").get(0).getSeverity());
    }

    @Test
    void validate_rowWiderThanHeader_isOnlyReportedAsShortHeader() throws Exception {
        var text = Files.readString(Paths.get(MS_FILE))
                .replace("alanine\t1021.5\t998.2\t1403.7\t1388.1\n", "alanine\t1021.5\t998.2\t1403.7\t1388.1\t7.0\n");

        var report = validator.validate(mwTab.build("wide", text));

        assertEquals(1, matching(report, "has a mismatch between the number of headers").size());
        assertTrue(matching(report, "missing sample ID(s)").isEmpty(), report.toText());
    }

    @Test
    void validate_extendedWithoutSampleId_isError() throws Exception {
        var doc = load();
        var extended = new Table();
        extended.getRows().add(DuplicatesMap.of(Table.LABEL, "alanine", "sample", "S001", "area", "10"));
        doc.getDataSection().setExtended(extended);

        var missing = matching(validator.validate(doc), "does not have a column for \"sample_id\"");

        assertEquals(1, missing.size());
        assertEquals("The EXTENDED_MS_METABOLITE_DATA table does not have a column for \"sample_id\".", missing.get(0).getMessage());
    }

    @Test
    void validate_isDeterministicAndLeavesDocumentUntouched() throws Exception {
        var doc = load();
        doc.getSubjectSampleFactors().get(1).setSampleId("S001");
        doc.getItemSection("PROJECT").put("EMAIL", "nobody");
        var before = doc.copy();

        var first = validator.validate(doc);
        var second = validator.validate(doc);

        assertEquals(first.getFindings(), second.getFindings());
        assertTrue(doc.sameContent(before));
        assertTrue(first.toText().contains("Status: Contains Validation Errors"));
        assertTrue(first.toText().contains("Number of Warnings: " + first.getWarnings().size()));
    }

    private MwTabDocument load() throws Exception {
        return mwTab.build(MS_FILE, Files.readString(Paths.get(MS_FILE)));
    }

    private static List<Finding> matching(ValidationReport report, String text) {
        var found = new ArrayList<Finding>();
        for (Finding finding : report.getFindings()) {
            if (finding.getMessage().contains(text)) {
                found.add(finding);
            }
        }
        return found;
    }
}

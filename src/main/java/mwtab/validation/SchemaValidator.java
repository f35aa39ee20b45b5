package mwtab.validation;

import mwtab.DataSection;
import mwtab.DuplicatesMap;
import mwtab.ItemSection;
import mwtab.ListSection;
import mwtab.MwTabDocument;
import mwtab.ResultsFile;
import mwtab.Section;
import mwtab.SubjectSampleFactor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks every section against the schema of the document's analysis kind: required and unknown
 * sections and keys, and the value rules of each key.
 */
class SchemaValidator implements ValidationStep {
    private static final String SSF = MwTabDocument.SUBJECT_SAMPLE_FACTORS;

    private final SchemaTable schema;

    SchemaValidator(SchemaTable schema) {
        this.schema = schema;
    }

    @Override
    public void validate(MwTabDocument document, List<Finding> findings) {
        SchemaTable.Analysis analysis = selectAnalysis(document, findings);
        List<String> allowed = schema.allowedSections(analysis);

        for (String name : allowed) {
            Section section = document.getSection(name);
            if (section != null) {
                checkSection(section, schema.getSection(name), findings);
            }
        }
        for (String name : schema.requiredSections(analysis)) {
            if (!document.hasSection(name)) {
                findings.add(Finding.error(Stage.SCHEMA, name, "The required section, \"" + name + "\", is missing."));
            }
        }
        for (String name : document.getSectionNames()) {
            if (!allowed.contains(name)) {
                findings.add(Finding.error(Stage.SCHEMA, name, "Unknown or invalid section, \"" + name + "\"."));
            }
        }

        boolean hasData = false;
        for (String name : analysis.getDataSections()) {
            hasData = hasData || document.hasSection(name);
        }
        ItemSection analysisSection = document.getItemSection(analysis.getSection());
        if (!hasData && (analysisSection == null || analysisSection.getResultsFile() == null)) {
            findings.add(Finding.error(Stage.SCHEMA, analysis.getSection(), analysis.getMissingDataMessage()));
        }
    }

    private SchemaTable.Analysis selectAnalysis(MwTabDocument document, List<Finding> findings) {
        boolean ms = document.hasSection(MwTabDocument.MS);
        boolean nm = document.hasSection(MwTabDocument.NM);
        if (ms && nm) {
            findings.add(Finding.error(Stage.SCHEMA, null, "Both an \"MS\" and \"NM\" section were found. "
                    + "A single mwTab file should describe one analysis. Mass spec will be assumed."));
        } else if (!ms && !nm) {
            findings.add(Finding.error(Stage.SCHEMA, null, "No \"MS\" or \"NM\" section was found, "
                    + "so analysis type could not be determined. Mass spec will be assumed."));
        }
        return schema.getAnalysis(nm && !ms ? MwTabDocument.NM : MwTabDocument.MS);
    }

    private void checkSection(Section section, SectionRule rule, List<Finding> findings) {
        if (section.getKind() != rule.getKind()) {
            findings.add(Finding.error(Stage.SCHEMA, section.getName(), "The \"" + section.getName()
                    + "\" section does not have the expected structure."));
            return;
        }
        switch (section.getKind()) {
            case ITEMS:
                checkItems((ItemSection) section, rule, findings);
                break;
            case DATA:
                checkData((DataSection) section, rule, findings);
                break;
            default:
                checkSubjectSampleFactors((ListSection) section, rule, findings);
                break;
        }
    }

    private void checkItems(ItemSection section, SectionRule rule, List<Finding> findings) {
        String name = section.getName();
        DuplicatesMap items = section.getItems();
        List<String> unknown = new ArrayList<>();
        for (String key : items.keys()) {
            FieldRule field = rule.getFields().get(key);
            if (field == null) {
                unknown.add(key);
                continue;
            }
            for (String value : items.getAll(key)) {
                findings.addAll(field.check(value, name, keyLocation(name, key), rule.isRequired(key), schema.getNaValues()));
            }
        }

        String resultsFileKey = section.getResultsFileKey();
        if (section.getResultsFile() != null) {
            FieldRule field = rule.getFields().get(resultsFileKey);
            if (field == null || !field.isResultsFile()) {
                unknown.add(resultsFileKey);
            } else {
                checkResultsFile(section.getResultsFile(), name, resultsFileKey, findings);
            }
        }

        for (String key : rule.getRequired()) {
            boolean present = items.containsKey(key) || (key.equals(resultsFileKey) && section.getResultsFile() != null);
            if (!present) {
                findings.add(Finding.error(Stage.SCHEMA, name, "The required property, \"" + key + "\", "
                        + sectionLocation(name) + " is missing."));
            }
        }
        addUnknown(name, unknown, findings);
    }

    private void checkResultsFile(ResultsFile resultsFile, String section, String key, List<Finding> findings) {
        SectionRule rule = schema.getResultsFile();
        Map<String, String> attributes = new LinkedHashMap<>();
        if (resultsFile.getFilename() != null) {
            attributes.put(ResultsFile.FILENAME, resultsFile.getFilename());
        }
        attributes.putAll(resultsFile.attributes());

        String subsection = "for the subsection, \"" + key + "\", in the \"" + section + "\" section";
        for (Map.Entry<String, String> attribute : attributes.entrySet()) {
            FieldRule field = rule.getFields().get(attribute.getKey());
            if (field != null) {
                findings.addAll(field.check(attribute.getValue(), section,
                        subsection + ", for the \"" + attribute.getKey() + "\" attribute",
                        rule.isRequired(attribute.getKey()), schema.getNaValues()));
            }
        }
        for (String required : rule.getRequired()) {
            if (!attributes.containsKey(required)) {
                findings.add(Finding.error(Stage.SCHEMA, section, "The required property, \"" + required + "\", "
                        + subsection + " is missing."));
            }
        }
    }

    private void checkData(DataSection section, SectionRule rule, List<Finding> findings) {
        String name = section.getName();
        FieldRule units = rule.getFields().get(DataSection.UNITS);
        if (units != null && section.getUnits() != null) {
            findings.addAll(units.check(section.getUnits(), name, keyLocation(name, DataSection.UNITS),
                    rule.isRequired(DataSection.UNITS), schema.getNaValues()));
        }

        Map<String, Boolean> parts = new LinkedHashMap<>();
        parts.put(DataSection.UNITS, section.getUnits() != null);
        parts.put(DataSection.DATA, section.getData() != null);
        parts.put(DataSection.METABOLITES, section.getMetabolites() != null);
        parts.put(DataSection.EXTENDED, section.getExtended() != null);
        for (String key : rule.getRequired()) {
            if (!Boolean.TRUE.equals(parts.get(key))) {
                findings.add(Finding.error(Stage.SCHEMA, name, "The required property, \"" + key + "\", "
                        + sectionLocation(name) + " is missing."));
            }
        }

        List<String> unknown = new ArrayList<>();
        for (Map.Entry<String, Boolean> part : parts.entrySet()) {
            if (part.getValue() && !rule.isKnown(part.getKey())) {
                unknown.add(part.getKey());
            }
        }
        unknown.addAll(section.getAdditionalItems().keys());
        if (section.getResultsFile() != null) {
            unknown.add(section.getResultsFileKey());
        }
        addUnknown(name, unknown, findings);
    }

    private void checkSubjectSampleFactors(ListSection section, SectionRule rule, List<Finding> findings) {
        List<String> naValues = schema.getNaValues();
        FieldRule otherValues = rule.getOtherValues();
        List<SubjectSampleFactor> rows = section.getRows();
        for (int i = 0; i < rows.size(); i++) {
            SubjectSampleFactor row = rows.get(i);
            String entry = "in entry " + (i + 1) + " of the \"" + SSF + "\" section";

            Map<String, String> fields = new LinkedHashMap<>();
            fields.put(SubjectSampleFactor.SUBJECT_ID, row.getSubjectId());
            fields.put(SubjectSampleFactor.SAMPLE_ID, row.getSampleId());
            for (Map.Entry<String, String> field : fields.entrySet()) {
                FieldRule fieldRule = rule.getFields().get(field.getKey());
                if (fieldRule != null && field.getValue() != null) {
                    findings.addAll(fieldRule.check(field.getValue(), SSF, "for the \"" + field.getKey() + "\" " + entry,
                            rule.isRequired(field.getKey()), naValues));
                }
            }
            for (String key : rule.getRequired()) {
                boolean present = SubjectSampleFactor.FACTORS.equals(key) ? row.getFactors() != null : fields.get(key) != null;
                if (!present) {
                    findings.add(Finding.error(Stage.SCHEMA, SSF, "The required property, \"" + key + "\", " + entry + " is missing."));
                }
            }

            if (row.getFactors() != null && otherValues != null) {
                for (DuplicatesMap.Entry factor : row.getFactors()) {
                    findings.addAll(otherValues.check(factor.getValue(), SSF, "for the \"" + factor.getKey() + "\" in \""
                            + SubjectSampleFactor.FACTORS + "\" " + entry, false, naValues));
                }
            }
            if (row.getAdditionalData() != null) {
                for (DuplicatesMap.Entry item : row.getAdditionalData()) {
                    FieldRule itemRule = rule.getAdditionalData().get(item.getKey());
                    if (itemRule == null) {
                        itemRule = otherValues;
                    }
                    if (itemRule != null) {
                        findings.addAll(itemRule.check(item.getValue(), SSF, "for the \"" + item.getKey() + "\" in \""
                                + SubjectSampleFactor.ADDITIONAL_DATA + "\" " + entry,
                                false, naValues));
                    }
                }
            }
        }
    }

    private static void addUnknown(String section, List<String> unknown, List<Finding> findings) {
        if (unknown.isEmpty()) {
            return;
        }
        List<String> quoted = new ArrayList<>();
        for (String key : unknown) {
            quoted.add("\"" + key + "\"");
        }
        String noun = unknown.size() == 1 ? "subsection" : "subsections";
        findings.add(Finding.error(Stage.SCHEMA, section, "Unknown or invalid " + noun + ", " + String.join(", ", quoted)
                + ", " + sectionLocation(section) + "."));
    }

    private static String keyLocation(String section, String key) {
        if (MwTabDocument.HEADER.equals(section)) {
            return "for \"" + key + "\" in the file header";
        }
        return "for the subsection, \"" + key + "\", in the \"" + section + "\" section";
    }

    private static String sectionLocation(String section) {
        if (MwTabDocument.HEADER.equals(section)) {
            return "in the file header";
        }
        return "in the \"" + section + "\" section";
    }
}

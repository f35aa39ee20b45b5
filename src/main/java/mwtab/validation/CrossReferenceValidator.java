package mwtab.validation;

import mwtab.DataSection;
import mwtab.MwTabDocument;
import mwtab.SubjectSampleFactor;
import mwtab.Table;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Checks that the data tables refer to samples listed in SUBJECT_SAMPLE_FACTORS and that the
 * Data and Metabolites tables name the same metabolites.
 */
class CrossReferenceValidator implements ValidationStep {
    static final String SAMPLE_ID = "sample_id";

    private final SchemaTable schema;

    CrossReferenceValidator(SchemaTable schema) {
        this.schema = schema;
    }

    @Override
    public void validate(MwTabDocument document, List<Finding> findings) {
        DataSection section = document.getDataSection();
        if (section == null) {
            return;
        }
        String name = section.getName();
        Set<String> sampleIds = new HashSet<>();
        for (SubjectSampleFactor row : document.getSubjectSampleFactors()) {
            sampleIds.add(row.getSampleId());
        }

        Table data = section.getData();
        if (data != null) {
            List<String> samples = data.headerOrColumns();
            Set<String> missing = new TreeSet<>();
            for (String sample : samples) {
                // Unnamed padding columns are reported as short headers.
                if (!sample.isEmpty() && !sampleIds.contains(sample)) {
                    missing.add(sample);
                }
            }
            if (!missing.isEmpty()) {
                findings.add(Finding.error(Stage.CROSS_REFERENCE, MwTabDocument.SUBJECT_SAMPLE_FACTORS,
                        "SUBJECT_SAMPLE_FACTORS section missing sample ID(s). The following IDs were found in the " + name
                                + " section but not in the SUBJECT_SAMPLE_FACTORS:" + DataTables.quotedLines(missing)));
            }
            if (new HashSet<>(samples).size() < samples.size()) {
                findings.add(Finding.warning(Stage.CROSS_REFERENCE, name, "There are duplicate samples in the " + name + " section."));
            }
        }

        Table metabolites = section.getMetabolites();
        if (data != null && metabolites != null && !section.isBinned()) {
            compareLabels(name, labels(data), MwTabDocument.METABOLITES, labels(metabolites), findings);
            compareLabels(MwTabDocument.METABOLITES, labels(metabolites), name, labels(data), findings);
        }
        if (data != null) {
            checkLabels(name, name, data, findings);
        }
        if (metabolites != null) {
            checkLabels(name, MwTabDocument.METABOLITES, metabolites, findings);
        } else if (section.isMetaboliteData()) {
            findings.add(Finding.warning(Stage.CROSS_REFERENCE, name, "Missing METABOLITES section."));
        }
        if (section.getExtended() != null) {
            checkExtended(name, section.getExtended(), sampleIds, findings);
        }
    }

    private static void compareLabels(String from, List<String> fromLabels, String to, List<String> toLabels,
                                      List<Finding> findings) {
        Set<String> known = new HashSet<>(toLabels);
        List<String> absent = new ArrayList<>();
        for (String label : fromLabels) {
            if (!known.contains(label)) {
                absent.add(label);
            }
        }
        if (!absent.isEmpty()) {
            findings.add(Finding.warning(Stage.CROSS_REFERENCE, from, "The following metabolites in the " + from
                    + " table were not found in the " + to + " table:" + DataTables.quotedLines(absent)));
        }
    }

    private void checkLabels(String section, String location, Table table, List<Finding> findings) {
        List<String> labels = labels(table);
        for (String label : labels) {
            if (schema.getMetaboliteNaValues().contains(label)) {
                findings.add(Finding.error(Stage.CROSS_REFERENCE, section,
                        "A metabolite without a name was found in the " + location + " table."));
                break;
            }
        }
        Set<String> seen = new HashSet<>();
        List<String> duplicates = new ArrayList<>();
        for (String label : labels) {
            if (!seen.add(label)) {
                duplicates.add(label);
            }
        }
        if (!duplicates.isEmpty()) {
            findings.add(Finding.warning(Stage.CROSS_REFERENCE, section, "The following metabolites in the " + location
                    + " table appear more than once in the table:" + DataTables.quotedLines(duplicates)));
        }
    }

    private void checkExtended(String section, Table extended, Set<String> sampleIds, List<Finding> findings) {
        String location = DataTables.EXTENDED_PREFIX + section;
        List<String> columns = extended.columns();
        if (!columns.contains(SAMPLE_ID)) {
            findings.add(Finding.error(Stage.CROSS_REFERENCE, section,
                    "The " + location + " table does not have a column for \"" + SAMPLE_ID + "\"."));
        } else {
            List<String> ids = DataTables.column(extended, SAMPLE_ID);
            Set<String> notListed = new TreeSet<>();
            boolean blank = false;
            for (String id : ids) {
                if (id != null && !sampleIds.contains(id)) {
                    notListed.add(id);
                }
                blank = blank || DataTables.isNa(id, schema.getNaValues());
            }
            if (!notListed.isEmpty()) {
                findings.add(Finding.error(Stage.CROSS_REFERENCE, section, "The " + location
                        + " table has Sample IDs that were not found in the SUBJECT_SAMPLE_FACTORS section. Those IDs are:"
                        + DataTables.quotedLines(notListed)));
            }
            if (blank) {
                findings.add(Finding.error(Stage.CROSS_REFERENCE, section,
                        "A Sample ID without a name was found in the " + location + " table."));
            }
        }
        if (columns.contains(Table.LABEL)) {
            for (String label : DataTables.column(extended, Table.LABEL)) {
                if (DataTables.isNa(label, schema.getMetaboliteNaValues())) {
                    findings.add(Finding.error(Stage.CROSS_REFERENCE, section,
                            "A metabolite without a name was found in the " + location + " table."));
                    break;
                }
            }
        }
    }

    private static List<String> labels(Table table) {
        List<String> labels = new ArrayList<>();
        for (String label : table.labels()) {
            labels.add(label.strip());
        }
        return labels;
    }
}

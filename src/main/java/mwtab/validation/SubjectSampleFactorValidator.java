package mwtab.validation;

import mwtab.DuplicatesMap;
import mwtab.MwTabDocument;
import mwtab.SubjectSampleFactor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

class SubjectSampleFactorValidator implements ValidationStep {
    private static final String SSF = MwTabDocument.SUBJECT_SAMPLE_FACTORS;

    @Override
    public void validate(MwTabDocument document, List<Finding> findings) {
        List<SubjectSampleFactor> rows = document.getSubjectSampleFactors();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < rows.size(); i++) {
            SubjectSampleFactor row = rows.get(i);
            String entry = SSF + " entry #" + (i + 1);
            String sampleId = row.getSampleId();
            if (sampleId != null && !sampleId.isEmpty() && !seen.add(sampleId)) {
                findings.add(Finding.warning(Stage.SUBJECT_SAMPLE_FACTORS, SSF, entry + " has a duplicate Sample ID."));
            }
            duplicateKeys(row.getFactors(), entry, SubjectSampleFactor.FACTORS, findings);
            duplicateKeys(row.getAdditionalData(), entry, SubjectSampleFactor.ADDITIONAL_DATA, findings);
        }
        compareFactors(document, rows, findings);
    }

    private static void duplicateKeys(DuplicatesMap map, String entry, String name, List<Finding> findings) {
        if (map == null || map.duplicateKeys().isEmpty()) {
            return;
        }
        findings.add(Finding.warning(Stage.SUBJECT_SAMPLE_FACTORS, SSF, entry + " has the following duplicate keys in its "
                + name + ":" + DataTables.quotedLines(map.duplicateKeys())));
    }

    /** The "Factors" row of the data block must agree with the factors listed per sample. */
    private static void compareFactors(MwTabDocument document, List<SubjectSampleFactor> rows, List<Finding> findings) {
        Map<String, DuplicatesMap> dataFactors = document.getFactors();
        if (dataFactors == null || dataFactors.isEmpty()) {
            return;
        }
        Map<String, List<String>> expected = new HashMap<>();
        for (Map.Entry<String, DuplicatesMap> entry : dataFactors.entrySet()) {
            expected.put(entry.getKey(), pairs(entry.getValue()));
        }
        Map<String, List<String>> listed = new HashMap<>();
        for (SubjectSampleFactor row : rows) {
            if (row.getSampleId() != null && dataFactors.containsKey(row.getSampleId())) {
                listed.put(row.getSampleId(), pairs(row.getFactors()));
            }
        }
        if (!expected.equals(listed)) {
            findings.add(Finding.error(Stage.SUBJECT_SAMPLE_FACTORS, SSF, "The factors in the " + document.getDataSectionKey()
                    + " section and " + SSF + " section do not match."));
        }
    }

    private static List<String> pairs(DuplicatesMap map) {
        List<String> pairs = new ArrayList<>();
        if (map != null) {
            for (DuplicatesMap.Entry entry : map) {
                pairs.add(entry.getKey().strip() + ":" + entry.getValue().strip());
            }
        }
        Collections.sort(pairs);
        return pairs;
    }
}

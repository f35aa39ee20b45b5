package mwtab;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a document in the mwTab text grammar.
 */
public class TextWriter {

    static final String SUBJECT_SAMPLE_FACTORS_HEADER = "#SUBJECT_SAMPLE_FACTORS:         \t"
            + "SUBJECT(optional)[tab]SAMPLE[tab]FACTORS(NAME:VALUE pairs separated by |)[tab]Additional sample data";
    static final String SUBJECT_SAMPLE_FACTORS_ROW = MwTabDocument.SUBJECT_SAMPLE_FACTORS + StringUtils.repeat(' ', 11);
    static final String SAMPLES_ROW = "Samples";
    static final String METABOLITE_NAME = "metabolite_name";

    static final Map<String, String> PREFIXES;

    static {
        Map<String, String> prefixes = new LinkedHashMap<>();
        prefixes.put("PROJECT", "PR:");
        prefixes.put("STUDY", "ST:");
        prefixes.put("SUBJECT", "SU:");
        prefixes.put("COLLECTION", "CO:");
        prefixes.put("TREATMENT", "TR:");
        prefixes.put("SAMPLEPREP", "SP:");
        prefixes.put("CHROMATOGRAPHY", "CH:");
        prefixes.put("ANALYSIS", "AN:");
        prefixes.put(MwTabDocument.MS, "MS:");
        prefixes.put(MwTabDocument.NM, "NM:");
        PREFIXES = Collections.unmodifiableMap(prefixes);
    }

    private static final List<String> SHORT_PADDED = Arrays.asList(MwTabDocument.VERSION, MwTabDocument.CREATED_ON);

    private final int wrapWidth;

    public TextWriter() {
        this(MwTabConfig.DEFAULT_WRAP_WIDTH);
    }

    public TextWriter(int wrapWidth) {
        this.wrapWidth = wrapWidth;
    }

    public String write(MwTabDocument document) {
        MwTabDocument doc = document.copy();
        KeyOrder.apply(doc);
        List<String> lines = new ArrayList<>();
        for (Section section : doc.getSections()) {
            switch (section.getKind()) {
                case SUBJECT_SAMPLE_FACTORS:
                    lines.add(SUBJECT_SAMPLE_FACTORS_HEADER);
                    writeSubjectSampleFactors((ListSection) section, lines);
                    break;
                case ITEMS:
                    lines.add(openingLine(doc, section.getName()));
                    writeItems((ItemSection) section, lines);
                    break;
                case DATA:
                    lines.add(openingLine(doc, section.getName()));
                    writeData(doc, (DataSection) section, lines);
                    break;
                default:
                    throw new IllegalStateException("Unknown section kind " + section.getKind());
            }
        }
        lines.add("#END");
        return String.join("\n", lines) + "\n";
    }

    private static String openingLine(MwTabDocument doc, String name) {
        if (MwTabDocument.HEADER.equals(name)) {
            return doc.getHeader();
        }
        if (MwTabDocument.NM.equals(name)) {
            return "#" + DocumentBuilder.NMR_ALIAS;
        }
        return "#" + name;
    }

    private static void writeSubjectSampleFactors(ListSection section, List<String> lines) {
        for (SubjectSampleFactor row : section.getRows()) {
            List<String> fields = new ArrayList<>();
            fields.add(StringUtils.defaultString(row.getSubjectId()));
            fields.add(StringUtils.defaultString(row.getSampleId()));
            fields.add(joinPairs(row.getFactors(), ":", " | "));
            if (row.getAdditionalData() != null && !row.getAdditionalData().isEmpty()) {
                fields.add(joinPairs(row.getAdditionalData(), "=", "; "));
            }
            String line = SUBJECT_SAMPLE_FACTORS_ROW + "\t" + String.join("\t", fields);
            if (fields.size() < 4) {
                line += "\t";
            }
            lines.add(line);
        }
    }

    static String joinPairs(DuplicatesMap pairs, String assignment, String separator) {
        List<String> parts = new ArrayList<>();
        if (pairs != null) {
            for (DuplicatesMap.Entry entry : pairs) {
                parts.add(entry.getKey() + assignment + entry.getValue());
            }
        }
        return String.join(separator, parts);
    }

    private void writeItems(ItemSection section, List<String> lines) {
        String name = section.getName();
        boolean header = MwTabDocument.HEADER.equals(name);
        for (DuplicatesMap.Entry entry : section.getItems()) {
            if (header && !SHORT_PADDED.contains(entry.getKey())) {
                continue;
            }
            writeItem(name, entry.getKey(), entry.getValue(), lines);
        }
        if (section.getResultsFile() != null) {
            lines.add(resultsFileLine(name, section.getResultsFileKey(), section.getResultsFile()));
        }
    }

    private static String resultsFileLine(String sectionName, String key, ResultsFile resultsFile) {
        return PREFIXES.getOrDefault(sectionName, "") + key + padding(key) + "\t" + resultsFile.render("\t");
    }

    private void writeItem(String sectionName, String key, String value, List<String> lines) {
        String lead = PREFIXES.getOrDefault(sectionName, "") + key + padding(key) + "\t";
        String text = StringUtils.defaultString(value);
        if (text.length() <= wrapWidth || key.endsWith("_FILENAME")) {
            lines.add(lead + text);
            return;
        }
        int length = 0;
        List<String> line = new ArrayList<>();
        for (String word : text.split(" ", -1)) {
            if (length + word.length() + line.size() - 1 < wrapWidth) {
                line.add(word);
                length += word.length();
            } else {
                if (!line.isEmpty()) {
                    lines.add(lead + String.join(" ", line));
                }
                line = new ArrayList<>();
                line.add(word);
                length = word.length();
            }
        }
        lines.add(lead + String.join(" ", line));
    }

    private static String padding(String key) {
        int width = SHORT_PADDED.contains(key) ? 20 : 30;
        return StringUtils.repeat(' ', Math.max(0, width - key.length()));
    }

    private void writeData(MwTabDocument doc, DataSection section, List<String> lines) {
        String name = section.getName();
        if (section.getUnits() != null) {
            String key = name + Tokenizer.UNITS_MARKER;
            lines.add(key + StringUtils.repeat(' ', Math.max(0, 33 - key.length())) + "\t" + section.getUnits());
        }
        if (section.getData() != null) {
            lines.add(name + Tokenizer.START_SUFFIX);
            Table data = section.getData();
            if (name.contains("METABOLITE")) {
                List<String> samples = data.headerOrColumns();
                lines.add(joinRow(SAMPLES_ROW, samples));
                if (!samples.isEmpty()) {
                    List<String> factors = factorsRow(doc, samples);
                    if (!factors.isEmpty()) {
                        lines.add(joinRow(DocumentBuilder.FACTORS_ROW, factors));
                    }
                }
            } else {
                lines.add(joinRow(Table.BIN_RANGE, data.headerOrColumns()));
            }
            writeRows(data, lines);
            lines.add(name + Tokenizer.END_SUFFIX);
        }
        // stray lines go before #METABOLITES so they are read back into this section
        if (section.getResultsFile() != null) {
            lines.add(resultsFileLine(name, section.getResultsFileKey(), section.getResultsFile()));
        }
        for (DuplicatesMap.Entry entry : section.getAdditionalItems()) {
            writeItem(name, entry.getKey(), entry.getValue(), lines);
        }
        if (section.getMetabolites() != null) {
            lines.add("#" + MwTabDocument.METABOLITES);
            lines.add(MwTabDocument.METABOLITES + Tokenizer.START_SUFFIX);
            lines.add(joinRow(METABOLITE_NAME, section.getMetabolites().headerOrColumns()));
            writeRows(section.getMetabolites(), lines);
            lines.add(MwTabDocument.METABOLITES + Tokenizer.END_SUFFIX);
        }
        if (section.getExtended() != null) {
            String block = DocumentBuilder.EXTENDED_PREFIX + name;
            lines.add(block + Tokenizer.START_SUFFIX);
            lines.add(joinRow(METABOLITE_NAME, section.getExtended().headerOrColumns()));
            writeRows(section.getExtended(), lines);
            lines.add(block + Tokenizer.END_SUFFIX);
        }
    }

    /**
     * Factor strings lined up with the samples, or empty when any sample has none.
     */
    private static List<String> factorsRow(MwTabDocument doc, List<String> samples) {
        Map<String, String> bySample = new LinkedHashMap<>();
        if (doc.getFactors() != null) {
            for (Map.Entry<String, DuplicatesMap> entry : doc.getFactors().entrySet()) {
                bySample.put(entry.getKey(), joinPairs(entry.getValue(), ":", " | "));
            }
        } else {
            for (SubjectSampleFactor row : doc.getSubjectSampleFactors()) {
                bySample.put(row.getSampleId(), joinPairs(row.getFactors(), ":", " | "));
            }
        }
        List<String> factors = new ArrayList<>();
        for (String sample : samples) {
            if (!bySample.containsKey(sample)) {
                return Collections.emptyList();
            }
            factors.add(bySample.get(sample));
        }
        return factors;
    }

    private static void writeRows(Table table, List<String> lines) {
        for (DuplicatesMap row : table.getRows()) {
            lines.add(String.join("\t", row.values()));
        }
    }

    private static String joinRow(String label, List<String> values) {
        List<String> fields = new ArrayList<>();
        fields.add(label);
        fields.addAll(values);
        return String.join("\t", fields);
    }
}

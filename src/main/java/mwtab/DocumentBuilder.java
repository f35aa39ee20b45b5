package mwtab;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles a token stream into a {@link MwTabDocument} in a single pass.
 */
public class DocumentBuilder {
    private static final Logger logger = LoggerFactory.getLogger(DocumentBuilder.class);

    static final String NMR_ALIAS = "NMR";
    static final String END = "END";
    static final String FACTORS_ROW = "Factors";
    static final String EXTENDED_PREFIX = "EXTENDED_";

    public MwTabDocument build(String sourceId, Iterator<Token> tokens) {
        MwTabDocument document = new MwTabDocument(sourceId, MwTabDocument.FORMAT_MWTAB);
        SectionAccumulator current = null;

        loop:
        while (tokens.hasNext()) {
            Token token = tokens.next();
            switch (token.getType()) {
                case SECTION_START:
                    current = new SectionAccumulator(canonicalName(token.getName()));
                    break;
                case END_OF_SECTION:
                    if (current != null) {
                        finish(document, current);
                    }
                    current = null;
                    break;
                case KEY_VALUE:
                    requireSection(current, token).addItem(document, token.getKey(), token.getValue());
                    break;
                case SUBJECT_SAMPLE_FACTORS:
                    requireSection(current, token).subjectSampleFactors.add(SubjectSampleFactor.builder()
                            .subjectId(token.getSubjectId())
                            .sampleId(token.getSampleId())
                            .factors(token.getFactors())
                            .additionalData(token.getAdditionalData())
                            .build());
                    break;
                case DATA_START:
                    readBlock(document, requireSection(current, token), token.getName(), tokens);
                    break;
                case KEY_VALUE_LIST:
                case DATA_END:
                    throw new BuildException("Data row outside of a data block at line " + token.getLineNumber());
                case END_OF_FILE:
                    break loop;
                default:
                    throw new IllegalStateException("Unexpected token " + token.getType());
            }
        }
        if (current != null) {
            finish(document, current);
        }

        if (document.getHeaderSection() == null) {
            throw new BuildException("No \"" + Tokenizer.HEADER_SENTINEL + "\" header section was found in "
                    + StringUtils.defaultString(sourceId, "the input"));
        }
        relocateResultsFile(document);
        return document;
    }

    private static String canonicalName(String name) {
        return NMR_ALIAS.equals(name) ? MwTabDocument.NM : name;
    }

    private static SectionAccumulator requireSection(SectionAccumulator current, Token token) {
        if (current == null) {
            throw new BuildException("Line " + token.getLineNumber() + " appears before the first section");
        }
        return current;
    }

    private void readBlock(MwTabDocument document, SectionAccumulator section, String blockName,
                           Iterator<Token> tokens) {
        List<List<String>> rows = new ArrayList<>();
        while (true) {
            if (!tokens.hasNext()) {
                throw new BuildException("Data block \"" + blockName + "\" ended without an end marker");
            }
            Token token = tokens.next();
            if (token.getType() == Token.Type.DATA_END) {
                break;
            }
            if (token.getType() != Token.Type.KEY_VALUE_LIST) {
                throw new BuildException("Unexpected " + token.getType() + " inside data block \"" + blockName
                        + "\" at line " + token.getLineNumber());
            }
            rows.add(trimTrailingEmpty(token.getValues()));
        }

        String tableName;
        if (MwTabDocument.METABOLITES.equals(blockName)) {
            tableName = DataSection.METABOLITES;
        } else if (blockName.startsWith(EXTENDED_PREFIX)) {
            tableName = DataSection.EXTENDED;
        } else {
            tableName = DataSection.DATA;
        }
        section.tables.put(tableName, buildTable(document, blockName, rows));
    }

    private Table buildTable(MwTabDocument document, String blockName, List<List<String>> rows) {
        Table table = new Table();
        if (rows.isEmpty()) {
            table.setHeader(new ArrayList<>());
            return table;
        }
        List<String> headerRow = rows.get(0);
        List<String> columns = new ArrayList<>();
        columns.add(Table.LABEL);
        columns.addAll(headerRow.subList(Math.min(1, headerRow.size()), headerRow.size()));
        table.setRawHeader(new ArrayList<>(headerRow));

        List<List<String>> body = new ArrayList<>(rows.subList(1, rows.size()));
        if (!body.isEmpty() && blockName.contains("METABOLITE_DATA")
                && FACTORS_ROW.equalsIgnoreCase(StringUtils.defaultString(body.get(0).isEmpty() ? null : body.get(0).get(0)))) {
            document.setFactors(parseFactors(columns, body.remove(0)));
        }

        int width = columns.size();
        int widest = width;
        for (List<String> row : body) {
            widest = Math.max(widest, row.size());
        }
        if (widest > width) {
            logger.debug("Rows in {} are longer than the header ({} > {})", blockName, widest, width);
            document.recordShortHeader(blockName);
            for (int i = width; i < widest; i++) {
                columns.add("");
            }
        }
        table.setHeader(new ArrayList<>(columns.subList(1, columns.size())));
        for (List<String> values : body) {
            DuplicatesMap row = new DuplicatesMap();
            for (int i = 0; i < columns.size(); i++) {
                row.add(columns.get(i), i < values.size() ? values.get(i) : "");
            }
            table.getRows().add(row);
        }
        return table;
    }

    private static Map<String, DuplicatesMap> parseFactors(List<String> columns, List<String> factorsRow) {
        Map<String, DuplicatesMap> factors = new LinkedHashMap<>();
        for (int i = 1; i < factorsRow.size(); i++) {
            String sample = i < columns.size() ? columns.get(i) : "";
            DuplicatesMap pairs = new DuplicatesMap();
            for (String pair : StringUtils.split(factorsRow.get(i), '|')) {
                if (pair.isBlank()) {
                    continue;
                }
                int colon = pair.indexOf(':');
                if (colon < 0) {
                    pairs.add(pair.strip(), "");
                } else {
                    pairs.add(pair.substring(0, colon).strip(), pair.substring(colon + 1).strip());
                }
            }
            factors.put(sample, pairs);
        }
        return factors;
    }

    private static List<String> trimTrailingEmpty(List<String> values) {
        List<String> trimmed = new ArrayList<>(values);
        while (!trimmed.isEmpty() && trimmed.get(trimmed.size() - 1).isEmpty()) {
            trimmed.remove(trimmed.size() - 1);
        }
        return trimmed;
    }

    private void finish(MwTabDocument document, SectionAccumulator section) {
        String name = section.name;
        if (END.equals(name)) {
            return;
        }
        if (MwTabDocument.METABOLITES.equals(name)) {
            mergeMetabolites(document, section);
            return;
        }
        Section built;
        if (MwTabDocument.SUBJECT_SAMPLE_FACTORS.equals(name)) {
            built = new ListSection(name, section.subjectSampleFactors);
        } else if (name.endsWith("_DATA") || !section.tables.isEmpty()) {
            built = dataSection(section);
        } else {
            ItemSection items = new ItemSection(name, section.items);
            if (section.resultsFile != null) {
                items.setResultsFile(section.resultsFileKey, section.resultsFile);
            }
            built = items;
        }
        if (document.hasSection(name)) {
            logger.warn("Section {} appears more than once in {}; the last one is kept", name, document.getSource());
        }
        document.putSection(built);
    }

    private static DataSection dataSection(SectionAccumulator section) {
        DataSection data = new DataSection(section.name);
        DuplicatesMap extra = new DuplicatesMap(section.items);
        data.setUnits(extra.get(DataSection.UNITS));
        extra.remove(DataSection.UNITS);
        data.setAdditionalItems(extra);
        data.setData(section.tables.get(DataSection.DATA));
        data.setMetabolites(section.tables.get(DataSection.METABOLITES));
        data.setExtended(section.tables.get(DataSection.EXTENDED));
        if (section.resultsFile != null) {
            data.setResultsFile(section.resultsFileKey, section.resultsFile);
        }
        return data;
    }

    private static void mergeMetabolites(MwTabDocument document, SectionAccumulator section) {
        DataSection target = null;
        for (Section candidate : document.getSections()) {
            if (candidate instanceof DataSection
                    && (candidate.getName().contains("METABOLITE_DATA") || candidate.getName().contains("BINNED_DATA"))) {
                target = (DataSection) candidate;
                break;
            }
        }
        if (target == null) {
            throw new BuildException("The #METABOLITES section must follow a METABOLITE_DATA or BINNED_DATA section");
        }
        logger.debug("Merging METABOLITES into {}", target.getName());
        if (section.tables.containsKey(DataSection.METABOLITES)) {
            target.setMetabolites(section.tables.get(DataSection.METABOLITES));
        }
        if (section.tables.containsKey(DataSection.EXTENDED)) {
            target.setExtended(section.tables.get(DataSection.EXTENDED));
        }
        for (DuplicatesMap.Entry entry : section.items) {
            target.getAdditionalItems().add(entry.getKey(), entry.getValue());
        }
    }

    private static void relocateResultsFile(MwTabDocument document) {
        DataSection data = document.getDataSection();
        if (data == null || data.getResultsFile() == null) {
            return;
        }
        ItemSection analysis = document.getItemSection(MwTabDocument.MS);
        if (analysis == null) {
            analysis = document.getItemSection(MwTabDocument.NM);
        }
        if (analysis != null && analysis.getResultsFile() == null) {
            logger.debug("Moving {} from {} to {}", data.getResultsFileKey(), data.getName(), analysis.getName());
            analysis.setResultsFile(data.getResultsFileKey(), data.getResultsFile());
            data.setResultsFile(null, null);
        }
    }

    private static final class SectionAccumulator {
        final String name;
        final DuplicatesMap items = new DuplicatesMap();
        final List<SubjectSampleFactor> subjectSampleFactors = new ArrayList<>();
        final Map<String, Table> tables = new LinkedHashMap<>();
        String resultsFileKey;
        ResultsFile resultsFile;

        SectionAccumulator(String name) {
            this.name = name;
        }

        void addItem(MwTabDocument document, String key, String value) {
            if (key.endsWith(Tokenizer.RESULTS_FILE_MARKER)) {
                resultsFileKey = key;
                resultsFile = ResultsFile.parse(value);
                return;
            }
            String existing = items.get(key);
            if (existing == null) {
                items.add(key, value);
                return;
            }
            if (existing.equals(value)) {
                document.recordDuplicateSubSection(name, key, value);
            }
            if (MwTabDocument.HEADER.equals(name)) {
                items.set(key, value);
            } else {
                items.set(key, existing + " " + value);
            }
        }
    }
}

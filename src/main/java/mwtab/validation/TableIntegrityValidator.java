package mwtab.validation;

import mwtab.DataSection;
import mwtab.DuplicatesMap;
import mwtab.MwTabDocument;
import mwtab.Table;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Shape and content checks on the Data, Metabolites and Extended tables, plus the problems the
 * builder noted while reading blocks.
 */
class TableIntegrityValidator implements ValidationStep {
    static final String SAMPLES_HEADER = "Samples";
    static final String METABOLITE_HEADER = "metabolite_name";
    private static final List<String> HEADER_SPELLINGS =
            Arrays.asList("samples", "factors", "bin range(ppm)", "metabolite_name", "metabolite name");

    private final List<String> naValues;
    private final double dominanceThreshold;

    TableIntegrityValidator(List<String> naValues, double dominanceThreshold) {
        this.naValues = naValues;
        this.dominanceThreshold = dominanceThreshold;
    }

    @Override
    public void validate(MwTabDocument document, List<Finding> findings) {
        DataSection section = document.getDataSection();
        if (section != null) {
            for (Map.Entry<String, Table> entry : DataTables.named(section).entrySet()) {
                checkTable(section, entry.getKey(), entry.getValue(), findings);
            }
        }
        for (String name : document.getShortHeaders()) {
            findings.add(Finding.error(Stage.TABLE_INTEGRITY, name, "The section, " + name + ", has a mismatch between the "
                    + "number of headers and the number of elements in each line. Either a line(s) has more values than "
                    + "headers or there are too few headers."));
        }
        for (Map.Entry<String, Map<String, String>> entry : document.getDuplicateSubSections().entrySet()) {
            for (String key : entry.getValue().keySet()) {
                findings.add(Finding.warning(Stage.TABLE_INTEGRITY, entry.getKey(), "The section, " + entry.getKey()
                        + ", has a sub-section, " + key + ", that is duplicated."));
            }
        }
    }

    private void checkTable(DataSection section, String location, Table table, List<Finding> findings) {
        String name = section.getName();
        boolean dataTable = table == section.getData();
        String reserved = !dataTable ? METABOLITE_HEADER : section.isBinned() ? Table.BIN_RANGE : SAMPLES_HEADER;
        if (table.getRawHeader() != null && !table.getRawHeader().contains(reserved)) {
            findings.add(Finding.error(Stage.TABLE_INTEGRITY, name, "The " + location + " table does not have a column for \""
                    + reserved + "\". It is likely misspelled or using a common incorrect substitute."));
        }
        if (table.isEmpty()) {
            return;
        }

        List<DuplicatesMap> rows = table.getRows();
        List<String> columns = table.columns();
        for (DuplicatesMap row : rows) {
            if (!row.allKeys().equals(columns)) {
                findings.add(Finding.error(Stage.TABLE_INTEGRITY, name,
                        "The " + location + " table does not have the same columns for every row."));
                break;
            }
        }
        if (columns.contains("")) {
            findings.add(Finding.error(Stage.TABLE_INTEGRITY, name, "Column(s) with no name were found in the " + location + " table."));
        }

        Map<String, Integer> occurrences = new HashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            String column = columns.get(i);
            int occurrence = occurrences.merge(column, 1, Integer::sum) - 1;
            List<String> cells = cells(rows, column, occurrence);
            String prefix = "The \"" + column + "\" column at position " + (i + 1) + " in the " + location + " table";
            if (isNullColumn(cells)) {
                findings.add(Finding.warning(Stage.TABLE_INTEGRITY, name, prefix + " has all null values."));
            } else if (!Table.LABEL.equals(column) && isDominated(cells)) {
                findings.add(Finding.warning(Stage.TABLE_INTEGRITY, name, prefix + " may have incorrect values. "
                        + "90% or more of the values are the same, but 10% or less are different."));
            }
        }

        if (new HashSet<>(rows).size() < rows.size()) {
            findings.add(Finding.warning(Stage.TABLE_INTEGRITY, name, "There are duplicate rows in the " + location + " table."));
        }
        // Duplicate samples in Data are reported with the cross-reference checks.
        if (!dataTable && new HashSet<>(columns).size() < columns.size()) {
            findings.add(Finding.warning(Stage.TABLE_INTEGRITY, name, "There are duplicate column names in the " + location + " table."));
        }

        for (String label : table.labels()) {
            if (HEADER_SPELLINGS.contains(label.strip().toLowerCase(Locale.ROOT))) {
                findings.add(Finding.warning(Stage.TABLE_INTEGRITY, name, "There is a metabolite name, \"" + label + "\", in the "
                        + location + " table that is probably wrong. It is close to a header name and is likely due to a "
                        + "badly constructed Tab file."));
            }
        }
    }

    private boolean isNullColumn(List<String> cells) {
        for (String cell : cells) {
            if (!DataTables.isNa(cell, naValues)) {
                return false;
            }
        }
        return true;
    }

    /** One value holds at least the threshold share of the non-null cells, and it is not the only value. */
    private boolean isDominated(List<String> cells) {
        Map<String, Integer> counts = new HashMap<>();
        int filled = 0;
        for (String cell : cells) {
            if (!DataTables.isNa(cell, naValues)) {
                counts.merge(cell, 1, Integer::sum);
                filled++;
            }
        }
        if (counts.size() < 2) {
            return false;
        }
        for (int count : counts.values()) {
            if (count >= dominanceThreshold * filled) {
                return true;
            }
        }
        return false;
    }

    private static List<String> cells(List<DuplicatesMap> rows, String column, int occurrence) {
        List<String> cells = new ArrayList<>();
        for (DuplicatesMap row : rows) {
            List<String> values = row.getAll(column);
            cells.add(occurrence < values.size() ? values.get(occurrence) : null);
        }
        return cells;
    }
}

package mwtab.validation;

import mwtab.DataSection;
import mwtab.MwTabDocument;
import mwtab.Table;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compares METABOLITES column names and values with the standard columns of the matcher library.
 */
class ColumnSemanticsValidator implements ValidationStep {
    static final String OTHER_ID = "other_id";
    private static final String TABLE = MwTabDocument.METABOLITES;

    private final ColumnMatcherLibrary library;

    ColumnSemanticsValidator(ColumnMatcherLibrary library) {
        this.library = library;
    }

    @Override
    public void validate(MwTabDocument document, List<Finding> findings) {
        DataSection section = document.getDataSection();
        if (section == null || section.getMetabolites() == null || section.getMetabolites().isEmpty()) {
            return;
        }
        String name = section.getName();
        Table table = section.getMetabolites();
        List<String> allKeys = table.columns();
        List<String> columns = new ArrayList<>(new LinkedHashSet<>(allKeys));
        columns.remove(Table.LABEL);

        Map<String, List<String>> standardsByColumn = new LinkedHashMap<>();
        Map<String, List<String>> columnsByStandard = new LinkedHashMap<>();
        for (ColumnMatcher matcher : library.getMatchers()) {
            String standard = matcher.getStandardName();
            for (String column : columns) {
                String normalized = ColumnMatcherLibrary.normalize(column);
                if (!matcher.matchesName(normalized)) {
                    continue;
                }
                standardsByColumn.computeIfAbsent(column, k -> new ArrayList<>()).add(standard);
                columnsByStandard.computeIfAbsent(standard, k -> new ArrayList<>()).add(column);
                String prefix = "The \"" + column + "\" column at position " + (allKeys.indexOf(column) + 1)
                        + " in the " + TABLE + " table, matches a standard column name, \"" + standard + "\"";

                if (!columns.contains(standard) && !normalized.equals(standard)) {
                    findings.add(Finding.warning(Stage.COLUMN_SEMANTICS, name, prefix + ". If this match was not in error, "
                            + "the column should be renamed to the standard name or a name that doesn't resemble the standard name."));
                }
                Set<String> bad = new LinkedHashSet<>();
                for (String value : DataTables.column(table, column)) {
                    if (!matcher.matchesValue(value, library.getNaValues())) {
                        bad.add(value);
                    }
                }
                if (!bad.isEmpty()) {
                    findings.add(Finding.warning(Stage.COLUMN_SEMANTICS, name, prefix + ", and some of the values in the column "
                            + "do not match the expected type or format for that column. The non-matching values are:"
                            + DataTables.quotedLines(bad)));
                }
            }
        }

        for (Map.Entry<String, List<String>> pair : library.getImpliedPairs().entrySet()) {
            for (String column : columnsByStandard.getOrDefault(pair.getKey(), new ArrayList<>())) {
                for (String implied : pair.getValue()) {
                    List<String> companions = columnsByStandard.get(implied);
                    if (companions == null) {
                        findings.add(Finding.warning(Stage.COLUMN_SEMANTICS, name, "The column \"" + column + "\" was found in the "
                                + TABLE + " table, but this column implies that another column, \"" + implied
                                + "\", should also exist, and that column was not found."));
                        continue;
                    }
                    for (String companion : companions) {
                        if (!sameRowsFilled(table, column, companion)) {
                            findings.add(Finding.warning(Stage.COLUMN_SEMANTICS, name, "The column pair, \"" + column + "\" and \""
                                    + companion + "\", in the " + TABLE + " table should have data in the same rows, "
                                    + "but at least one row has data in one column and nothing in the other."));
                        }
                    }
                }
            }
        }

        for (String column : columnsByStandard.getOrDefault(OTHER_ID, new ArrayList<>())) {
            findings.add(Finding.warning(Stage.COLUMN_SEMANTICS, name, "The standard column, \"" + OTHER_ID + "\", was found in the "
                    + TABLE + " table as \"" + column + "\". If this column contains database IDs for standard databases "
                    + "such as KEGG, PubChem, HMDB, etc., it is recommended to make individual columns for these and not "
                    + "lump them together into a less descriptive \"" + OTHER_ID + "\" column."));
        }

        for (Map.Entry<String, List<String>> entry : standardsByColumn.entrySet()) {
            if (entry.getValue().size() > 1) {
                findings.add(Finding.warning(Stage.COLUMN_SEMANTICS, name, "The column, \"" + entry.getKey() + "\", in the " + TABLE
                        + " table was matched to multiple standard names, [" + String.join(", ", entry.getValue())
                        + "]. This is a good indication that the values in that column should be split into the "
                        + "appropriate individual columns."));
            }
        }
    }

    private boolean sameRowsFilled(Table table, String first, String second) {
        List<String> a = DataTables.column(table, first);
        List<String> b = DataTables.column(table, second);
        for (int i = 0; i < a.size(); i++) {
            if (DataTables.isNa(a.get(i), library.getNaValues()) != DataTables.isNa(b.get(i), library.getNaValues())) {
                return false;
            }
        }
        return true;
    }
}

package mwtab.validation;

import mwtab.DataSection;
import mwtab.DuplicatesMap;
import mwtab.MwTabDocument;
import mwtab.Table;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers shared by the table checks: the name a table goes by in messages and quoted value
 * lists.
 */
final class DataTables {
    static final String EXTENDED_PREFIX = "EXTENDED_";

    private DataTables() {
    }

    /** Tables present in the section keyed by the name used in messages. */
    static Map<String, Table> named(DataSection section) {
        Map<String, Table> tables = new LinkedHashMap<>();
        if (section.getData() != null) {
            tables.put(section.getName(), section.getData());
        }
        if (section.getMetabolites() != null) {
            tables.put(MwTabDocument.METABOLITES, section.getMetabolites());
        }
        if (section.getExtended() != null) {
            tables.put(EXTENDED_PREFIX + section.getName(), section.getExtended());
        }
        return tables;
    }

    static List<String> column(Table table, String name) {
        List<String> values = new ArrayList<>();
        for (DuplicatesMap row : table.getRows()) {
            values.add(row.get(name));
        }
        return values;
    }

    static boolean isNa(String value, List<String> naValues) {
        return value == null || naValues.contains(value.strip());
    }

    /** Joins values as {@code \n\t"a"\n\t"b"}. */
    static String quotedLines(Iterable<String> values) {
        StringBuilder sb = new StringBuilder();
        for (String value : values) {
            sb.append("\n\t\"").append(value).append('"');
        }
        return sb.toString();
    }
}

package mwtab;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Rows of a data block. Every row is keyed by the same columns; the first column holds the
 * metabolite name or bin label.
 */
@Getter
@Setter
@ToString
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Table {
    public static final String LABEL = "Metabolite";
    /** Label column name used by binned data in JSON and on the text header row. */
    public static final String BIN_RANGE = "Bin range(ppm)";

    @EqualsAndHashCode.Include
    private final List<DuplicatesMap> rows;
    /** Column names after the label column as captured from the block header. */
    private List<String> header;
    /** The header row exactly as it appeared in the block, label field included. */
    private List<String> rawHeader;

    public Table() {
        this(new ArrayList<>());
    }

    public Table(List<DuplicatesMap> rows) {
        this.rows = rows;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /** Column names of the first row, label included; falls back to the captured header. */
    public List<String> columns() {
        if (!rows.isEmpty()) {
            return new ArrayList<>(rows.get(0).allKeys());
        }
        List<String> columns = new ArrayList<>();
        columns.add(LABEL);
        if (header != null) {
            columns.addAll(header);
        }
        return columns;
    }

    /** Header to print after the reserved label: the captured one, else the first row's keys. */
    public List<String> headerOrColumns() {
        if (header != null) {
            return header;
        }
        List<String> columns = columns();
        return columns.subList(1, columns.size());
    }

    public List<String> labels() {
        List<String> labels = new ArrayList<>();
        for (DuplicatesMap row : rows) {
            labels.add(row.getOrDefault(LABEL, ""));
        }
        return labels;
    }

    public Table copy() {
        List<DuplicatesMap> copied = new ArrayList<>();
        for (DuplicatesMap row : rows) {
            copied.add(new DuplicatesMap(row));
        }
        Table table = new Table(copied);
        table.setHeader(header == null ? null : new ArrayList<>(header));
        table.setRawHeader(rawHeader == null ? null : new ArrayList<>(rawHeader));
        return table;
    }
}

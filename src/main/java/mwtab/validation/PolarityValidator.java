package mwtab.validation;

import mwtab.DataSection;
import mwtab.MwTabDocument;
import mwtab.Table;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * A document describes a single analysis, so a polarity column must not mix positive and negative
 * modes.
 */
class PolarityValidator implements ValidationStep {
    static final String POLARITY = "polarity";
    private static final List<String> POSITIVE = Arrays.asList("pos", "positive", "+");
    private static final List<String> NEGATIVE = Arrays.asList("neg", "negative", "-");

    private final ColumnMatcherLibrary library;

    PolarityValidator(ColumnMatcherLibrary library) {
        this.library = library;
    }

    @Override
    public void validate(MwTabDocument document, List<Finding> findings) {
        DataSection section = document.getDataSection();
        ColumnMatcher matcher = library.get(POLARITY);
        if (section == null || section.getMetabolites() == null || matcher == null) {
            return;
        }
        Table table = section.getMetabolites();
        for (String column : table.columns()) {
            if (Table.LABEL.equals(column) || !matcher.matchesName(ColumnMatcherLibrary.normalize(column))) {
                continue;
            }
            boolean positive = false;
            boolean negative = false;
            for (String value : DataTables.column(table, column)) {
                String lowered = value == null ? "" : value.strip().toLowerCase(Locale.ROOT);
                positive = positive || POSITIVE.contains(lowered);
                negative = negative || NEGATIVE.contains(lowered);
            }
            if (positive && negative) {
                findings.add(Finding.error(Stage.POLARITY, section.getName(), "The \"" + column + "\" column in the "
                        + MwTabDocument.METABOLITES + " table indicates multiple polarities in a single analysis, and this "
                        + "should not be. A single mwTab file is supposed to be restricted to a single analysis. This means "
                        + "multiple MS runs under different settings should each be in their own file."));
                break;
            }
        }
    }
}

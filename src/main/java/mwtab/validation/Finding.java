package mwtab.validation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

/**
 * One entry of a {@link ValidationReport}. The message carries no severity prefix; see
 * {@link #toText()}.
 */
@Builder
@AllArgsConstructor
@Data
public class Finding {

    public enum Kind {
        /** The document does not follow its section schema. */
        SCHEMA,
        /** Cross-reference or table problems that break internal consistency. */
        STRUCTURAL,
        /** Naming and value heuristics. */
        ADVISORY
    }

    private final Severity severity;
    private final Stage stage;
    /** Section the finding is about, or null when it concerns the whole document. */
    private final String section;
    private final String message;

    public static Finding error(Stage stage, String section, String message) {
        return new Finding(Severity.ERROR, stage, section, message);
    }

    public static Finding warning(Stage stage, String section, String message) {
        return new Finding(Severity.WARNING, stage, section, message);
    }

    public Kind getKind() {
        if (severity == Severity.WARNING) {
            return Kind.ADVISORY;
        }
        return stage == Stage.SCHEMA ? Kind.SCHEMA : Kind.STRUCTURAL;
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public String toText() {
        return severity.getLabel() + ": " + message;
    }
}

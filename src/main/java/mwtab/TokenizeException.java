package mwtab;

import lombok.Getter;

/**
 * A line that cannot be decomposed by the tokenizer rule that applies to it.
 */
@Getter
public class TokenizeException extends MwTabException {
    private final int lineNumber;
    private final String line;
    private final String reason;

    public TokenizeException(int lineNumber, String line, String reason) {
        super(reason + " (line " + lineNumber + ")\nLINE WITH ERROR:\n\t'" + line + "'");
        this.lineNumber = lineNumber;
        this.line = line;
        this.reason = reason;
    }
}

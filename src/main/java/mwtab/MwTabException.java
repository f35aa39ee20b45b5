package mwtab;

public class MwTabException extends RuntimeException {

    public MwTabException(String message) {
        super(message);
    }

    public MwTabException(String message, Throwable cause) {
        super(message, cause);
    }
}

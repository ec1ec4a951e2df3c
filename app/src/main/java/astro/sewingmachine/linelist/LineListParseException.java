package astro.sewingmachine.linelist;

/**
 * Raised when a line-list source is missing or one of its rows is malformed.
 */
public class LineListParseException extends RuntimeException {

    public LineListParseException(String message) {
        super(message);
    }

    public LineListParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

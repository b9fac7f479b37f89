package villagecompute.screening.exceptions;

/**
 * Exception thrown when a CSV source cannot be parsed with any candidate delimiter.
 *
 * <p>
 * Extends RuntimeException per project standards. Raised after delimiter sniffing and the fixed candidate fallback are both exhausted.
 */
public class ParseFailureException extends RuntimeException {

    public ParseFailureException(String message) {
        super(message);
    }

    public ParseFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}

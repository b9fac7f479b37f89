package villagecompute.screening.exceptions;

/**
 * Exception thrown when an ingestion source reference cannot be resolved by the source store.
 *
 * <p>
 * Extends RuntimeException per project standards. The message always contains "not found" so the persisted task error is recognisable.
 */
public class SourceNotFoundException extends RuntimeException {

    public SourceNotFoundException(String message) {
        super(message);
    }

    public SourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}

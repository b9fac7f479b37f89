package villagecompute.screening.exceptions;

/**
 * Exception thrown when a dataset or record store operation fails (insert, query, status write).
 *
 * <p>
 * Extends RuntimeException per project standards. Also raised by search jobs whose task has no ingested rows.
 */
public class StorageFailureException extends RuntimeException {

    public StorageFailureException(String message) {
        super(message);
    }

    public StorageFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}

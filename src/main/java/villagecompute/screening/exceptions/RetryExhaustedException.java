package villagecompute.screening.exceptions;

/**
 * Exception describing a notification that failed its final delivery attempt.
 *
 * <p>
 * Extends RuntimeException per project standards. Its message is persisted as the terminal error of the notification record.
 */
public class RetryExhaustedException extends RuntimeException {

    public RetryExhaustedException(String message) {
        super(message);
    }

    public RetryExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }
}

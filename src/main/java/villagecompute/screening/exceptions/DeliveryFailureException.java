package villagecompute.screening.exceptions;

/**
 * Exception thrown when a notification transport cannot deliver a message.
 *
 * <p>
 * Extends RuntimeException per project standards. Counts as one failed attempt against the notification's retry budget.
 */
public class DeliveryFailureException extends RuntimeException {

    public DeliveryFailureException(String message) {
        super(message);
    }

    public DeliveryFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}

package villagecompute.screening.exceptions;

/**
 * Exception thrown when a bounded job queue rejects a job because it is full.
 *
 * <p>
 * This exception signals backpressure to the producer: the job was not accepted and the caller decides whether to
 * surface an error or try again later.
 *
 * <p>
 * All exceptions in this project extend RuntimeException per project standards.
 */
public class QueueCapacityException extends RuntimeException {

    private final int capacity;

    public QueueCapacityException(String message, int capacity) {
        super(message);
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }
}

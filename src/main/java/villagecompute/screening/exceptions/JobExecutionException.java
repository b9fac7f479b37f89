package villagecompute.screening.exceptions;

/**
 * Exception handed to a job handler's failure callback when its execution ended with a {@link Error}.
 *
 * <p>
 * The worker loop keeps running after such an error; the original error is available as the cause.
 *
 * <p>
 * All exceptions in this project extend RuntimeException per project standards.
 */
public class JobExecutionException extends RuntimeException {

    public JobExecutionException(Throwable cause) {
        super("Job execution failed: " + cause, cause);
    }
}

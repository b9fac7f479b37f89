package villagecompute.screening.jobs;

import java.time.Duration;

/**
 * Contract for background job handler implementations.
 *
 * <p>
 * Handlers are CDI-managed beans annotated with {@code @ApplicationScoped}. The
 * {@link villagecompute.screening.services.BackgroundJobService} binds each handler to the {@link WorkerLoop} of the
 * kind returned by {@link #handlesKind()}.
 *
 * <p>
 * <b>Execution Model:</b>
 * <ul>
 * <li>Each handler is invoked from exactly one worker thread, one job at a time</li>
 * <li>Handlers persist their own terminal status; exceptions never reach the producer</li>
 * <li>Handlers must be idempotent: start-up recovery may replay a job interrupted by a crash</li>
 * </ul>
 *
 * <p>
 * <b>Example Implementation:</b>
 *
 * <pre>{@code
 * @ApplicationScoped
 * public class IngestionJobHandler implements JobHandler<IngestionJobPayload> {
 *     @Override
 *     public JobKind handlesKind() {
 *         return JobKind.INGESTION;
 *     }
 *
 *     @Override
 *     public void execute(Job<IngestionJobPayload> job) throws Exception {
 *         // Load the CSV source and write the task status...
 *     }
 * }
 * }</pre>
 *
 * @param <P>
 *            payload type of the jobs this handler processes
 * @see WorkerLoop for the consumer loop
 * @see JobKind for supported kinds
 */
public interface JobHandler<P> {

    /**
     * Returns the job kind this handler processes.
     *
     * @return the kind enum value
     */
    JobKind handlesKind();

    /**
     * Executes the job.
     *
     * <p>
     * <b>Error Handling:</b> Handlers are expected to record failures in their record store themselves. An exception
     * escaping this method is logged by the {@link WorkerLoop}, which then calls {@link #onFailure} and continues with
     * the next job.
     *
     * @param job
     *            the dequeued job
     * @throws Exception
     *             any error not already recorded by the handler
     */
    void execute(Job<P> job) throws Exception;

    /**
     * Finalizes a job whose {@link #execute} threw.
     *
     * <p>
     * Called by the worker loop after logging the exception. The default does nothing; handlers override it to write
     * a failed status when {@code execute} could not.
     *
     * @param job
     *            the job that failed
     * @param cause
     *            the escaped exception; an {@link Error} arrives wrapped in a
     *            {@link villagecompute.screening.exceptions.JobExecutionException}
     * @param elapsed
     *            time spent in {@code execute} before it failed
     */
    default void onFailure(Job<P> job, Exception cause, Duration elapsed) {
    }
}

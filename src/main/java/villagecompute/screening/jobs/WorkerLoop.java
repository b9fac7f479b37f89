package villagecompute.screening.jobs;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.jboss.logging.Logger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import villagecompute.screening.exceptions.JobExecutionException;
import villagecompute.screening.observability.LoggingConfig;

/**
 * Single consumer of one {@link JobQueue}.
 *
 * <p>
 * The loop runs on a dedicated thread, dequeues one job at a time and hands it to its {@link JobHandler}. It keeps
 * track of the job currently executing so status endpoints can poll {@link #currentJobId()}.
 *
 * <p>
 * <b>Failure Isolation:</b> an exception or error escaping a handler is logged, the handler's
 * {@link JobHandler#onFailure} is invoked with the time spent so far, the current job is cleared and the loop moves on.
 * Errors are handed to {@code onFailure} wrapped in a {@link JobExecutionException}. Anything raised by the loop itself
 * is logged as well; a single bad job never halts the loop.
 *
 * <p>
 * <b>Shutdown:</b> {@link #stop} is cooperative. The in-flight job runs to completion, then the loop observes the stop
 * flag at its next poll and exits. Jobs are never interrupted mid-execution.
 *
 * @param <P>
 *            payload type of the jobs
 */
public class WorkerLoop<P> {

    private static final Logger LOG = Logger.getLogger(WorkerLoop.class);

    static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(500);

    private final JobQueue<P> queue;
    private final JobHandler<P> handler;
    private final Tracer tracer;
    private final Duration pollInterval;

    private final AtomicReference<String> currentJobId = new AtomicReference<>();
    private volatile boolean running;
    private Thread thread;

    private final Counter completedCounter;
    private final Counter failedCounter;
    private final Timer executionTimer;

    public WorkerLoop(JobQueue<P> queue, JobHandler<P> handler, Tracer tracer, MeterRegistry meterRegistry) {
        this(queue, handler, tracer, meterRegistry, DEFAULT_POLL_INTERVAL);
    }

    public WorkerLoop(JobQueue<P> queue, JobHandler<P> handler, Tracer tracer, MeterRegistry meterRegistry,
            Duration pollInterval) {
        this.queue = queue;
        this.handler = handler;
        this.tracer = tracer;
        this.pollInterval = pollInterval;

        String kindTag = queue.getKind().getTag();
        this.completedCounter = Counter.builder("screening.jobs.executed").tag("kind", kindTag)
                .tag("outcome", "completed").description("Jobs whose handler returned normally")
                .register(meterRegistry);
        this.failedCounter = Counter.builder("screening.jobs.executed").tag("kind", kindTag).tag("outcome", "failed")
                .description("Jobs whose handler threw").register(meterRegistry);
        this.executionTimer = Timer.builder("screening.jobs.duration").tag("kind", kindTag)
                .description("Job handler execution time").register(meterRegistry);
    }

    /**
     * Starts the consumer thread. Calling start on a running loop is a no-op, and so is calling it while the thread of
     * an earlier {@link #stop} is still finishing its job.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        if (thread != null && thread.isAlive()) {
            LOG.warnf("%s worker loop not restarted: previous thread still finishing job %s", queue.getKind(),
                    currentJobId.get());
            return;
        }
        running = true;
        thread = new Thread(this::run, "worker-" + queue.getKind().getTag());
        thread.setDaemon(true);
        thread.start();
        LOG.infof("Started %s worker loop", queue.getKind());
    }

    /**
     * Signals the loop to stop after the in-flight job and waits up to {@code timeout} for it to exit.
     *
     * @return {@code true} if the loop thread exited within the timeout
     */
    public boolean stop(Duration timeout) {
        Thread current;
        synchronized (this) {
            running = false;
            current = thread;
        }
        if (current == null) {
            return true;
        }
        try {
            current.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warnf("Interrupted while waiting for %s worker loop to stop", queue.getKind());
        }
        if (current.isAlive()) {
            LOG.warnf("%s worker loop still running after %d ms (job in flight: %s)", queue.getKind(),
                    timeout.toMillis(), currentJobId.get());
            return false;
        }
        LOG.infof("Stopped %s worker loop", queue.getKind());
        return true;
    }

    /**
     * Returns the id of the job currently executing, if any.
     */
    public Optional<String> currentJobId() {
        return Optional.ofNullable(currentJobId.get());
    }

    public boolean isRunning() {
        return running;
    }

    public JobQueue<P> getQueue() {
        return queue;
    }

    private void run() {
        try {
            while (running) {
                Job<P> job;
                try {
                    job = queue.poll(pollInterval);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOG.infof("%s worker loop interrupted, exiting", queue.getKind());
                    break;
                }
                if (job == null) {
                    continue;
                }
                try {
                    process(job);
                } catch (Throwable t) {
                    LOG.errorf(t, "%s worker loop error while processing job %s", queue.getKind(), job.jobId());
                    currentJobId.set(null);
                }
            }
        } finally {
            running = false;
        }
    }

    /**
     * Runs a single job on the calling thread. Exposed to the package for deterministic tests.
     */
    void process(Job<P> job) {
        currentJobId.set(job.jobId());
        LoggingConfig.setJob(job.jobId(), job.kind().getTag());

        Span span = tracer.spanBuilder("job.execute").setAttribute("job.id", job.jobId())
                .setAttribute("job.kind", job.kind().name()).startSpan();
        long startNanos = System.nanoTime();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LOG.debugf("Picked up %s job %s (waited %d ms)", job.kind(), job.jobId(),
                    Duration.between(job.enqueuedAt(), Instant.now()).toMillis());

            handler.execute(job);

            span.setStatus(StatusCode.OK);
            completedCounter.increment();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            span.recordException(e);
            failedCounter.increment();
            LOG.warnf(e, "%s job %s interrupted during execution", job.kind(), job.jobId());
            finalizeFailure(job, e, startNanos);

        } catch (Exception e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            failedCounter.increment();
            LOG.errorf(e, "%s job %s failed", job.kind(), job.jobId());
            finalizeFailure(job, e, startNanos);

        } catch (Error e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, String.valueOf(e));
            failedCounter.increment();
            LOG.errorf(e, "%s job %s failed with an error", job.kind(), job.jobId());
            finalizeFailure(job, new JobExecutionException(e), startNanos);

        } finally {
            executionTimer.record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
            currentJobId.set(null);
            span.end();
            LoggingConfig.clearMDC();
        }
    }

    private void finalizeFailure(Job<P> job, Exception cause, long startNanos) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        try {
            handler.onFailure(job, cause, elapsed);
        } catch (Throwable t) {
            LOG.errorf(t, "Could not finalize failed %s job %s", job.kind(), job.jobId());
        }
    }
}

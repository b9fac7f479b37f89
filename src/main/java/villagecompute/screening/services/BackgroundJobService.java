package villagecompute.screening.services;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;

import jakarta.annotation.Priority;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.screening.api.types.SearchParamsType;
import villagecompute.screening.config.JobsConfig;
import villagecompute.screening.data.models.SearchRecord.SearchKind;
import villagecompute.screening.jobs.IngestionJobPayload;
import villagecompute.screening.jobs.Job;
import villagecompute.screening.jobs.JobHandler;
import villagecompute.screening.jobs.JobKind;
import villagecompute.screening.jobs.JobQueue;
import villagecompute.screening.jobs.NotificationJobPayload;
import villagecompute.screening.jobs.SearchJobPayload;
import villagecompute.screening.jobs.WorkerLoop;

/**
 * Entry point for asynchronous work: owns one {@link JobQueue} and one {@link WorkerLoop} per {@link JobKind}.
 *
 * <p>
 * This service handles:
 * <ul>
 * <li>Enqueuing ingestion, search and notification jobs without blocking the caller</li>
 * <li>Starting the three worker loops at application start and stopping them cooperatively at shutdown</li>
 * <li>Reporting the job each loop is currently executing</li>
 * </ul>
 *
 * <p>
 * <b>Job Identity:</b> a job's id is the id of the record it acts on (task, search or notification), so callers and
 * the recovery pass can correlate queued work with persisted status.
 *
 * <p>
 * <b>Concurrency:</b> each kind runs strictly one job at a time; the three kinds progress independently. Handler
 * failures never reach the enqueuing caller, they are visible only through the persisted record status.
 *
 * @see JobHandler for the handler contract
 * @see WorkerLoop for failure isolation and cooperative shutdown
 */
@ApplicationScoped
public class BackgroundJobService {

    private static final Logger LOG = Logger.getLogger(BackgroundJobService.class);

    private final JobQueue<IngestionJobPayload> ingestionQueue;
    private final JobQueue<SearchJobPayload> searchQueue;
    private final JobQueue<NotificationJobPayload> notificationQueue;

    private final WorkerLoop<IngestionJobPayload> ingestionLoop;
    private final WorkerLoop<SearchJobPayload> searchLoop;
    private final WorkerLoop<NotificationJobPayload> notificationLoop;

    private final Duration shutdownTimeout;

    @Inject
    public BackgroundJobService(JobHandler<IngestionJobPayload> ingestionHandler,
            JobHandler<SearchJobPayload> searchHandler, JobHandler<NotificationJobPayload> notificationHandler,
            JobsConfig jobsConfig, Tracer tracer, MeterRegistry meterRegistry) {
        checkHandlers(ingestionHandler, searchHandler, notificationHandler);

        int capacity = jobsConfig.getQueueCapacity();
        Duration pollInterval = jobsConfig.getPollInterval();
        this.shutdownTimeout = jobsConfig.getShutdownTimeout();

        this.ingestionQueue = new JobQueue<>(JobKind.INGESTION, capacity);
        this.searchQueue = new JobQueue<>(JobKind.SEARCH, capacity);
        this.notificationQueue = new JobQueue<>(JobKind.NOTIFICATION, capacity);

        this.ingestionLoop = new WorkerLoop<>(ingestionQueue, ingestionHandler, tracer, meterRegistry, pollInterval);
        this.searchLoop = new WorkerLoop<>(searchQueue, searchHandler, tracer, meterRegistry, pollInterval);
        this.notificationLoop = new WorkerLoop<>(notificationQueue, notificationHandler, tracer, meterRegistry,
                pollInterval);

        LOG.infof("Initialized BackgroundJobService with %d queues (capacity: %s)", JobKind.values().length,
                capacity == 0 ? "unbounded" : String.valueOf(capacity));
    }

    /**
     * Verifies every handler serves the kind of the loop it is wired to.
     *
     * @throws IllegalStateException
     *             if a handler reports a different kind
     */
    private static void checkHandlers(JobHandler<?> ingestion, JobHandler<?> search, JobHandler<?> notification) {
        Map<JobKind, JobHandler<?>> wiring = new EnumMap<>(JobKind.class);
        wiring.put(JobKind.INGESTION, ingestion);
        wiring.put(JobKind.SEARCH, search);
        wiring.put(JobKind.NOTIFICATION, notification);
        for (Map.Entry<JobKind, JobHandler<?>> entry : wiring.entrySet()) {
            JobKind handled = entry.getValue().handlesKind();
            if (handled != entry.getKey()) {
                throw new IllegalStateException("Handler " + entry.getValue().getClass().getName() + " handles "
                        + handled + " but is wired to the " + entry.getKey() + " loop");
            }
            LOG.debugf("Registered handler %s for JobKind.%s", entry.getValue().getClass().getSimpleName(),
                    entry.getKey());
        }
    }

    /**
     * Starts the worker loops before the start-up recovery pass enqueues anything.
     */
    void onStart(@Observes @Priority(1) StartupEvent event) {
        start();
    }

    void onStop(@Observes ShutdownEvent event) {
        stop();
    }

    public void start() {
        for (WorkerLoop<?> loop : loops()) {
            loop.start();
        }
        LOG.info("Background worker loops started");
    }

    /**
     * Stops all loops, letting each in-flight job finish within {@code screening.jobs.shutdown-timeout}.
     */
    public void stop() {
        int stopped = 0;
        for (WorkerLoop<?> loop : loops()) {
            if (loop.stop(shutdownTimeout)) {
                stopped++;
            }
        }
        LOG.infof("Background worker loops stopped (%d/%d exited cleanly)", stopped, JobKind.values().length);
    }

    /**
     * Enqueues an ingestion job for the task.
     *
     * @return the job id, equal to the task id
     */
    public String enqueueIngestion(UUID taskId, String sourceRef) {
        Job<IngestionJobPayload> job = Job.of(taskId.toString(), JobKind.INGESTION,
                new IngestionJobPayload(taskId, sourceRef));
        ingestionQueue.enqueue(job);
        LOG.infof("Enqueued ingestion job: taskId=%s, source=%s", taskId, sourceRef);
        return job.jobId();
    }

    /**
     * Enqueues a search job.
     *
     * @return the job id, equal to the search id
     */
    public String enqueueSearch(UUID searchId, SearchKind kind, SearchParamsType params) {
        Job<SearchJobPayload> job = Job.of(searchId.toString(), JobKind.SEARCH,
                new SearchJobPayload(searchId, kind, params));
        searchQueue.enqueue(job);
        LOG.infof("Enqueued %s search job: searchId=%s, taskRef=%s", kind, searchId, params.taskRef());
        return job.jobId();
    }

    /**
     * Enqueues a notification delivery job. A notification already waiting in the queue is not added twice.
     *
     * @return the job id, equal to the notification id
     */
    public String enqueueNotification(UUID notificationId) {
        offerNotification(notificationId);
        return notificationId.toString();
    }

    /**
     * Enqueues a notification delivery job unless one for the same notification is already waiting.
     *
     * @return {@code true} if a job was added
     */
    public boolean offerNotification(UUID notificationId) {
        Job<NotificationJobPayload> job = Job.of(notificationId.toString(), JobKind.NOTIFICATION,
                new NotificationJobPayload(notificationId));
        boolean added = notificationQueue.enqueueIfAbsent(job);
        if (added) {
            LOG.debugf("Enqueued notification job: id=%s", notificationId);
        }
        return added;
    }

    public Optional<String> currentIngestionJob() {
        return ingestionLoop.currentJobId();
    }

    public Optional<String> currentSearchJob() {
        return searchLoop.currentJobId();
    }

    public Optional<String> currentNotificationJob() {
        return notificationLoop.currentJobId();
    }

    /**
     * Number of jobs waiting in the queue of the given kind.
     */
    public int getQueueDepth(JobKind kind) {
        return switch (kind) {
            case INGESTION -> ingestionQueue.size();
            case SEARCH -> searchQueue.size();
            case NOTIFICATION -> notificationQueue.size();
        };
    }

    private List<WorkerLoop<?>> loops() {
        return List.of(ingestionLoop, searchLoop, notificationLoop);
    }
}

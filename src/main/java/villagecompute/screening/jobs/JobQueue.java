package villagecompute.screening.jobs;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import org.jboss.logging.Logger;

import villagecompute.screening.exceptions.QueueCapacityException;

/**
 * FIFO handoff between producers (the API layer) and the single consumer loop of one {@link JobKind}.
 *
 * <p>
 * <b>Capacity:</b> a capacity of {@code 0} means unbounded, which is the default
 * ({@code screening.jobs.queue-capacity}). With a positive capacity, {@link #enqueue} rejects jobs once the queue is
 * full by throwing {@link QueueCapacityException}; it never blocks the producer either way.
 *
 * <p>
 * <b>Deduplication:</b> the queue counts the ids of waiting jobs. {@link #enqueueIfAbsent} skips a job whose id is
 * already waiting, which lets periodic sweeps re-offer records without piling up copies.
 *
 * <p>
 * <b>Thread Safety:</b> backed by a {@link LinkedBlockingQueue}; any number of producers may enqueue concurrently.
 *
 * @param <P>
 *            payload type carried by the jobs
 */
public class JobQueue<P> {

    private static final Logger LOG = Logger.getLogger(JobQueue.class);

    private final JobKind kind;
    private final int capacity;
    private final BlockingQueue<Job<P>> jobs;
    private final ConcurrentMap<String, Integer> waiting = new ConcurrentHashMap<>();

    public JobQueue(JobKind kind, int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Queue capacity must be >= 0, got " + capacity);
        }
        this.kind = kind;
        this.capacity = capacity;
        this.jobs = capacity == 0 ? new LinkedBlockingQueue<>() : new LinkedBlockingQueue<>(capacity);
    }

    public static <P> JobQueue<P> unbounded(JobKind kind) {
        return new JobQueue<>(kind, 0);
    }

    /**
     * Appends a job to the tail of the queue without blocking.
     *
     * @param job
     *            the job to append; its kind must match the queue's kind
     * @throws QueueCapacityException
     *             if the queue is bounded and full
     */
    public void enqueue(Job<P> job) {
        checkKind(job);
        waiting.merge(job.jobId(), 1, Integer::sum);
        offer(job);
    }

    /**
     * Appends a job unless a job with the same id is already waiting.
     *
     * @return {@code false} if the job was skipped as a duplicate
     * @throws QueueCapacityException
     *             if the queue is bounded and full
     */
    public boolean enqueueIfAbsent(Job<P> job) {
        checkKind(job);
        if (waiting.putIfAbsent(job.jobId(), 1) != null) {
            LOG.debugf("%s job %s already waiting, not enqueued again", kind, job.jobId());
            return false;
        }
        offer(job);
        return true;
    }

    /**
     * Whether a job with this id is waiting to be dequeued.
     */
    public boolean isWaiting(String jobId) {
        return waiting.containsKey(jobId);
    }

    /**
     * Removes the head of the queue, waiting until a job is available.
     *
     * @return the oldest job
     * @throws InterruptedException
     *             if the waiting thread is interrupted
     */
    public Job<P> dequeue() throws InterruptedException {
        return released(jobs.take());
    }

    /**
     * Removes the head of the queue, waiting up to {@code timeout} for a job.
     *
     * @return the oldest job, or {@code null} if none arrived in time
     */
    public Job<P> poll(Duration timeout) throws InterruptedException {
        return released(jobs.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    public int size() {
        return jobs.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public JobKind getKind() {
        return kind;
    }

    private void checkKind(Job<P> job) {
        if (job.kind() != kind) {
            throw new IllegalArgumentException("Job " + job.jobId() + " of kind " + job.kind()
                    + " cannot be enqueued on the " + kind + " queue");
        }
    }

    private void offer(Job<P> job) {
        if (!jobs.offer(job)) {
            waiting.computeIfPresent(job.jobId(), (id, count) -> count > 1 ? count - 1 : null);
            throw new QueueCapacityException(
                    String.format("%s queue is full (capacity %d), job %s rejected", kind, capacity, job.jobId()),
                    capacity);
        }
        LOG.debugf("Enqueued %s job %s (depth: %d)", kind, job.jobId(), jobs.size());
    }

    private Job<P> released(Job<P> job) {
        if (job != null) {
            waiting.computeIfPresent(job.jobId(), (id, count) -> count > 1 ? count - 1 : null);
        }
        return job;
    }
}

package villagecompute.screening.jobs;

import java.time.Instant;
import java.util.Objects;

/**
 * Envelope for a unit of background work.
 *
 * <p>
 * The job id is the id of the record the job acts on (task, search or notification id), so status polling and the
 * loop's current-job accessor speak the same identifier.
 *
 * @param jobId
 *            id of the record this job processes
 * @param kind
 *            job family, selects the queue
 * @param payload
 *            typed job parameters
 * @param enqueuedAt
 *            time the producer handed the job over
 * @param <P>
 *            payload type
 */
public record Job<P>(String jobId, JobKind kind, P payload, Instant enqueuedAt) {

    public Job {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(enqueuedAt, "enqueuedAt");
    }

    public static <P> Job<P> of(String jobId, JobKind kind, P payload) {
        return new Job<>(jobId, kind, payload, Instant.now());
    }
}

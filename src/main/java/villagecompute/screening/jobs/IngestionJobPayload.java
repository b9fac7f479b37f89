package villagecompute.screening.jobs;

import java.util.Objects;
import java.util.UUID;

/**
 * Parameters of an ingestion job.
 *
 * @param taskId
 *            task whose status the job writes
 * @param sourceRef
 *            uploaded CSV to load
 */
public record IngestionJobPayload(UUID taskId, String sourceRef) {

    public IngestionJobPayload {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(sourceRef, "sourceRef");
    }
}

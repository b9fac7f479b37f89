package villagecompute.screening.data.stores;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import villagecompute.screening.data.models.IngestionTask;

/**
 * Persistence of ingestion task status.
 *
 * <p>
 * Status writes go through {@link IngestionTask#complete} and {@link IngestionTask#completeWithError}, so an illegal
 * transition raises {@link IllegalStateException} whatever the backing store.
 */
public interface TaskRecordStore {

    IngestionTask create(String sourceRef);

    Optional<IngestionTask> read(UUID taskId);

    void markCompleted(UUID taskId, List<String> columnNames, long totalRows, double processingSeconds);

    void markFailed(UUID taskId, String errorMessage, double processingSeconds);

    /**
     * Tasks whose ingestion has not written a terminal status, oldest first.
     */
    List<IngestionTask> listNonTerminal();

    boolean delete(UUID taskId);
}

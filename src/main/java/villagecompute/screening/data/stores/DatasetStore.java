package villagecompute.screening.data.stores;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Row storage for ingested datasets, partitioned by ingestion task.
 */
public interface DatasetStore {

    void insertBatch(UUID taskId, List<Map<String, String>> rows);

    /**
     * Rows of a task in ingestion order, each restricted to the requested columns it has. An empty column list returns
     * whole rows.
     */
    List<Map<String, String>> queryRows(UUID taskId, List<String> columns);

    long countRows(UUID taskId);

    long deleteRows(UUID taskId);

    /**
     * First row of a task, used to list the dataset's columns.
     */
    Optional<Map<String, String>> sampleRow(UUID taskId);
}

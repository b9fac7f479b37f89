package villagecompute.screening.data.stores;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;

import org.jboss.logging.Logger;

import villagecompute.screening.data.models.DatasetRow;
import villagecompute.screening.exceptions.StorageFailureException;

/**
 * {@link DatasetStore} backed by the {@code dataset_rows} table.
 */
@ApplicationScoped
public class PanacheDatasetStore implements DatasetStore {

    private static final Logger LOG = Logger.getLogger(PanacheDatasetStore.class);

    @Override
    @Transactional
    public void insertBatch(UUID taskId, List<Map<String, String>> rows) {
        Instant now = Instant.now();
        List<DatasetRow> entities = new ArrayList<>(rows.size());
        for (Map<String, String> values : rows) {
            entities.add(DatasetRow.of(taskId, new LinkedHashMap<>(values), now));
        }
        try {
            DatasetRow.persist(entities);
        } catch (RuntimeException e) {
            throw new StorageFailureException("Failed to insert " + rows.size() + " rows for task " + taskId, e);
        }
        LOG.debugf("Inserted %d dataset rows for task %s", rows.size(), taskId);
    }

    @Override
    @Transactional
    public List<Map<String, String>> queryRows(UUID taskId, List<String> columns) {
        List<DatasetRow> stored;
        try {
            stored = DatasetRow.findByTask(taskId);
        } catch (RuntimeException e) {
            throw new StorageFailureException("Failed to query rows for task " + taskId, e);
        }
        List<Map<String, String>> rows = new ArrayList<>(stored.size());
        for (DatasetRow row : stored) {
            rows.add(project(row.values, columns));
        }
        return rows;
    }

    @Override
    @Transactional
    public long countRows(UUID taskId) {
        return DatasetRow.countByTask(taskId);
    }

    @Override
    @Transactional
    public long deleteRows(UUID taskId) {
        return DatasetRow.deleteByTask(taskId);
    }

    @Override
    @Transactional
    public Optional<Map<String, String>> sampleRow(UUID taskId) {
        return DatasetRow.<DatasetRow> find("taskId = ?1 ORDER BY id ASC", taskId).firstResultOptional()
                .map(row -> row.values);
    }

    public static Map<String, String> project(Map<String, String> values, List<String> columns) {
        if (columns.isEmpty()) {
            return new LinkedHashMap<>(values);
        }
        Map<String, String> projected = new LinkedHashMap<>();
        for (String column : columns) {
            if (values.containsKey(column)) {
                projected.put(column, values.get(column));
            }
        }
        return projected;
    }
}

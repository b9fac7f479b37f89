package villagecompute.screening.data.stores;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;

import org.jboss.logging.Logger;

import villagecompute.screening.data.models.IngestionTask;
import villagecompute.screening.exceptions.StorageFailureException;

/**
 * {@link TaskRecordStore} backed by the {@code ingestion_tasks} table. Every write commits in its own transaction so a
 * terminal status is durable before the caller continues.
 */
@ApplicationScoped
public class PanacheTaskRecordStore implements TaskRecordStore {

    private static final Logger LOG = Logger.getLogger(PanacheTaskRecordStore.class);

    @Override
    @Transactional
    public IngestionTask create(String sourceRef) {
        IngestionTask task = IngestionTask.newPending(sourceRef);
        task.persist();
        LOG.infof("Created ingestion task %s for source %s", task.id, sourceRef);
        return task;
    }

    @Override
    @Transactional
    public Optional<IngestionTask> read(UUID taskId) {
        return IngestionTask.findByIdOptional(taskId);
    }

    @Override
    @Transactional
    public void markCompleted(UUID taskId, List<String> columnNames, long totalRows, double processingSeconds) {
        require(taskId).complete(columnNames, totalRows, processingSeconds);
    }

    @Override
    @Transactional
    public void markFailed(UUID taskId, String errorMessage, double processingSeconds) {
        require(taskId).completeWithError(errorMessage, processingSeconds);
    }

    @Override
    @Transactional
    public List<IngestionTask> listNonTerminal() {
        return IngestionTask.find("#" + IngestionTask.QUERY_FIND_NON_TERMINAL).list();
    }

    @Override
    @Transactional
    public boolean delete(UUID taskId) {
        return IngestionTask.deleteById(taskId);
    }

    private IngestionTask require(UUID taskId) {
        IngestionTask task = IngestionTask.findById(taskId);
        if (task == null) {
            throw new StorageFailureException("Task not found: " + taskId);
        }
        return task;
    }
}

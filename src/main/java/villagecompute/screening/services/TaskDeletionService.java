package villagecompute.screening.services;

import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;

import org.jboss.logging.Logger;

import villagecompute.screening.data.models.IngestionTask;
import villagecompute.screening.data.stores.DatasetStore;
import villagecompute.screening.data.stores.SearchRecordStore;
import villagecompute.screening.data.stores.TaskRecordStore;

/**
 * Explicit cascading delete of an ingestion task.
 *
 * <p>
 * Records are never removed automatically; this is the only path that deletes them. The dataset rows, every search
 * run against the task and the task record itself go in one transaction. A task whose ingestion is still running is
 * refused.
 */
@ApplicationScoped
public class TaskDeletionService {

    private static final Logger LOG = Logger.getLogger(TaskDeletionService.class);

    @Inject
    TaskRecordStore taskStore;

    @Inject
    SearchRecordStore searchStore;

    @Inject
    DatasetStore datasetStore;

    @Inject
    BackgroundJobService jobService;

    /**
     * Deletes a task with its dataset rows and searches.
     *
     * @param taskId
     *            task to delete
     * @return counts of what was removed
     * @throws IllegalArgumentException
     *             if the task does not exist
     * @throws IllegalStateException
     *             if the task is being ingested right now
     */
    @Transactional
    public DeletionResult deleteTask(UUID taskId) {
        IngestionTask task = taskStore.read(taskId)
                .orElseThrow(() -> new IllegalArgumentException("Task not found: " + taskId));

        if (jobService.currentIngestionJob().filter(taskId.toString()::equals).isPresent()) {
            throw new IllegalStateException("Task " + taskId + " is being ingested and cannot be deleted");
        }

        long rows = datasetStore.deleteRows(taskId);
        long searches = searchStore.deleteByTask(taskId);
        taskStore.delete(taskId);

        LOG.infof("Deleted task: id=%s, source=%s, status=%s, rows=%d, searches=%d", taskId, task.sourceRef,
                task.status, rows, searches);
        return new DeletionResult(taskId, rows, searches);
    }

    public record DeletionResult(UUID taskId, long rowsDeleted, long searchesDeleted) {
    }
}

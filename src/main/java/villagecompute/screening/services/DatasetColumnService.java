package villagecompute.screening.services;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.screening.api.types.ColumnsOverviewType;
import villagecompute.screening.data.stores.DatasetStore;
import villagecompute.screening.data.stores.TaskRecordStore;

/**
 * Lists the columns of an ingested dataset and suggests the ones worth screening names against.
 */
@ApplicationScoped
public class DatasetColumnService {

    private static final Logger LOG = Logger.getLogger(DatasetColumnService.class);

    /**
     * Name columns suggested for screening, in suggestion order.
     */
    static final List<String> NAME_COLUMNS = List.of("NameAlias_WholeName", "NameAlias_FirstName",
            "NameAlias_LastName", "NameAlias_MiddleName");

    @Inject
    DatasetStore datasetStore;

    @Inject
    TaskRecordStore taskStore;

    /**
     * Describes the dataset of a task. A task without rows yields empty column lists and a zero count.
     *
     * <p>
     * Columns come in header order from the task record; rows stored as JSONB do not keep key order, so the sample row
     * is only used when the task carries no column names.
     */
    public ColumnsOverviewType describeColumns(UUID taskId) {
        Optional<Map<String, String>> sample = datasetStore.sampleRow(taskId);
        if (sample.isEmpty()) {
            LOG.debugf("No dataset rows for task %s", taskId);
            return new ColumnsOverviewType(taskId, List.of(), List.of(), 0);
        }

        List<String> available = taskStore.read(taskId).map(task -> task.columnNames).filter(c -> !c.isEmpty())
                .<List<String>> map(ArrayList::new).orElseGet(() -> new ArrayList<>(sample.get().keySet()));
        List<String> recommended = NAME_COLUMNS.stream().filter(available::contains).toList();
        long total = datasetStore.countRows(taskId);

        return new ColumnsOverviewType(taskId, available, recommended, total);
    }
}

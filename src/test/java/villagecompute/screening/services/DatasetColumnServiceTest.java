package villagecompute.screening.services;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import villagecompute.screening.api.types.ColumnsOverviewType;
import villagecompute.screening.data.models.IngestionTask;
import villagecompute.screening.testing.InMemoryDatasetStore;
import villagecompute.screening.testing.InMemoryTaskRecordStore;

/**
 * Unit tests for {@link DatasetColumnService}.
 */
class DatasetColumnServiceTest {

    private DatasetColumnService service;
    private InMemoryTaskRecordStore taskStore;
    private InMemoryDatasetStore datasetStore;

    @BeforeEach
    void setUp() {
        taskStore = new InMemoryTaskRecordStore();
        datasetStore = new InMemoryDatasetStore();
        service = new DatasetColumnService();
        service.taskStore = taskStore;
        service.datasetStore = datasetStore;
    }

    @Test
    void testDescribeColumns_headerOrderAndRecommendations() {
        IngestionTask task = taskStore.create("list.csv");
        List<String> header = List.of("Entity_LogicalId", "NameAlias_LastName", "NameAlias_WholeName");
        datasetStore.insertBatch(task.id,
                List.of(Map.of("Entity_LogicalId", "1", "NameAlias_LastName", "Smith", "NameAlias_WholeName", "J S"),
                        Map.of("Entity_LogicalId", "2", "NameAlias_LastName", "Doe", "NameAlias_WholeName", "J D")));
        taskStore.markCompleted(task.id, header, 2, 0.1);

        ColumnsOverviewType overview = service.describeColumns(task.id);

        assertEquals(task.id, overview.taskId());
        assertEquals(header, overview.availableColumns());
        assertEquals(List.of("NameAlias_WholeName", "NameAlias_LastName"), overview.recommendedColumns());
        assertEquals(2, overview.totalRecords());
    }

    @Test
    void testDescribeColumns_fallsBackToSampleRowKeys() {
        UUID taskId = UUID.randomUUID();
        datasetStore.insertBatch(taskId, List.of(Map.of("Country", "FR")));

        ColumnsOverviewType overview = service.describeColumns(taskId);

        assertEquals(List.of("Country"), overview.availableColumns());
        assertEquals(List.of(), overview.recommendedColumns());
        assertEquals(1, overview.totalRecords());
    }

    @Test
    void testDescribeColumns_noRows() {
        UUID taskId = UUID.randomUUID();

        assertEquals(new ColumnsOverviewType(taskId, List.of(), List.of(), 0), service.describeColumns(taskId));
    }
}

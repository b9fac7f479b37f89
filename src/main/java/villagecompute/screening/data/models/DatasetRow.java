package villagecompute.screening.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One ingested CSV row. Column values are kept as a JSONB object keyed by header name; the identity id preserves file
 * order.
 */
@Entity
@Table(
        name = "dataset_rows",
        indexes = @Index(
                name = "idx_dataset_rows_task",
                columnList = "task_id"))
public class DatasetRow extends PanacheEntityBase {

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            name = "task_id",
            nullable = false)
    public UUID taskId;

    @Column(
            name = "row_values",
            nullable = false,
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, String> values;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    public static DatasetRow of(UUID taskId, Map<String, String> values, Instant createdAt) {
        DatasetRow row = new DatasetRow();
        row.taskId = taskId;
        row.values = values;
        row.createdAt = createdAt;
        return row;
    }

    public static List<DatasetRow> findByTask(UUID taskId) {
        return list("taskId = ?1 ORDER BY id ASC", taskId);
    }

    public static long countByTask(UUID taskId) {
        return count("taskId", taskId);
    }

    public static long deleteByTask(UUID taskId) {
        return delete("taskId", taskId);
    }
}

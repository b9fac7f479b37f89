package villagecompute.screening.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.NamedQuery;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * CSV ingestion task, one per uploaded source.
 *
 * <h3>Schema Mapping:</h3>
 * <ul>
 * <li>id (UUID, PK) - Task identifier, also the ingestion job id</li>
 * <li>source_ref (VARCHAR, NOT NULL) - Source artifact reference in the SourceStore</li>
 * <li>status (VARCHAR, NOT NULL) - PENDING or COMPLETED</li>
 * <li>is_done (BOOLEAN) - True once the ingestion job wrote its terminal status</li>
 * <li>column_names (JSONB) - Header of the ingested CSV, empty on failure</li>
 * <li>total_rows (BIGINT) - Ingested row count, 0 on failure</li>
 * <li>processing_time (DOUBLE) - Elapsed ingestion time in seconds</li>
 * <li>error_message (TEXT) - Failure cause, null on success</li>
 * </ul>
 *
 * <p>
 * A failed ingestion still ends in COMPLETED; {@code error_message} tells the outcome apart.
 */
@Entity
@Table(
        name = "ingestion_tasks")
@NamedQuery(
        name = IngestionTask.QUERY_FIND_NON_TERMINAL,
        query = "FROM IngestionTask WHERE status = 'PENDING' ORDER BY createdAt ASC")
public class IngestionTask extends PanacheEntityBase {

    public static final String QUERY_FIND_NON_TERMINAL = "IngestionTask.findNonTerminal";

    @Id
    @GeneratedValue
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "source_ref",
            nullable = false)
    public String sourceRef;

    @Enumerated(EnumType.STRING)
    @Column(
            nullable = false,
            length = 20)
    public TaskStatus status = TaskStatus.PENDING;

    @Column(
            name = "is_done",
            nullable = false)
    public boolean isDone;

    @Column(
            name = "column_names",
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public List<String> columnNames = new ArrayList<>();

    @Column(
            name = "total_rows",
            nullable = false)
    public long totalRows;

    @Column(
            name = "processing_time")
    public Double processingTime;

    @Column(
            name = "error_message",
            columnDefinition = "TEXT")
    public String errorMessage;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Ingestion lifecycle. Success and failure both end in COMPLETED.
     */
    public enum TaskStatus {
        PENDING,
        COMPLETED;

        public boolean isTerminal() {
            return this == COMPLETED;
        }

        public boolean canTransitionTo(TaskStatus next) {
            return this == PENDING && next == COMPLETED;
        }
    }

    /**
     * Builds a pending task for a stored source. The caller persists it.
     */
    public static IngestionTask newPending(String sourceRef) {
        IngestionTask task = new IngestionTask();
        task.sourceRef = sourceRef;
        task.status = TaskStatus.PENDING;
        task.createdAt = Instant.now();
        task.updatedAt = task.createdAt;
        return task;
    }

    /**
     * Records a successful ingestion.
     */
    public void complete(List<String> columns, long rows, double seconds) {
        transitionTo(TaskStatus.COMPLETED);
        this.columnNames = new ArrayList<>(columns);
        this.totalRows = rows;
        this.processingTime = seconds;
        this.errorMessage = null;
    }

    /**
     * Records a failed ingestion: no columns, no rows, the error kept for the status endpoint.
     */
    public void completeWithError(String error, double seconds) {
        transitionTo(TaskStatus.COMPLETED);
        this.columnNames = new ArrayList<>();
        this.totalRows = 0;
        this.processingTime = seconds;
        this.errorMessage = error;
    }

    private void transitionTo(TaskStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Task " + id + " cannot move from " + status + " to " + next);
        }
        this.status = next;
        this.isDone = true;
        this.updatedAt = Instant.now();
    }
}

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
import villagecompute.screening.api.types.AdvancedQueryResultType;
import villagecompute.screening.api.types.BulkMatchResultType;
import villagecompute.screening.api.types.ColumnOptionsType;
import villagecompute.screening.api.types.MatchedRecordType;
import villagecompute.screening.api.types.SearchParamsType;
import villagecompute.screening.api.types.SearchSummaryType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A screening search over one ingested dataset.
 *
 * <h3>Schema Mapping:</h3>
 * <ul>
 * <li>id (UUID, PK) - Search identifier, also the search job id</li>
 * <li>task_ref (UUID, NOT NULL) - Ingestion task whose rows are searched</li>
 * <li>kind (VARCHAR) - SINGLE, BULK or ADVANCED</li>
 * <li>query_names, columns, column_options, query_rows (JSONB) - Search parameters</li>
 * <li>status (VARCHAR) - PENDING, PROCESSING, COMPLETED, FAILED</li>
 * <li>matched_records, bulk_results, advanced_results, summary (JSONB) - Results by kind</li>
 * <li>execution_time_ms (DOUBLE) - Elapsed time up to completion or failure</li>
 * </ul>
 *
 * <h3>Lifecycle:</h3> PENDING → PROCESSING → COMPLETED | FAILED. A replayed search may enter PROCESSING again.
 */
@Entity
@Table(
        name = "search_records")
@NamedQuery(
        name = SearchRecord.QUERY_FIND_NON_TERMINAL,
        query = "FROM SearchRecord WHERE status IN ('PENDING', 'PROCESSING') ORDER BY createdAt ASC")
@NamedQuery(
        name = SearchRecord.QUERY_FIND_BY_TASK,
        query = "FROM SearchRecord WHERE taskRef = ?1 ORDER BY createdAt DESC")
public class SearchRecord extends PanacheEntityBase {

    public static final String QUERY_FIND_NON_TERMINAL = "SearchRecord.findNonTerminal";
    public static final String QUERY_FIND_BY_TASK = "SearchRecord.findByTask";

    @Id
    @GeneratedValue
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "task_ref",
            nullable = false)
    public UUID taskRef;

    @Enumerated(EnumType.STRING)
    @Column(
            nullable = false,
            length = 20)
    public SearchKind kind;

    @Column(
            name = "query_names",
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public List<String> queryNames = new ArrayList<>();

    @Column(
            name = "columns",
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public List<String> columns = new ArrayList<>();

    @Column(
            nullable = false)
    public int threshold;

    @Column(
            name = "watchlist_ref")
    public String watchlistRef;

    @Column(
            name = "column_options",
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, ColumnOptionsType> columnOptions = new HashMap<>();

    @Column(
            name = "query_rows",
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public List<Map<String, String>> queryRows = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(
            nullable = false,
            length = 20)
    public SearchStatus status = SearchStatus.PENDING;

    @Column(
            name = "total_rows",
            nullable = false)
    public long totalRows;

    @Column(
            name = "execution_time_ms")
    public Double executionTimeMs;

    @Column(
            name = "matched_records",
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public List<MatchedRecordType> matchedRecords = new ArrayList<>();

    @Column(
            name = "bulk_results",
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public List<BulkMatchResultType> bulkResults = new ArrayList<>();

    @Column(
            name = "advanced_results",
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public List<AdvancedQueryResultType> advancedResults = new ArrayList<>();

    @Column(
            name = "summary",
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public SearchSummaryType summary;

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

    public enum SearchKind {
        SINGLE,
        BULK,
        ADVANCED
    }

    public enum SearchStatus {
        PENDING,
        PROCESSING,
        COMPLETED,
        FAILED;

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED;
        }

        public boolean canTransitionTo(SearchStatus next) {
            return switch (this) {
                case PENDING -> next == PROCESSING || next == FAILED;
                // PROCESSING again when recovery replays an interrupted search
                case PROCESSING -> next == PROCESSING || next == COMPLETED || next == FAILED;
                case COMPLETED, FAILED -> false;
            };
        }
    }

    /**
     * Builds a pending search from its parameters. The caller persists it.
     */
    public static SearchRecord newPending(SearchKind kind, SearchParamsType params) {
        SearchRecord record = new SearchRecord();
        record.kind = kind;
        record.taskRef = params.taskRef();
        record.columns = new ArrayList<>(params.columns());
        record.threshold = params.threshold();
        record.queryNames = new ArrayList<>(params.queryNames());
        record.watchlistRef = params.watchlistRef();
        record.columnOptions = new HashMap<>(params.columnOptions());
        record.queryRows = new ArrayList<>(params.queryRows());
        record.status = SearchStatus.PENDING;
        record.createdAt = Instant.now();
        record.updatedAt = record.createdAt;
        return record;
    }

    /**
     * Rebuilds the job parameters, used when a search is re-enqueued at start-up.
     */
    public SearchParamsType toParams() {
        return new SearchParamsType(taskRef, columns, threshold, queryNames, watchlistRef, columnOptions, queryRows);
    }

    public void markProcessing() {
        transitionTo(SearchStatus.PROCESSING);
        this.errorMessage = null;
    }

    public void complete(SearchResults results) {
        transitionTo(SearchStatus.COMPLETED);
        this.matchedRecords = new ArrayList<>(results.matchedRecords());
        this.bulkResults = new ArrayList<>(results.bulkResults());
        this.advancedResults = new ArrayList<>(results.advancedResults());
        this.summary = results.summary();
        this.totalRows = results.totalRows();
        this.executionTimeMs = results.executionTimeMs();
        this.errorMessage = null;
    }

    public void fail(String error, double executionTimeMs) {
        transitionTo(SearchStatus.FAILED);
        this.errorMessage = error;
        this.executionTimeMs = executionTimeMs;
    }

    private void transitionTo(SearchStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Search " + id + " cannot move from " + status + " to " + next);
        }
        this.status = next;
        this.updatedAt = Instant.now();
    }

    /**
     * Results written with a completed search. Lists not produced by the search kind are empty.
     */
    public record SearchResults(List<MatchedRecordType> matchedRecords, List<BulkMatchResultType> bulkResults,
            List<AdvancedQueryResultType> advancedResults, SearchSummaryType summary, long totalRows,
            double executionTimeMs) {

        public static SearchResults single(List<MatchedRecordType> matches, SearchSummaryType summary, long totalRows,
                double executionTimeMs) {
            return new SearchResults(matches, List.of(), List.of(), summary, totalRows, executionTimeMs);
        }

        public static SearchResults bulk(List<BulkMatchResultType> results, SearchSummaryType summary, long totalRows,
                double executionTimeMs) {
            return new SearchResults(List.of(), results, List.of(), summary, totalRows, executionTimeMs);
        }

        public static SearchResults advanced(List<AdvancedQueryResultType> results, SearchSummaryType summary,
                long totalRows, double executionTimeMs) {
            return new SearchResults(List.of(), List.of(), results, summary, totalRows, executionTimeMs);
        }
    }
}

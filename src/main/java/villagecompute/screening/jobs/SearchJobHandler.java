/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.screening.jobs;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;

import org.jboss.logging.Logger;

import villagecompute.screening.api.types.AdvancedQueryResultType;
import villagecompute.screening.api.types.BulkMatchResultType;
import villagecompute.screening.api.types.MatchedRecordType;
import villagecompute.screening.api.types.SearchParamsType;
import villagecompute.screening.api.types.SearchSummaryType;
import villagecompute.screening.config.JobsConfig;
import villagecompute.screening.config.ScoringPoolConfig;
import villagecompute.screening.data.models.SearchRecord;
import villagecompute.screening.data.models.SearchRecord.SearchKind;
import villagecompute.screening.data.models.SearchRecord.SearchResults;
import villagecompute.screening.data.stores.DatasetStore;
import villagecompute.screening.data.stores.SearchRecordStore;
import villagecompute.screening.exceptions.StorageFailureException;
import villagecompute.screening.util.ColumnCriteriaMatcher;
import villagecompute.screening.util.FuzzyMatcher;

/**
 * Job handler that screens query names against an ingested dataset.
 *
 * <p>
 * <b>Execution Flow:</b>
 * <ol>
 * <li>Mark the search PROCESSING</li>
 * <li>Load the task's rows once; a task without rows fails the search with {@link StorageFailureException}</li>
 * <li>Score in the scoring pool: one pool task for a single search, one per query for a bulk search</li>
 * <li>Store results, summary, row count and execution time with status COMPLETED</li>
 * </ol>
 *
 * <p>
 * Any exception fails the search with the error and the time spent so far. Searches are never retried automatically.
 *
 * <p>
 * Advanced searches count exact or substring hits per column instead of fuzzy scoring (see
 * {@link ColumnCriteriaMatcher}); they run as a single pool task.
 *
 * @see JobKind#SEARCH
 */
@ApplicationScoped
public class SearchJobHandler implements JobHandler<SearchJobPayload> {

    private static final Logger LOG = Logger.getLogger(SearchJobHandler.class);

    /**
     * Row fields always loaded with the searched columns so matches carry the entity's identity.
     */
    static final List<String> PROJECTION_FIELDS = List.of("Entity_LogicalId", "Entity_EU_ReferenceNumber",
            "Entity_SubjectType");

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    @Inject
    JobsConfig jobsConfig;

    @Inject
    SearchRecordStore searchStore;

    @Inject
    DatasetStore datasetStore;

    @Inject
    @Named(ScoringPoolConfig.SCORING_POOL)
    ExecutorService scoringPool;

    // Metrics
    private Counter completedCounter;
    private Counter failedCounter;
    private Counter matchesCounter;

    @Override
    public JobKind handlesKind() {
        return JobKind.SEARCH;
    }

    @Override
    public void execute(Job<SearchJobPayload> job) throws Exception {
        initializeMetrics();

        UUID searchId = job.payload().searchId();
        SearchKind kind = job.payload().kind();
        SearchParamsType params = job.payload().params();

        Span span = tracer.spanBuilder("job.search").setAttribute("search.id", searchId.toString())
                .setAttribute("search.kind", kind.name()).setAttribute("task.ref", String.valueOf(params.taskRef()))
                .startSpan();
        long startNanos = System.nanoTime();

        try (Scope scope = span.makeCurrent()) {
            LOG.infof("Starting %s search: searchId=%s, taskRef=%s, columns=%s, threshold=%d", kind, searchId,
                    params.taskRef(), params.columns(), params.threshold());

            SearchResults results;
            try {
                searchStore.markProcessing(searchId);
                results = search(kind, params, startNanos, span);
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
                double elapsedMs = elapsedMillis(startNanos);
                LOG.errorf(cause, "Search failed: searchId=%s, kind=%s, elapsed=%.1fms", searchId, kind, elapsedMs);
                span.recordException(cause);
                span.setStatus(StatusCode.ERROR, cause.getMessage());
                failedCounter.increment();

                searchStore.markFailed(searchId, describe(cause), elapsedMs);
                return;
            }

            searchStore.markCompleted(searchId, results);
            completedCounter.increment();
            span.setAttribute("search.total_found", results.summary().totalFound());
            span.setStatus(StatusCode.OK);
            LOG.infof("Search complete: searchId=%s, kind=%s, found=%d/%d, rows=%d, elapsed=%.1fms", searchId, kind,
                    results.summary().totalFound(), results.summary().totalSearched(), results.totalRows(),
                    results.executionTimeMs());

        } finally {
            span.end();
        }
    }

    @Override
    public void onFailure(Job<SearchJobPayload> job, Exception cause, Duration elapsed) {
        UUID searchId = job.payload().searchId();
        Optional<SearchRecord> record = searchStore.read(searchId);
        if (record.isEmpty() || record.get().status.isTerminal()) {
            return;
        }
        searchStore.markFailed(searchId, describe(cause), elapsed.toNanos() / 1_000_000.0);
    }

    private SearchResults search(SearchKind kind, SearchParamsType params, long startNanos, Span span)
            throws InterruptedException, ExecutionException {
        List<Map<String, String>> rows = datasetStore.queryRows(params.taskRef(), projection(params.columns()));
        if (rows.isEmpty()) {
            throw new StorageFailureException("No dataset rows found for task " + params.taskRef());
        }
        span.setAttribute("dataset.rows", rows.size());

        FuzzyMatcher matcher = new FuzzyMatcher(jobsConfig.getEntityRefColumn());

        return switch (kind) {
            case SINGLE -> searchSingle(matcher, params, rows, startNanos);
            case BULK -> searchBulk(matcher, params, rows, startNanos);
            case ADVANCED -> searchAdvanced(params, rows, startNanos);
        };
    }

    private SearchResults searchSingle(FuzzyMatcher matcher, SearchParamsType params, List<Map<String, String>> rows,
            long startNanos) throws InterruptedException, ExecutionException {
        if (params.queryNames().isEmpty()) {
            throw new IllegalArgumentException("Single search requires a query name");
        }
        String query = params.queryNames().get(0);
        Future<List<MatchedRecordType>> future = scoringPool
                .submit(() -> matcher.searchSingle(query, params.columns(), rows, params.threshold()));
        List<MatchedRecordType> matches = future.get();
        matchesCounter.increment(matches.size());

        BulkMatchResultType best = matches.isEmpty()
                ? BulkMatchResultType.notFound(query)
                : new BulkMatchResultType(query, matches.get(0).confidence(), true, matches.get(0));
        SearchSummaryType summary = FuzzyMatcher.summarize(List.of(best), params.threshold());
        return SearchResults.single(matches, summary, rows.size(), elapsedMillis(startNanos));
    }

    private SearchResults searchBulk(FuzzyMatcher matcher, SearchParamsType params, List<Map<String, String>> rows,
            long startNanos) throws InterruptedException, ExecutionException {
        List<Future<BulkMatchResultType>> futures = new ArrayList<>(params.queryNames().size());
        for (String query : params.queryNames()) {
            futures.add(scoringPool.submit(() -> matcher.bestMatch(query, params.columns(), rows, params.threshold())));
        }

        List<BulkMatchResultType> results = new ArrayList<>(futures.size());
        try {
            for (Future<BulkMatchResultType> future : futures) {
                results.add(future.get());
            }
        } catch (InterruptedException | ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            throw e;
        }

        SearchSummaryType summary = FuzzyMatcher.summarize(results, params.threshold());
        matchesCounter.increment(summary.totalFound());
        return SearchResults.bulk(results, summary, rows.size(), elapsedMillis(startNanos));
    }

    private SearchResults searchAdvanced(SearchParamsType params, List<Map<String, String>> rows, long startNanos)
            throws InterruptedException, ExecutionException {
        Future<List<AdvancedQueryResultType>> future = scoringPool.submit(() -> ColumnCriteriaMatcher
                .search(params.columns(), params.columnOptions(), params.queryRows(), rows));
        List<AdvancedQueryResultType> results = future.get();

        int found = (int) results.stream().filter(AdvancedQueryResultType::anyFound).count();
        SearchSummaryType summary = new SearchSummaryType(results.size(), found, found, 0.0, 0.0,
                params.threshold());
        matchesCounter.increment(found);
        return SearchResults.advanced(results, summary, rows.size(), elapsedMillis(startNanos));
    }

    private List<String> projection(List<String> columns) {
        Set<String> fields = new LinkedHashSet<>(columns);
        fields.add(jobsConfig.getEntityRefColumn());
        fields.addAll(PROJECTION_FIELDS);
        return new ArrayList<>(fields);
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private static double elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    /**
     * Initializes Micrometer metrics on first invocation.
     */
    private void initializeMetrics() {
        if (completedCounter == null) {
            completedCounter = Counter.builder("screening.search.total").tag("outcome", "completed")
                    .description("Searches finished").register(meterRegistry);
            failedCounter = Counter.builder("screening.search.total").tag("outcome", "failed")
                    .description("Searches finished").register(meterRegistry);
            matchesCounter = Counter.builder("screening.search.matches.total")
                    .description("Matches found by searches").register(meterRegistry);
        }
    }
}

/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.screening.jobs;

import java.io.BufferedInputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.google.common.collect.Iterators;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.screening.api.types.SourceDescriptorType;
import villagecompute.screening.config.JobsConfig;
import villagecompute.screening.data.models.IngestionTask;
import villagecompute.screening.data.stores.DatasetStore;
import villagecompute.screening.data.stores.TaskRecordStore;
import villagecompute.screening.exceptions.ParseFailureException;
import villagecompute.screening.services.SourceResolver;
import villagecompute.screening.util.DelimiterDetector;

/**
 * Job handler that loads an uploaded CSV source into the dataset store.
 *
 * <p>
 * <b>Execution Flow:</b>
 * <ol>
 * <li>Resolve the source through {@link SourceResolver}; a missing source fails the task</li>
 * <li>Detect the delimiter with {@link DelimiterDetector}</li>
 * <li>Purge rows left by an interrupted earlier run of the same task</li>
 * <li>Stream rows with opencsv and insert them in batches of {@code screening.ingestion.batch-size}</li>
 * <li>Write the terminal task status (columns, row count, processing time, or the error)</li>
 * <li>Delete the source artifact, best effort</li>
 * </ol>
 *
 * <p>
 * Every failure ends in a COMPLETED task carrying the error message, no columns and zero rows. The source is deleted
 * only after the terminal status is stored, so a crash before that point leaves the source in place for the start-up
 * replay.
 *
 * @see JobKind#INGESTION
 */
@ApplicationScoped
public class IngestionJobHandler implements JobHandler<IngestionJobPayload> {

    private static final Logger LOG = Logger.getLogger(IngestionJobHandler.class);

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    @Inject
    JobsConfig jobsConfig;

    @Inject
    SourceResolver sourceResolver;

    @Inject
    TaskRecordStore taskStore;

    @Inject
    DatasetStore datasetStore;

    // Metrics
    private Counter rowsCounter;
    private Counter completedCounter;
    private Counter failedCounter;

    @Override
    public JobKind handlesKind() {
        return JobKind.INGESTION;
    }

    @Override
    public void execute(Job<IngestionJobPayload> job) throws Exception {
        initializeMetrics();

        UUID taskId = job.payload().taskId();
        String sourceRef = job.payload().sourceRef();

        Span span = tracer.spanBuilder("job.ingestion").setAttribute("task.id", taskId.toString())
                .setAttribute("source.ref", sourceRef).startSpan();
        long startNanos = System.nanoTime();

        try (Scope scope = span.makeCurrent()) {
            LOG.infof("Starting ingestion: taskId=%s, source=%s", taskId, sourceRef);

            IngestedDataset dataset;
            try {
                dataset = ingest(taskId, sourceRef, span);
            } catch (Exception e) {
                double seconds = elapsedSeconds(startNanos);
                LOG.errorf(e, "Ingestion failed: taskId=%s, source=%s, elapsed=%.2fs", taskId, sourceRef, seconds);
                span.recordException(e);
                span.setStatus(StatusCode.ERROR, e.getMessage());
                failedCounter.increment();

                taskStore.markFailed(taskId, describe(e), seconds);
                cleanupSource(sourceRef);
                return;
            }

            double seconds = elapsedSeconds(startNanos);
            taskStore.markCompleted(taskId, dataset.columns(), dataset.rows(), seconds);
            completedCounter.increment();
            span.setAttribute("rows.ingested", dataset.rows());
            span.setStatus(StatusCode.OK, String.format("Ingested %d rows", dataset.rows()));
            LOG.infof("Ingestion complete: taskId=%s, columns=%d, rows=%d, elapsed=%.2fs", taskId,
                    dataset.columns().size(), dataset.rows(), seconds);

            cleanupSource(sourceRef);

        } finally {
            span.end();
        }
    }

    /**
     * Writes the failed status when {@link #execute} could not, and removes the source once that status is stored.
     */
    @Override
    public void onFailure(Job<IngestionJobPayload> job, Exception cause, Duration elapsed) {
        UUID taskId = job.payload().taskId();
        Optional<IngestionTask> task = taskStore.read(taskId);
        if (task.isEmpty() || task.get().status.isTerminal()) {
            return;
        }
        taskStore.markFailed(taskId, describe(cause), elapsed.toNanos() / 1_000_000_000.0);
        cleanupSource(job.payload().sourceRef());
    }

    private IngestedDataset ingest(UUID taskId, String sourceRef, Span span) throws Exception {
        SourceDescriptorType source = sourceResolver.resolve(sourceRef);
        span.setAttribute("source.size_bytes", source.sizeBytes());

        long purged = datasetStore.deleteRows(taskId);
        if (purged > 0) {
            LOG.infof("Purged %d rows left by an earlier run: taskId=%s", purged, taskId);
        }

        try (BufferedInputStream in = new BufferedInputStream(sourceResolver.open(source))) {
            String sample = DelimiterDetector.readSample(in);
            char delimiter = DelimiterDetector.detect(sample);
            span.setAttribute("csv.delimiter", String.valueOf(delimiter));
            LOG.debugf("Detected delimiter '%s' for source %s", delimiter == '\t' ? "\\t" : delimiter, sourceRef);

            Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
            try (CSVReader csv = new CSVReaderBuilder(reader)
                    .withCSVParser(new CSVParserBuilder().withSeparator(delimiter).build()).build()) {

                String[] header = csv.readNext();
                if (header == null) {
                    throw new ParseFailureException("CSV source has no header row: " + sourceRef);
                }
                header[0] = DelimiterDetector.stripBom(header[0]);
                List<String> columns = Arrays.asList(header);

                int batchSize = jobsConfig.getBatchSize();
                Iterator<String[]> rows = Iterators.filter(csv.iterator(), row -> !isBlankLine(row));
                Iterator<List<String[]>> batches = Iterators.partition(rows, batchSize);

                long total = 0;
                int batchNumber = 0;
                while (batches.hasNext()) {
                    List<String[]> batch = batches.next();
                    List<Map<String, String>> records = new ArrayList<>(batch.size());
                    for (String[] row : batch) {
                        records.add(toRecord(header, row));
                    }
                    datasetStore.insertBatch(taskId, records);
                    total += records.size();
                    batchNumber++;
                    rowsCounter.increment(records.size());
                    LOG.debugf("Inserted batch %d: taskId=%s, rows=%d, total=%d", batchNumber, taskId,
                            records.size(), total);
                }
                return new IngestedDataset(columns, total);
            }
        }
    }

    static Map<String, String> toRecord(String[] header, String[] row) {
        Map<String, String> record = new LinkedHashMap<>();
        for (int i = 0; i < header.length; i++) {
            record.put(header[i], i < row.length ? row[i] : "");
        }
        return record;
    }

    private static boolean isBlankLine(String[] row) {
        return row.length == 0 || (row.length == 1 && row[0].isBlank());
    }

    static String describe(Exception e) {
        Throwable cause = e;
        // opencsv's iterator wraps parse errors
        if (cause instanceof RuntimeException && cause.getCause() != null && cause.getMessage() == null) {
            cause = cause.getCause();
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }

    /**
     * Deletes the source after its task reached a terminal status. Failures are logged only.
     */
    private void cleanupSource(String sourceRef) {
        try {
            if (sourceResolver.delete(sourceRef)) {
                LOG.debugf("Deleted source: ref=%s", sourceRef);
            }
        } catch (Exception e) {
            LOG.errorf(e, "Error deleting source: ref=%s", sourceRef);
        }
    }

    private static double elapsedSeconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    /**
     * Initializes Micrometer metrics on first invocation.
     */
    private void initializeMetrics() {
        if (rowsCounter == null) {
            rowsCounter = Counter.builder("screening.ingestion.rows.total").description("Dataset rows ingested")
                    .register(meterRegistry);
            completedCounter = Counter.builder("screening.ingestion.tasks.total").tag("outcome", "completed")
                    .description("Ingestion tasks finished").register(meterRegistry);
            failedCounter = Counter.builder("screening.ingestion.tasks.total").tag("outcome", "failed")
                    .description("Ingestion tasks finished").register(meterRegistry);
        }
    }

    private record IngestedDataset(List<String> columns, long rows) {
    }
}

package villagecompute.screening.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * Central definitions for structured logging with job context.
 *
 * <p>
 * Worker threads enrich the MDC before running a job so every log entry written by a handler carries the job it
 * belongs to. The JSON console format configured in {@code application.yaml} emits these fields.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code job_id} - Id of the record the running job acts on</li>
 * <li>{@code job_kind} - Job family tag (ingestion, search, notification)</li>
 * </ul>
 *
 * <p>
 * <b>Usage in Worker Loops:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setJob(job.jobId(), job.kind().getTag());
 * try {
 *     handler.execute(job);
 * } finally {
 *     LoggingConfig.clearMDC();
 * }
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which uses ThreadLocal storage. Worker threads are long
 * lived, so the MDC must be cleared after every job.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    /**
     * Record id processed by the current job (task, search or notification UUID).
     */
    public static final String MDC_JOB_ID = "job_id";

    /**
     * Job family tag, see {@link villagecompute.screening.jobs.JobKind#getTag()}.
     */
    public static final String MDC_JOB_KIND = "job_kind";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Enriches MDC with trace_id and span_id from the current OpenTelemetry span. Empty strings are written when no
     * span is active so the log schema stays stable.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    /**
     * Sets the job id and kind for the running job.
     *
     * @param jobId
     *            record id processed by the job
     * @param kindTag
     *            job family tag
     */
    public static void setJob(String jobId, String kindTag) {
        if (jobId != null) {
            MDC.put(MDC_JOB_ID, jobId);
        }
        if (kindTag != null) {
            MDC.put(MDC_JOB_KIND, kindTag);
        }
    }

    /**
     * Clears all job-related MDC fields.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_JOB_ID);
        MDC.remove(MDC_JOB_KIND);
    }
}

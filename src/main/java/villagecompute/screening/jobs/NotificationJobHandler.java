package villagecompute.screening.jobs;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.screening.config.JobsConfig;
import villagecompute.screening.data.models.NotificationRecord;
import villagecompute.screening.data.models.NotificationRecord.NotificationStatus;
import villagecompute.screening.data.stores.NotificationRecordStore;
import villagecompute.screening.exceptions.RetryExhaustedException;
import villagecompute.screening.integration.mail.NotificationTransport;

/**
 * Job handler that delivers one email notification.
 *
 * <h3>Delivery Flow:</h3>
 * <ol>
 * <li>Skip the job unless the notification is eligible (PENDING or RETRY, not sent, {@code scheduled_at <= now})</li>
 * <li>Mark it PROCESSING and hand it to the {@link NotificationTransport}</li>
 * <li><b>Success:</b> SENT with {@code sent_at}</li>
 * <li><b>Failure:</b> retry_count incremented; RETRY with a backoff delay while attempts remain, otherwise FAILED</li>
 * </ol>
 *
 * <h3>Retry Strategy:</h3>
 * <ul>
 * <li>Attempts per notification: its {@code max_retries} ({@code screening.notifications.max-retries} by default)</li>
 * <li>Delay before the next attempt: {@code 2^failures × screening.notifications.backoff-base-seconds}, ±25%
 * jitter</li>
 * <li>Due RETRY notifications are re-enqueued by {@link NotificationSweepScheduler}</li>
 * </ul>
 *
 * @see JobKind#NOTIFICATION
 */
@ApplicationScoped
public class NotificationJobHandler implements JobHandler<NotificationJobPayload> {

    private static final Logger LOG = Logger.getLogger(NotificationJobHandler.class);

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    @Inject
    JobsConfig jobsConfig;

    @Inject
    NotificationRecordStore notificationStore;

    @Inject
    NotificationTransport transport;

    Clock clock = Clock.systemUTC();

    // Metrics
    private Counter sentCounter;
    private Counter retryCounter;
    private Counter failedCounter;

    @Override
    public JobKind handlesKind() {
        return JobKind.NOTIFICATION;
    }

    @Override
    public void execute(Job<NotificationJobPayload> job) throws Exception {
        initializeMetrics();

        UUID notificationId = job.payload().notificationId();
        Optional<NotificationRecord> found = notificationStore.read(notificationId);
        if (found.isEmpty()) {
            LOG.warnf("Notification not found, dropping job: id=%s", notificationId);
            return;
        }

        NotificationRecord notification = found.get();
        Instant now = clock.instant();
        if (!notification.isEligible(now)) {
            LOG.debugf("Notification not eligible, skipping: id=%s, status=%s, scheduledAt=%s", notificationId,
                    notification.status, notification.scheduledAt);
            return;
        }

        Span span = tracer.spanBuilder("job.notification").setAttribute("notification.id", notificationId.toString())
                .setAttribute("notification.priority", notification.priority.name())
                .setAttribute("notification.attempt", notification.retryCount + 1).startSpan();

        try (Scope scope = span.makeCurrent()) {
            notificationStore.markProcessing(notificationId, now);

            try {
                transport.send(notification);
            } catch (Exception e) {
                span.recordException(e);
                span.setStatus(StatusCode.ERROR, e.getMessage());
                handleDeliveryFailure(notification, e);
                return;
            }

            notificationStore.markSent(notificationId, clock.instant());
            sentCounter.increment();
            span.setStatus(StatusCode.OK);
            LOG.infof("Notification sent: id=%s, recipients=%d, subject=%s", notificationId,
                    notification.recipients.size(), notification.subject);

        } finally {
            span.end();
        }
    }

    /**
     * Counts the attempt when an error escaped after the notification was marked PROCESSING.
     */
    @Override
    public void onFailure(Job<NotificationJobPayload> job, Exception cause, Duration elapsed) {
        Optional<NotificationRecord> found = notificationStore.read(job.payload().notificationId());
        if (found.isPresent() && found.get().status == NotificationStatus.PROCESSING) {
            handleDeliveryFailure(found.get(), cause);
        }
    }

    private void handleDeliveryFailure(NotificationRecord notification, Exception cause) {
        Instant failedAt = clock.instant();
        int attempt = notification.retryCount + 1;

        String errorMessage = describe(cause);
        RetryExhaustedException exhausted = null;
        if (attempt >= notification.maxRetries) {
            exhausted = new RetryExhaustedException(
                    String.format("Delivery failed after %d attempts: %s", notification.maxRetries, errorMessage),
                    cause);
            errorMessage = exhausted.getMessage();
        }

        long delaySeconds = calculateBackoffDelay(notification.retryCount);
        NotificationStatus status = notificationStore.recordFailure(notification.id, errorMessage, failedAt,
                failedAt.plusSeconds(delaySeconds));

        if (status == NotificationStatus.FAILED) {
            failedCounter.increment();
            LOG.errorf(exhausted != null ? exhausted : cause, "Notification failed permanently: id=%s, subject=%s",
                    notification.id, notification.subject);
        } else {
            retryCounter.increment();
            LOG.warnf("Notification delivery failed (retry %d/%d in %ds): id=%s, error=%s", attempt,
                    notification.maxRetries, delaySeconds, notification.id, errorMessage);
        }
    }

    /**
     * Calculates the delay before the next delivery attempt.
     *
     * <p>
     * Formula: {@code 2^attempt × base} seconds with a random multiplier in [0.75, 1.25]. With the default base of 30
     * seconds the retries land at roughly 30s, 60s, 120s.
     *
     * @param attempt
     *            failed attempts before the current one (0-based)
     * @return delay in seconds
     */
    public long calculateBackoffDelay(int attempt) {
        double baseDelay = Math.pow(2, attempt) * jobsConfig.getBackoffBaseSeconds();
        double jitter = 0.75 + (Math.random() * 0.5);
        return (long) (baseDelay * jitter);
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    /**
     * Initializes Micrometer metrics on first invocation.
     */
    private void initializeMetrics() {
        if (sentCounter == null) {
            sentCounter = Counter.builder("screening.notifications.total").tag("outcome", "sent")
                    .description("Notification delivery attempts").register(meterRegistry);
            retryCounter = Counter.builder("screening.notifications.total").tag("outcome", "retry")
                    .description("Notification delivery attempts").register(meterRegistry);
            failedCounter = Counter.builder("screening.notifications.total").tag("outcome", "failed")
                    .description("Notification delivery attempts").register(meterRegistry);
        }
    }
}

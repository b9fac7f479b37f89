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
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Outbound email notification with delivery and retry tracking.
 *
 * <h3>Schema Mapping:</h3>
 * <ul>
 * <li>id (UUID, PK) - Notification identifier, also the notification job id</li>
 * <li>recipients, cc, bcc (JSONB) - Address lists; recipients must not be empty</li>
 * <li>reply_to (VARCHAR) - Optional reply-to address</li>
 * <li>subject (VARCHAR, NOT NULL), body (TEXT, NOT NULL), html_body (TEXT) - Message content</li>
 * <li>priority (VARCHAR) - LOW, NORMAL, HIGH, URGENT</li>
 * <li>status (VARCHAR) - PENDING, PROCESSING, SENT, RETRY, FAILED</li>
 * <li>retry_count (INT) - Failed delivery attempts so far, never above max_retries</li>
 * <li>max_retries (INT) - Attempts allowed before the notification fails</li>
 * <li>scheduled_at (TIMESTAMPTZ) - Earliest next delivery attempt, null for immediately</li>
 * <li>sent_at (TIMESTAMPTZ) - Successful delivery timestamp</li>
 * </ul>
 *
 * <h3>Delivery Flow:</h3>
 * <ol>
 * <li><b>Pickup:</b> PENDING or RETRY with {@code scheduled_at <= now} → PROCESSING</li>
 * <li><b>Success:</b> PROCESSING → SENT, {@code sent_at} set</li>
 * <li><b>Failure:</b> retry_count incremented; RETRY with a backoff delay while {@code retry_count < max_retries},
 * otherwise FAILED</li>
 * </ol>
 *
 * <p>
 * Terminal states: SENT and FAILED.
 */
@Entity
@Table(
        name = "notifications")
@NamedQuery(
        name = NotificationRecord.QUERY_FIND_NON_TERMINAL,
        query = "FROM NotificationRecord WHERE status IN ('PENDING', 'PROCESSING', 'RETRY') ORDER BY createdAt ASC")
@NamedQuery(
        name = NotificationRecord.QUERY_FIND_DUE,
        query = "FROM NotificationRecord WHERE status IN ('PENDING', 'RETRY') AND sentAt IS NULL "
                + "AND (scheduledAt IS NULL OR scheduledAt <= ?1) ORDER BY createdAt ASC")
public class NotificationRecord extends PanacheEntityBase {

    public static final String QUERY_FIND_NON_TERMINAL = "NotificationRecord.findNonTerminal";
    public static final String QUERY_FIND_DUE = "NotificationRecord.findDue";

    /**
     * Pickup order: higher priority first, then oldest first.
     */
    public static final Comparator<NotificationRecord> PICKUP_ORDER = Comparator
            .comparing((NotificationRecord n) -> n.priority.getRank()).reversed()
            .thenComparing(n -> n.createdAt);

    @Id
    @GeneratedValue
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "recipients",
            nullable = false,
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public List<String> recipients = new ArrayList<>();

    @Column(
            name = "cc",
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public List<String> cc = new ArrayList<>();

    @Column(
            name = "bcc",
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public List<String> bcc = new ArrayList<>();

    @Column(
            name = "reply_to")
    public String replyTo;

    @Column(
            nullable = false,
            length = 500)
    public String subject;

    @Column(
            nullable = false,
            columnDefinition = "TEXT")
    public String body;

    @Column(
            name = "html_body",
            columnDefinition = "TEXT")
    public String htmlBody;

    @Enumerated(EnumType.STRING)
    @Column(
            nullable = false,
            length = 10)
    public NotificationPriority priority = NotificationPriority.NORMAL;

    @Enumerated(EnumType.STRING)
    @Column(
            nullable = false,
            length = 20)
    public NotificationStatus status = NotificationStatus.PENDING;

    @Column(
            name = "retry_count",
            nullable = false)
    public int retryCount;

    @Column(
            name = "max_retries",
            nullable = false)
    public int maxRetries;

    @Column(
            name = "scheduled_at")
    public Instant scheduledAt;

    @Column(
            name = "sent_at")
    public Instant sentAt;

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

    public enum NotificationPriority {
        LOW(0),
        NORMAL(1),
        HIGH(2),
        URGENT(3);

        private final int rank;

        NotificationPriority(int rank) {
            this.rank = rank;
        }

        public int getRank() {
            return rank;
        }
    }

    public enum NotificationStatus {
        PENDING,
        PROCESSING,
        SENT,
        RETRY,
        FAILED;

        public boolean isTerminal() {
            return this == SENT || this == FAILED;
        }

        public boolean canTransitionTo(NotificationStatus next) {
            return switch (this) {
                case PENDING, RETRY -> next == PROCESSING;
                case PROCESSING -> next == SENT || next == RETRY || next == FAILED;
                case SENT, FAILED -> false;
            };
        }
    }

    /**
     * Builds a pending notification. The caller persists it.
     */
    public static NotificationRecord newPending(List<String> recipients, String subject, String body,
            NotificationPriority priority, int maxRetries, Instant now) {
        NotificationRecord record = new NotificationRecord();
        record.recipients = new ArrayList<>(recipients);
        record.subject = subject;
        record.body = body;
        record.priority = priority;
        record.maxRetries = maxRetries;
        record.status = NotificationStatus.PENDING;
        record.createdAt = now;
        record.updatedAt = now;
        return record;
    }

    /**
     * Whether a worker may pick this notification up at {@code now}.
     */
    public boolean isEligible(Instant now) {
        return (status == NotificationStatus.PENDING || status == NotificationStatus.RETRY) && sentAt == null
                && (scheduledAt == null || !scheduledAt.isAfter(now));
    }

    public void markProcessing(Instant now) {
        transitionTo(NotificationStatus.PROCESSING, now);
    }

    public void markSent(Instant now) {
        transitionTo(NotificationStatus.SENT, now);
        this.sentAt = now;
        this.errorMessage = null;
    }

    /**
     * Counts a failed attempt. Moves to RETRY at {@code retryAt} while attempts remain, otherwise to FAILED.
     *
     * @return the resulting status
     */
    public NotificationStatus recordFailure(String error, Instant now, Instant retryAt) {
        this.retryCount = Math.min(retryCount + 1, maxRetries);
        this.errorMessage = error;
        if (retryCount < maxRetries) {
            transitionTo(NotificationStatus.RETRY, now);
            this.scheduledAt = retryAt;
        } else {
            transitionTo(NotificationStatus.FAILED, now);
        }
        return status;
    }

    /**
     * Returns a notification interrupted mid-delivery to RETRY without consuming an attempt.
     */
    public void resetInterrupted(Instant now) {
        if (status != NotificationStatus.PROCESSING) {
            return;
        }
        transitionTo(NotificationStatus.RETRY, now);
        this.scheduledAt = null;
    }

    private void transitionTo(NotificationStatus next, Instant now) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Notification " + id + " cannot move from " + status + " to " + next);
        }
        this.status = next;
        this.updatedAt = now;
    }
}

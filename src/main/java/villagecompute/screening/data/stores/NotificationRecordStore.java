package villagecompute.screening.data.stores;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import villagecompute.screening.data.models.NotificationRecord;
import villagecompute.screening.data.models.NotificationRecord.NotificationStatus;

/**
 * Persistence of notification delivery state.
 */
public interface NotificationRecordStore {

    /**
     * Persists a new notification built with {@link NotificationRecord#newPending}.
     */
    NotificationRecord save(NotificationRecord record);

    Optional<NotificationRecord> read(UUID notificationId);

    void markProcessing(UUID notificationId, Instant now);

    void markSent(UUID notificationId, Instant now);

    /**
     * Counts a failed delivery attempt, see {@link NotificationRecord#recordFailure}.
     *
     * @return the status the notification moved to, RETRY or FAILED
     */
    NotificationStatus recordFailure(UUID notificationId, String errorMessage, Instant now, Instant retryAt);

    /**
     * Returns a notification left in PROCESSING by a previous process to RETRY.
     */
    void resetInterrupted(UUID notificationId, Instant now);

    /**
     * Notifications not yet SENT or FAILED, oldest first.
     */
    List<NotificationRecord> listNonTerminal();

    /**
     * Notifications eligible for pickup at {@code now}, in pickup order.
     */
    List<NotificationRecord> listDue(Instant now);
}

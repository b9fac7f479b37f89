package villagecompute.screening.data.stores;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;

import org.jboss.logging.Logger;

import villagecompute.screening.data.models.NotificationRecord;
import villagecompute.screening.data.models.NotificationRecord.NotificationStatus;
import villagecompute.screening.exceptions.StorageFailureException;

/**
 * {@link NotificationRecordStore} backed by the {@code notifications} table.
 */
@ApplicationScoped
public class PanacheNotificationRecordStore implements NotificationRecordStore {

    private static final Logger LOG = Logger.getLogger(PanacheNotificationRecordStore.class);

    @Override
    @Transactional
    public NotificationRecord save(NotificationRecord record) {
        record.persist();
        LOG.debugf("Saved notification %s (priority: %s, recipients: %d)", record.id, record.priority,
                record.recipients.size());
        return record;
    }

    @Override
    @Transactional
    public Optional<NotificationRecord> read(UUID notificationId) {
        return NotificationRecord.findByIdOptional(notificationId);
    }

    @Override
    @Transactional
    public void markProcessing(UUID notificationId, Instant now) {
        require(notificationId).markProcessing(now);
    }

    @Override
    @Transactional
    public void markSent(UUID notificationId, Instant now) {
        require(notificationId).markSent(now);
    }

    @Override
    @Transactional
    public NotificationStatus recordFailure(UUID notificationId, String errorMessage, Instant now, Instant retryAt) {
        return require(notificationId).recordFailure(errorMessage, now, retryAt);
    }

    @Override
    @Transactional
    public void resetInterrupted(UUID notificationId, Instant now) {
        require(notificationId).resetInterrupted(now);
    }

    @Override
    @Transactional
    public List<NotificationRecord> listNonTerminal() {
        return NotificationRecord.find("#" + NotificationRecord.QUERY_FIND_NON_TERMINAL).list();
    }

    @Override
    @Transactional
    public List<NotificationRecord> listDue(Instant now) {
        List<NotificationRecord> due = new ArrayList<>(
                NotificationRecord.<NotificationRecord> find("#" + NotificationRecord.QUERY_FIND_DUE, now).list());
        // priority is stored as its name, so rank ordering happens here
        due.sort(NotificationRecord.PICKUP_ORDER);
        return due;
    }

    private NotificationRecord require(UUID notificationId) {
        NotificationRecord record = NotificationRecord.findById(notificationId);
        if (record == null) {
            throw new StorageFailureException("Notification not found: " + notificationId);
        }
        return record;
    }
}

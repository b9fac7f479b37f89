package villagecompute.screening.jobs;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import io.quarkus.runtime.StartupEvent;

import jakarta.annotation.Priority;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.screening.data.models.IngestionTask;
import villagecompute.screening.data.models.NotificationRecord;
import villagecompute.screening.data.models.NotificationRecord.NotificationStatus;
import villagecompute.screening.data.models.SearchRecord;
import villagecompute.screening.data.stores.NotificationRecordStore;
import villagecompute.screening.data.stores.SearchRecordStore;
import villagecompute.screening.data.stores.TaskRecordStore;
import villagecompute.screening.exceptions.QueueCapacityException;
import villagecompute.screening.services.BackgroundJobService;

/**
 * Re-enqueues work left unfinished by a previous process.
 *
 * <p>
 * At start-up, after the worker loops are running, every non-terminal task, search and notification gets one job.
 * Notifications caught mid-delivery (PROCESSING) are first returned to RETRY without consuming an attempt.
 *
 * <p>
 * Replay relies on handler idempotency: ingestion purges rows of the task before inserting, searches overwrite their
 * results, and notifications are delivered only while eligible.
 */
@ApplicationScoped
public class RecoveryLoader {

    private static final Logger LOG = Logger.getLogger(RecoveryLoader.class);

    @Inject
    TaskRecordStore taskStore;

    @Inject
    SearchRecordStore searchStore;

    @Inject
    NotificationRecordStore notificationStore;

    @Inject
    BackgroundJobService jobService;

    Clock clock = Clock.systemUTC();

    void onStart(@Observes @Priority(10) StartupEvent event) {
        RecoverySummary summary = recover();
        LOG.infof("Start-up recovery complete: tasks=%d, searches=%d, notifications=%d (reset %d), skipped=%d",
                summary.tasks(), summary.searches(), summary.notifications(), summary.notificationsReset(),
                summary.skipped());
    }

    /**
     * Scans the three stores and enqueues one job per non-terminal record.
     */
    public RecoverySummary recover() {
        int tasks = 0;
        int searches = 0;
        int notifications = 0;
        int reset = 0;
        int skipped = 0;

        for (IngestionTask task : taskStore.listNonTerminal()) {
            try {
                jobService.enqueueIngestion(task.id, task.sourceRef);
                tasks++;
            } catch (QueueCapacityException e) {
                skipped++;
                LOG.errorf(e, "Could not re-enqueue ingestion task %s", task.id);
            }
        }

        for (SearchRecord search : searchStore.listNonTerminal()) {
            try {
                jobService.enqueueSearch(search.id, search.kind, search.toParams());
                searches++;
            } catch (QueueCapacityException e) {
                skipped++;
                LOG.errorf(e, "Could not re-enqueue search %s", search.id);
            }
        }

        Instant now = clock.instant();
        List<NotificationRecord> pending = notificationStore.listNonTerminal();
        for (NotificationRecord notification : pending) {
            if (notification.status == NotificationStatus.PROCESSING) {
                notificationStore.resetInterrupted(notification.id, now);
                reset++;
                LOG.infof("Notification interrupted mid-delivery returned to RETRY: id=%s", notification.id);
            }
        }
        List<NotificationRecord> ordered = new ArrayList<>(pending);
        ordered.sort(NotificationRecord.PICKUP_ORDER);
        for (NotificationRecord notification : ordered) {
            try {
                jobService.enqueueNotification(notification.id);
                notifications++;
            } catch (QueueCapacityException e) {
                skipped++;
                LOG.errorf(e, "Could not re-enqueue notification %s, the sweep will retry", notification.id);
            }
        }

        return new RecoverySummary(tasks, searches, notifications, reset, skipped);
    }

    /**
     * Counts of jobs re-enqueued by one recovery pass.
     */
    public record RecoverySummary(int tasks, int searches, int notifications, int notificationsReset, int skipped) {
    }
}

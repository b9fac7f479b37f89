package villagecompute.screening.jobs;

import java.time.Clock;
import java.util.List;

import io.quarkus.scheduler.Scheduled;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.screening.data.models.NotificationRecord;
import villagecompute.screening.data.stores.NotificationRecordStore;
import villagecompute.screening.exceptions.QueueCapacityException;
import villagecompute.screening.services.BackgroundJobService;

/**
 * Scheduler that hands due notifications back to the notification loop.
 *
 * <p>
 * A failed delivery leaves its notification in RETRY with a future {@code scheduled_at}; nothing re-enqueues it at
 * that time. This sweep lists every notification eligible now, in pickup order (priority, then age), and offers each
 * one to the queue. Notifications already waiting are not enqueued twice.
 *
 * <p>
 * <b>Schedule:</b> every {@code screening.notifications.sweep-interval} (default 30s), skipped while the previous
 * sweep is still running.
 *
 * @see NotificationJobHandler
 * @see JobKind#NOTIFICATION
 */
@ApplicationScoped
public class NotificationSweepScheduler {

    private static final Logger LOG = Logger.getLogger(NotificationSweepScheduler.class);

    @Inject
    NotificationRecordStore notificationStore;

    @Inject
    BackgroundJobService jobService;

    Clock clock = Clock.systemUTC();

    @Scheduled(
            every = "{screening.notifications.sweep-interval}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void sweep() {
        int enqueued = sweepDue();
        if (enqueued > 0) {
            LOG.infof("Notification sweep enqueued %d due notifications", enqueued);
        }
    }

    /**
     * Offers every notification due now to the queue.
     *
     * @return number of jobs actually added
     */
    int sweepDue() {
        List<NotificationRecord> due = notificationStore.listDue(clock.instant());
        int enqueued = 0;
        for (NotificationRecord notification : due) {
            try {
                if (jobService.offerNotification(notification.id)) {
                    enqueued++;
                }
            } catch (QueueCapacityException e) {
                LOG.warnf("Notification queue full, sweep stopped after %d of %d due notifications", enqueued,
                        due.size());
                break;
            }
        }
        LOG.debugf("Notification sweep: due=%d, enqueued=%d", due.size(), enqueued);
        return enqueued;
    }
}

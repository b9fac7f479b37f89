package villagecompute.screening.jobs;

import java.util.Objects;
import java.util.UUID;

/**
 * Parameters of a notification job. Message content is read from the notification record at delivery time.
 *
 * @param notificationId
 *            notification to deliver
 */
public record NotificationJobPayload(UUID notificationId) {

    public NotificationJobPayload {
        Objects.requireNonNull(notificationId, "notificationId");
    }
}

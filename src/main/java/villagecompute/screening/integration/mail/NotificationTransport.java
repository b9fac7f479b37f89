package villagecompute.screening.integration.mail;

import villagecompute.screening.data.models.NotificationRecord;

/**
 * Outbound delivery channel for notifications.
 */
public interface NotificationTransport {

    /**
     * Delivers a notification.
     *
     * @throws villagecompute.screening.exceptions.DeliveryFailureException
     *             if the message could not be handed to the mail server
     */
    void send(NotificationRecord notification);
}

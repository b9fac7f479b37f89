package villagecompute.screening.integration.mail;

import java.util.ArrayList;
import java.util.List;

import io.quarkus.mailer.Mail;
import io.quarkus.mailer.Mailer;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.screening.config.JobsConfig;
import villagecompute.screening.data.models.NotificationRecord;
import villagecompute.screening.exceptions.DeliveryFailureException;
import villagecompute.screening.util.EmailValidator;

/**
 * {@link NotificationTransport} backed by the blocking Quarkus {@link Mailer}.
 *
 * <p>
 * Every address (to, cc, bcc, reply-to) is format-checked before anything is sent; an invalid address fails the attempt
 * like any other delivery error. The HTML body is attached alongside the plain-text body when present.
 *
 * <p>
 * <b>Configuration:</b> SMTP settings come from {@code quarkus.mailer.*}; the sender is
 * {@code screening.notifications.from}.
 */
@ApplicationScoped
public class MailerNotificationTransport implements NotificationTransport {

    private static final Logger LOG = Logger.getLogger(MailerNotificationTransport.class);

    @Inject
    Mailer mailer;

    @Inject
    JobsConfig jobsConfig;

    @Override
    public void send(NotificationRecord notification) {
        validateAddresses(notification);

        Mail mail = new Mail().setFrom(jobsConfig.getFromEmail()).setTo(List.copyOf(notification.recipients))
                .setSubject(notification.subject).setText(notification.body)
                .addHeader("X-Notification-ID", notification.id.toString())
                .addHeader("X-Notification-Priority", notification.priority.name());
        if (notification.cc != null && !notification.cc.isEmpty()) {
            mail.setCc(List.copyOf(notification.cc));
        }
        if (notification.bcc != null && !notification.bcc.isEmpty()) {
            mail.setBcc(List.copyOf(notification.bcc));
        }
        if (notification.replyTo != null && !notification.replyTo.isBlank()) {
            mail.setReplyTo(notification.replyTo);
        }
        if (notification.htmlBody != null && !notification.htmlBody.isBlank()) {
            mail.setHtml(notification.htmlBody);
        }

        try {
            mailer.send(mail);
        } catch (Exception e) {
            throw new DeliveryFailureException("Mail server rejected notification " + notification.id + ": "
                    + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()), e);
        }

        LOG.debugf("Handed notification to mailer: id=%s, to=%d", notification.id, notification.recipients.size());
    }

    private static void validateAddresses(NotificationRecord notification) {
        if (notification.recipients == null || notification.recipients.isEmpty()) {
            throw new DeliveryFailureException("Notification " + notification.id + " has no recipients");
        }
        List<String> invalid = new ArrayList<>(EmailValidator.invalidAddresses(notification.recipients));
        invalid.addAll(EmailValidator.invalidAddresses(notification.cc));
        invalid.addAll(EmailValidator.invalidAddresses(notification.bcc));
        if (notification.replyTo != null && !notification.replyTo.isBlank()
                && !EmailValidator.isValidFormat(notification.replyTo)) {
            invalid.add(notification.replyTo);
        }
        if (!invalid.isEmpty()) {
            throw new DeliveryFailureException("Invalid email address(es): " + String.join(", ", invalid));
        }
    }
}

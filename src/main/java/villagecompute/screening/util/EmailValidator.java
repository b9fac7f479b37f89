package villagecompute.screening.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Email address format checks used before a notification is handed to the mail server.
 *
 * <h3>Usage Examples:</h3>
 *
 * <pre>
 * if (!EmailValidator.isValidFormat("user@example.com")) {
 *     throw new DeliveryFailureException("Invalid recipient");
 * }
 *
 * List&lt;String&gt; bad = EmailValidator.invalidAddresses(notification.recipients);
 * </pre>
 */
public final class EmailValidator {

    /**
     * Simplified RFC 5322 pattern: alphanumeric local part with dots, plus, hyphens and underscores; dotted domain with
     * a TLD of at least two letters.
     */
    private static final Pattern EMAIL_PATTERN = Pattern
            .compile("^[a-zA-Z0-9_+&*-]+(?:\\.[a-zA-Z0-9_+&*-]+)*@(?:[a-zA-Z0-9-]+\\.)+[a-zA-Z]{2,}$");

    private EmailValidator() {
    }

    /**
     * Validates email format.
     *
     * @param email
     *            the email address to validate
     * @return {@code true} if the address matches the pattern after trimming
     */
    public static boolean isValidFormat(String email) {
        if (email == null || email.isBlank()) {
            return false;
        }
        return EMAIL_PATTERN.matcher(email.trim().toLowerCase()).matches();
    }

    /**
     * Returns the addresses that fail {@link #isValidFormat}, in input order.
     */
    public static List<String> invalidAddresses(Collection<String> emails) {
        List<String> invalid = new ArrayList<>();
        if (emails == null) {
            return invalid;
        }
        for (String email : emails) {
            if (!isValidFormat(email)) {
                invalid.add(email);
            }
        }
        return invalid;
    }
}

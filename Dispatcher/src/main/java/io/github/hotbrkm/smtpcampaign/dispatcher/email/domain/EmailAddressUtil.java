package io.github.hotbrkm.smtpcampaign.dispatcher.email.domain;

import java.util.Locale;
import java.util.regex.Pattern;

public final class EmailAddressUtil {

    /**
     * local-part@domain.tld with an ASCII local part and a final label of at least two letters.
     */
    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");

    private EmailAddressUtil() {}

    public static boolean isValid(String email) {
        if (email == null || email.isEmpty()) {
            return false;
        }
        return ADDRESS_PATTERN.matcher(email).matches();
    }

    /**
     * Returns the lower-cased domain part, or an empty string when the value has no '@'.
     */
    public static String extractDomain(String email) {
        if (email == null) {
            return "";
        }
        int at = email.lastIndexOf('@');
        if (at < 0 || at >= email.length() - 1) {
            return "";
        }
        return email.substring(at + 1).trim().toLowerCase(Locale.ROOT);
    }
}

package com.autobot.mail.job;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Forward-rule matching and forwarded-message formatting.
 */
public final class ForwardRuleMatcher {

    public static final String SUBJECT_PREFIX = "FWD: ";

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    private ForwardRuleMatcher() {
    }

    /** Case-insensitive substring match of the search term in the subject. */
    public static boolean matchesSubject(String subject, String search) {
        if (subject == null || search == null) {
            return false;
        }
        return subject.toLowerCase(Locale.ROOT).contains(search.toLowerCase(Locale.ROOT));
    }

    public static boolean isValidEmail(String address) {
        return address != null && EMAIL.matcher(address).matches();
    }

    public static String forwardSubject(String originalSubject) {
        return SUBJECT_PREFIX + originalSubject;
    }

    public static String formatForwardBody(String originalBody, String originalFrom, String originalSubject) {
        return "Forwarded from: " + originalFrom + "\n"
                + "Original subject: " + originalSubject + "\n"
                + "\n"
                + originalBody;
    }
}

package villagecompute.courier.notifications;

/**
 * Text rules applied to everything the dispatcher sends: the product prefix appears exactly once, and channel length
 * limits truncate with an ellipsis instead of rejecting the send.
 */
public final class NotificationTextFormatter {

    private static final String ELLIPSIS = "...";

    private NotificationTextFormatter() {
        // Utility class, no instantiation
    }

    /**
     * Prefixes the text with the product identifier unless it already starts with it.
     */
    public static String withPrefix(String text, String prefix) {
        if (prefix == null || prefix.isEmpty()) {
            return text == null ? "" : text;
        }
        if (text == null || text.isBlank()) {
            return prefix;
        }
        String trimmed = text.strip();
        if (trimmed.startsWith(prefix)) {
            return trimmed;
        }
        return prefix + " " + trimmed;
    }

    /**
     * Truncates to at most {@code maxLength} characters, replacing the tail with "..." when text is cut. A surrogate
     * pair is never split.
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        if (maxLength <= ELLIPSIS.length()) {
            return text.substring(0, cutIndex(text, Math.max(0, maxLength)));
        }
        return text.substring(0, cutIndex(text, maxLength - ELLIPSIS.length())) + ELLIPSIS;
    }

    /**
     * Prefixed SMS body within the SMS length limit.
     */
    public static String smsBody(String text, String prefix, int maxLength) {
        return truncate(withPrefix(text, prefix), maxLength);
    }

    /**
     * Plain cut used for delivery log previews.
     */
    public static String preview(String text, int length) {
        if (text == null) {
            return null;
        }
        return text.length() <= length ? text : text.substring(0, cutIndex(text, length));
    }

    /**
     * Moves a cut point back off the middle of a surrogate pair.
     */
    private static int cutIndex(String text, int end) {
        if (end > 0 && end < text.length() && Character.isHighSurrogate(text.charAt(end - 1))
                && Character.isLowSurrogate(text.charAt(end))) {
            return end - 1;
        }
        return end;
    }
}

package villagecompute.courier.notifications;

import java.util.Locale;

/**
 * Notification priority. Claims hand out higher ranks first, then oldest first within a rank.
 */
public enum NotificationPriority {
    LOW(0), MEDIUM(1), HIGH(2), CRITICAL(3);

    private final int rank;

    NotificationPriority(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    public static NotificationPriority fromString(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        return NotificationPriority.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

package villagecompute.courier.notifications;

import villagecompute.courier.data.models.NotificationRequest;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Counts of what one dispatch batch did with the requests it claimed.
 */
public final class DispatchSummary {

    private final NotificationChannel channel;
    private final Map<NotificationRequest.Status, Integer> outcomes = new EnumMap<>(NotificationRequest.Status.class);
    private int claimed;
    private int errors;

    public DispatchSummary(NotificationChannel channel) {
        this.channel = channel;
    }

    public void claimed(int count) {
        this.claimed += count;
    }

    public void record(NotificationRequest.Status outcome) {
        outcomes.merge(outcome, 1, Integer::sum);
    }

    /**
     * Records a request whose dispatch threw; it is also counted under its final status once that is recorded.
     */
    public void error() {
        errors++;
    }

    public NotificationChannel getChannel() {
        return channel;
    }

    public int getClaimed() {
        return claimed;
    }

    public int getErrors() {
        return errors;
    }

    public int count(NotificationRequest.Status status) {
        return outcomes.getOrDefault(status, 0);
    }

    public Map<String, Object> toDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("channel", channel.name().toLowerCase(Locale.ROOT));
        details.put("claimed", claimed);
        for (Map.Entry<NotificationRequest.Status, Integer> entry : outcomes.entrySet()) {
            details.put(entry.getKey().name().toLowerCase(Locale.ROOT), entry.getValue());
        }
        details.put("errors", errors);
        return details;
    }

    @Override
    public String toString() {
        return "DispatchSummary" + toDetails();
    }
}

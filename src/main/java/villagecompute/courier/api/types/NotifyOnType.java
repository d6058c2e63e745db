package villagecompute.courier.api.types;

import java.util.List;

/**
 * Notification trigger names enqueued after a run succeeds or fails.
 */
public record NotifyOnType(List<String> success, List<String> failure) {
}

package villagecompute.courier.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.Map;

/**
 * Aggregate health of the notification queue.
 *
 * @param counts
 *            requests per status (lowercase status names)
 * @param total
 *            all requests
 * @param successRate
 *            percentage of delivered requests among delivered and failed ones, 100 when none finished yet
 * @param stuckProcessing
 *            requests PROCESSING for longer than the recovery timeout
 * @param oldestPendingAgeSeconds
 *            age of the oldest PENDING request, 0 when none
 */
@Schema(
        description = "Notification queue health")
public record QueueHealthType(Map<String, Long> counts, long total,
        @JsonProperty("success_rate") double successRate, @JsonProperty("stuck_processing") long stuckProcessing,
        @JsonProperty("oldest_pending_age_seconds") long oldestPendingAgeSeconds) {
}

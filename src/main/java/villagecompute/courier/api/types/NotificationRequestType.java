package villagecompute.courier.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * API response type for a queued notification.
 */
public record NotificationRequestType(UUID id, String recipient, String trigger, List<String> channels,
        @JsonProperty("delivery_mode") String deliveryMode, String priority, String status, int attempts,
        @JsonProperty("status_reason") String statusReason,
        @JsonProperty("template_data") Map<String, Object> templateData,
        @JsonProperty("processing_started_at") Instant processingStartedAt,
        @JsonProperty("scheduled_for") Instant scheduledFor, @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt, @JsonProperty("completed_at") Instant completedAt) {
}

package villagecompute.courier.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * API request type for enqueueing a notification from an operator or an external producer.
 *
 * @param recipient
 *            recipient identifier of the producing domain
 * @param trigger
 *            semantic event name
 * @param channels
 *            ordered channel preference, must not be empty
 * @param priority
 *            low, medium (default), high or critical
 * @param templateData
 *            rendering payload ({@code title}, {@code message}, {@code subject}, {@code html}, extra keys)
 * @param deliveryMode
 *            {@code fallback} or {@code all}; trigger configuration decides when absent
 * @param scheduledFor
 *            earliest dispatch time, null for immediately
 */
@Schema(
        description = "Request to enqueue a notification")
public record EnqueueNotificationRequestType(String recipient, String trigger, List<String> channels,
        String priority, @JsonProperty("template_data") Map<String, Object> templateData,
        @JsonProperty("delivery_mode") String deliveryMode, @JsonProperty("scheduled_for") Instant scheduledFor) {
}

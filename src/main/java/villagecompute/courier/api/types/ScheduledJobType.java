package villagecompute.courier.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * API response type for a scheduled job, including its scheduling state.
 */
public record ScheduledJobType(Long id, String name, String description,
        @JsonProperty("template_type") String templateType, Map<String, Object> parameters, ScheduleType schedule,
        boolean enabled, @JsonProperty("timeout_seconds") int timeoutSeconds,
        @JsonProperty("retry_policy") RetryPolicyType retryPolicy, @JsonProperty("notify_on") NotifyOnType notifyOn,
        @JsonProperty("last_run_at") Instant lastRunAt, @JsonProperty("next_run_at") Instant nextRunAt,
        @JsonProperty("last_status") String lastStatus, @JsonProperty("retry_at") Instant retryAt,
        @JsonProperty("retry_attempt") Integer retryAttempt, @JsonProperty("created_by") String createdBy,
        @JsonProperty("created_at") Instant createdAt, @JsonProperty("updated_at") Instant updatedAt) {
}

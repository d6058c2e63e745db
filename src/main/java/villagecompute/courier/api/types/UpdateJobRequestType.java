package villagecompute.courier.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.Map;

/**
 * API request type for updating a scheduled job.
 *
 * <p>
 * All fields are optional to support partial updates via PATCH semantics. Null values indicate "no change". A new
 * {@code schedule} recomputes the next run from the time of the update.
 */
@Schema(
        description = "Request to update a scheduled job (partial update)")
public record UpdateJobRequestType(String description,

        @Schema(
                description = "Replacement template parameters",
                nullable = true) Map<String, Object> parameters,

        @Valid ScheduleType schedule,

        Boolean enabled,

        @JsonProperty("timeout_seconds") @Min(1) Integer timeoutSeconds,

        @JsonProperty("retry_policy") @Valid RetryPolicyType retryPolicy,

        @JsonProperty("notify_on") NotifyOnType notifyOn) {
}

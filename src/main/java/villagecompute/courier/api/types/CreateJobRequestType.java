package villagecompute.courier.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.Map;

/**
 * API request type for creating a scheduled job.
 *
 * <p>
 * Omitted policy fields fall back to the {@code courier.jobs.default-*} configuration. {@code enabled} defaults to
 * true.
 */
@Schema(
        description = "Request to create a scheduled job")
public record CreateJobRequestType(@Schema(
        description = "Unique job name",
        example = "email-dispatcher",
        required = true) @NotBlank String name,

        @Schema(
                description = "What the job is for",
                nullable = true) String description,

        @Schema(
                description = "Registered template type key",
                example = "notification_dispatcher",
                required = true) @JsonProperty("template_type") @NotBlank String templateType,

        @Schema(
                description = "Template parameters",
                example = "{\"channel\": \"email\", \"batch_size\": 50}",
                nullable = true) Map<String, Object> parameters,

        @NotNull @Valid ScheduleType schedule,

        Boolean enabled,

        @JsonProperty("timeout_seconds") @Min(1) Integer timeoutSeconds,

        @JsonProperty("retry_policy") @Valid RetryPolicyType retryPolicy,

        @JsonProperty("notify_on") NotifyOnType notifyOn) {
}

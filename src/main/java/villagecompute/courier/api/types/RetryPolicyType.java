package villagecompute.courier.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * Retry policy of a job: how many follow-up attempts a failed or timed out run gets, and how long after the failure.
 */
public record RetryPolicyType(@JsonProperty("max_retries") @Min(0) @Max(20) Integer maxRetries,
        @JsonProperty("retry_delay_seconds") @Min(0) Integer retryDelaySeconds) {
}

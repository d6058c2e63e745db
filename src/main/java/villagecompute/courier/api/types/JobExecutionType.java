package villagecompute.courier.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * API response type for one job execution.
 */
public record JobExecutionType(Long id, @JsonProperty("job_id") Long jobId, @JsonProperty("job_name") String jobName,
        @JsonProperty("template_type") String templateType, @JsonProperty("triggered_by") String triggeredBy,
        int attempt, String status, @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("finished_at") Instant finishedAt, @JsonProperty("duration_seconds") Double durationSeconds,
        String message, Map<String, Object> result, List<String> errors) {
}

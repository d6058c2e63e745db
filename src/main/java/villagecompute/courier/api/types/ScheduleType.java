package villagecompute.courier.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Job schedule as exchanged with the admin API.
 *
 * @param kind
 *            {@code "interval"} or {@code "cron"}
 * @param intervalSeconds
 *            period for interval schedules
 * @param expression
 *            cron expression for cron schedules
 * @param timezone
 *            zone id cron expressions are evaluated in (UTC when absent)
 */
@Schema(
        description = "Interval or cron schedule of a job")
public record ScheduleType(@Schema(
        description = "Schedule kind",
        example = "interval",
        required = true) String kind,

        @Schema(
                description = "Period in seconds (interval schedules)",
                example = "300",
                nullable = true) @JsonProperty("interval_seconds") Integer intervalSeconds,

        @Schema(
                description = "Cron expression (cron schedules)",
                example = "0 3 * * *",
                nullable = true) String expression,

        @Schema(
                description = "Timezone the cron expression is evaluated in",
                example = "America/New_York",
                nullable = true) String timezone) {
}

package villagecompute.courier.jobs;

import java.util.Map;

/**
 * Everything a {@link JobTemplate} needs about the run it is executing. Database access goes through the template's
 * injected services, not through the context.
 *
 * @param jobId
 *            {@code ScheduledJob} primary key
 * @param jobName
 *            job name, for logging
 * @param executionId
 *            {@code JobExecution} primary key of this run
 * @param attempt
 *            1 for a regular run, incremented for each retry
 * @param triggeredBy
 *            {@code "scheduler"} or {@code "manual:<actor>"}
 * @param parameters
 *            job parameters merged over the template defaults
 */
public record JobContext(Long jobId, String jobName, Long executionId, int attempt, String triggeredBy,
        Map<String, Object> parameters) {

    public int intParam(String name, int defaultValue) {
        return TemplateParameters.intValue(parameters, name, defaultValue);
    }

    public String stringParam(String name, String defaultValue) {
        Object value = parameters.get(name);
        return value != null ? value.toString() : defaultValue;
    }
}

package villagecompute.courier.jobs;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Structured outcome of one {@link JobTemplate#execute(JobContext)} call, stored on the execution row.
 *
 * @param status
 *            outcome reported by the template
 * @param message
 *            human-readable summary
 * @param details
 *            template-defined counters and identifiers
 * @param recordsProcessed
 *            items examined
 * @param recordsAffected
 *            items changed, sent or enqueued
 * @param errors
 *            per-item errors that did not abort the run
 * @param warnings
 *            non-fatal observations
 * @param durationSeconds
 *            wall time, filled in by the executor
 */
public record JobResult(Outcome status, String message, Map<String, Object> details, int recordsProcessed,
        int recordsAffected, List<String> errors, List<String> warnings, double durationSeconds) {

    /**
     * Template-level outcome. {@code PARTIAL} means some items failed but the run itself completed.
     */
    public enum Outcome {
        SUCCESS, PARTIAL, FAILED
    }

    public JobResult {
        details = details == null ? Map.of() : details;
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static JobResult success(String message, Map<String, Object> details, int recordsProcessed,
            int recordsAffected) {
        return new JobResult(Outcome.SUCCESS, message, details, recordsProcessed, recordsAffected, List.of(),
                List.of(), 0.0);
    }

    /**
     * Success when {@code errors} is empty, {@code PARTIAL} otherwise.
     */
    public static JobResult completed(String message, Map<String, Object> details, int recordsProcessed,
            int recordsAffected, List<String> errors) {
        Outcome outcome = errors == null || errors.isEmpty() ? Outcome.SUCCESS : Outcome.PARTIAL;
        return new JobResult(outcome, message, details, recordsProcessed, recordsAffected, errors, List.of(), 0.0);
    }

    public static JobResult failed(String message, List<String> errors) {
        return new JobResult(Outcome.FAILED, message, Map.of(), 0, 0, errors, List.of(), 0.0);
    }

    public JobResult withDuration(double seconds) {
        return new JobResult(status, message, details, recordsProcessed, recordsAffected, errors, warnings, seconds);
    }

    /**
     * JSON-ready form with snake_case keys.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("status", status.name().toLowerCase(Locale.ROOT));
        map.put("message", message);
        map.put("details", details);
        map.put("records_processed", recordsProcessed);
        map.put("records_affected", recordsAffected);
        map.put("errors", errors);
        map.put("warnings", warnings);
        map.put("duration_seconds", durationSeconds);
        return map;
    }
}

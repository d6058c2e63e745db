package villagecompute.courier.jobs;

import java.util.Map;

/**
 * Task body of a schedulable job, selected by {@link #templateType()}.
 *
 * <p>
 * Implementations are {@code @ApplicationScoped} CDI beans discovered by {@link JobTemplateRegistry} at startup. A
 * {@link villagecompute.courier.data.models.ScheduledJob} names its template by type key and carries the parameters
 * the template validates.
 *
 * <p>
 * <b>Thread Safety:</b> {@link #execute(JobContext)} may run concurrently for different jobs using the same template,
 * and for a scheduled and a manual run of the same job. Implementations must not keep per-run state in fields.
 *
 * <p>
 * <b>Cancellation:</b> When a run exceeds the job's timeout the executor records {@code TIMEOUT} and interrupts the
 * worker thread. Long loops should check {@link Thread#isInterrupted()} and stop early; nothing forces them to.
 *
 * <p>
 * <b>Error Handling:</b> Thrown exceptions are recorded as a {@code FAILED} execution and feed the job's retry policy.
 * They never reach the scheduler tick.
 */
public interface JobTemplate {

    /**
     * Unique key of this template, e.g. {@code "notification_dispatcher"}.
     */
    String templateType();

    /**
     * One-line description shown in the admin template listing.
     */
    String description();

    /**
     * Default parameter values, also used to document the parameters a template accepts.
     */
    default Map<String, Object> defaultParameters() {
        return Map.of();
    }

    /**
     * Validates job parameters when a job is created or updated.
     *
     * @param parameters
     *            the job's parameters (never null, possibly empty)
     * @return {@link ParameterValidation#ok()} or an invalid result naming the problem
     */
    ParameterValidation validateParameters(Map<String, Object> parameters);

    /**
     * Runs the task body once.
     *
     * @param context
     *            job, execution and parameters of this run
     * @return structured outcome stored on the execution
     * @throws Exception
     *             any error; recorded as a failed execution
     */
    JobResult execute(JobContext context) throws Exception;
}

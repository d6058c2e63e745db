package villagecompute.courier.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.courier.data.models.JobExecution;
import villagecompute.courier.data.models.ScheduledJob;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Persists the lifecycle of {@link JobExecution} rows. Each method commits on its own so a RUNNING row is visible
 * while the template body is still executing, and a finished row survives a failure in whatever the caller does next.
 */
@ApplicationScoped
public class JobExecutionService {

    private static final Logger LOG = Logger.getLogger(JobExecutionService.class);

    private final String executionHost = resolveHost();

    /**
     * Opens a RUNNING execution for the job.
     */
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public JobExecution start(ScheduledJob job, String triggeredBy, int attempt) {
        JobExecution execution = new JobExecution();
        execution.jobId = job.id;
        execution.jobName = job.name;
        execution.templateType = job.templateType;
        execution.triggeredBy = triggeredBy;
        execution.attempt = attempt;
        execution.status = JobExecution.Status.RUNNING;
        execution.timeoutSeconds = job.timeoutSeconds;
        execution.startedAt = Instant.now();
        execution.executionHost = executionHost;
        execution.persist();
        return execution;
    }

    /**
     * Closes an execution. An execution no longer RUNNING (expired by the orphan sweep) is left as it is.
     *
     * @return the execution as stored after the call
     */
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public JobExecution finish(Long executionId, JobExecution.Status status, String message,
            Map<String, Object> result, List<String> errors, double durationSeconds) {
        JobExecution execution = JobExecution.findById(executionId);
        if (execution == null) {
            throw new IllegalStateException("Execution disappeared before it finished: " + executionId);
        }
        if (execution.status != JobExecution.Status.RUNNING) {
            LOG.warnf("Execution %d was already closed as %s, discarding %s outcome", executionId, execution.status,
                    status);
            return execution;
        }
        execution.status = status;
        execution.message = message;
        execution.result = result;
        execution.errors = errors != null ? new ArrayList<>(errors) : new ArrayList<>();
        execution.durationSeconds = durationSeconds;
        execution.finishedAt = execution.startedAt.plusMillis(Math.round(durationSeconds * 1000));
        return execution;
    }

    /**
     * Times out RUNNING executions that outlived their timeout plus a grace period. Covers runs whose process died
     * before it could record an outcome.
     *
     * @return number of executions expired
     */
    @Transactional
    public int expireOrphaned(Instant now, int graceSeconds) {
        int expired = 0;
        for (JobExecution execution : JobExecution.findRunning()) {
            Instant deadline = execution.startedAt.plusSeconds((long) execution.timeoutSeconds + graceSeconds);
            if (deadline.isBefore(now)) {
                String error = "Execution abandoned: still running " + graceSeconds + "s past its "
                        + execution.timeoutSeconds + "s timeout";
                if (JobExecution.expire(execution.id, now, error)) {
                    expired++;
                    LOG.warnf("Expired orphaned execution %d of job %d (started %s on %s)", execution.id,
                            execution.jobId, execution.startedAt, execution.executionHost);
                }
            }
        }
        return expired;
    }

    @Transactional
    public boolean hasRunning(Long jobId) {
        return JobExecution.hasRunning(jobId);
    }

    @Transactional
    public JobExecution get(Long executionId) {
        return JobExecution.findById(executionId);
    }

    /**
     * Deletes finished executions started before the cutoff.
     */
    @Transactional
    public long purgeFinishedBefore(Instant cutoff) {
        return JobExecution.deleteFinishedBefore(cutoff);
    }

    private static String resolveHost() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            LOG.warnf("Could not resolve local host name, recording executions as 'unknown': %s", e.getMessage());
            return "unknown";
        }
    }
}

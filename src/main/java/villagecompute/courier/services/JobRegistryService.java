package villagecompute.courier.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.courier.api.types.CreateJobRequestType;
import villagecompute.courier.api.types.NotifyOnType;
import villagecompute.courier.api.types.RetryPolicyType;
import villagecompute.courier.api.types.ScheduleType;
import villagecompute.courier.api.types.UpdateJobRequestType;
import villagecompute.courier.config.JobConfig;
import villagecompute.courier.data.models.JobExecution;
import villagecompute.courier.data.models.ScheduledJob;
import villagecompute.courier.exceptions.ResourceNotFoundException;
import villagecompute.courier.exceptions.ValidationException;
import villagecompute.courier.jobs.JobTemplateRegistry;
import villagecompute.courier.jobs.ScheduleCalculator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;

/**
 * Job definitions: create, update, delete, enable, and the due-job queries the scheduler tick runs on.
 *
 * <p>
 * Every definition is validated here, never at tick time: the template type must be registered, the template must
 * accept the parameters, and the schedule must parse. Changing a schedule recomputes {@code next_run_at} from the time
 * of the change.
 */
@ApplicationScoped
public class JobRegistryService {

    private static final Logger LOG = Logger.getLogger(JobRegistryService.class);

    @Inject
    JobTemplateRegistry templates;

    @Inject
    JobConfig jobConfig;

    /**
     * Creates a job.
     *
     * @param request
     *            definition
     * @param actor
     *            operator creating the job
     * @return persisted job
     * @throws ValidationException
     *             for a duplicate name, unknown template, rejected parameters or invalid schedule/policy
     */
    @Transactional
    public ScheduledJob createJob(CreateJobRequestType request, String actor) {
        if (request == null || request.name() == null || request.name().isBlank()) {
            throw new ValidationException("Job name is required");
        }
        String name = request.name().trim();
        if (ScheduledJob.count("name", name) > 0) {
            throw new ValidationException("Job name already exists: " + name);
        }
        templates.validate(request.templateType(), request.parameters());
        ScheduleCalculator.Schedule schedule = toSchedule(request.schedule());

        Instant now = Instant.now();
        ScheduledJob job = new ScheduledJob();
        job.name = name;
        job.description = request.description();
        job.templateType = request.templateType();
        job.parameters = request.parameters() != null ? new HashMap<>(request.parameters()) : new HashMap<>();
        applySchedule(job, schedule);
        job.enabled = request.enabled() == null || request.enabled();
        job.timeoutSeconds = request.timeoutSeconds() != null ? request.timeoutSeconds()
                : jobConfig.getDefaultTimeoutSeconds();
        applyRetryPolicy(job, request.retryPolicy(), true);
        applyNotifyOn(job, request.notifyOn());
        validatePolicy(job);
        job.createdBy = actor;
        job.nextRunAt = ScheduleCalculator.firstRun(schedule, jobConfig.getCronType(), now);
        job.version = 0;
        job.createdAt = now;
        job.updatedAt = now;
        job.persist();

        LOG.infof("Created job %d '%s' (template: %s, schedule: %s, next run: %s)", job.id, job.name,
                job.templateType, describe(schedule), job.nextRunAt);
        return job;
    }

    /**
     * Applies a partial update. A new schedule recomputes the next run from now; new parameters are validated against
     * the job's template.
     *
     * @throws ResourceNotFoundException
     *             if the job does not exist
     * @throws ValidationException
     *             for rejected parameters or an invalid schedule/policy
     */
    @Transactional
    public ScheduledJob updateJob(Long id, UpdateJobRequestType request) {
        ScheduledJob job = getJob(id);
        Instant now = Instant.now();

        if (request.description() != null) {
            job.description = request.description();
        }
        if (request.parameters() != null) {
            templates.validate(job.templateType, request.parameters());
            job.parameters = new HashMap<>(request.parameters());
        }
        if (request.schedule() != null) {
            ScheduleCalculator.Schedule schedule = toSchedule(request.schedule());
            applySchedule(job, schedule);
            job.nextRunAt = job.lastRunAt == null
                    ? ScheduleCalculator.firstRun(schedule, jobConfig.getCronType(), now)
                    : ScheduleCalculator.nextRunAfter(schedule, jobConfig.getCronType(), now);
        }
        if (request.enabled() != null) {
            job.enabled = request.enabled();
        }
        if (request.timeoutSeconds() != null) {
            job.timeoutSeconds = request.timeoutSeconds();
        }
        if (request.retryPolicy() != null) {
            applyRetryPolicy(job, request.retryPolicy(), false);
        }
        if (request.notifyOn() != null) {
            applyNotifyOn(job, request.notifyOn());
        }
        validatePolicy(job);
        job.version++;
        job.updatedAt = now;

        LOG.infof("Updated job %d '%s' (next run: %s)", job.id, job.name, job.nextRunAt);
        return job;
    }

    /**
     * Deletes a job. Jobs with execution history are soft-deleted (disabled and hidden) so the history keeps its
     * owner; jobs that never ran are removed.
     *
     * @return true if the job was soft-deleted, false if it was removed
     * @throws ResourceNotFoundException
     *             if the job does not exist
     */
    @Transactional
    public boolean deleteJob(Long id) {
        ScheduledJob job = getJob(id);
        if (JobExecution.countByJob(job.id, null) == 0) {
            job.delete();
            LOG.infof("Deleted job %d '%s'", id, job.name);
            return false;
        }
        Instant now = Instant.now();
        job.enabled = false;
        job.deletedAt = now;
        job.name = job.name + "#deleted-" + job.id;
        job.retryAt = null;
        job.version++;
        job.updatedAt = now;
        LOG.infof("Soft-deleted job %d (execution history retained)", id);
        return true;
    }

    /**
     * Enables or disables a job. Disabling stops future ticks and pending retries; it does not touch a run already in
     * flight.
     */
    @Transactional
    public ScheduledJob setEnabled(Long id, boolean enabled) {
        ScheduledJob job = getJob(id);
        if (job.enabled != enabled) {
            job.enabled = enabled;
            job.version++;
            job.updatedAt = Instant.now();
            LOG.infof("Job %d '%s' %s", job.id, job.name, enabled ? "enabled" : "disabled");
        }
        return job;
    }

    /**
     * @throws ResourceNotFoundException
     *             if the job does not exist or was deleted
     */
    @Transactional
    public ScheduledJob getJob(Long id) {
        ScheduledJob job = id == null ? null : ScheduledJob.findById(id);
        if (job == null || job.deletedAt != null) {
            throw new ResourceNotFoundException("Job not found: " + id);
        }
        return job;
    }

    /**
     * @return the live job with this name, or null
     */
    @Transactional
    public ScheduledJob findByName(String name) {
        return ScheduledJob.findByName(name);
    }

    @Transactional
    public List<ScheduledJob> listJobs(boolean includeDisabled) {
        return ScheduledJob.findActive(includeDisabled);
    }

    /**
     * Enabled jobs whose regular run or pending retry is due at {@code now}.
     */
    @Transactional
    public List<ScheduledJob> listDueJobs(Instant now) {
        return ScheduledJob.findDue(now);
    }

    /**
     * Pages through a job's executions, newest first.
     *
     * @param status
     *            optional status filter
     */
    @Transactional
    public List<JobExecution> getExecutions(Long jobId, JobExecution.Status status, int page, int size) {
        if (page < 0 || size <= 0 || size > 500) {
            throw new ValidationException("page must be >= 0 and size between 1 and 500");
        }
        return JobExecution.findByJob(jobId, status, page, size);
    }

    @Transactional
    public long countExecutions(Long jobId, JobExecution.Status status) {
        return JobExecution.countByJob(jobId, status);
    }

    /**
     * Claims the regular slot of a due job read at {@code job.version}, advancing its next run past {@code now}.
     *
     * @return false if another tick changed the job first
     */
    @Transactional
    public boolean claimScheduledRun(ScheduledJob job, Instant now) {
        Instant next = ScheduleCalculator.nextRunAfter(ScheduleCalculator.Schedule.of(job), jobConfig.getCronType(),
                now);
        return ScheduledJob.claimScheduledRun(job.id, job.version, now, next);
    }

    /**
     * Claims the pending retry of a job read at {@code job.version}.
     *
     * @return false if another tick changed the job first
     */
    @Transactional
    public boolean claimRetryRun(ScheduledJob job, Instant now) {
        Instant next = job.nextRunAt;
        if (next == null || !next.isAfter(now)) {
            next = ScheduleCalculator.nextRunAfter(ScheduleCalculator.Schedule.of(job), jobConfig.getCronType(), now);
        }
        return ScheduledJob.claimRetryRun(job.id, job.version, now, next);
    }

    @Transactional
    public void scheduleRetry(Long jobId, Instant retryAt, int attempt) {
        ScheduledJob.scheduleRetry(jobId, retryAt, attempt);
        LOG.infof("Job %d retry attempt %d scheduled at %s", jobId, attempt, retryAt);
    }

    @Transactional
    public void recordLastStatus(Long jobId, JobExecution.Status status) {
        ScheduledJob.recordLastStatus(jobId, status);
    }

    private ScheduleCalculator.Schedule toSchedule(ScheduleType type) {
        if (type == null || type.kind() == null) {
            throw new ValidationException("Schedule kind is required (interval or cron)");
        }
        ScheduledJob.ScheduleKind kind;
        try {
            kind = ScheduledJob.ScheduleKind.valueOf(type.kind().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown schedule kind: " + type.kind(), e);
        }
        ScheduleCalculator.Schedule schedule = kind == ScheduledJob.ScheduleKind.INTERVAL
                ? ScheduleCalculator.Schedule.interval(type.intervalSeconds() == null ? 0 : type.intervalSeconds())
                : ScheduleCalculator.Schedule.cron(type.expression(), type.timezone());
        ScheduleCalculator.validate(schedule, jobConfig.getCronType());
        return schedule;
    }

    private static void applySchedule(ScheduledJob job, ScheduleCalculator.Schedule schedule) {
        job.scheduleKind = schedule.kind();
        job.intervalSeconds = schedule.intervalSeconds();
        job.cronExpression = schedule.cronExpression();
        job.timezone = schedule.timezone();
    }

    private void applyRetryPolicy(ScheduledJob job, RetryPolicyType policy, boolean useDefaults) {
        if (policy != null && policy.maxRetries() != null) {
            job.maxRetries = policy.maxRetries();
        } else if (useDefaults) {
            job.maxRetries = jobConfig.getDefaultMaxRetries();
        }
        if (policy != null && policy.retryDelaySeconds() != null) {
            job.retryDelaySeconds = policy.retryDelaySeconds();
        } else if (useDefaults) {
            job.retryDelaySeconds = jobConfig.getDefaultRetryDelaySeconds();
        }
    }

    private static void applyNotifyOn(ScheduledJob job, NotifyOnType notifyOn) {
        job.notifyOnSuccess = notifyOn != null && notifyOn.success() != null ? new ArrayList<>(notifyOn.success())
                : new ArrayList<>();
        job.notifyOnFailure = notifyOn != null && notifyOn.failure() != null ? new ArrayList<>(notifyOn.failure())
                : new ArrayList<>();
    }

    private static void validatePolicy(ScheduledJob job) {
        if (job.timeoutSeconds <= 0) {
            throw new ValidationException("timeout_seconds must be positive");
        }
        if (job.maxRetries < 0) {
            throw new ValidationException("max_retries must not be negative");
        }
        if (job.retryDelaySeconds < 0) {
            throw new ValidationException("retry_delay_seconds must not be negative");
        }
    }

    private static String describe(ScheduleCalculator.Schedule schedule) {
        return schedule.kind() == ScheduledJob.ScheduleKind.INTERVAL ? "every " + schedule.intervalSeconds() + "s"
                : "cron '" + schedule.cronExpression() + "' " + (schedule.timezone() != null ? schedule.timezone()
                        : "UTC");
    }
}

package villagecompute.courier.jobs;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.courier.data.models.JobExecution;
import villagecompute.courier.data.models.ScheduledJob;
import villagecompute.courier.services.JobExecutionService;
import villagecompute.courier.services.JobExecutorService;
import villagecompute.courier.services.JobRegistryService;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic tick that launches due jobs.
 *
 * <p>
 * <b>Each tick:</b>
 * <ol>
 * <li>Expire RUNNING executions abandoned past their timeout plus {@code courier.scheduler.orphan-grace-seconds}</li>
 * <li>List enabled jobs whose regular run or pending retry is due</li>
 * <li>Skip jobs with an execution still RUNNING, here or on another instance</li>
 * <li>Claim the run with a version-checked update so only one instance launches it</li>
 * <li>Hand the job to {@link JobExecutorService} without waiting for it</li>
 * </ol>
 *
 * <p>
 * While a retry is pending the regular slot is held: the job is skipped until {@code retryAt}, and the retry then takes
 * the overdue regular slot, which moves to the next occurrence after the retry.
 *
 * <p>
 * The tick is driven by Quarkus {@code @Scheduled} and does nothing until {@link #start()} is called, which happens at
 * startup when {@code courier.scheduler.enabled} is true. {@link #stop()} waits up to
 * {@code courier.scheduler.drain-timeout-seconds} for in-flight executions.
 */
@ApplicationScoped
public class JobScheduler {

    private static final Logger LOG = Logger.getLogger(JobScheduler.class);

    @Inject
    JobRegistryService registry;

    @Inject
    JobExecutionService executions;

    @Inject
    JobExecutorService executor;

    @ConfigProperty(
            name = "courier.scheduler.enabled",
            defaultValue = "true")
    boolean enabled;

    @ConfigProperty(
            name = "courier.scheduler.orphan-grace-seconds",
            defaultValue = "60")
    int orphanGraceSeconds;

    @ConfigProperty(
            name = "courier.scheduler.drain-timeout-seconds",
            defaultValue = "30")
    int drainTimeoutSeconds;

    private final AtomicBoolean running = new AtomicBoolean(false);

    private final Map<Long, CompletableFuture<JobExecution>> inFlight = new ConcurrentHashMap<>();

    void onStart(@Observes StartupEvent event) {
        if (enabled) {
            start();
        } else {
            LOG.info("Job scheduler disabled (courier.scheduler.enabled=false)");
        }
    }

    void onStop(@Observes ShutdownEvent event) {
        stop();
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            LOG.info("Job scheduler started");
        }
    }

    /**
     * Stops launching jobs and waits for in-flight executions to finish, up to the drain timeout.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        List<CompletableFuture<JobExecution>> pending = new ArrayList<>(inFlight.values());
        if (pending.isEmpty()) {
            LOG.info("Job scheduler stopped");
            return;
        }
        LOG.infof("Job scheduler stopping, waiting up to %ds for %d in-flight executions", drainTimeoutSeconds,
                pending.size());
        try {
            CompletableFuture.allOf(pending.toArray(new CompletableFuture[0])).get(drainTimeoutSeconds,
                    TimeUnit.SECONDS);
            LOG.info("Job scheduler stopped, all executions drained");
        } catch (TimeoutException e) {
            LOG.warnf("Job scheduler stopped with %d executions still running after %ds", inFlight.size(),
                    drainTimeoutSeconds);
        } catch (ExecutionException e) {
            LOG.warnf(e.getCause(), "Job scheduler stopped, an in-flight execution ended abnormally");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Job scheduler stop interrupted while draining executions");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    @Scheduled(
            every = "${courier.scheduler.tick-interval:5s}",
            identity = "job-scheduler-tick",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduledTick() {
        if (!running.get()) {
            return;
        }
        try {
            tick(Instant.now());
        } catch (Exception e) {
            LOG.errorf(e, "Job scheduler tick failed");
        }
    }

    /**
     * Runs one scheduling pass as of {@code now}.
     *
     * @return what the pass did, including the futures of launched executions
     */
    public synchronized TickResult tick(Instant now) {
        int expired = executions.expireOrphaned(now, orphanGraceSeconds);
        List<ScheduledJob> due = registry.listDueJobs(now);
        List<CompletableFuture<JobExecution>> launched = new ArrayList<>();
        int skipped = 0;

        for (ScheduledJob job : due) {
            CompletableFuture<JobExecution> current = inFlight.get(job.id);
            if ((current != null && !current.isDone()) || executions.hasRunning(job.id)) {
                LOG.debugf("Job %d '%s' still running, skipping this tick", job.id, job.name);
                skipped++;
                continue;
            }

            if (job.retryAt != null && job.retryAt.isAfter(now)) {
                LOG.debugf("Job %d '%s' holds its regular slot until retry attempt %d at %s", job.id, job.name,
                        job.retryAttempt, job.retryAt);
                skipped++;
                continue;
            }

            boolean retry = job.retryAt != null;
            int attempt = retry && job.retryAttempt != null ? job.retryAttempt : 1;
            boolean claimed = retry ? registry.claimRetryRun(job, now) : registry.claimScheduledRun(job, now);
            if (!claimed) {
                LOG.debugf("Job %d '%s' was claimed elsewhere, skipping", job.id, job.name);
                skipped++;
                continue;
            }

            LOG.debugf("Launching job %d '%s' (%s, attempt %d)", job.id, job.name, retry ? "retry" : "scheduled",
                    attempt);
            CompletableFuture<JobExecution> future = executor.submit(job, JobExecution.TRIGGERED_BY_SCHEDULER,
                    attempt);
            inFlight.put(job.id, future);
            future.whenComplete((execution, error) -> {
                inFlight.remove(job.id, future);
                if (error != null) {
                    LOG.errorf(error, "Execution of job %d '%s' ended abnormally", job.id, job.name);
                }
            });
            launched.add(future);
        }

        if (expired > 0 || !launched.isEmpty()) {
            LOG.infof("Scheduler tick: %d due, %d launched, %d skipped, %d orphans expired", due.size(),
                    launched.size(), skipped, expired);
        }
        return new TickResult(due.size(), skipped, expired, launched);
    }

    /**
     * Outcome of one scheduling pass.
     *
     * @param due
     *            jobs found due
     * @param skipped
     *            due jobs not launched (still running or claimed elsewhere)
     * @param orphansExpired
     *            abandoned executions moved to TIMEOUT
     * @param launched
     *            futures of the executions started by this pass
     */
    public record TickResult(int due, int skipped, int orphansExpired,
            List<CompletableFuture<JobExecution>> launched) {
    }
}

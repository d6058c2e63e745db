package villagecompute.courier.services;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.courier.config.JobConfig;
import villagecompute.courier.data.models.JobExecution;
import villagecompute.courier.data.models.ScheduledJob;
import villagecompute.courier.jobs.JobContext;
import villagecompute.courier.jobs.JobResult;
import villagecompute.courier.jobs.JobTemplate;
import villagecompute.courier.jobs.JobTemplateRegistry;
import villagecompute.courier.notifications.NotificationPriority;
import villagecompute.courier.observability.CourierMetrics;
import villagecompute.courier.observability.LoggingConfig;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one job execution end to end.
 *
 * <p>
 * <b>Execution flow:</b>
 * <ol>
 * <li>Persist a RUNNING {@link JobExecution} (committed on its own)</li>
 * <li>Run the template body on a pool thread and wait at most {@code timeoutSeconds}</li>
 * <li>Timeout: cancel the body and record TIMEOUT. Exception: record FAILED with its message. Otherwise SUCCESS,
 * unless the template reported FAILED</li>
 * <li>Persist the outcome before returning</li>
 * <li>FAILED or TIMEOUT with {@code attempt <= maxRetries}: schedule the next attempt after {@code retryDelaySeconds}</li>
 * <li>Enqueue the job's {@code notifyOn} triggers for the outcome</li>
 * </ol>
 *
 * <p>
 * The template body is interrupted on timeout; templates that loop over batches check
 * {@link Thread#isInterrupted()} between items so the abandoned body stops promptly.
 */
@ApplicationScoped
public class JobExecutorService {

    private static final Logger LOG = Logger.getLogger(JobExecutorService.class);

    @Inject
    JobTemplateRegistry templates;

    @Inject
    JobExecutionService executions;

    @Inject
    JobRegistryService registry;

    @Inject
    NotificationQueueService queueService;

    @Inject
    JobConfig jobConfig;

    @Inject
    CourierMetrics metrics;

    @Inject
    Tracer tracer;

    private ExecutorService pool;

    @PostConstruct
    void init() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "courier-job-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        pool = Executors.newCachedThreadPool(factory);
    }

    @PreDestroy
    void shutdown() {
        List<Runnable> abandoned = pool.shutdownNow();
        if (!abandoned.isEmpty()) {
            LOG.warnf("Job executor shut down with %d queued tasks abandoned", abandoned.size());
        }
    }

    /**
     * Runs the job asynchronously.
     *
     * @return future completed with the finished execution
     */
    public CompletableFuture<JobExecution> submit(ScheduledJob job, String triggeredBy, int attempt) {
        return CompletableFuture.supplyAsync(() -> run(job, triggeredBy, attempt), pool);
    }

    /**
     * Runs the first attempt of the job on the calling thread and waits for it.
     */
    public JobExecution run(ScheduledJob job, String triggeredBy) {
        return run(job, triggeredBy, 1);
    }

    /**
     * Runs one attempt of the job on the calling thread and waits for it, at most {@code job.timeoutSeconds}.
     *
     * @return the finished execution
     */
    public JobExecution run(ScheduledJob job, String triggeredBy, int attempt) {
        JobExecution execution = executions.start(job, triggeredBy, attempt);

        Span span = tracer.spanBuilder("job.execute").setAttribute("job.id", job.id)
                .setAttribute("job.name", job.name).setAttribute("job.template", job.templateType)
                .setAttribute("job.attempt", attempt).setAttribute("job.triggered_by", triggeredBy).startSpan();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setJobId(job.id);
            LoggingConfig.setExecutionId(execution.id);
            LOG.infof("Executing job %d '%s' (template: %s, attempt: %d, triggered by: %s)", job.id, job.name,
                    job.templateType, attempt, triggeredBy);

            Outcome outcome = execute(job, execution, attempt, triggeredBy, span);
            double durationSeconds = (System.nanoTime() - outcome.startNanos()) / 1_000_000_000.0;
            JobResult result = outcome.result() != null ? outcome.result().withDuration(durationSeconds) : null;

            JobExecution finished = executions.finish(execution.id, outcome.status(), outcome.message(),
                    result != null ? result.toMap() : null, outcome.errors(), durationSeconds);
            span.setAttribute("job.status", finished.status.name());
            if (finished.status != JobExecution.Status.SUCCESS) {
                span.setStatus(StatusCode.ERROR, String.valueOf(finished.errors));
            }
            metrics.recordExecution(job.templateType, finished.status,
                    Duration.ofMillis(Math.round(durationSeconds * 1000)));
            LOG.infof("Job %d '%s' finished as %s in %.2fs", job.id, job.name, finished.status, durationSeconds);

            afterExecution(job, finished, attempt);
            return finished;
        } finally {
            span.end();
            LoggingConfig.clearMDC();
        }
    }

    private Outcome execute(ScheduledJob job, JobExecution execution, int attempt, String triggeredBy, Span span) {
        long startNanos = System.nanoTime();
        JobTemplate template = templates.find(job.templateType).orElse(null);
        if (template == null) {
            return new Outcome(startNanos, JobExecution.Status.FAILED, "Template not registered", null,
                    List.of("Unknown template type: " + job.templateType));
        }

        JobContext context = new JobContext(job.id, job.name, execution.id, attempt, triggeredBy,
                JobTemplateRegistry.effectiveParameters(template, job.parameters));
        Callable<JobResult> body = Context.current().wrap(() -> {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setJobId(job.id);
            LoggingConfig.setExecutionId(execution.id);
            try {
                return template.execute(context);
            } finally {
                LoggingConfig.clearMDC();
            }
        });

        Future<JobResult> future = pool.submit(body);
        try {
            JobResult result = future.get(job.timeoutSeconds, TimeUnit.SECONDS);
            if (result == null) {
                return new Outcome(startNanos, JobExecution.Status.FAILED, "Template returned no result", null,
                        List.of("Template " + job.templateType + " returned no result"));
            }
            JobExecution.Status status = result.status() == JobResult.Outcome.FAILED ? JobExecution.Status.FAILED
                    : JobExecution.Status.SUCCESS;
            return new Outcome(startNanos, status, result.message(), result, result.errors());
        } catch (TimeoutException e) {
            future.cancel(true);
            span.addEvent("job.timeout");
            LOG.warnf("Job %d '%s' exceeded its timeout of %ds, cancelled", job.id, job.name, job.timeoutSeconds);
            return new Outcome(startNanos, JobExecution.Status.TIMEOUT, "Timed out",
                    null, List.of("Execution exceeded timeout of " + job.timeoutSeconds + " seconds"));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            span.recordException(cause);
            LOG.errorf(cause, "Job %d '%s' failed", job.id, job.name);
            String error = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
            return new Outcome(startNanos, JobExecution.Status.FAILED, "Execution failed", null, List.of(error));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            LOG.warnf("Interrupted while waiting for job %d '%s', cancelled", job.id, job.name);
            return new Outcome(startNanos, JobExecution.Status.FAILED, "Interrupted", null,
                    List.of("Executor interrupted before the job finished"));
        }
    }

    private void afterExecution(ScheduledJob job, JobExecution finished, int attempt) {
        try {
            registry.recordLastStatus(job.id, finished.status);
        } catch (Exception e) {
            LOG.errorf(e, "Failed to record last status of job %d", job.id);
        }

        if (finished.status.isRetryable()) {
            if (attempt <= job.maxRetries) {
                Instant retryAt = Instant.now().plusSeconds(job.retryDelaySeconds);
                try {
                    registry.scheduleRetry(job.id, retryAt, attempt + 1);
                } catch (Exception e) {
                    LOG.errorf(e, "Failed to schedule retry %d of job %d", attempt + 1, job.id);
                }
            } else if (job.maxRetries > 0) {
                LOG.warnf("Job %d '%s' failed attempt %d, retries exhausted (max_retries: %d)", job.id, job.name,
                        attempt, job.maxRetries);
            }
        }

        List<String> triggers = finished.status == JobExecution.Status.SUCCESS ? job.notifyOnSuccess
                : job.notifyOnFailure;
        if (triggers == null || triggers.isEmpty()) {
            return;
        }
        boolean failed = finished.status != JobExecution.Status.SUCCESS;
        String status = finished.status.name().toLowerCase(Locale.ROOT);
        Map<String, Object> templateData = new HashMap<>();
        templateData.put("job_name", job.name);
        templateData.put("status", status);
        templateData.put("attempt", attempt);
        templateData.put("execution_id", finished.id);
        templateData.put("title", "Job " + job.name + " " + status);
        templateData.put("message", failed && !finished.errors.isEmpty()
                ? "Job " + job.name + " ended " + status + ": " + finished.errors.get(0)
                : "Job " + job.name + " ended " + status + ".");

        for (String trigger : triggers) {
            try {
                queueService.enqueue(jobConfig.getNotifyRecipient(), trigger, jobConfig.getNotifyChannels(),
                        failed ? NotificationPriority.HIGH : NotificationPriority.LOW, templateData);
            } catch (Exception e) {
                LOG.errorf(e, "Failed to enqueue %s notification for job %d", trigger, job.id);
            }
        }
    }

    /**
     * What the template body produced, before it is persisted.
     */
    private record Outcome(long startNanos, JobExecution.Status status, String message, JobResult result,
            List<String> errors) {
    }
}

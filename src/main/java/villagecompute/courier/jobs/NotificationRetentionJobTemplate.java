package villagecompute.courier.jobs;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.courier.services.DeliveryLogService;
import villagecompute.courier.services.JobExecutionService;
import villagecompute.courier.services.NotificationQueueService;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deletes history older than {@code retention_days}: terminal notification requests (in batches of
 * {@code batch_size}), delivery log rows and finished job executions.
 */
@ApplicationScoped
public class NotificationRetentionJobTemplate implements JobTemplate {

    private static final Logger LOG = Logger.getLogger(NotificationRetentionJobTemplate.class);

    public static final String TEMPLATE_TYPE = "notification_retention_cleanup";

    static final int DEFAULT_RETENTION_DAYS = 30;

    static final int DEFAULT_BATCH_SIZE = 500;

    @Inject
    NotificationQueueService queueService;

    @Inject
    DeliveryLogService deliveryLogService;

    @Inject
    JobExecutionService executionService;

    @Override
    public String templateType() {
        return TEMPLATE_TYPE;
    }

    @Override
    public String description() {
        return "Purge completed notifications, delivery logs and job executions past retention";
    }

    @Override
    public Map<String, Object> defaultParameters() {
        return Map.of("retention_days", DEFAULT_RETENTION_DAYS, "batch_size", DEFAULT_BATCH_SIZE);
    }

    @Override
    public ParameterValidation validateParameters(Map<String, Object> parameters) {
        return TemplateParameters.checkRanges(parameters, "retention_days", 1, 3650, "batch_size", 1, 5000);
    }

    @Override
    public JobResult execute(JobContext context) {
        int retentionDays = context.intParam("retention_days", DEFAULT_RETENTION_DAYS);
        int batchSize = context.intParam("batch_size", DEFAULT_BATCH_SIZE);
        Instant cutoff = Instant.now().minus(Duration.ofDays(retentionDays));

        int requests = 0;
        int batch;
        do {
            if (Thread.currentThread().isInterrupted()) {
                LOG.warnf("Retention cleanup interrupted after %d requests", requests);
                break;
            }
            batch = queueService.purgeCompletedBefore(cutoff, batchSize);
            requests += batch;
        } while (batch == batchSize);

        long logs = deliveryLogService.purgeOlderThan(cutoff);
        long executions = executionService.purgeFinishedBefore(cutoff);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("cutoff", cutoff.toString());
        details.put("notifications_deleted", requests);
        details.put("delivery_logs_deleted", logs);
        details.put("executions_deleted", executions);
        int affected = (int) (requests + logs + executions);
        return JobResult.success(String.format("Purged %d notifications, %d delivery logs, %d executions", requests,
                logs, executions), details, affected, affected);
    }
}

package villagecompute.courier.jobs;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.courier.config.NotificationConfig;
import villagecompute.courier.services.NotificationQueueService;

import java.util.Map;

/**
 * Returns requests stuck in PROCESSING past {@code timeout_minutes} to PENDING. A worker that crashed mid-dispatch
 * leaves its claimed requests behind; this sweep is what makes them deliverable again.
 */
@ApplicationScoped
public class StuckNotificationRecoveryJobTemplate implements JobTemplate {

    public static final String TEMPLATE_TYPE = "stuck_notification_recovery";

    @Inject
    NotificationQueueService queueService;

    @Inject
    NotificationConfig config;

    @Override
    public String templateType() {
        return TEMPLATE_TYPE;
    }

    @Override
    public String description() {
        return "Reset notifications stuck in processing back to pending";
    }

    @Override
    public Map<String, Object> defaultParameters() {
        return Map.of("timeout_minutes", config.getRecoveryTimeoutMinutes());
    }

    @Override
    public ParameterValidation validateParameters(Map<String, Object> parameters) {
        return TemplateParameters.checkRanges(parameters, "timeout_minutes", 1, 1440);
    }

    @Override
    public JobResult execute(JobContext context) {
        int timeoutMinutes = context.intParam("timeout_minutes", config.getRecoveryTimeoutMinutes());
        int recovered = queueService.resetStuckProcessing(timeoutMinutes);
        return JobResult.success(String.format("Recovered %d stuck notifications", recovered),
                Map.of("timeout_minutes", timeoutMinutes, "recovered", recovered), recovered, recovered);
    }
}

package villagecompute.courier.jobs;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.courier.data.models.NotificationRequest;
import villagecompute.courier.notifications.DispatchSummary;
import villagecompute.courier.notifications.NotificationChannel;
import villagecompute.courier.services.NotificationDispatcher;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Drains one channel of the notification queue per run.
 *
 * <p>
 * <b>Parameters:</b>
 * <ul>
 * <li>{@code channel} - {@code push}, {@code email} or {@code sms} (required)</li>
 * <li>{@code batch_size} - requests claimed per run, 1..500 (default 50)</li>
 * </ul>
 *
 * <p>
 * A run where some requests failed completes as {@code PARTIAL}; only an exception from the claim itself fails the
 * execution.
 */
@ApplicationScoped
public class NotificationDispatchJobTemplate implements JobTemplate {

    public static final String TEMPLATE_TYPE = "notification_dispatcher";

    static final int DEFAULT_BATCH_SIZE = 50;

    @Inject
    NotificationDispatcher dispatcher;

    @Override
    public String templateType() {
        return TEMPLATE_TYPE;
    }

    @Override
    public String description() {
        return "Claim pending notifications for one channel and deliver them";
    }

    @Override
    public Map<String, Object> defaultParameters() {
        return Map.of("batch_size", DEFAULT_BATCH_SIZE);
    }

    @Override
    public ParameterValidation validateParameters(Map<String, Object> parameters) {
        Object channel = parameters.get("channel");
        if (channel == null || channel.toString().isBlank()) {
            return ParameterValidation.invalid("channel is required (push, email or sms)");
        }
        try {
            NotificationChannel.fromString(channel.toString());
        } catch (IllegalArgumentException e) {
            return ParameterValidation.invalid("Unknown channel: " + channel);
        }
        return TemplateParameters.checkRanges(parameters, "batch_size", 1, 500);
    }

    @Override
    public JobResult execute(JobContext context) {
        NotificationChannel channel = NotificationChannel.fromString(context.stringParam("channel", null));
        int batchSize = context.intParam("batch_size", DEFAULT_BATCH_SIZE);

        DispatchSummary summary = dispatcher.drain(channel, batchSize);

        List<String> errors = summary.getErrors() > 0
                ? List.of(summary.getErrors() + " requests failed with an unexpected error")
                : List.of();
        String message = String.format("Dispatched %d %s notifications", summary.getClaimed(),
                channel.name().toLowerCase(Locale.ROOT));
        return JobResult.completed(message, summary.toDetails(), summary.getClaimed(),
                summary.count(NotificationRequest.Status.SENT), errors);
    }
}

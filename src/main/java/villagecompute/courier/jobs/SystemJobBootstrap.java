package villagecompute.courier.jobs;

import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.courier.api.types.CreateJobRequestType;
import villagecompute.courier.api.types.ScheduleType;
import villagecompute.courier.exceptions.ValidationException;
import villagecompute.courier.services.JobRegistryService;

import java.util.List;
import java.util.Map;

/**
 * Creates the built-in jobs on startup when they do not exist yet. Existing jobs are left untouched, so operator
 * changes to their schedule or parameters survive restarts.
 *
 * <p>
 * <b>Built-in jobs:</b>
 * <ul>
 * <li>{@code push-dispatcher}, {@code email-dispatcher}, {@code sms-dispatcher} - every 30 seconds</li>
 * <li>{@code stuck-notification-recovery} - every 5 minutes</li>
 * <li>{@code notification-retention-cleanup} - daily at 03:00 UTC</li>
 * <li>{@code pending-messages-reminder} - every 15 minutes</li>
 * </ul>
 */
@ApplicationScoped
public class SystemJobBootstrap {

    private static final Logger LOG = Logger.getLogger(SystemJobBootstrap.class);

    static final String ACTOR = "system";

    @Inject
    JobRegistryService registry;

    @ConfigProperty(
            name = "courier.jobs.bootstrap.enabled",
            defaultValue = "true")
    boolean enabled;

    void onStart(@Observes StartupEvent event) {
        if (!enabled) {
            LOG.info("System job bootstrap disabled (courier.jobs.bootstrap.enabled=false)");
            return;
        }
        int created = ensureSystemJobs();
        LOG.infof("System job bootstrap complete, %d jobs created", created);
    }

    /**
     * Creates each built-in job whose name is not taken.
     *
     * @return number of jobs created
     */
    public int ensureSystemJobs() {
        int created = 0;
        for (CreateJobRequestType definition : definitions()) {
            if (registry.findByName(definition.name()) != null) {
                LOG.debugf("System job '%s' already exists", definition.name());
                continue;
            }
            try {
                registry.createJob(definition, ACTOR);
                created++;
            } catch (ValidationException e) {
                // a concurrent instance may have created it between the check and the insert
                LOG.warnf("System job '%s' not created: %s", definition.name(), e.getMessage());
            }
        }
        return created;
    }

    static List<CreateJobRequestType> definitions() {
        return List.of(
                interval("push-dispatcher", "Deliver pending push notifications",
                        NotificationDispatchJobTemplate.TEMPLATE_TYPE, Map.of("channel", "push", "batch_size", 50),
                        30),
                interval("email-dispatcher", "Deliver pending email notifications",
                        NotificationDispatchJobTemplate.TEMPLATE_TYPE, Map.of("channel", "email", "batch_size", 50),
                        30),
                interval("sms-dispatcher", "Deliver pending SMS notifications",
                        NotificationDispatchJobTemplate.TEMPLATE_TYPE, Map.of("channel", "sms", "batch_size", 50), 30),
                interval("stuck-notification-recovery", "Return notifications stuck in processing to the queue",
                        StuckNotificationRecoveryJobTemplate.TEMPLATE_TYPE, Map.of(), 300),
                new CreateJobRequestType("notification-retention-cleanup",
                        "Purge notification history past retention", NotificationRetentionJobTemplate.TEMPLATE_TYPE,
                        Map.of(), new ScheduleType("cron", null, "0 3 * * *", "UTC"), true, null, null, null),
                interval("pending-messages-reminder", "Remind recipients about unread messages",
                        PendingMessagesReminderJobTemplate.TEMPLATE_TYPE, Map.of(), 900));
    }

    private static CreateJobRequestType interval(String name, String description, String templateType,
            Map<String, Object> parameters, int seconds) {
        return new CreateJobRequestType(name, description, templateType, parameters,
                new ScheduleType("interval", seconds, null, null), true, null, null, null);
    }
}

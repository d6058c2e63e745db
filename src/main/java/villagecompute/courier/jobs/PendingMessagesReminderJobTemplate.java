package villagecompute.courier.jobs;

import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.courier.data.models.InboxMessage;
import villagecompute.courier.notifications.NotificationChannel;
import villagecompute.courier.notifications.NotificationPriority;
import villagecompute.courier.services.DeliveryTargetService;
import villagecompute.courier.services.NotificationQueueService;
import villagecompute.courier.services.ReminderCooldownService;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reminds recipients about inbox messages they have left unread.
 *
 * <p>
 * <b>Execution Flow:</b>
 * <ol>
 * <li>Summarize recipients with messages unread for at least {@code min_unread_age_minutes}, up to
 * {@code batch_size} recipients</li>
 * <li>Skip recipients with no active push or SMS target</li>
 * <li>Skip recipients reminded within {@code reminder_cooldown_hours}</li>
 * <li>Enqueue an {@code unread_messages} notification on push, falling back to SMS</li>
 * <li>Record the reminder with the unread count</li>
 * </ol>
 *
 * <p>
 * A failure for one recipient is counted and the batch continues.
 */
@ApplicationScoped
public class PendingMessagesReminderJobTemplate implements JobTemplate {

    private static final Logger LOG = Logger.getLogger(PendingMessagesReminderJobTemplate.class);

    public static final String TEMPLATE_TYPE = "pending_messages_notifier";

    public static final String REMINDER_KIND = "pending_messages";

    public static final String TRIGGER = "unread_messages";

    static final List<NotificationChannel> CHANNELS = List.of(NotificationChannel.PUSH, NotificationChannel.SMS);

    static final int DEFAULT_MIN_UNREAD_AGE_MINUTES = 30;

    static final int DEFAULT_COOLDOWN_HOURS = 4;

    static final int DEFAULT_BATCH_SIZE = 100;

    static final int DEFAULT_MAX_SENDERS = 3;

    @Inject
    NotificationQueueService queueService;

    @Inject
    DeliveryTargetService targetService;

    @Inject
    ReminderCooldownService cooldownService;

    @Override
    public String templateType() {
        return TEMPLATE_TYPE;
    }

    @Override
    public String description() {
        return "Remind recipients about unread messages, at most once per cooldown window";
    }

    @Override
    public Map<String, Object> defaultParameters() {
        return Map.of("min_unread_age_minutes", DEFAULT_MIN_UNREAD_AGE_MINUTES, "reminder_cooldown_hours",
                DEFAULT_COOLDOWN_HOURS, "batch_size", DEFAULT_BATCH_SIZE, "max_senders_to_show", DEFAULT_MAX_SENDERS);
    }

    @Override
    public ParameterValidation validateParameters(Map<String, Object> parameters) {
        return TemplateParameters.checkRanges(parameters, "min_unread_age_minutes", 5, 1440,
                "reminder_cooldown_hours", 1, 24, "batch_size", 1, 500, "max_senders_to_show", 1, 5);
    }

    @Override
    public JobResult execute(JobContext context) {
        int minAgeMinutes = context.intParam("min_unread_age_minutes", DEFAULT_MIN_UNREAD_AGE_MINUTES);
        Duration cooldown = Duration.ofHours(context.intParam("reminder_cooldown_hours", DEFAULT_COOLDOWN_HOURS));
        int batchSize = context.intParam("batch_size", DEFAULT_BATCH_SIZE);
        int maxSenders = context.intParam("max_senders_to_show", DEFAULT_MAX_SENDERS);

        Instant now = Instant.now();
        Instant cutoff = now.minus(Duration.ofMinutes(minAgeMinutes));
        List<InboxMessage.UnreadSummary> summaries = QuarkusTransaction.requiringNew()
                .call(() -> InboxMessage.summarizeUnreadBefore(cutoff, batchSize));

        int checked = 0;
        int queued = 0;
        int skippedCooldown = 0;
        int skippedNoTarget = 0;
        List<String> errors = new ArrayList<>();

        for (InboxMessage.UnreadSummary summary : summaries) {
            if (Thread.currentThread().isInterrupted()) {
                LOG.warnf("Pending messages reminder interrupted after %d of %d recipients", checked,
                        summaries.size());
                break;
            }
            checked++;
            try {
                if (!targetService.hasActiveTarget(summary.recipient(), CHANNELS)) {
                    skippedNoTarget++;
                    continue;
                }
                if (!cooldownService.shouldRemind(summary.recipient(), REMINDER_KIND, cooldown, now)) {
                    skippedCooldown++;
                    continue;
                }

                List<String> senders = summary.senders().subList(0,
                        Math.min(maxSenders, summary.senders().size()));
                Map<String, Object> templateData = new HashMap<>();
                templateData.put("title", "Unread Messages");
                templateData.put("message", reminderText(summary.unreadCount(), senders, summary.senders().size()));
                templateData.put("unread_count", summary.unreadCount());
                templateData.put("senders", senders);

                queueService.enqueue(summary.recipient(), TRIGGER, CHANNELS, NotificationPriority.MEDIUM,
                        templateData);
                cooldownService.recordReminder(summary.recipient(), REMINDER_KIND,
                        Map.of("unread_count", summary.unreadCount()), now);
                queued++;
            } catch (Exception e) {
                LOG.errorf(e, "Failed to remind %s about unread messages", summary.recipient());
                errors.add(summary.recipient() + ": " + e.getMessage());
            }
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("recipients_checked", checked);
        details.put("notifications_queued", queued);
        details.put("skipped_cooldown", skippedCooldown);
        details.put("skipped_no_target", skippedNoTarget);
        details.put("errors", errors.size());
        LOG.infof("Pending messages reminder: checked %d, queued %d, cooldown %d, no target %d", checked, queued,
                skippedCooldown, skippedNoTarget);
        return JobResult.completed(String.format("Processed %d recipients, queued %d reminders", checked, queued),
                details, checked, queued, errors);
    }

    /**
     * "You have 3 unread messages from Ann, Bob and 2 others".
     *
     * @param shown
     *            sender names to mention
     * @param totalSenders
     *            distinct senders overall
     */
    static String reminderText(long unreadCount, List<String> shown, int totalSenders) {
        String messages = unreadCount == 1 ? "1 unread message" : unreadCount + " unread messages";
        if (shown.isEmpty()) {
            return "You have " + messages;
        }
        if (shown.size() == 1 && totalSenders == 1) {
            return "You have " + messages + " from " + shown.get(0);
        }
        if (shown.size() == totalSenders) {
            return "You have " + messages + " from " + String.join(", ", shown.subList(0, shown.size() - 1))
                    + " and " + shown.get(shown.size() - 1);
        }
        int others = totalSenders - shown.size();
        return "You have " + messages + " from " + String.join(", ", shown) + " and " + others
                + (others == 1 ? " other" : " others");
    }
}

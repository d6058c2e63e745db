package villagecompute.courier.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.courier.data.models.ReminderCooldown;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Cooldown ledger for recurring reminders: "may I remind this recipient about this kind of thing now?"
 *
 * <p>
 * {@link #shouldRemind} and {@link #recordReminder} are separate calls and are not atomic together. Two overlapping
 * reminder runs can both see an expired cooldown and both remind; the cost is one duplicate reminder, so this path uses
 * a plain read and a plain upsert instead of the conditional updates the notification claim relies on.
 */
@ApplicationScoped
public class ReminderCooldownService {

    private static final Logger LOG = Logger.getLogger(ReminderCooldownService.class);

    @Transactional
    public boolean shouldRemind(String recipient, String reminderKind, Duration cooldownWindow) {
        return shouldRemind(recipient, reminderKind, cooldownWindow, Instant.now());
    }

    /**
     * Checks whether no reminder of this kind reached the recipient within the window ending at {@code now}.
     *
     * @return true when there is no record or the last reminder is at least {@code cooldownWindow} old
     */
    @Transactional
    public boolean shouldRemind(String recipient, String reminderKind, Duration cooldownWindow, Instant now) {
        ReminderCooldown record = ReminderCooldown.findByRecipientAndKind(recipient, reminderKind);
        if (record == null) {
            return true;
        }
        boolean elapsed = !now.isBefore(record.lastSentAt.plus(cooldownWindow));
        if (!elapsed) {
            LOG.debugf("Recipient %s is in %s cooldown until %s", recipient, reminderKind,
                    record.lastSentAt.plus(cooldownWindow));
        }
        return elapsed;
    }

    @Transactional
    public ReminderCooldown recordReminder(String recipient, String reminderKind, Map<String, Object> snapshot) {
        return recordReminder(recipient, reminderKind, snapshot, Instant.now());
    }

    /**
     * Upserts the cooldown record for (recipient, reminderKind).
     */
    @Transactional
    public ReminderCooldown recordReminder(String recipient, String reminderKind, Map<String, Object> snapshot,
            Instant sentAt) {
        ReminderCooldown record = ReminderCooldown.findByRecipientAndKind(recipient, reminderKind);
        if (record == null) {
            record = new ReminderCooldown();
            record.recipient = recipient;
            record.reminderKind = reminderKind;
        }
        record.lastSentAt = sentAt;
        record.snapshot = snapshot != null ? new HashMap<>(snapshot) : null;
        record.updatedAt = Instant.now();
        record.persist();
        LOG.debugf("Recorded %s reminder for %s at %s", reminderKind, recipient, sentAt);
        return record;
    }

    @Transactional
    public Optional<ReminderCooldown> lastReminder(String recipient, String reminderKind) {
        return Optional.ofNullable(ReminderCooldown.findByRecipientAndKind(recipient, reminderKind));
    }
}

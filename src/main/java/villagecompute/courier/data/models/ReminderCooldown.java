package villagecompute.courier.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

/**
 * Last time a reminder of a given kind went to a recipient. One row per (recipient, reminder_kind), overwritten in
 * place.
 *
 * @see villagecompute.courier.services.ReminderCooldownService
 */
@Entity
@Table(
        name = "reminder_cooldowns",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_reminder_cooldowns_recipient_kind",
                columnNames = {"recipient", "reminder_kind"}))
public class ReminderCooldown extends PanacheEntityBase {

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            name = "recipient",
            nullable = false)
    public String recipient;

    @Column(
            name = "reminder_kind",
            nullable = false)
    public String reminderKind;

    @Column(
            name = "last_sent_at",
            nullable = false)
    public Instant lastSentAt;

    /** Snapshot of the condition at send time, e.g. {@code {"unread_count": 3}}. */
    @Column(
            name = "snapshot")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> snapshot;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    public static ReminderCooldown findByRecipientAndKind(String recipient, String reminderKind) {
        return find("recipient = ?1 AND reminderKind = ?2", recipient, reminderKind).firstResult();
    }
}

package villagecompute.courier.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import villagecompute.courier.notifications.NotificationChannel;

import java.time.Instant;
import java.util.List;

/**
 * A concrete address a recipient can be reached at on one channel: a push device token, a verified email address or a
 * verified phone number.
 *
 * <p>
 * Only targets that are both {@code active} and {@code verified} are eligible for dispatch. Gateways reporting an
 * invalid target cause the row to be deactivated, never deleted, so the reason stays visible.
 */
@Entity
@Table(
        name = "delivery_targets",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_delivery_targets_recipient_channel_address",
                columnNames = {"recipient", "channel", "address"}))
public class DeliveryTarget extends PanacheEntityBase {

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
            name = "channel",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public NotificationChannel channel;

    @Column(
            name = "address",
            nullable = false)
    public String address;

    @Column(
            name = "active",
            nullable = false)
    public boolean active;

    @Column(
            name = "verified",
            nullable = false)
    public boolean verified;

    @Column(
            name = "deactivated_at")
    public Instant deactivatedAt;

    @Column(
            name = "deactivation_reason")
    public String deactivationReason;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Finds targets eligible for dispatch, oldest registration first.
     */
    public static List<DeliveryTarget> findEligible(String recipient, NotificationChannel channel) {
        if (recipient == null || channel == null) {
            return List.of();
        }
        return find("recipient = ?1 AND channel = ?2 AND active = true AND verified = true ORDER BY createdAt ASC",
                recipient, channel).list();
    }

    public static DeliveryTarget findByAddress(String recipient, NotificationChannel channel, String address) {
        return find("recipient = ?1 AND channel = ?2 AND address = ?3", recipient, channel, address).firstResult();
    }

    /**
     * Checks whether the recipient has any eligible target on one of the given channels.
     */
    public static boolean hasEligible(String recipient, List<NotificationChannel> channels) {
        if (recipient == null || channels == null || channels.isEmpty()) {
            return false;
        }
        return count("recipient = ?1 AND channel IN ?2 AND active = true AND verified = true", recipient,
                channels) > 0;
    }
}

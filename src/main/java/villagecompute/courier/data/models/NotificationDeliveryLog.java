package villagecompute.courier.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Parameters;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.NamedQuery;
import jakarta.persistence.Table;
import villagecompute.courier.notifications.NotificationChannel;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Append-only audit row written once per channel attempted for a notification.
 *
 * <p>
 * Rows are inserted by {@link villagecompute.courier.services.DeliveryLogService} and never updated. They feed
 * analytics and debugging only; dispatch decisions never read them.
 *
 * <h3>Schema Mapping:</h3>
 * <ul>
 * <li>id (UUID, PK)</li>
 * <li>notification_id (UUID, NOT NULL) - The request this attempt belongs to</li>
 * <li>recipient, trigger_name, channel - Copied from the request</li>
 * <li>status (VARCHAR) - SENT, PARTIAL or FAILED for this channel</li>
 * <li>success_count / failure_count (INT) - Targets reached / rejected on this channel</li>
 * <li>status_reason (TEXT) - Last gateway error on this channel</li>
 * <li>preview (VARCHAR(100)) - Truncated body text</li>
 * <li>created_at (TIMESTAMPTZ) - Attempt timestamp</li>
 * </ul>
 */
@Entity
@Table(
        name = "notification_delivery_logs",
        indexes = {@Index(
                name = "idx_delivery_logs_notification",
                columnList = "notification_id"),
                @Index(
                        name = "idx_delivery_logs_created_at",
                        columnList = "created_at")})
@NamedQuery(
        name = NotificationDeliveryLog.QUERY_FIND_BY_NOTIFICATION,
        query = "FROM NotificationDeliveryLog WHERE notificationId = :notificationId ORDER BY createdAt ASC")
public class NotificationDeliveryLog extends PanacheEntityBase {

    /**
     * Named query constant: all attempts for one request in insertion order.
     */
    public static final String QUERY_FIND_BY_NOTIFICATION = "NotificationDeliveryLog.findByNotification";

    @Id
    @GeneratedValue
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "notification_id",
            nullable = false)
    public UUID notificationId;

    @Column(
            name = "recipient",
            nullable = false)
    public String recipient;

    @Column(
            name = "trigger_name",
            nullable = false)
    public String trigger;

    @Column(
            name = "channel",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public NotificationChannel channel;

    @Column(
            name = "status",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public AttemptStatus status;

    @Column(
            name = "success_count",
            nullable = false)
    public int successCount;

    @Column(
            name = "failure_count",
            nullable = false)
    public int failureCount;

    @Column(
            name = "status_reason")
    public String statusReason;

    @Column(
            name = "preview",
            length = 100)
    public String preview;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    /**
     * Outcome of one channel attempt.
     */
    public enum AttemptStatus {
        /**
         * Every target on the channel accepted the message.
         */
        SENT,

        /**
         * Some targets accepted, some rejected.
         */
        PARTIAL,

        /**
         * No target accepted the message.
         */
        FAILED
    }

    public static List<NotificationDeliveryLog> findByNotification(UUID notificationId) {
        if (notificationId == null) {
            return List.of();
        }
        return find("#" + QUERY_FIND_BY_NOTIFICATION, Parameters.with("notificationId", notificationId)).list();
    }

    /**
     * Deletes attempts recorded before the cutoff.
     *
     * @return number of rows removed
     */
    public static long deleteOlderThan(Instant cutoff) {
        return delete("createdAt < ?1", cutoff);
    }
}

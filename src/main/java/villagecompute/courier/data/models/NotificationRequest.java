package villagecompute.courier.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Parameters;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.NamedQuery;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import villagecompute.courier.notifications.DeliveryMode;
import villagecompute.courier.notifications.NotificationChannel;
import villagecompute.courier.notifications.NotificationPriority;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Panache entity for one queued "tell this recipient" unit.
 *
 * <p>
 * A request is channel-independent: {@link #channels} lists the delivery preference (e.g. push then SMS) and
 * {@link #deliveryMode} decides whether the list is a fallback chain or a broadcast. Dispatchers never read-then-write
 * the status column; every transition out of {@code PENDING} or {@code PROCESSING} is a conditional bulk update issued
 * by {@link villagecompute.courier.services.NotificationQueueService}.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (UUID, PK)</li>
 * <li>{@code recipient} (TEXT) - Recipient identifier owned by the producing domain</li>
 * <li>{@code trigger_name} (TEXT) - Semantic event name (e.g. {@code unread_messages})</li>
 * <li>{@code notification_request_channels} (child table) - Ordered channel preference</li>
 * <li>{@code delivery_mode} (TEXT) - FALLBACK or ALL</li>
 * <li>{@code priority} / {@code priority_rank} - Priority and its sortable rank</li>
 * <li>{@code template_data} (JSONB) - Opaque payload used to render channel content</li>
 * <li>{@code status} (TEXT) - See {@link Status}</li>
 * <li>{@code attempts} (INT) - Dispatch attempts so far</li>
 * <li>{@code processing_started_at} (TIMESTAMPTZ) - Set while PROCESSING, null otherwise</li>
 * <li>{@code claim_token} (TEXT) - Token of the claim that moved the row to PROCESSING</li>
 * <li>{@code scheduled_for} (TIMESTAMPTZ) - Not claimable before this instant (retry backoff)</li>
 * <li>{@code status_reason} (TEXT) - Why the request ended up in its current status</li>
 * </ul>
 */
@Entity
@Table(
        name = "notification_requests",
        indexes = {@Index(
                name = "idx_notification_requests_status_priority",
                columnList = "status, priority_rank, created_at"),
                @Index(
                        name = "idx_notification_requests_claim_token",
                        columnList = "claim_token")})
@NamedQuery(
        name = NotificationRequest.QUERY_FIND_CLAIM_CANDIDATES,
        query = "SELECT n.id FROM NotificationRequest n WHERE n.status = :status AND :channel MEMBER OF n.channels "
                + "AND (n.scheduledFor IS NULL OR n.scheduledFor <= :now) "
                + "ORDER BY n.priorityRank DESC, n.createdAt ASC")
@NamedQuery(
        name = NotificationRequest.QUERY_FIND_BY_CLAIM_TOKEN,
        query = "FROM NotificationRequest WHERE claimToken = :claimToken ORDER BY priorityRank DESC, createdAt ASC")
@NamedQuery(
        name = NotificationRequest.QUERY_COUNT_BY_STATUS,
        query = "SELECT n.status, COUNT(n) FROM NotificationRequest n GROUP BY n.status")
public class NotificationRequest extends PanacheEntityBase {

    public static final String QUERY_FIND_CLAIM_CANDIDATES = "NotificationRequest.findClaimCandidates";
    public static final String QUERY_FIND_BY_CLAIM_TOKEN = "NotificationRequest.findByClaimToken";
    public static final String QUERY_COUNT_BY_STATUS = "NotificationRequest.countByStatus";

    @Id
    @GeneratedValue
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "recipient",
            nullable = false)
    public String recipient;

    @Column(
            name = "trigger_name",
            nullable = false)
    public String trigger;

    @ElementCollection(
            fetch = FetchType.EAGER)
    @CollectionTable(
            name = "notification_request_channels",
            joinColumns = @JoinColumn(
                    name = "request_id"))
    @OrderColumn(
            name = "position")
    @Enumerated(EnumType.STRING)
    @Column(
            name = "channel",
            nullable = false)
    public List<NotificationChannel> channels = new ArrayList<>();

    @Column(
            name = "delivery_mode",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public DeliveryMode deliveryMode;

    @Column(
            name = "priority",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public NotificationPriority priority;

    @Column(
            name = "priority_rank",
            nullable = false)
    public int priorityRank;

    @Column(
            name = "template_data")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> templateData;

    @Column(
            name = "status",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public Status status;

    @Column(
            name = "attempts",
            nullable = false)
    public int attempts;

    @Column(
            name = "processing_started_at")
    public Instant processingStartedAt;

    @Column(
            name = "claim_token")
    public String claimToken;

    @Column(
            name = "scheduled_for")
    public Instant scheduledFor;

    @Column(
            name = "status_reason")
    public String statusReason;

    @Column(
            name = "completed_at")
    public Instant completedAt;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Request lifecycle. {@code PENDING -> PROCESSING -> terminal}; {@code PROCESSING -> PENDING} only through the
     * stuck-processing sweep or a transient-failure release.
     */
    public enum Status {
        PENDING, PROCESSING, SENT, DELIVERED, FAILED, SKIPPED, CANCELLED;

        private static final Set<Status> TERMINAL = EnumSet.of(SENT, DELIVERED, FAILED, SKIPPED, CANCELLED);

        public boolean isTerminal() {
            return TERMINAL.contains(this);
        }

        public static Set<Status> terminalStatuses() {
            return EnumSet.copyOf(TERMINAL);
        }
    }

    /**
     * Selects ids of claimable requests for a channel: pending, listing the channel, and not deferred past {@code now}.
     *
     * @param channel
     *            channel being drained
     * @param now
     *            reference time for {@code scheduled_for}
     * @param limit
     *            max ids to return
     * @return candidate ids, highest priority first then oldest first
     */
    public static List<UUID> findClaimCandidateIds(NotificationChannel channel, Instant now, int limit) {
        return getEntityManager().createNamedQuery(QUERY_FIND_CLAIM_CANDIDATES, UUID.class)
                .setParameter("status", Status.PENDING).setParameter("channel", channel).setParameter("now", now)
                .setMaxResults(limit).getResultList();
    }

    /**
     * Loads the rows a claim stamped with the given token.
     */
    public static List<NotificationRequest> findByClaimToken(String claimToken) {
        if (claimToken == null) {
            return List.of();
        }
        return find("#" + QUERY_FIND_BY_CLAIM_TOKEN, Parameters.with("claimToken", claimToken)).list();
    }

    /**
     * Counts requests per status. Statuses with no rows are reported as zero.
     */
    public static Map<Status, Long> countByStatus() {
        Map<Status, Long> counts = new EnumMap<>(Status.class);
        for (Status status : Status.values()) {
            counts.put(status, 0L);
        }
        List<Object[]> rows = getEntityManager().createNamedQuery(QUERY_COUNT_BY_STATUS, Object[].class)
                .getResultList();
        for (Object[] row : rows) {
            counts.put((Status) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }

    /**
     * Counts requests that have been PROCESSING since before the cutoff.
     */
    public static long countProcessingSince(Instant cutoff) {
        return count("status = ?1 AND processingStartedAt < ?2", Status.PROCESSING, cutoff);
    }

    /**
     * Returns the creation time of the oldest PENDING request, or null when none is pending.
     */
    public static Instant findOldestPendingCreatedAt() {
        return getEntityManager()
                .createQuery("SELECT MIN(n.createdAt) FROM NotificationRequest n WHERE n.status = :status",
                        Instant.class)
                .setParameter("status", Status.PENDING).getSingleResult();
    }

    /**
     * Finds terminal requests last updated before the cutoff, oldest first.
     */
    public static List<NotificationRequest> findCompletedBefore(Instant cutoff, int limit) {
        return find("status IN ?1 AND updatedAt < ?2 ORDER BY updatedAt ASC", Status.terminalStatuses(), cutoff)
                .page(0, limit).list();
    }
}

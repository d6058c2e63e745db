package villagecompute.courier.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Direct message delivered to a recipient's inbox. Read by the pending-messages reminder job; written by the messaging
 * domain.
 */
@Entity
@Table(
        name = "inbox_messages",
        indexes = @Index(
                name = "idx_inbox_messages_unread",
                columnList = "recipient, is_read, created_at"))
public class InboxMessage extends PanacheEntityBase {

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
            name = "sender",
            nullable = false)
    public String sender;

    @Column(
            name = "body")
    public String body;

    @Column(
            name = "is_read",
            nullable = false)
    public boolean read;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    /**
     * Unread messages for one recipient, grouped.
     *
     * @param recipient
     *            inbox owner
     * @param unreadCount
     *            unread messages older than the cutoff
     * @param senders
     *            distinct senders, most recent first
     */
    public record UnreadSummary(String recipient, long unreadCount, List<String> senders) {
    }

    /**
     * Groups unread messages created before the cutoff by recipient.
     *
     * @param cutoff
     *            only messages older than this count as pending
     * @param maxRecipients
     *            max recipients to return
     * @return one summary per recipient, ordered by recipient
     */
    public static List<UnreadSummary> summarizeUnreadBefore(Instant cutoff, int maxRecipients) {
        List<String> recipients = getEntityManager()
                .createQuery("SELECT DISTINCT m.recipient FROM InboxMessage m WHERE m.read = false "
                        + "AND m.createdAt < :cutoff ORDER BY m.recipient", String.class)
                .setParameter("cutoff", cutoff).setMaxResults(maxRecipients).getResultList();

        List<UnreadSummary> summaries = new ArrayList<>();
        for (String recipient : recipients) {
            List<InboxMessage> unread = list(
                    "recipient = ?1 AND read = false AND createdAt < ?2 ORDER BY createdAt DESC",
                    recipient, cutoff);
            Map<String, Boolean> senders = new LinkedHashMap<>();
            for (InboxMessage message : unread) {
                senders.putIfAbsent(message.sender, Boolean.TRUE);
            }
            summaries.add(new UnreadSummary(recipient, unread.size(), new ArrayList<>(senders.keySet())));
        }
        return summaries;
    }
}

package villagecompute.courier.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.courier.data.models.NotificationDeliveryLog;
import villagecompute.courier.data.models.NotificationRequest;
import villagecompute.courier.notifications.NotificationChannel;

import java.time.Instant;

/**
 * Writes and prunes the append-only delivery log.
 */
@ApplicationScoped
public class DeliveryLogService {

    private static final Logger LOG = Logger.getLogger(DeliveryLogService.class);

    /**
     * Appends one row for a channel attempt. Committed on its own so the audit trail survives a later failure of the
     * same dispatch.
     */
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public NotificationDeliveryLog append(NotificationRequest request, NotificationChannel channel,
            NotificationDeliveryLog.AttemptStatus status, int successCount, int failureCount, String statusReason,
            String preview) {
        NotificationDeliveryLog entry = new NotificationDeliveryLog();
        entry.notificationId = request.id;
        entry.recipient = request.recipient;
        entry.trigger = request.trigger;
        entry.channel = channel;
        entry.status = status;
        entry.successCount = successCount;
        entry.failureCount = failureCount;
        entry.statusReason = statusReason;
        entry.preview = preview;
        entry.createdAt = Instant.now();
        entry.persist();

        LOG.debugf("Logged %s attempt for notification %s: %s (%d ok, %d failed)", channel, request.id, status,
                successCount, failureCount);
        return entry;
    }

    @Transactional
    public long purgeOlderThan(Instant cutoff) {
        long deleted = NotificationDeliveryLog.deleteOlderThan(cutoff);
        if (deleted > 0) {
            LOG.infof("Purged %d delivery log entries older than %s", deleted, cutoff);
        }
        return deleted;
    }
}

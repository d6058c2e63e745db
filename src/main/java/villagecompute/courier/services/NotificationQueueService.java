package villagecompute.courier.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.courier.api.types.QueueHealthType;
import villagecompute.courier.config.NotificationConfig;
import villagecompute.courier.data.models.NotificationRequest;
import villagecompute.courier.exceptions.ResourceNotFoundException;
import villagecompute.courier.exceptions.ValidationException;
import villagecompute.courier.notifications.DeliveryMode;
import villagecompute.courier.notifications.NotificationChannel;
import villagecompute.courier.notifications.NotificationPriority;
import villagecompute.courier.observability.CourierMetrics;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Durable notification queue: enqueue, atomic claim, status transitions and the stuck-processing sweep.
 *
 * <p>
 * <b>Claim protocol:</b> {@link #claimPending(NotificationChannel, int)} selects candidate ids, then moves them to
 * {@code PROCESSING} with a single bulk {@code UPDATE ... WHERE id IN (:ids) AND status = 'PENDING'} that stamps a
 * fresh claim token. The database re-checks {@code status} per row under its row lock, so a row another dispatcher
 * claimed first is skipped rather than claimed twice. The caller then loads exactly the rows carrying its token. No
 * in-process lock is involved; the guarantee holds across processes.
 *
 * <p>
 * <b>Transitions out of PROCESSING</b> are conditional on the row still being {@code PROCESSING}. A request the sweep
 * already returned to {@code PENDING} is therefore never overwritten by a late dispatcher.
 *
 * <p>
 * <b>Attempts:</b> incremented once per dispatch attempt by {@link #markTerminal} or {@link #releaseForRetry}. The
 * sweep does not count as an attempt.
 */
@ApplicationScoped
public class NotificationQueueService {

    private static final Logger LOG = Logger.getLogger(NotificationQueueService.class);

    /**
     * Base delay in seconds for transient-failure backoff. Actual delay = (2^attempts) * BASE_DELAY_SECONDS with ±25%
     * jitter.
     */
    private static final int BASE_DELAY_SECONDS = 30;

    @Inject
    NotificationConfig config;

    @Inject
    CourierMetrics metrics;

    /**
     * Enqueues a notification with the trigger's configured delivery mode, dispatchable immediately.
     *
     * @return id of the created request
     * @throws ValidationException
     *             if recipient or trigger is blank or channels is empty
     */
    @Transactional
    public UUID enqueue(String recipient, String trigger, List<NotificationChannel> channels,
            NotificationPriority priority, Map<String, Object> templateData) {
        return enqueue(recipient, trigger, channels, priority, templateData, null, null);
    }

    /**
     * Enqueues a notification.
     *
     * @param deliveryMode
     *            explicit mode, or null to use the trigger-level configuration
     * @param scheduledFor
     *            earliest dispatch time, or null for immediately
     * @return id of the created request
     * @throws ValidationException
     *             if recipient or trigger is blank or channels is empty
     */
    @Transactional
    public UUID enqueue(String recipient, String trigger, List<NotificationChannel> channels,
            NotificationPriority priority, Map<String, Object> templateData, DeliveryMode deliveryMode,
            Instant scheduledFor) {
        if (recipient == null || recipient.isBlank()) {
            throw new ValidationException("Notification recipient is required");
        }
        if (trigger == null || trigger.isBlank()) {
            throw new ValidationException("Notification trigger is required");
        }
        if (channels == null || channels.isEmpty()) {
            throw new ValidationException("Notification for trigger " + trigger + " has no channels");
        }
        if (channels.contains(null)) {
            throw new ValidationException("Notification channels must not contain null");
        }

        Instant now = Instant.now();
        NotificationPriority effectivePriority = priority != null ? priority : NotificationPriority.MEDIUM;

        NotificationRequest request = new NotificationRequest();
        request.recipient = recipient.trim();
        request.trigger = trigger.trim();
        request.channels = new ArrayList<>(new LinkedHashSet<>(channels));
        request.deliveryMode = deliveryMode != null ? deliveryMode : config.deliveryModeFor(request.trigger);
        request.priority = effectivePriority;
        request.priorityRank = effectivePriority.getRank();
        request.templateData = templateData != null ? new HashMap<>(templateData) : new HashMap<>();
        request.status = NotificationRequest.Status.PENDING;
        request.attempts = 0;
        request.scheduledFor = scheduledFor;
        request.createdAt = now;
        request.updatedAt = now;
        request.persist();

        LOG.infof("Enqueued notification %s (trigger: %s, recipient: %s, channels: %s, mode: %s, priority: %s)",
                request.id, request.trigger, request.recipient, request.channels, request.deliveryMode,
                effectivePriority);
        return request.id;
    }

    /**
     * Atomically claims up to {@code limit} pending requests that list {@code channel}.
     *
     * <p>
     * Runs in its own transaction so the claim is committed, and visible to competing dispatchers, before any gateway
     * is called.
     *
     * @param channel
     *            channel being drained
     * @param limit
     *            max requests to claim; 0 or less claims nothing
     * @return claimed requests, now PROCESSING with {@code processingStartedAt} set; empty when nothing was claimable
     */
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public List<NotificationRequest> claimPending(NotificationChannel channel, int limit) {
        if (channel == null || limit <= 0) {
            return List.of();
        }
        Instant now = Instant.now();
        List<UUID> candidates = NotificationRequest.findClaimCandidateIds(channel, now, limit);
        if (candidates.isEmpty()) {
            return List.of();
        }

        String claimToken = UUID.randomUUID().toString();
        int claimed = NotificationRequest.getEntityManager()
                .createQuery("UPDATE NotificationRequest n SET n.status = :processing, n.processingStartedAt = :now, "
                        + "n.claimToken = :claimToken, n.updatedAt = :now "
                        + "WHERE n.id IN :ids AND n.status = :pending")
                .setParameter("processing", NotificationRequest.Status.PROCESSING).setParameter("now", now)
                .setParameter("claimToken", claimToken).setParameter("ids", candidates)
                .setParameter("pending", NotificationRequest.Status.PENDING).executeUpdate();

        if (claimed == 0) {
            LOG.debugf("Lost all %d %s candidates to concurrent claims", candidates.size(), channel);
            return List.of();
        }
        List<NotificationRequest> requests = NotificationRequest.findByClaimToken(claimToken);
        LOG.debugf("Claimed %d of %d %s candidates (token %s)", claimed, candidates.size(), channel, claimToken);
        return requests;
    }

    /**
     * Moves a PROCESSING request to a terminal status and counts the attempt.
     *
     * @param id
     *            request id
     * @param status
     *            terminal status
     * @param reason
     *            status reason, may be null
     * @return true if the request was PROCESSING and has been updated
     * @throws IllegalArgumentException
     *             if {@code status} is not terminal
     */
    @Transactional
    public boolean markTerminal(UUID id, NotificationRequest.Status status, String reason) {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal notification status: " + status);
        }
        Instant now = Instant.now();
        int updated = NotificationRequest.update(
                "status = ?1, statusReason = ?2, attempts = attempts + 1, processingStartedAt = null, "
                        + "completedAt = ?3, updatedAt = ?3 WHERE id = ?4 AND status = ?5",
                status, reason, now, id, NotificationRequest.Status.PROCESSING);
        if (updated == 0) {
            LOG.warnf("Notification %s was not PROCESSING, %s transition ignored", id, status);
            return false;
        }
        LOG.infof("Notification %s marked %s%s", id, status, reason != null ? " (" + reason + ")" : "");
        return true;
    }

    /**
     * Records a transient dispatch failure. The attempt is counted; the request goes back to PENDING behind an
     * exponential backoff, or to FAILED with reason {@code max_attempts_exceeded} once the attempt budget is spent.
     *
     * @return the status the request ended up in, or null if it was no longer PROCESSING
     */
    @Transactional
    public NotificationRequest.Status releaseForRetry(UUID id, String reason) {
        NotificationRequest request = NotificationRequest.findById(id);
        if (request == null || request.status != NotificationRequest.Status.PROCESSING) {
            LOG.warnf("Notification %s was not PROCESSING, retry release ignored", id);
            return null;
        }
        Instant now = Instant.now();
        int attemptsAfter = request.attempts + 1;

        if (attemptsAfter >= config.getMaxAttempts()) {
            String finalReason = "max_attempts_exceeded: " + reason;
            int updated = NotificationRequest.update(
                    "status = ?1, statusReason = ?2, attempts = attempts + 1, processingStartedAt = null, "
                            + "completedAt = ?3, updatedAt = ?3 WHERE id = ?4 AND status = ?5",
                    NotificationRequest.Status.FAILED, finalReason, now, id, NotificationRequest.Status.PROCESSING);
            if (updated == 0) {
                LOG.warnf("Notification %s left PROCESSING before its final failure was recorded", id);
                return null;
            }
            LOG.warnf("Notification %s failed after %d attempts: %s", id, attemptsAfter, reason);
            return NotificationRequest.Status.FAILED;
        }

        long backoffSeconds = calculateBackoffDelay(attemptsAfter);
        int updated = NotificationRequest.update(
                "status = ?1, statusReason = ?2, attempts = attempts + 1, processingStartedAt = null, "
                        + "claimToken = null, scheduledFor = ?3, updatedAt = ?4 WHERE id = ?5 AND status = ?6",
                NotificationRequest.Status.PENDING, reason, now.plusSeconds(backoffSeconds), now, id,
                NotificationRequest.Status.PROCESSING);
        if (updated == 0) {
            LOG.warnf("Notification %s left PROCESSING before its retry release was recorded", id);
            return null;
        }
        LOG.infof("Notification %s released for retry in %d seconds (attempt %d/%d): %s", id, backoffSeconds,
                attemptsAfter, config.getMaxAttempts(), reason);
        return NotificationRequest.Status.PENDING;
    }

    /**
     * Returns every request PROCESSING since before {@code now - timeoutMinutes} to PENDING.
     *
     * @param timeoutMinutes
     *            age after which a claim counts as abandoned
     * @return number of requests recovered
     */
    @Transactional
    public int resetStuckProcessing(int timeoutMinutes) {
        Instant now = Instant.now();
        Instant cutoff = now.minus(Duration.ofMinutes(timeoutMinutes));
        int recovered = NotificationRequest.update(
                "status = ?1, processingStartedAt = null, claimToken = null, updatedAt = ?2 "
                        + "WHERE status = ?3 AND processingStartedAt < ?4",
                NotificationRequest.Status.PENDING, now, NotificationRequest.Status.PROCESSING, cutoff);
        if (recovered > 0) {
            LOG.warnf("Recovered %d notifications stuck in PROCESSING for more than %d minutes", recovered,
                    timeoutMinutes);
        } else {
            LOG.debugf("No notifications stuck in PROCESSING for more than %d minutes", timeoutMinutes);
        }
        metrics.recordRecovered(recovered);
        return recovered;
    }

    /**
     * Cancels a request that has not been claimed yet.
     *
     * @return true if the request was PENDING and is now CANCELLED
     * @throws ResourceNotFoundException
     *             if no request has this id
     */
    @Transactional
    public boolean cancel(UUID id) {
        if (NotificationRequest.findById(id) == null) {
            throw new ResourceNotFoundException("Notification not found: " + id);
        }
        Instant now = Instant.now();
        int updated = NotificationRequest.update(
                "status = ?1, statusReason = ?2, completedAt = ?3, updatedAt = ?3 WHERE id = ?4 AND status = ?5",
                NotificationRequest.Status.CANCELLED, "cancelled", now, id, NotificationRequest.Status.PENDING);
        if (updated == 1) {
            LOG.infof("Notification %s cancelled", id);
            return true;
        }
        LOG.debugf("Notification %s not cancelled, it is no longer PENDING", id);
        return false;
    }

    /**
     * @throws ResourceNotFoundException
     *             if no request has this id
     */
    @Transactional
    public NotificationRequest get(UUID id) {
        NotificationRequest request = NotificationRequest.findById(id);
        if (request == null) {
            throw new ResourceNotFoundException("Notification not found: " + id);
        }
        return request;
    }

    /**
     * Aggregates queue health: counts by status, success rate, stuck count and backlog age.
     */
    @Transactional
    public QueueHealthType getQueueHealth() {
        Instant now = Instant.now();
        Map<NotificationRequest.Status, Long> counts = NotificationRequest.countByStatus();

        Map<String, Long> byStatus = new LinkedHashMap<>();
        long total = 0;
        for (Map.Entry<NotificationRequest.Status, Long> entry : counts.entrySet()) {
            byStatus.put(entry.getKey().name().toLowerCase(Locale.ROOT), entry.getValue());
            total += entry.getValue();
        }

        long delivered = counts.get(NotificationRequest.Status.SENT)
                + counts.get(NotificationRequest.Status.DELIVERED);
        long failed = counts.get(NotificationRequest.Status.FAILED);
        double successRate = delivered + failed == 0 ? 100.0 : delivered * 100.0 / (delivered + failed);
        successRate = Math.round(successRate * 100.0) / 100.0;

        long stuck = NotificationRequest
                .countProcessingSince(now.minus(Duration.ofMinutes(config.getRecoveryTimeoutMinutes())));
        Instant oldestPending = NotificationRequest.findOldestPendingCreatedAt();
        long oldestPendingAge = oldestPending == null ? 0
                : Math.max(0, Duration.between(oldestPending, now).toSeconds());

        return new QueueHealthType(byStatus, total, successRate, stuck, oldestPendingAge);
    }

    /**
     * Deletes terminal requests last updated before the cutoff.
     *
     * @return number of requests deleted
     */
    @Transactional
    public int purgeCompletedBefore(Instant cutoff, int limit) {
        List<NotificationRequest> expired = NotificationRequest.findCompletedBefore(cutoff, limit);
        for (NotificationRequest request : expired) {
            request.delete();
        }
        if (!expired.isEmpty()) {
            LOG.infof("Purged %d completed notifications older than %s", expired.size(), cutoff);
        }
        return expired.size();
    }

    /**
     * Calculates the retry delay using exponential backoff with jitter.
     *
     * <p>
     * <b>Formula:</b> {@code delay = (2^attempts) * BASE_DELAY_SECONDS * (1.0 ± 0.25)}
     *
     * @param attempts
     *            attempts made so far (1-indexed)
     * @return delay in seconds before the request becomes claimable again
     */
    public long calculateBackoffDelay(int attempts) {
        double baseDelay = Math.pow(2, attempts) * BASE_DELAY_SECONDS;
        double jitter = 0.75 + (Math.random() * 0.5);
        return (long) (baseDelay * jitter);
    }
}

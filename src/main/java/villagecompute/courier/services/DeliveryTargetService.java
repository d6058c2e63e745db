package villagecompute.courier.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.courier.config.NotificationConfig;
import villagecompute.courier.data.models.DeliveryTarget;
import villagecompute.courier.exceptions.ValidationException;
import villagecompute.courier.notifications.NotificationChannel;

import java.time.Instant;
import java.util.List;

/**
 * Resolves and maintains the addresses recipients can be reached at.
 *
 * <p>
 * The dispatcher asks this service for eligible targets per channel and tells it to deactivate targets a gateway
 * reported as invalid, so later claims do not repeat the same failure.
 */
@ApplicationScoped
public class DeliveryTargetService {

    private static final Logger LOG = Logger.getLogger(DeliveryTargetService.class);

    @Transactional
    public List<DeliveryTarget> activeTargets(String recipient, NotificationChannel channel) {
        return DeliveryTarget.findEligible(recipient, channel);
    }

    @Transactional
    public boolean hasActiveTarget(String recipient, List<NotificationChannel> channels) {
        return DeliveryTarget.hasEligible(recipient, channels);
    }

    /**
     * Registers a target or reactivates a previously deactivated one with the same address.
     *
     * @throws ValidationException
     *             for a malformed email address or phone number
     */
    @Transactional
    public DeliveryTarget register(String recipient, NotificationChannel channel, String address,
            boolean verified) {
        if (recipient == null || recipient.isBlank() || address == null || address.isBlank()) {
            throw new ValidationException("Recipient and address are required");
        }
        if (channel == NotificationChannel.EMAIL && !NotificationConfig.isValidEmail(address)) {
            throw new ValidationException("Invalid email address: " + address);
        }
        if (channel == NotificationChannel.SMS && !NotificationConfig.isValidPhoneNumber(address)) {
            throw new ValidationException("Phone number must be in E.164 format: " + address);
        }

        Instant now = Instant.now();
        DeliveryTarget target = DeliveryTarget.findByAddress(recipient, channel, address);
        if (target == null) {
            target = new DeliveryTarget();
            target.recipient = recipient;
            target.channel = channel;
            target.address = address;
            target.createdAt = now;
        }
        target.active = true;
        target.verified = verified;
        target.deactivatedAt = null;
        target.deactivationReason = null;
        target.updatedAt = now;
        target.persist();

        LOG.infof("Registered %s target %d for recipient %s (verified: %b)", channel, target.id, recipient, verified);
        return target;
    }

    /**
     * Deactivates a target after a gateway reported it invalid.
     *
     * @return true if the target was active
     */
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public boolean deactivate(Long targetId, String reason) {
        DeliveryTarget target = DeliveryTarget.findById(targetId);
        if (target == null || !target.active) {
            return false;
        }
        Instant now = Instant.now();
        target.active = false;
        target.deactivatedAt = now;
        target.deactivationReason = reason;
        target.updatedAt = now;
        LOG.infof("Deactivated %s target %d of recipient %s: %s", target.channel, targetId, target.recipient, reason);
        return true;
    }
}

package villagecompute.courier.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import villagecompute.courier.notifications.DeliveryMode;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Notification queue and dispatch settings.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code courier.notifications.product-prefix} - Prefix applied once to every dispatched text</li>
 * <li>{@code courier.notifications.sms-max-length} - SMS body limit, longer bodies are truncated with "..."</li>
 * <li>{@code courier.notifications.preview-length} - Length of delivery log previews</li>
 * <li>{@code courier.notifications.max-attempts} - Attempts before a request fails for good</li>
 * <li>{@code courier.notifications.recovery-timeout-minutes} - Age after which PROCESSING counts as abandoned</li>
 * <li>{@code courier.notifications.broadcast-triggers} - Triggers sent on all channels instead of as a fallback
 * chain</li>
 * </ul>
 */
@ApplicationScoped
public class NotificationConfig {

    private static final Pattern EMAIL_PATTERN = Pattern
            .compile("^[A-Za-z0-9+_.-]{1,64}@[A-Za-z0-9.-]{1,253}\\.[A-Za-z]{2,24}$");

    private static final Pattern E164_PATTERN = Pattern.compile("^\\+[1-9]\\d{6,14}$");

    @ConfigProperty(
            name = "courier.notifications.product-prefix",
            defaultValue = "[VillageCourier]")
    String productPrefix;

    @ConfigProperty(
            name = "courier.notifications.sms-max-length",
            defaultValue = "160")
    int smsMaxLength;

    @ConfigProperty(
            name = "courier.notifications.preview-length",
            defaultValue = "100")
    int previewLength;

    @ConfigProperty(
            name = "courier.notifications.max-attempts",
            defaultValue = "5")
    int maxAttempts;

    @ConfigProperty(
            name = "courier.notifications.recovery-timeout-minutes",
            defaultValue = "10")
    int recoveryTimeoutMinutes;

    @ConfigProperty(
            name = "courier.notifications.broadcast-triggers")
    Optional<List<String>> broadcastTriggers;

    public String getProductPrefix() {
        return productPrefix;
    }

    public int getSmsMaxLength() {
        return smsMaxLength;
    }

    public int getPreviewLength() {
        return previewLength;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public int getRecoveryTimeoutMinutes() {
        return recoveryTimeoutMinutes;
    }

    /**
     * Trigger-level delivery mode: {@link DeliveryMode#ALL} for configured broadcast triggers, otherwise
     * {@link DeliveryMode#FALLBACK}.
     *
     * @param trigger
     *            semantic event name
     */
    public DeliveryMode deliveryModeFor(String trigger) {
        if (trigger == null) {
            return DeliveryMode.FALLBACK;
        }
        String normalized = trigger.trim().toLowerCase(Locale.ROOT);
        boolean broadcast = broadcastTriggers.orElse(List.of()).stream()
                .anyMatch(t -> t.trim().toLowerCase(Locale.ROOT).equals(normalized));
        return broadcast ? DeliveryMode.ALL : DeliveryMode.FALLBACK;
    }

    public static boolean isValidEmail(String address) {
        return address != null && EMAIL_PATTERN.matcher(address).matches();
    }

    public static boolean isValidPhoneNumber(String phoneNumber) {
        return phoneNumber != null && E164_PATTERN.matcher(phoneNumber).matches();
    }
}

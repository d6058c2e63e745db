package villagecompute.courier.notifications;

import java.util.Locale;

/**
 * Delivery channels a {@link villagecompute.courier.data.models.NotificationRequest} can be routed through.
 *
 * <p>
 * Each channel has exactly one gateway adapter ({@code PushGateway}, {@code EmailGateway}, {@code SmsGateway}) and one
 * kind of {@link villagecompute.courier.data.models.DeliveryTarget} address (device token, email address, E.164 phone
 * number).
 */
public enum NotificationChannel {
    PUSH, EMAIL, SMS;

    /**
     * Parses a channel name case-insensitively.
     *
     * @param value
     *            channel name such as {@code "push"} or {@code "EMAIL"}
     * @return the matching channel
     * @throws IllegalArgumentException
     *             if the value is null or not a known channel
     */
    public static NotificationChannel fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Channel must not be null");
        }
        return NotificationChannel.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

package villagecompute.courier.notifications;

import java.util.Map;

/**
 * Rendered content of one notification, ready for any channel.
 *
 * @param title
 *            prefixed push title
 * @param body
 *            prefixed plain text used for push bodies
 * @param subject
 *            prefixed email subject
 * @param html
 *            email HTML body
 * @param text
 *            email plain text body
 * @param smsBody
 *            prefixed and truncated SMS text
 * @param data
 *            string key/values attached to push messages
 */
public record ChannelPayload(String title, String body, String subject, String html, String text, String smsBody,
        Map<String, String> data) {
}

package villagecompute.courier.notifications;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.courier.config.NotificationConfig;
import villagecompute.courier.data.models.NotificationRequest;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a request's {@code templateData} into channel content.
 *
 * <p>
 * Recognised keys: {@code title}, {@code message} (or {@code body}), {@code subject}, {@code html}. Missing keys fall
 * back to text derived from the trigger name. Every other scalar key is forwarded as push data.
 */
@ApplicationScoped
public class ChannelPayloadRenderer {

    @Inject
    NotificationConfig config;

    public ChannelPayload render(NotificationRequest request) {
        Map<String, Object> data = request.templateData != null ? request.templateData : Map.of();
        String prefix = config.getProductPrefix();

        String title = stringValue(data, "title");
        if (title == null) {
            title = humanize(request.trigger);
        }
        String message = stringValue(data, "message");
        if (message == null) {
            message = stringValue(data, "body");
        }
        if (message == null) {
            message = "You have a new " + humanize(request.trigger).toLowerCase(Locale.ROOT) + " notification.";
        }
        String subject = stringValue(data, "subject");
        if (subject == null) {
            subject = title;
        }

        String body = NotificationTextFormatter.withPrefix(message, prefix);
        String html = stringValue(data, "html");
        if (html == null) {
            html = "<p>" + escapeHtml(body) + "</p>";
        }

        Map<String, String> pushData = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof String || value instanceof Number || value instanceof Boolean) {
                pushData.put(entry.getKey(), value.toString());
            }
        }
        pushData.put("notification_id", String.valueOf(request.id));
        pushData.put("trigger", request.trigger);

        return new ChannelPayload(NotificationTextFormatter.withPrefix(title, prefix), body,
                NotificationTextFormatter.withPrefix(subject, prefix), html, body,
                NotificationTextFormatter.smsBody(message, prefix, config.getSmsMaxLength()), pushData);
    }

    private static String stringValue(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString();
        return text.isBlank() ? null : text;
    }

    static String humanize(String trigger) {
        if (trigger == null || trigger.isBlank()) {
            return "Notification";
        }
        String spaced = trigger.replace('_', ' ').replace('-', ' ').strip();
        return Character.toUpperCase(spaced.charAt(0)) + spaced.substring(1);
    }

    private static String escapeHtml(String text) {
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("\"", "&quot;");
    }
}

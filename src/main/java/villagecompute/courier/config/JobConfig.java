package villagecompute.courier.config;

import com.cronutils.model.CronType;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import villagecompute.courier.notifications.NotificationChannel;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Job defaults and the cron dialect used to parse job schedules.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code courier.jobs.default-timeout-seconds}, {@code courier.jobs.default-max-retries},
 * {@code courier.jobs.default-retry-delay-seconds} - Applied when a definition omits them</li>
 * <li>{@code courier.jobs.cron-type} - cron-utils {@link CronType} ({@code UNIX} = 5 fields)</li>
 * <li>{@code courier.jobs.notify-recipient} / {@code courier.jobs.notify-channels} - Where notifyOn triggers go</li>
 * </ul>
 */
@ApplicationScoped
public class JobConfig {

    @ConfigProperty(
            name = "courier.jobs.default-timeout-seconds",
            defaultValue = "3600")
    int defaultTimeoutSeconds;

    @ConfigProperty(
            name = "courier.jobs.default-max-retries",
            defaultValue = "3")
    int defaultMaxRetries;

    @ConfigProperty(
            name = "courier.jobs.default-retry-delay-seconds",
            defaultValue = "300")
    int defaultRetryDelaySeconds;

    @ConfigProperty(
            name = "courier.jobs.cron-type",
            defaultValue = "UNIX")
    CronType cronType;

    @ConfigProperty(
            name = "courier.jobs.notify-recipient",
            defaultValue = "ops")
    String notifyRecipient;

    @ConfigProperty(
            name = "courier.jobs.notify-channels",
            defaultValue = "EMAIL")
    List<String> notifyChannels;

    public int getDefaultTimeoutSeconds() {
        return defaultTimeoutSeconds;
    }

    public int getDefaultMaxRetries() {
        return defaultMaxRetries;
    }

    public int getDefaultRetryDelaySeconds() {
        return defaultRetryDelaySeconds;
    }

    public CronType getCronType() {
        return cronType;
    }

    public String getNotifyRecipient() {
        return notifyRecipient;
    }

    public List<NotificationChannel> getNotifyChannels() {
        return notifyChannels.stream().map(NotificationChannel::fromString).collect(Collectors.toList());
    }
}

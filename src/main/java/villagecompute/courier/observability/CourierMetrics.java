package villagecompute.courier.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;
import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.Initialized;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.courier.data.models.JobExecution;
import villagecompute.courier.data.models.NotificationRequest;
import villagecompute.courier.notifications.NotificationChannel;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Registers the courier's custom Micrometer meters.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li><b>Gauge:</b> {@code courier.notifications.queue.depth{status}} - Requests per status</li>
 * <li><b>Counter:</b> {@code courier.notifications.dispatched{channel,status}} - Channel attempts by outcome</li>
 * <li><b>Counter:</b> {@code courier.notifications.recovered} - Requests returned to PENDING by the stuck sweep</li>
 * <li><b>Counter:</b> {@code courier.jobs.executions{template,status}} - Finished job executions</li>
 * <li><b>Timer:</b> {@code courier.jobs.duration{template}} - Wall time of job executions</li>
 * </ul>
 *
 * <p>
 * Exported in Prometheus format at {@code /q/metrics}.
 */
@ApplicationScoped
public class CourierMetrics {

    private static final Logger LOG = Logger.getLogger(CourierMetrics.class);

    @Inject
    MeterRegistry registry;

    /**
     * Registers queue depth gauges at application startup.
     */
    public void registerMetrics(@Observes @Initialized(ApplicationScoped.class) Object init) {
        for (NotificationRequest.Status status : NotificationRequest.Status.values()) {
            Gauge.builder("courier.notifications.queue.depth", this, m -> queueDepth(status))
                    .description("Notification requests currently in status " + status.name())
                    .tags(List.of(Tag.of("status", status.name().toLowerCase(Locale.ROOT)))).register(registry);
        }
        LOG.debugf("Registered queue depth gauges for %d statuses", NotificationRequest.Status.values().length);
    }

    public void recordDispatch(NotificationChannel channel, String outcome) {
        Counter.builder("courier.notifications.dispatched").description("Channel delivery attempts by outcome")
                .tag("channel", channel.name().toLowerCase(Locale.ROOT)).tag("status", outcome).register(registry)
                .increment();
    }

    public void recordRecovered(int count) {
        if (count > 0) {
            Counter.builder("courier.notifications.recovered")
                    .description("Requests returned to pending by the stuck-processing sweep").register(registry)
                    .increment(count);
        }
    }

    public void recordExecution(String templateType, JobExecution.Status status, Duration duration) {
        Counter.builder("courier.jobs.executions").description("Finished job executions")
                .tag("template", templateType).tag("status", status.name().toLowerCase(Locale.ROOT))
                .register(registry).increment();
        Timer.builder("courier.jobs.duration").description("Job execution wall time").tag("template", templateType)
                .register(registry).record(duration);
    }

    private double queueDepth(NotificationRequest.Status status) {
        try {
            return QuarkusTransaction.requiringNew().call(() -> NotificationRequest.count("status", status));
        } catch (Exception e) {
            LOG.warnf(e, "Failed to read queue depth for status %s, reporting 0", status);
            return 0.0;
        }
    }
}

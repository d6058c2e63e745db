package villagecompute.courier.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

import java.util.UUID;

/**
 * Standard MDC field names and helpers for enriching log lines emitted by jobs and dispatchers.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} / {@code span_id} - OpenTelemetry context of the current span</li>
 * <li>{@code job_id} - {@code ScheduledJob} primary key</li>
 * <li>{@code execution_id} - {@code JobExecution} primary key</li>
 * <li>{@code notification_id} - {@code NotificationRequest} id while it is being dispatched</li>
 * <li>{@code request_origin} - Admin request path or template identifier (e.g. {@code "template.notification_dispatcher"})</li>
 * </ul>
 *
 * <p>
 * <b>Usage in job execution:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setJobId(job.id);
 * LoggingConfig.setExecutionId(execution.id);
 * try {
 *     ...
 * } finally {
 *     LoggingConfig.clearMDC();
 * }
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which is thread-local. Executions run on pool threads, so
 * every entry point must clear the MDC when it is done.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_JOB_ID = "job_id";

    public static final String MDC_EXECUTION_ID = "execution_id";

    public static final String MDC_NOTIFICATION_ID = "notification_id";

    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Copies trace_id and span_id from the current OpenTelemetry span into the MDC. Empty strings are used when no
     * span is active so every line carries the same keys.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    public static void setJobId(Long jobId) {
        if (jobId != null) {
            MDC.put(MDC_JOB_ID, jobId.toString());
        }
    }

    public static void setExecutionId(Long executionId) {
        if (executionId != null) {
            MDC.put(MDC_EXECUTION_ID, executionId.toString());
        }
    }

    public static void setNotificationId(UUID notificationId) {
        if (notificationId != null) {
            MDC.put(MDC_NOTIFICATION_ID, notificationId.toString());
        } else {
            MDC.remove(MDC_NOTIFICATION_ID);
        }
    }

    /**
     * Sets the request origin (admin path or template identifier).
     *
     * @param requestOrigin
     *            path like "/admin/api/jobs" or "template.stuck_notification_recovery"
     */
    public static void setRequestOrigin(String requestOrigin) {
        if (requestOrigin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, requestOrigin);
        }
    }

    /**
     * Removes every field this class manages. Call in a {@code finally} block at the end of each execution.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_JOB_ID);
        MDC.remove(MDC_EXECUTION_ID);
        MDC.remove(MDC_NOTIFICATION_ID);
        MDC.remove(MDC_REQUEST_ORIGIN);
    }
}

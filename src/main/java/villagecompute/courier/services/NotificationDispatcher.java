package villagecompute.courier.services;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.courier.config.NotificationConfig;
import villagecompute.courier.data.models.DeliveryTarget;
import villagecompute.courier.data.models.NotificationDeliveryLog;
import villagecompute.courier.data.models.NotificationRequest;
import villagecompute.courier.integration.FailureKind;
import villagecompute.courier.integration.GatewayResult;
import villagecompute.courier.integration.email.EmailGateway;
import villagecompute.courier.integration.push.PushGateway;
import villagecompute.courier.integration.sms.SmsGateway;
import villagecompute.courier.notifications.ChannelPayload;
import villagecompute.courier.notifications.ChannelPayloadRenderer;
import villagecompute.courier.notifications.DeliveryMode;
import villagecompute.courier.notifications.DispatchSummary;
import villagecompute.courier.notifications.NotificationChannel;
import villagecompute.courier.notifications.NotificationTextFormatter;
import villagecompute.courier.observability.CourierMetrics;
import villagecompute.courier.observability.LoggingConfig;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Worker loop body: claims a batch for one channel, renders each request, sends through the channel gateways and
 * records the outcome.
 *
 * <p>
 * <b>Per-request flow:</b>
 * <ol>
 * <li>Resolve eligible targets for every listed channel. None at all: {@code SKIPPED} with reason
 * {@code no_active_subscriptions}.</li>
 * <li>Walk the channels in listed order. {@link DeliveryMode#FALLBACK} stops at the first channel that reached a
 * target; {@link DeliveryMode#ALL} tries them all.</li>
 * <li>Per target, call the gateway. {@link FailureKind#INVALID_TARGET} deactivates the target.</li>
 * <li>Append one delivery log row per channel tried.</li>
 * <li>Any delivery: {@code SENT}. Only transient failures: released for a later attempt. Otherwise {@code FAILED}.</li>
 * </ol>
 *
 * <p>
 * A request that throws is marked {@code FAILED} and the rest of the batch continues.
 */
@ApplicationScoped
public class NotificationDispatcher {

    private static final Logger LOG = Logger.getLogger(NotificationDispatcher.class);

    /** Status reason for requests with no eligible target on any channel. */
    public static final String REASON_NO_ACTIVE_SUBSCRIPTIONS = "no_active_subscriptions";

    @Inject
    NotificationQueueService queueService;

    @Inject
    DeliveryTargetService targetService;

    @Inject
    DeliveryLogService deliveryLogService;

    @Inject
    ChannelPayloadRenderer renderer;

    @Inject
    NotificationConfig config;

    @Inject
    PushGateway pushGateway;

    @Inject
    EmailGateway emailGateway;

    @Inject
    SmsGateway smsGateway;

    @Inject
    CourierMetrics metrics;

    @Inject
    Tracer tracer;

    /**
     * Claims up to {@code batchSize} requests for the channel and dispatches each of them.
     *
     * @return what happened to the claimed requests
     */
    public DispatchSummary drain(NotificationChannel channel, int batchSize) {
        DispatchSummary summary = new DispatchSummary(channel);

        Span span = tracer.spanBuilder("notification.dispatch").setAttribute("notification.channel", channel.name())
                .setAttribute("notification.batch_size", batchSize).startSpan();

        try (Scope scope = span.makeCurrent()) {
            List<NotificationRequest> claimed = queueService.claimPending(channel, batchSize);
            summary.claimed(claimed.size());
            span.setAttribute("notification.claimed", claimed.size());

            int processed = 0;
            for (NotificationRequest request : claimed) {
                if (Thread.currentThread().isInterrupted()) {
                    LOG.warnf("Dispatch of %s batch interrupted, %d claimed requests left for the recovery sweep",
                            channel, claimed.size() - processed);
                    break;
                }
                processed++;
                LoggingConfig.setNotificationId(request.id);
                try {
                    summary.record(dispatch(request));
                } catch (Exception e) {
                    span.recordException(e);
                    LOG.errorf(e, "Dispatch of notification %s failed", request.id);
                    summary.error();
                    String reason = "dispatch_error: " + e.getMessage();
                    try {
                        queueService.markTerminal(request.id, NotificationRequest.Status.FAILED, reason);
                        summary.record(NotificationRequest.Status.FAILED);
                    } catch (Exception markError) {
                        LOG.errorf(markError, "Could not mark notification %s FAILED, left PROCESSING for the "
                                + "recovery sweep", request.id);
                    }
                } finally {
                    LoggingConfig.setNotificationId(null);
                }
            }

            if (!claimed.isEmpty()) {
                LOG.infof("Dispatched %s batch: %s", channel, summary.toDetails());
            }
            span.addEvent("dispatch.completed");
            return summary;
        } finally {
            span.end();
        }
    }

    /**
     * Dispatches one claimed request and moves it out of PROCESSING.
     *
     * @return the status the request ended in
     */
    public NotificationRequest.Status dispatch(NotificationRequest request) {
        Map<NotificationChannel, List<DeliveryTarget>> targets = new EnumMap<>(NotificationChannel.class);
        for (NotificationChannel channel : request.channels) {
            List<DeliveryTarget> eligible = targetService.activeTargets(request.recipient, channel);
            if (!eligible.isEmpty()) {
                targets.put(channel, eligible);
            }
        }

        if (targets.isEmpty()) {
            LOG.infof("Notification %s skipped: recipient %s has no active target on %s", request.id,
                    request.recipient, request.channels);
            queueService.markTerminal(request.id, NotificationRequest.Status.SKIPPED, REASON_NO_ACTIVE_SUBSCRIPTIONS);
            return NotificationRequest.Status.SKIPPED;
        }

        ChannelPayload payload = renderer.render(request);
        DeliveryMode mode = request.deliveryMode != null ? request.deliveryMode : DeliveryMode.FALLBACK;

        List<ChannelAttempt> attempts = new ArrayList<>();
        for (NotificationChannel channel : request.channels) {
            List<DeliveryTarget> channelTargets = targets.get(channel);
            if (channelTargets == null) {
                continue;
            }
            ChannelAttempt attempt = sendOnChannel(request, channel, channelTargets, payload);
            attempts.add(attempt);
            if (mode == DeliveryMode.FALLBACK && attempt.delivered()) {
                break;
            }
        }

        return settle(request, attempts);
    }

    private NotificationRequest.Status settle(NotificationRequest request, List<ChannelAttempt> attempts) {
        boolean delivered = attempts.stream().anyMatch(ChannelAttempt::delivered);
        if (delivered) {
            queueService.markTerminal(request.id, NotificationRequest.Status.SENT, null);
            return NotificationRequest.Status.SENT;
        }

        String lastError = attempts.isEmpty() ? "no_channel_attempted" : attempts.get(attempts.size() - 1).lastError();
        boolean onlyTransient = !attempts.isEmpty() && attempts.stream().allMatch(ChannelAttempt::onlyTransient);
        if (onlyTransient) {
            NotificationRequest.Status status = queueService.releaseForRetry(request.id, lastError);
            return status != null ? status : NotificationRequest.Status.PENDING;
        }

        queueService.markTerminal(request.id, NotificationRequest.Status.FAILED, lastError);
        return NotificationRequest.Status.FAILED;
    }

    private ChannelAttempt sendOnChannel(NotificationRequest request, NotificationChannel channel,
            List<DeliveryTarget> targets, ChannelPayload payload) {
        int successes = 0;
        int failures = 0;
        boolean onlyTransient = true;
        String lastError = null;

        for (DeliveryTarget target : targets) {
            GatewayResult result = send(channel, target, payload);
            if (result.success()) {
                successes++;
                metrics.recordDispatch(channel, "sent");
                continue;
            }
            failures++;
            lastError = result.error();
            if (result.failureKind() != FailureKind.TRANSIENT) {
                onlyTransient = false;
            }
            if (result.failureKind() == FailureKind.INVALID_TARGET) {
                targetService.deactivate(target.id, result.error());
                metrics.recordDispatch(channel, "invalid_target");
            } else {
                metrics.recordDispatch(channel, result.failureKind() == FailureKind.TRANSIENT ? "transient" : "failed");
            }
            LOG.debugf("%s send to target %d of %s failed (%s): %s", channel, target.id, request.recipient,
                    result.failureKind(), result.error());
        }

        NotificationDeliveryLog.AttemptStatus status;
        if (failures == 0) {
            status = NotificationDeliveryLog.AttemptStatus.SENT;
        } else if (successes > 0) {
            status = NotificationDeliveryLog.AttemptStatus.PARTIAL;
        } else {
            status = NotificationDeliveryLog.AttemptStatus.FAILED;
        }
        String previewSource = channel == NotificationChannel.SMS ? payload.smsBody() : payload.body();
        deliveryLogService.append(request, channel, status, successes, failures, lastError,
                NotificationTextFormatter.preview(previewSource, config.getPreviewLength()));

        return new ChannelAttempt(successes > 0, failures > 0 && onlyTransient && successes == 0, lastError);
    }

    private GatewayResult send(NotificationChannel channel, DeliveryTarget target, ChannelPayload payload) {
        return switch (channel) {
            case PUSH -> pushGateway.sendPush(target.address, payload.title(), payload.body(), payload.data());
            case EMAIL -> emailGateway.sendEmail(target.address, payload.subject(), payload.html(), payload.text());
            case SMS -> smsGateway.sendSms(target.address, payload.smsBody());
        };
    }

    /**
     * Outcome of one channel within a dispatch.
     *
     * @param delivered
     *            at least one target accepted the message
     * @param onlyTransient
     *            nothing was delivered and every failure was transient
     * @param lastError
     *            last gateway error on the channel
     */
    private record ChannelAttempt(boolean delivered, boolean onlyTransient, String lastError) {
    }
}

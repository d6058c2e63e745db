package villagecompute.courier.services;

import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.TracerProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import villagecompute.courier.config.NotificationConfig;
import villagecompute.courier.data.models.NotificationRequest;
import villagecompute.courier.integration.email.EmailGateway;
import villagecompute.courier.integration.push.PushGateway;
import villagecompute.courier.integration.sms.SmsGateway;
import villagecompute.courier.notifications.ChannelPayloadRenderer;
import villagecompute.courier.notifications.DispatchSummary;
import villagecompute.courier.notifications.NotificationChannel;
import villagecompute.courier.observability.CourierMetrics;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link NotificationDispatcher#drain} batch isolation when the queue store itself fails.
 */
class NotificationDispatcherBatchTest {

    @Mock
    NotificationQueueService queueService;

    @Mock
    DeliveryTargetService targetService;

    @Mock
    DeliveryLogService deliveryLogService;

    @Mock
    ChannelPayloadRenderer renderer;

    @Mock
    NotificationConfig config;

    @Mock
    PushGateway pushGateway;

    @Mock
    EmailGateway emailGateway;

    @Mock
    SmsGateway smsGateway;

    @Mock
    CourierMetrics metrics;

    @Mock
    Tracer tracer;

    @InjectMocks
    NotificationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(tracer.spanBuilder(anyString())).thenReturn(TracerProvider.noop().get("test").spanBuilder("test"));
    }

    @Test
    void testDrain_FailedStatusWriteDoesNotAbortBatch() {
        NotificationRequest broken = request("alice");
        NotificationRequest next = request("bob");
        when(queueService.claimPending(NotificationChannel.PUSH, 10)).thenReturn(List.of(broken, next));
        when(targetService.activeTargets(eq("alice"), any())).thenThrow(new IllegalStateException("db unavailable"));
        when(targetService.activeTargets(eq("bob"), any())).thenReturn(List.of());
        when(queueService.markTerminal(eq(broken.id), any(), any()))
                .thenThrow(new IllegalStateException("db unavailable"));
        when(queueService.markTerminal(eq(next.id), any(), any())).thenReturn(true);

        DispatchSummary summary = dispatcher.drain(NotificationChannel.PUSH, 10);

        assertEquals(2, summary.getClaimed());
        assertEquals(1, summary.getErrors());
        assertEquals(0, summary.count(NotificationRequest.Status.FAILED));
        assertEquals(1, summary.count(NotificationRequest.Status.SKIPPED));
        verify(queueService).markTerminal(eq(broken.id), eq(NotificationRequest.Status.FAILED),
                startsWith("dispatch_error"));
        verify(queueService).markTerminal(next.id, NotificationRequest.Status.SKIPPED,
                NotificationDispatcher.REASON_NO_ACTIVE_SUBSCRIPTIONS);
        verifyNoInteractions(pushGateway);
    }

    private static NotificationRequest request(String recipient) {
        NotificationRequest request = new NotificationRequest();
        request.id = UUID.randomUUID();
        request.recipient = recipient;
        request.trigger = "new_match";
        request.channels = List.of(NotificationChannel.PUSH);
        request.status = NotificationRequest.Status.PROCESSING;
        return request;
    }
}

package villagecompute.courier.jobs;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import villagecompute.courier.data.models.NotificationRequest;
import villagecompute.courier.notifications.DispatchSummary;
import villagecompute.courier.notifications.NotificationChannel;
import villagecompute.courier.services.NotificationDispatcher;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link NotificationDispatchJobTemplate} with a mocked dispatcher.
 */
class NotificationDispatchJobTemplateTest {

    @Mock
    NotificationDispatcher dispatcher;

    private NotificationDispatchJobTemplate template;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        template = new NotificationDispatchJobTemplate();
        template.dispatcher = dispatcher;
    }

    @Test
    void testValidateParameters() {
        assertTrue(template.validateParameters(Map.of("channel", "email")).valid());
        assertTrue(template.validateParameters(Map.of("channel", "SMS", "batch_size", 500)).valid());

        ParameterValidation missing = template.validateParameters(Map.of("batch_size", 10));
        assertFalse(missing.valid());
        assertTrue(missing.error().contains("channel is required"));
        assertFalse(template.validateParameters(Map.of("channel", "pigeon")).valid());
        assertFalse(template.validateParameters(Map.of("channel", "push", "batch_size", 0)).valid());
    }

    @Test
    void testExecute_DrainsConfiguredChannel() {
        DispatchSummary summary = new DispatchSummary(NotificationChannel.PUSH);
        summary.claimed(3);
        summary.record(NotificationRequest.Status.SENT);
        summary.record(NotificationRequest.Status.SENT);
        summary.record(NotificationRequest.Status.SKIPPED);
        when(dispatcher.drain(NotificationChannel.PUSH, 25)).thenReturn(summary);

        JobResult result = template.execute(context(Map.of("channel", "push", "batch_size", 25)));

        verify(dispatcher).drain(NotificationChannel.PUSH, 25);
        assertEquals(JobResult.Outcome.SUCCESS, result.status());
        assertEquals(3, result.recordsProcessed());
        assertEquals(2, result.recordsAffected());
        assertEquals("Dispatched 3 push notifications", result.message());
        assertEquals(2, result.details().get("sent"));
    }

    @Test
    void testExecute_UnexpectedErrorsMakeRunPartial() {
        DispatchSummary summary = new DispatchSummary(NotificationChannel.EMAIL);
        summary.claimed(1);
        summary.record(NotificationRequest.Status.FAILED);
        summary.error();
        when(dispatcher.drain(any(), anyInt())).thenReturn(summary);

        JobResult result = template.execute(context(Map.of("channel", "email")));

        verify(dispatcher).drain(NotificationChannel.EMAIL, NotificationDispatchJobTemplate.DEFAULT_BATCH_SIZE);
        assertEquals(JobResult.Outcome.PARTIAL, result.status());
        assertEquals(1, result.errors().size());
    }

    private JobContext context(Map<String, Object> parameters) {
        return new JobContext(1L, "dispatcher", 1L, 1, "scheduler",
                JobTemplateRegistry.effectiveParameters(template, parameters));
    }
}

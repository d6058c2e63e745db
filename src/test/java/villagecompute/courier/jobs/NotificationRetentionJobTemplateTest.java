package villagecompute.courier.jobs;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.transaction.Transactional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.courier.TestFixtures;
import villagecompute.courier.data.models.JobExecution;
import villagecompute.courier.data.models.NotificationRequest;
import villagecompute.courier.notifications.NotificationChannel;
import villagecompute.courier.services.NotificationQueueService;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link NotificationRetentionJobTemplate} and {@link StuckNotificationRecoveryJobTemplate}, the two queue
 * maintenance templates.
 */
@QuarkusTest
class NotificationRetentionJobTemplateTest {

    @Inject
    NotificationRetentionJobTemplate retention;

    @Inject
    StuckNotificationRecoveryJobTemplate recovery;

    @Inject
    NotificationQueueService queueService;

    @Inject
    EntityManager entityManager;

    @BeforeEach
    @Transactional
    void setUp() {
        TestFixtures.cleanDatabase(entityManager);
    }

    @Test
    void testRetention_PurgesOnlyOldTerminalRowsInBatches() {
        Instant old = Instant.now().minus(Duration.ofDays(45));
        UUID oldSent = completed("alice", NotificationRequest.Status.SENT, old);
        UUID oldFailed = completed("bob", NotificationRequest.Status.FAILED, old);
        UUID recentSent = completed("carol", NotificationRequest.Status.SENT, Instant.now());
        UUID oldPending = queueService.enqueue("dave", "new_match", List.of(NotificationChannel.EMAIL), null,
                Map.of());
        QuarkusTransaction.requiringNew()
                .run(() -> NotificationRequest.update("updatedAt = ?1 WHERE id = ?2", old, oldPending));
        Long oldExecution = finishedExecution(old);

        JobResult result = retention.execute(context(retention, Map.of("retention_days", 30, "batch_size", 1)));

        assertEquals(JobResult.Outcome.SUCCESS, result.status());
        assertEquals(2, result.details().get("notifications_deleted"));
        assertEquals(1L, result.details().get("executions_deleted"));
        assertFalse(exists(oldSent));
        assertFalse(exists(oldFailed));
        assertTrue(exists(recentSent));
        assertTrue(exists(oldPending), "pending requests are never purged");
        assertNull(QuarkusTransaction.requiringNew().call(() -> JobExecution.findById(oldExecution)));
    }

    @Test
    void testRetention_ValidatesParameters() {
        assertTrue(retention.validateParameters(Map.of("retention_days", 7)).valid());
        assertFalse(retention.validateParameters(Map.of("retention_days", 0)).valid());
        assertFalse(retention.validateParameters(Map.of("batch_size", 10_000)).valid());
    }

    @Test
    void testRecovery_ResetsStuckRequests() {
        UUID stuck = queueService.enqueue("alice", "new_match", List.of(NotificationChannel.PUSH), null, Map.of());
        QuarkusTransaction.requiringNew().run(
                () -> TestFixtures.markProcessingSince(stuck, Instant.now().minus(Duration.ofMinutes(30))));

        JobResult result = recovery.execute(context(recovery, Map.of("timeout_minutes", 15)));

        assertEquals(1, result.details().get("recovered"));
        assertEquals(NotificationRequest.Status.PENDING, queueService.get(stuck).status);
        assertFalse(recovery.validateParameters(Map.of("timeout_minutes", 0)).valid());
    }

    private UUID completed(String recipient, NotificationRequest.Status status, Instant updatedAt) {
        UUID id = queueService.enqueue(recipient, "new_match", List.of(NotificationChannel.EMAIL), null, Map.of());
        queueService.claimPending(NotificationChannel.EMAIL, 1);
        queueService.markTerminal(id, status, null);
        QuarkusTransaction.requiringNew()
                .run(() -> NotificationRequest.update("updatedAt = ?1 WHERE id = ?2", updatedAt, id));
        return id;
    }

    private static Long finishedExecution(Instant startedAt) {
        return QuarkusTransaction.requiringNew().call(() -> {
            JobExecution execution = new JobExecution();
            execution.jobId = 1L;
            execution.jobName = "gone";
            execution.templateType = RecordingTestTemplate.TEMPLATE_TYPE;
            execution.triggeredBy = JobExecution.TRIGGERED_BY_SCHEDULER;
            execution.attempt = 1;
            execution.status = JobExecution.Status.SUCCESS;
            execution.timeoutSeconds = 60;
            execution.startedAt = startedAt;
            execution.finishedAt = startedAt.plusSeconds(1);
            execution.persist();
            return execution.id;
        });
    }

    private static boolean exists(UUID id) {
        return QuarkusTransaction.requiringNew().call(() -> NotificationRequest.findById(id)) != null;
    }

    private static JobContext context(JobTemplate template, Map<String, Object> parameters) {
        return new JobContext(1L, template.templateType(), 1L, 1, "manual:test",
                JobTemplateRegistry.effectiveParameters(template, parameters));
    }
}

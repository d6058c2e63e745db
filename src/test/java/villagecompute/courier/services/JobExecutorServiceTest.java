package villagecompute.courier.services;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.transaction.Transactional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.courier.TestFixtures;
import villagecompute.courier.api.types.ScheduleType;
import villagecompute.courier.data.models.JobExecution;
import villagecompute.courier.data.models.NotificationRequest;
import villagecompute.courier.data.models.ScheduledJob;
import villagecompute.courier.jobs.FailingTestTemplate;
import villagecompute.courier.jobs.JobContext;
import villagecompute.courier.jobs.RecordingTestTemplate;
import villagecompute.courier.jobs.SleepingTestTemplate;
import villagecompute.courier.notifications.NotificationChannel;
import villagecompute.courier.notifications.NotificationPriority;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for {@link JobExecutorService}: outcome mapping, timeouts, the retry policy and outcome
 * notifications.
 */
@QuarkusTest
class JobExecutorServiceTest {

    private static final ScheduleType HOURLY = new ScheduleType("interval", 3600, null, null);

    @Inject
    JobExecutorService executor;

    @Inject
    JobRegistryService registry;

    @Inject
    RecordingTestTemplate recorder;

    @Inject
    EntityManager entityManager;

    @BeforeEach
    @Transactional
    void setUp() {
        TestFixtures.cleanDatabase(entityManager);
        recorder.clear();
    }

    @Test
    void testRun_SuccessMergesDefaultParameters() {
        ScheduledJob job = registry.createJob(
                TestFixtures.intervalJob("recorder", RecordingTestTemplate.TEMPLATE_TYPE, Map.of("limit", 3), 3600),
                "tester");

        JobExecution execution = executor.run(job, "manual:tester");

        assertEquals(JobExecution.Status.SUCCESS, execution.status);
        assertEquals("manual:tester", execution.triggeredBy);
        assertEquals(1, execution.attempt);
        assertNotNull(execution.finishedAt);
        assertNotNull(execution.durationSeconds);
        assertEquals("success", execution.result.get("status"));

        assertEquals(1, recorder.runs().size());
        JobContext context = recorder.runs().get(0);
        assertEquals(job.id, context.jobId());
        assertEquals(execution.id, context.executionId());
        assertEquals(3, context.intParam("limit", 0));
        assertEquals("hello", context.stringParam("greeting", null));

        ScheduledJob reloaded = registry.getJob(job.id);
        assertEquals(JobExecution.Status.SUCCESS, reloaded.lastStatus);
        assertNull(reloaded.retryAt);
    }

    @Test
    void testRun_TimeoutCancelsBody() {
        ScheduledJob job = registry.createJob(TestFixtures.jobWithPolicy("sleeper", SleepingTestTemplate.TEMPLATE_TYPE,
                Map.of("sleep_seconds", 10), HOURLY, 1, 0, 0, List.of()), "tester");

        long start = System.nanoTime();
        JobExecution execution = executor.run(job, "manual:tester");
        double elapsedSeconds = (System.nanoTime() - start) / 1_000_000_000.0;

        assertEquals(JobExecution.Status.TIMEOUT, execution.status);
        assertEquals(List.of("Execution exceeded timeout of 1 seconds"), execution.errors);
        assertTrue(elapsedSeconds < 5, "timed out run took " + elapsedSeconds + "s");
        assertNull(registry.getJob(job.id).retryAt, "no retries configured");
    }

    @Test
    void testRun_FailureSchedulesRetry() {
        ScheduledJob job = registry.createJob(TestFixtures.jobWithPolicy("failing", FailingTestTemplate.TEMPLATE_TYPE,
                Map.of(), HOURLY, 60, 2, 60, List.of()), "tester");
        Instant before = Instant.now();

        JobExecution execution = executor.run(job, "manual:tester");

        assertEquals(JobExecution.Status.FAILED, execution.status);
        assertEquals(List.of(FailingTestTemplate.ERROR), execution.errors);
        ScheduledJob reloaded = registry.getJob(job.id);
        assertEquals(JobExecution.Status.FAILED, reloaded.lastStatus);
        assertEquals(2, (int) reloaded.retryAttempt);
        assertNotNull(reloaded.retryAt);
        assertFalse(reloaded.retryAt.isBefore(before.plusSeconds(60)));
    }

    @Test
    void testRun_NoRetryOnceAttemptsExhausted() {
        ScheduledJob job = registry.createJob(TestFixtures.jobWithPolicy("failing", FailingTestTemplate.TEMPLATE_TYPE,
                Map.of(), HOURLY, 60, 2, 60, List.of()), "tester");

        JobExecution execution = executor.run(job, JobExecution.TRIGGERED_BY_SCHEDULER, 3);

        assertEquals(JobExecution.Status.FAILED, execution.status);
        assertEquals(3, execution.attempt);
        ScheduledJob reloaded = registry.getJob(job.id);
        assertNull(reloaded.retryAt);
        assertNull(reloaded.retryAttempt);
    }

    @Test
    void testRun_UnknownTemplateFails() {
        ScheduledJob job = registry.createJob(
                TestFixtures.intervalJob("recorder", RecordingTestTemplate.TEMPLATE_TYPE, Map.of(), 3600), "tester");
        job.templateType = "removed_template";

        JobExecution execution = executor.run(job, "manual:tester");

        assertEquals(JobExecution.Status.FAILED, execution.status);
        assertEquals(List.of("Unknown template type: removed_template"), execution.errors);
    }

    @Test
    void testRun_FailureEnqueuesOpsNotification() {
        ScheduledJob job = registry.createJob(TestFixtures.jobWithPolicy("failing", FailingTestTemplate.TEMPLATE_TYPE,
                Map.of(), HOURLY, 60, 0, 0, List.of("job_failed")), "tester");

        JobExecution execution = executor.run(job, "manual:tester");

        List<NotificationRequest> queued = QuarkusTransaction.requiringNew()
                .call(() -> NotificationRequest.<NotificationRequest> list("recipient", "ops"));
        assertEquals(1, queued.size());
        NotificationRequest request = queued.get(0);
        assertEquals("job_failed", request.trigger);
        assertEquals(List.of(NotificationChannel.EMAIL), request.channels);
        assertEquals(NotificationPriority.HIGH, request.priority);
        assertEquals("failing", request.templateData.get("job_name"));
        assertEquals("failed", request.templateData.get("status"));
        assertEquals(execution.id.intValue(), ((Number) request.templateData.get("execution_id")).intValue());
    }

    @Test
    void testRun_SuccessWithoutTriggersEnqueuesNothing() {
        ScheduledJob job = registry.createJob(
                TestFixtures.intervalJob("recorder", RecordingTestTemplate.TEMPLATE_TYPE, Map.of(), 3600), "tester");

        executor.run(job, "manual:tester");

        assertEquals(0L, (long) QuarkusTransaction.requiringNew().call(() -> NotificationRequest.count()));
    }
}

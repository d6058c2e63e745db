package villagecompute.courier.jobs;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.transaction.Transactional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.courier.TestFixtures;
import villagecompute.courier.api.types.ScheduleType;
import villagecompute.courier.data.models.JobExecution;
import villagecompute.courier.data.models.ScheduledJob;
import villagecompute.courier.services.JobExecutionService;
import villagecompute.courier.services.JobExecutorService;
import villagecompute.courier.services.JobRegistryService;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for {@link JobScheduler}. Ticks are driven directly with an explicit {@code now}; the Quarkus
 * scheduler is disabled in the test profile.
 */
@QuarkusTest
class JobSchedulerTest {

    @Inject
    JobScheduler scheduler;

    @Inject
    JobRegistryService registry;

    @Inject
    JobExecutionService executions;

    @Inject
    JobExecutorService executor;

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

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    @Test
    void testTick_IntervalJobRunsOncePerPeriod() throws Exception {
        ScheduledJob job = registry.createJob(
                TestFixtures.intervalJob("recorder", RecordingTestTemplate.TEMPLATE_TYPE, Map.of(), 60), "tester");
        Instant now = Instant.now().plusSeconds(1).truncatedTo(ChronoUnit.SECONDS);

        JobScheduler.TickResult first = scheduler.tick(now);
        assertEquals(1, first.due());
        assertEquals(1, first.launched().size());
        awaitAll(first);

        assertTrue(scheduler.tick(now.plusSeconds(30)).launched().isEmpty());

        JobScheduler.TickResult third = scheduler.tick(now.plusSeconds(60));
        assertEquals(1, third.launched().size());
        awaitAll(third);

        assertEquals(2, recorder.runs().size());
        assertEquals(2, registry.countExecutions(job.id, JobExecution.Status.SUCCESS));
        List<JobExecution> history = registry.getExecutions(job.id, null, 0, 10);
        assertTrue(history.stream().allMatch(e -> JobExecution.TRIGGERED_BY_SCHEDULER.equals(e.triggeredBy)));
        assertEquals(now.plusSeconds(120), registry.getJob(job.id).nextRunAt);
    }

    @Test
    void testTick_DisabledJobNotLaunched() {
        ScheduledJob job = registry.createJob(
                TestFixtures.intervalJob("recorder", RecordingTestTemplate.TEMPLATE_TYPE, Map.of(), 60), "tester");
        registry.setEnabled(job.id, false);

        JobScheduler.TickResult result = scheduler.tick(Instant.now().plusSeconds(5));

        assertEquals(0, result.due());
        assertTrue(result.launched().isEmpty());
        assertEquals(0, registry.countExecutions(job.id, null));
    }

    @Test
    void testTick_RetriesFailedRunUntilExhausted() throws Exception {
        ScheduledJob job = registry.createJob(TestFixtures.jobWithPolicy("failing", FailingTestTemplate.TEMPLATE_TYPE,
                Map.of(), new ScheduleType("cron", null, "0 0 1 1 *", "UTC"), 60, 2, 0, List.of()), "tester");

        JobExecution first = executor.run(job, "manual:tester");
        assertEquals(JobExecution.Status.FAILED, first.status);

        JobScheduler.TickResult second = scheduler.tick(Instant.now());
        assertEquals(1, second.launched().size());
        assertEquals(2, second.launched().get(0).get(30, TimeUnit.SECONDS).attempt);

        JobScheduler.TickResult third = scheduler.tick(Instant.now());
        assertEquals(1, third.launched().size());
        assertEquals(3, third.launched().get(0).get(30, TimeUnit.SECONDS).attempt);

        assertTrue(scheduler.tick(Instant.now()).launched().isEmpty());
        assertEquals(3, registry.countExecutions(job.id, JobExecution.Status.FAILED));
        ScheduledJob reloaded = registry.getJob(job.id);
        assertNull(reloaded.retryAt);
        assertTrue(reloaded.nextRunAt.isAfter(Instant.now().plus(Duration.ofDays(1))),
                "regular yearly slot is untouched by retries");
    }

    @Test
    void testTick_PendingRetryHoldsShorterIntervalSlot() throws Exception {
        ScheduledJob job = registry.createJob(TestFixtures.jobWithPolicy("failing-often",
                FailingTestTemplate.TEMPLATE_TYPE, Map.of(), new ScheduleType("interval", 10, null, null), 60, 2, 60,
                List.of()), "tester");
        Instant t0 = Instant.now().plusSeconds(1).truncatedTo(ChronoUnit.SECONDS);

        JobScheduler.TickResult first = scheduler.tick(t0);
        assertEquals(1, first.launched().size());
        assertEquals(1, first.launched().get(0).get(30, TimeUnit.SECONDS).attempt);

        ScheduledJob afterFirst = registry.getJob(job.id);
        assertNotNull(afterFirst.retryAt);
        assertEquals(2, (int) afterFirst.retryAttempt);

        // interval slots at +10s..+50s all fall before the 60s retry delay
        for (int offset = 10; offset <= 50; offset += 10) {
            JobScheduler.TickResult held = scheduler.tick(t0.plusSeconds(offset));
            assertTrue(held.launched().isEmpty(), "regular slot at +" + offset + "s waits for the retry");
            assertEquals(1, held.skipped());
        }
        ScheduledJob stillPending = registry.getJob(job.id);
        assertEquals(afterFirst.retryAt, stillPending.retryAt);
        assertEquals(2, (int) stillPending.retryAttempt);

        JobScheduler.TickResult second = scheduler.tick(afterFirst.retryAt);
        assertEquals(1, second.launched().size());
        assertEquals(2, second.launched().get(0).get(30, TimeUnit.SECONDS).attempt);

        ScheduledJob afterSecond = registry.getJob(job.id);
        assertTrue(afterSecond.nextRunAt.isAfter(afterFirst.retryAt), "retry consumed the held regular slot");
        assertNotNull(afterSecond.retryAt);
        assertEquals(3, (int) afterSecond.retryAttempt);

        JobScheduler.TickResult third = scheduler.tick(afterSecond.retryAt);
        assertEquals(1, third.launched().size());
        assertEquals(3, third.launched().get(0).get(30, TimeUnit.SECONDS).attempt);

        assertEquals(3, registry.countExecutions(job.id, JobExecution.Status.FAILED));
        assertNull(registry.getJob(job.id).retryAt);
    }

    @Test
    void testTick_SkipsJobWithRunningExecution() {
        ScheduledJob job = registry.createJob(
                TestFixtures.intervalJob("recorder", RecordingTestTemplate.TEMPLATE_TYPE, Map.of(), 60), "tester");
        executions.start(job, "manual:tester", 1);

        JobScheduler.TickResult result = scheduler.tick(Instant.now().plusSeconds(1));

        assertEquals(1, result.due());
        assertEquals(1, result.skipped());
        assertTrue(result.launched().isEmpty());
        assertTrue(recorder.runs().isEmpty());
    }

    @Test
    void testTick_ExpiresOrphanedExecutions() {
        ScheduledJob job = registry.createJob(TestFixtures.jobWithPolicy("recorder",
                RecordingTestTemplate.TEMPLATE_TYPE, Map.of(), new ScheduleType("cron", null, "0 0 1 1 *", "UTC"), 30,
                0, 0, List.of()), "tester");
        JobExecution orphan = executions.start(job, JobExecution.TRIGGERED_BY_SCHEDULER, 1);

        // 30s timeout + 60s grace
        assertEquals(0, scheduler.tick(orphan.startedAt.plusSeconds(60)).orphansExpired());
        assertEquals(1, scheduler.tick(orphan.startedAt.plusSeconds(120)).orphansExpired());

        JobExecution expired = executions.get(orphan.id);
        assertEquals(JobExecution.Status.TIMEOUT, expired.status);
        assertNotNull(expired.finishedAt);
        assertEquals(1, expired.errors.size());
        assertFalse(executions.hasRunning(job.id));
    }

    @Test
    void testStartStop() {
        scheduler.stop();
        assertFalse(scheduler.isRunning());

        scheduler.start();
        assertTrue(scheduler.isRunning());

        scheduler.stop();
        assertFalse(scheduler.isRunning());
    }

    private static void awaitAll(JobScheduler.TickResult result) throws Exception {
        CompletableFuture.allOf(result.launched().toArray(new CompletableFuture[0])).get(30, TimeUnit.SECONDS);
    }
}

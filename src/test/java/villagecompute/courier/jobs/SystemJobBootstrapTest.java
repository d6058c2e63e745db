package villagecompute.courier.jobs;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.transaction.Transactional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.courier.TestFixtures;
import villagecompute.courier.data.models.ScheduledJob;
import villagecompute.courier.services.JobRegistryService;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link SystemJobBootstrap}.
 */
@QuarkusTest
class SystemJobBootstrapTest {

    @Inject
    SystemJobBootstrap bootstrap;

    @Inject
    JobRegistryService registry;

    @Inject
    EntityManager entityManager;

    @BeforeEach
    @Transactional
    void setUp() {
        TestFixtures.cleanDatabase(entityManager);
    }

    @Test
    void testEnsureSystemJobs_CreatesOnceAndIsIdempotent() {
        assertEquals(6, bootstrap.ensureSystemJobs());
        assertEquals(0, bootstrap.ensureSystemJobs());

        List<ScheduledJob> jobs = registry.listJobs(true);
        assertEquals(6, jobs.size());
        assertTrue(jobs.stream().allMatch(job -> SystemJobBootstrap.ACTOR.equals(job.createdBy)));

        ScheduledJob sms = registry.findByName("sms-dispatcher");
        assertEquals(NotificationDispatchJobTemplate.TEMPLATE_TYPE, sms.templateType);
        assertEquals("sms", sms.parameters.get("channel"));
        assertEquals(30, sms.intervalSeconds);

        ScheduledJob retention = registry.findByName("notification-retention-cleanup");
        assertEquals(ScheduledJob.ScheduleKind.CRON, retention.scheduleKind);
        assertEquals("0 3 * * *", retention.cronExpression);
    }

    @Test
    void testEnsureSystemJobs_KeepsOperatorChanges() {
        bootstrap.ensureSystemJobs();
        ScheduledJob reminder = registry.findByName("pending-messages-reminder");
        registry.setEnabled(reminder.id, false);

        assertEquals(0, bootstrap.ensureSystemJobs());
        assertFalse(registry.getJob(reminder.id).enabled);
    }

    @Test
    void testDefinitionsAreValid() {
        for (var definition : SystemJobBootstrap.definitions()) {
            assertNotNull(definition.schedule(), definition.name());
        }
        assertEquals(6, SystemJobBootstrap.definitions().stream().map(d -> d.name()).distinct().count());
    }
}

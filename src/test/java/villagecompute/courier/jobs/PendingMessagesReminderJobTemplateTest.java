package villagecompute.courier.jobs;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.transaction.Transactional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.courier.TestFixtures;
import villagecompute.courier.data.models.NotificationRequest;
import villagecompute.courier.notifications.NotificationChannel;
import villagecompute.courier.notifications.NotificationPriority;
import villagecompute.courier.services.DeliveryTargetService;
import villagecompute.courier.services.ReminderCooldownService;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link PendingMessagesReminderJobTemplate}: recipient selection, cooldown and reminder wording.
 */
@QuarkusTest
class PendingMessagesReminderJobTemplateTest {

    @Inject
    PendingMessagesReminderJobTemplate template;

    @Inject
    DeliveryTargetService targetService;

    @Inject
    ReminderCooldownService cooldownService;

    @Inject
    EntityManager entityManager;

    @BeforeEach
    @Transactional
    void setUp() {
        TestFixtures.cleanDatabase(entityManager);
    }

    @Test
    void testExecute_QueuesReminderAndRecordsCooldown() {
        Instant now = Instant.now();
        QuarkusTransaction.requiringNew().run(() -> {
            TestFixtures.createUnreadMessage("alice", "bob", now.minus(Duration.ofHours(3)));
            TestFixtures.createUnreadMessage("alice", "carol", now.minus(Duration.ofHours(2)));
        });
        targetService.register("alice", NotificationChannel.PUSH, "device-token-1", true);

        JobResult result = template.execute(context(Map.of()));

        assertEquals(JobResult.Outcome.SUCCESS, result.status());
        assertEquals(1, result.details().get("notifications_queued"));
        List<NotificationRequest> queued = queuedFor("alice");
        assertEquals(1, queued.size());
        NotificationRequest request = queued.get(0);
        assertEquals(PendingMessagesReminderJobTemplate.TRIGGER, request.trigger);
        assertEquals(List.of(NotificationChannel.PUSH, NotificationChannel.SMS), request.channels);
        assertEquals(NotificationPriority.MEDIUM, request.priority);
        assertEquals("You have 2 unread messages from carol and bob", request.templateData.get("message"));
        assertEquals("Unread Messages", request.templateData.get("title"));

        assertTrue(cooldownService.lastReminder("alice", PendingMessagesReminderJobTemplate.REMINDER_KIND)
                .isPresent());
    }

    @Test
    void testExecute_CooldownSuppressesSecondReminder() {
        QuarkusTransaction.requiringNew().run(
                () -> TestFixtures.createUnreadMessage("alice", "bob", Instant.now().minus(Duration.ofHours(1))));
        targetService.register("alice", NotificationChannel.SMS, "+15555550100", true);

        template.execute(context(Map.of()));
        JobResult second = template.execute(context(Map.of()));

        assertEquals(0, second.details().get("notifications_queued"));
        assertEquals(1, second.details().get("skipped_cooldown"));
        assertEquals(1, queuedFor("alice").size());
    }

    @Test
    void testExecute_SkipsRecipientsWithoutTargetsAndRecentMessages() {
        Instant now = Instant.now();
        QuarkusTransaction.requiringNew().run(() -> {
            TestFixtures.createUnreadMessage("dave", "bob", now.minus(Duration.ofHours(1)));
            TestFixtures.createUnreadMessage("erin", "bob", now.minus(Duration.ofMinutes(10)));
        });
        targetService.register("dave", NotificationChannel.EMAIL, "dave@example.com", true);
        targetService.register("erin", NotificationChannel.PUSH, "device-token-2", true);

        JobResult result = template.execute(context(Map.of()));

        assertEquals(1, result.details().get("recipients_checked"), "erin's message is too recent");
        assertEquals(1, result.details().get("skipped_no_target"), "email is not a reminder channel");
        assertEquals(0, result.details().get("notifications_queued"));
        assertTrue(queuedFor("dave").isEmpty());
    }

    @Test
    void testValidateParameters() {
        assertTrue(template.validateParameters(Map.of()).valid());
        assertTrue(template.validateParameters(Map.of("reminder_cooldown_hours", 24)).valid());
        assertFalse(template.validateParameters(Map.of("min_unread_age_minutes", 1)).valid());
        assertFalse(template.validateParameters(Map.of("max_senders_to_show", 6)).valid());
    }

    @Test
    void testReminderText() {
        assertEquals("You have 1 unread message", PendingMessagesReminderJobTemplate.reminderText(1, List.of(), 0));
        assertEquals("You have 1 unread message from Ann",
                PendingMessagesReminderJobTemplate.reminderText(1, List.of("Ann"), 1));
        assertEquals("You have 4 unread messages from Ann and Bob",
                PendingMessagesReminderJobTemplate.reminderText(4, List.of("Ann", "Bob"), 2));
        assertEquals("You have 5 unread messages from Ann, Bob and Cy",
                PendingMessagesReminderJobTemplate.reminderText(5, List.of("Ann", "Bob", "Cy"), 3));
        assertEquals("You have 6 unread messages from Ann, Bob and 1 other",
                PendingMessagesReminderJobTemplate.reminderText(6, List.of("Ann", "Bob"), 3));
        assertEquals("You have 9 unread messages from Ann and 3 others",
                PendingMessagesReminderJobTemplate.reminderText(9, List.of("Ann"), 4));
    }

    private JobContext context(Map<String, Object> parameters) {
        return new JobContext(1L, "pending-messages-reminder", 1L, 1, "manual:test",
                JobTemplateRegistry.effectiveParameters(template, parameters));
    }

    private static List<NotificationRequest> queuedFor(String recipient) {
        return QuarkusTransaction.requiringNew()
                .call(() -> NotificationRequest.<NotificationRequest> list("recipient", recipient));
    }
}

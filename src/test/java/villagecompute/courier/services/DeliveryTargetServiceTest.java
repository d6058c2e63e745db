package villagecompute.courier.services;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.transaction.Transactional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.courier.TestFixtures;
import villagecompute.courier.data.models.DeliveryTarget;
import villagecompute.courier.exceptions.ValidationException;
import villagecompute.courier.notifications.NotificationChannel;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for {@link DeliveryTargetService}.
 */
@QuarkusTest
class DeliveryTargetServiceTest {

    @Inject
    DeliveryTargetService targetService;

    @Inject
    EntityManager entityManager;

    @BeforeEach
    @Transactional
    void setUp() {
        TestFixtures.cleanDatabase(entityManager);
    }

    @Test
    void testRegister_ValidatesAddresses() {
        assertThrows(ValidationException.class,
                () -> targetService.register("alice", NotificationChannel.EMAIL, "not-an-email", true));
        assertThrows(ValidationException.class,
                () -> targetService.register("alice", NotificationChannel.SMS, "555-0100", true));
        assertThrows(ValidationException.class,
                () -> targetService.register(" ", NotificationChannel.PUSH, "token", true));

        assertNotNull(targetService.register("alice", NotificationChannel.SMS, "+15555550100", true).id);
    }

    @Test
    void testActiveTargets_OnlyVerifiedAndActive() {
        targetService.register("alice", NotificationChannel.PUSH, "token-1", true);
        targetService.register("alice", NotificationChannel.PUSH, "token-unverified", false);
        targetService.register("alice", NotificationChannel.EMAIL, "alice@example.com", true);

        List<DeliveryTarget> push = targetService.activeTargets("alice", NotificationChannel.PUSH);

        assertEquals(1, push.size());
        assertEquals("token-1", push.get(0).address);
        assertTrue(targetService.hasActiveTarget("alice", List.of(NotificationChannel.SMS, NotificationChannel.EMAIL)));
        assertFalse(targetService.hasActiveTarget("alice", List.of(NotificationChannel.SMS)));
        assertFalse(targetService.hasActiveTarget("bob", List.of(NotificationChannel.PUSH)));
    }

    @Test
    void testDeactivateThenReregister() {
        DeliveryTarget target = targetService.register("alice", NotificationChannel.PUSH, "token-1", true);

        assertTrue(targetService.deactivate(target.id, "NotRegistered"));
        assertFalse(targetService.deactivate(target.id, "NotRegistered"));
        assertTrue(targetService.activeTargets("alice", NotificationChannel.PUSH).isEmpty());

        DeliveryTarget reactivated = targetService.register("alice", NotificationChannel.PUSH, "token-1", true);

        assertEquals(target.id, reactivated.id);
        assertTrue(reactivated.active);
        assertNull(reactivated.deactivationReason);
        assertEquals(1, targetService.activeTargets("alice", NotificationChannel.PUSH).size());
    }
}

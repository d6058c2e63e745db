package villagecompute.courier.integration;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the HTTP status classification in {@link GatewayResult}.
 */
class GatewayResultTest {

    @Test
    void testFromHttpStatus_Success() {
        GatewayResult result = GatewayResult.fromHttpStatus(200, "{}");
        assertTrue(result.success());
        assertNull(result.failureKind());
    }

    @Test
    void testFromHttpStatus_GoneTargetsAreInvalid() {
        assertEquals(FailureKind.INVALID_TARGET, GatewayResult.fromHttpStatus(404, "").failureKind());
        assertEquals(FailureKind.INVALID_TARGET, GatewayResult.fromHttpStatus(410, "").failureKind());
    }

    @Test
    void testFromHttpStatus_RetryableStatusesAreTransient() {
        for (int status : new int[] { 408, 429, 500, 502, 503 }) {
            GatewayResult result = GatewayResult.fromHttpStatus(status, "busy");
            assertFalse(result.success());
            assertEquals(FailureKind.TRANSIENT, result.failureKind(), "status " + status);
        }
    }

    @Test
    void testFromHttpStatus_OtherClientErrorsAreUnknown() {
        GatewayResult result = GatewayResult.fromHttpStatus(401, "unauthorized");
        assertEquals(FailureKind.UNKNOWN, result.failureKind());
        assertNotNull(result.error());
    }
}

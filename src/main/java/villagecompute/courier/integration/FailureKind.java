package villagecompute.courier.integration;

/**
 * Classification of a failed gateway send, used by the dispatcher to choose between deactivation, retry and plain
 * failure.
 */
public enum FailureKind {
    /**
     * The target is permanently unusable (unregistered device token, unknown mailbox, invalid number). The target is
     * deactivated and the attempt counts as a permanent failure.
     */
    INVALID_TARGET,

    /**
     * Timeouts, rate limits and 5xx responses. The request is released for a later attempt.
     */
    TRANSIENT,

    /**
     * Anything the gateway could not classify.
     */
    UNKNOWN
}

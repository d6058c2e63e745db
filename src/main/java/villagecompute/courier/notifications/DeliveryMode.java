package villagecompute.courier.notifications;

/**
 * How a multi-channel request uses its channel list.
 */
public enum DeliveryMode {
    /**
     * Try channels in listed order and stop at the first channel that delivers.
     */
    FALLBACK,

    /**
     * Send on every listed channel that has an eligible target.
     */
    ALL
}

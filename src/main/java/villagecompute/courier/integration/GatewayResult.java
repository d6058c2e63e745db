package villagecompute.courier.integration;

/**
 * Outcome of one gateway send.
 *
 * @param success
 *            whether the gateway accepted the message
 * @param failureKind
 *            classification of the failure, null on success
 * @param error
 *            gateway error text, null on success
 */
public record GatewayResult(boolean success, FailureKind failureKind, String error) {

    private static final GatewayResult OK = new GatewayResult(true, null, null);

    public static GatewayResult ok() {
        return OK;
    }

    public static GatewayResult invalidTarget(String error) {
        return new GatewayResult(false, FailureKind.INVALID_TARGET, error);
    }

    public static GatewayResult transientFailure(String error) {
        return new GatewayResult(false, FailureKind.TRANSIENT, error);
    }

    public static GatewayResult unknownFailure(String error) {
        return new GatewayResult(false, FailureKind.UNKNOWN, error);
    }

    /**
     * Maps an HTTP status of a gateway API to a result: 2xx succeeds, 404/410 mean the target is gone, 408/429/5xx are
     * transient.
     */
    public static GatewayResult fromHttpStatus(int status, String body) {
        if (status >= 200 && status < 300) {
            return ok();
        }
        String error = "HTTP " + status + (body == null || body.isBlank() ? "" : ": " + abbreviate(body));
        if (status == 404 || status == 410) {
            return invalidTarget(error);
        }
        if (status == 408 || status == 429 || status >= 500) {
            return transientFailure(error);
        }
        return unknownFailure(error);
    }

    private static String abbreviate(String body) {
        String trimmed = body.strip();
        return trimmed.length() <= 200 ? trimmed : trimmed.substring(0, 200);
    }
}

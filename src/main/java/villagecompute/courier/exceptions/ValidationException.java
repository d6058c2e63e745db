package villagecompute.courier.exceptions;

/**
 * Exception thrown when a job definition, job parameters or a notification request is rejected before anything is
 * scheduled or queued (bad schedule, unknown template, empty channel list).
 *
 * <p>
 * Mapped to HTTP 400 Bad Request by the admin resources.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}

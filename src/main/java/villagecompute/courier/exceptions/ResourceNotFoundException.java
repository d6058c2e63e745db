package villagecompute.courier.exceptions;

/**
 * Exception thrown when a job or notification referenced by id does not exist (or was soft-deleted).
 *
 * <p>
 * Mapped to HTTP 404 Not Found by the admin resources.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}

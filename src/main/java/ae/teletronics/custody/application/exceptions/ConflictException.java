package ae.teletronics.custody.application.exceptions;

/**
 * Thrown when a concurrent modification conflict occurs or a fresh identifier
 * could not be allocated. The caller may retry.
 * Typically mapped to HTTP 409 Conflict.
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}

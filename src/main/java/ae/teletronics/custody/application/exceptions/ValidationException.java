package ae.teletronics.custody.application.exceptions;

/**
 * Malformed input. Extends IllegalArgumentException so generic bad-request handling applies.
 */
public class ValidationException extends IllegalArgumentException {
    public ValidationException(String message) { super(message); }
}

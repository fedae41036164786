package ae.teletronics.custody.application.exceptions;

/**
 * The id or code does not resolve. Inactive and expired records are reported the
 * same way as ids that never existed.
 */
public class NotFoundException extends RuntimeException {
    public NotFoundException(String message) { super(message); }
}

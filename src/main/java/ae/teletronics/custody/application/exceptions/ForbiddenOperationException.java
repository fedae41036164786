package ae.teletronics.custody.application.exceptions;

/** The acting user is not allowed to perform the operation (not the owner, banned, not an admin). */
public class ForbiddenOperationException extends RuntimeException {
    public ForbiddenOperationException(String message) { super(message); }
}

package ae.teletronics.custody.application.exceptions;

/**
 * The remote blob store could not be reached or rejected the request.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}

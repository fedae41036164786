package ae.teletronics.custody.application.exceptions;

/**
 * The remote blob store did not answer in time. The outcome on the remote side is
 * unknown, so callers must not blindly retry an upload.
 */
public class TransportTimeoutException extends TransportException {

    public TransportTimeoutException(String message) {
        super(message);
    }

    public TransportTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}

package gmail.cleanup.app.exception;

/**
 * A call to the Gmail API failed at the network or HTTP level.
 */
public class TransportException extends RuntimeException {
    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}

package gmail.cleanup.app.exception;

/**
 * Credentials are missing, invalid or expired. Fatal to the current sync run.
 */
public class AuthException extends RuntimeException {
    public AuthException(String message) {
        super(message);
    }

    public AuthException(String message, Throwable cause) {
        super(message, cause);
    }
}

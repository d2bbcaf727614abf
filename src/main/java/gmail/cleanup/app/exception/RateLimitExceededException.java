package gmail.cleanup.app.exception;

/**
 * Gmail signalled throttling (HTTP 429 or a 403 rate limit reason).
 * Kept separate from plain transport failures so callers can back off the rate limiter.
 */
public class RateLimitExceededException extends TransportException {
    public RateLimitExceededException(String message, Throwable cause) {
        super(message, cause);
    }
}

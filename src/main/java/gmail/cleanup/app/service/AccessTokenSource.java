package gmail.cleanup.app.service;

/**
 * Supplies a currently valid Gmail access token. Called before each remote call so that
 * long-running work picks up refreshed tokens.
 */
@FunctionalInterface
public interface AccessTokenSource {
    /**
     * @return a non-expired access token
     * @throws gmail.cleanup.app.exception.AuthException if no valid token can be obtained
     */
    String getAccessToken();
}

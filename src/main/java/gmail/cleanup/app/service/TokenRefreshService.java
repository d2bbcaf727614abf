package gmail.cleanup.app.service;

import gmail.cleanup.app.exception.AuthException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.security.oauth2.client.OAuth2AuthorizeRequest;
import org.springframework.security.oauth2.client.OAuth2AuthorizedClient;
import org.springframework.security.oauth2.client.OAuth2AuthorizedClientManager;
import org.springframework.security.oauth2.client.authentication.OAuth2AuthenticationToken;
import org.springframework.stereotype.Service;

/**
 * Hands out Gmail access tokens for the signed-in user, refreshing them when they expire.
 * The returned {@link AccessTokenSource} does not depend on the request thread, so background
 * sync and trash work keep using fresh tokens after the request that started them has finished.
 */
@Slf4j
@Service
public class TokenRefreshService {
    static final String DEFAULT_REGISTRATION_ID = "google";

    private final OAuth2AuthorizedClientManager authorizedClientManager;

    public TokenRefreshService(OAuth2AuthorizedClientManager authorizedClientManager) {
        this.authorizedClientManager = authorizedClientManager;
    }

    /**
     * Builds a token source bound to the given authentication.
     * @throws AuthException if the request is not authenticated
     */
    public AccessTokenSource tokenSourceFor(Authentication authentication) {
        if (authentication == null || !authentication.isAuthenticated()) {
            throw new AuthException("Not signed in");
        }
        String registrationId = authentication instanceof OAuth2AuthenticationToken
            ? ((OAuth2AuthenticationToken) authentication).getAuthorizedClientRegistrationId()
            : DEFAULT_REGISTRATION_ID;
        String principalName = authentication.getName();
        return () -> ensureValidAccessToken(registrationId, principalName);
    }

    /**
     * Returns a valid access token for the principal, refreshing it with the refresh token if it
     * is expired or about to expire.
     */
    public String ensureValidAccessToken(String registrationId, String principalName) {
        OAuth2AuthorizeRequest request = OAuth2AuthorizeRequest.withClientRegistrationId(registrationId)
            .principal(principalName)
            .build();
        OAuth2AuthorizedClient client;
        try {
            client = authorizedClientManager.authorize(request);
        } catch (RuntimeException e) {
            log.error("Failed to refresh access token for {}: {}", principalName, e.getMessage(), e);
            throw new AuthException("Failed to refresh access token for " + principalName + ". Please sign in again.", e);
        }
        if (client == null || client.getAccessToken() == null) {
            throw new AuthException("No authorized Gmail client for " + principalName + ". Please sign in again.");
        }
        return client.getAccessToken().getTokenValue();
    }
}

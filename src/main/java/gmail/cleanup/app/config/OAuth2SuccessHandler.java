package gmail.cleanup.app.config;

import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.core.Authentication;
import org.springframework.security.oauth2.client.OAuth2AuthorizedClient;
import org.springframework.security.oauth2.client.OAuth2AuthorizedClientService;
import org.springframework.security.oauth2.client.authentication.OAuth2AuthenticationToken;
import org.springframework.security.oauth2.core.user.OAuth2User;
import org.springframework.security.web.authentication.SimpleUrlAuthenticationSuccessHandler;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Logs the signed-in mailbox and warns when Google granted no refresh token, in which case
 * sync runs will fail with an authentication error once the access token expires.
 */
@Slf4j
@Component
public class OAuth2SuccessHandler extends SimpleUrlAuthenticationSuccessHandler {
    private final OAuth2AuthorizedClientService authorizedClientService;

    public OAuth2SuccessHandler(
            OAuth2AuthorizedClientService authorizedClientService,
            @Value("${cleanup.home-url:/api/account}") String homeUrl) {
        this.authorizedClientService = authorizedClientService;
        setDefaultTargetUrl(homeUrl);
    }

    @Override
    public void onAuthenticationSuccess(HttpServletRequest request, HttpServletResponse response,
                                        Authentication authentication) throws IOException, ServletException {
        if (authentication instanceof OAuth2AuthenticationToken) {
            OAuth2AuthenticationToken oauthToken = (OAuth2AuthenticationToken) authentication;

            OAuth2AuthorizedClient client = authorizedClientService.loadAuthorizedClient(
                oauthToken.getAuthorizedClientRegistrationId(),
                oauthToken.getName()
            );

            OAuth2User oauth2User = oauthToken.getPrincipal();
            String email = oauth2User.getAttribute("email");
            if (client == null) {
                log.warn("Signed in {} but no authorized client was stored", email);
            } else if (client.getRefreshToken() == null) {
                log.warn("No refresh token granted for {}; long sync runs will stop when the access token expires", email);
            } else {
                log.info("Signed in {}", email);
            }
        }

        super.onAuthenticationSuccess(request, response, authentication);
    }
}

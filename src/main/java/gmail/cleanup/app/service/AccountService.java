package gmail.cleanup.app.service;

import gmail.cleanup.app.model.AccountInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Mailbox profile lookups, proxied straight to Gmail on every call.
 */
@Slf4j
@Service
public class AccountService {
    private final MailApiService mailApiService;
    private final RateLimiter rateLimiter;

    public AccountService(MailApiService mailApiService, RateLimiter rateLimiter) {
        this.mailApiService = mailApiService;
        this.rateLimiter = rateLimiter;
    }

    public AccountInfo getAccountInfo(AccessTokenSource tokens) throws InterruptedException {
        try (RateLimiter.Permit permit = rateLimiter.acquire()) {
            AccountInfo info = mailApiService.getAccountInfo(tokens.getAccessToken());
            log.debug("Fetched profile for {}: {} messages", info.getEmailAddress(), info.getTotalMessages());
            return info;
        }
    }
}

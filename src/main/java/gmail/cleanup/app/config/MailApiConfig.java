package gmail.cleanup.app.config;

import gmail.cleanup.app.service.RateLimiter;
import gmail.cleanup.app.service.SyncSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Rate budget and scan tuning for Gmail API access.
 * Gmail allows 250 quota units per user per second; a messages.get costs 5 units and a batch of
 * 100 of them counts per inner request, so the defaults stay well below the limit.
 */
@Slf4j
@Configuration
public class MailApiConfig {

    @Bean
    public RateLimiter gmailRateLimiter(
            @Value("${cleanup.rate-limit.max-concurrency:4}") int maxConcurrency,
            @Value("${cleanup.rate-limit.max-requests:20}") int maxRequests,
            @Value("${cleanup.rate-limit.window:1s}") Duration window) {
        log.info("Gmail rate limit: {} concurrent calls, {} calls per {} ms", maxConcurrency, maxRequests, window.toMillis());
        return new RateLimiter(maxConcurrency, maxRequests, window);
    }

    @Bean
    public SyncSettings syncSettings(
            @Value("${cleanup.sync.max-messages:50000}") int maxMessages,
            @Value("${cleanup.sync.fetch-batch-size:100}") int fetchBatchSize,
            @Value("${cleanup.sync.max-retries:3}") int maxRetries,
            @Value("${cleanup.sync.initial-backoff:500ms}") Duration initialBackoff,
            @Value("${cleanup.sync.stale-after:0}") Duration staleAfter) {
        if (maxMessages < 1) {
            throw new IllegalArgumentException("cleanup.sync.max-messages must be positive");
        }
        if (fetchBatchSize < 1) {
            throw new IllegalArgumentException("cleanup.sync.fetch-batch-size must be positive");
        }
        return SyncSettings.builder()
                .maxMessages(maxMessages)
                .fetchBatchSize(fetchBatchSize)
                .maxRetries(Math.max(0, maxRetries))
                .initialBackoff(initialBackoff)
                .staleAfter(staleAfter)
                .build();
    }
}

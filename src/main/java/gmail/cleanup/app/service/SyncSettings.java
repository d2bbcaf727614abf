package gmail.cleanup.app.service;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Tuning of the mailbox scan, bound from the {@code cleanup.sync.*} properties.
 */
@Value
@Builder
public class SyncSettings {
    int maxMessages;
    int fetchBatchSize;
    int maxRetries;
    Duration initialBackoff;
    /**
     * Age after which a cached record is fetched again; zero disables re-fetching.
     */
    Duration staleAfter;
}

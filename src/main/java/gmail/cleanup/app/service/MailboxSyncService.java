package gmail.cleanup.app.service;

import gmail.cleanup.app.entity.SyncStatus;
import gmail.cleanup.app.exception.AuthException;
import gmail.cleanup.app.exception.PartialBatchFailureException;
import gmail.cleanup.app.exception.RateLimitExceededException;
import gmail.cleanup.app.exception.StorageException;
import gmail.cleanup.app.exception.TransportException;
import gmail.cleanup.app.model.AccountInfo;
import gmail.cleanup.app.model.MessageIdPage;
import gmail.cleanup.app.model.MessageRecord;
import gmail.cleanup.app.model.SyncStartResult;
import gmail.cleanup.app.model.SyncStatusView;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Background scan of the mailbox into the local cache.
 *
 * <p>Lists message ids page by page, fetches headers only for ids that are not cached yet
 * (or are stale), and writes each batch to the {@link MessageCacheStore} before moving on.
 * At most one run is active at a time. Progress is published through {@link SyncStateHolder}.
 */
@Slf4j
@Service
public class MailboxSyncService {
    private final MailApiService mailApiService;
    private final MessageCacheStore cacheStore;
    private final RateLimiter rateLimiter;
    private final SyncStateHolder stateHolder;
    private final Executor syncExecutor;
    private final SyncSettings settings;

    private CancellationToken currentCancellation;

    public MailboxSyncService(
            MailApiService mailApiService,
            MessageCacheStore cacheStore,
            RateLimiter rateLimiter,
            SyncStateHolder stateHolder,
            @Qualifier("syncExecutor") Executor syncExecutor,
            SyncSettings settings) {
        this.mailApiService = mailApiService;
        this.cacheStore = cacheStore;
        this.rateLimiter = rateLimiter;
        this.stateHolder = stateHolder;
        this.syncExecutor = syncExecutor;
        this.settings = settings;
    }

    /**
     * Starts a new run unless one is already running. Returns immediately; the scan runs on the
     * sync executor.
     */
    public synchronized SyncStartResult start(AccessTokenSource tokens) {
        if (stateHolder.current().getStatus() == SyncStatus.RUNNING) {
            log.info("Sync start requested while a run is in progress, ignoring");
            return SyncStartResult.ALREADY_RUNNING;
        }

        SyncState state = SyncState.running(settings.getMaxMessages(), Instant.now());
        CancellationToken cancellation = new CancellationToken();
        stateHolder.replace(state);
        currentCancellation = cancellation;

        try {
            syncExecutor.execute(() -> runScan(tokens, state, cancellation));
        } catch (RejectedExecutionException e) {
            log.error("Could not schedule sync run: {}", e.getMessage(), e);
            state.fail("Sync could not be scheduled: " + e.getMessage(), Instant.now());
        }
        return SyncStartResult.STARTED;
    }

    /**
     * Asks the running scan to finish after its current batch.
     * @return false if no run was in progress
     */
    public synchronized boolean stop() {
        SyncState state = stateHolder.current();
        if (currentCancellation == null || state.getStatus() != SyncStatus.RUNNING) {
            return false;
        }
        log.info("Stop requested for running sync");
        state.setPhase("Stopping...");
        currentCancellation.cancel();
        return true;
    }

    public SyncStatusView status() {
        return stateHolder.current().snapshot();
    }

    void runScan(AccessTokenSource tokens, SyncState state, CancellationToken cancellation) {
        log.info("Mailbox sync started, scanning up to {} messages", settings.getMaxMessages());
        try {
            estimateTotal(tokens, state);
            boolean exhausted = scan(tokens, state, cancellation);
            state.complete(Instant.now(), exhausted, cancellation.isCancelled());
            SyncStatusView done = state.snapshot();
            log.info("Mailbox sync finished: {} scanned, {} fetched, {} skipped{}",
                    done.getScannedCount(), done.getFetchedCount(), done.getSkippedCount(),
                    done.isStoppedByUser() ? " (stopped by user)" : "");
        } catch (AuthException e) {
            log.error("Mailbox sync aborted, authentication failed: {}", e.getMessage());
            state.fail("Authentication failed: " + e.getMessage(), Instant.now());
        } catch (StorageException e) {
            log.error("Mailbox sync aborted, cache write failed: {}", e.getMessage(), e);
            state.fail(e.getMessage(), Instant.now());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Mailbox sync interrupted");
            state.fail("Sync interrupted", Instant.now());
        } catch (RuntimeException e) {
            log.error("Mailbox sync failed: {}", e.getMessage(), e);
            state.fail(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), Instant.now());
        }
    }

    private void estimateTotal(AccessTokenSource tokens, SyncState state) throws InterruptedException {
        try {
            AccountInfo account = withPermit(() -> mailApiService.getAccountInfo(tokens.getAccessToken()));
            if (account.getTotalMessages() != null) {
                state.estimateTotal(account.getTotalMessages());
            }
        } catch (RateLimitExceededException e) {
            rateLimiter.backOff(settings.getInitialBackoff());
            log.warn("Could not read mailbox size, using scan ceiling: {}", e.getMessage());
        } catch (TransportException e) {
            log.warn("Could not read mailbox size, using scan ceiling: {}", e.getMessage());
        }
    }

    /**
     * @return true if the listing was exhausted, false if the ceiling was reached or the run was stopped
     */
    private boolean scan(AccessTokenSource tokens, SyncState state, CancellationToken cancellation) throws InterruptedException {
        String cursor = null;
        while (!cancellation.isCancelled()) {
            int remaining = settings.getMaxMessages() - state.getScannedCount();
            if (remaining <= 0) {
                log.info("Scan ceiling of {} messages reached", settings.getMaxMessages());
                return false;
            }

            state.setPhase("Listing messages...");
            MessageIdPage page = listPage(tokens, cursor, Math.min(MailApiService.MAX_PAGE_SIZE, remaining), cancellation);
            if (page == null) {
                return false;
            }
            List<String> ids = page.getIds();
            boolean truncated = ids.size() > remaining;
            if (truncated) {
                ids = ids.subList(0, remaining);
            }

            if (!processPage(tokens, state, ids, cancellation)) {
                return false;
            }
            cursor = page.getNextCursor();
            state.setCursor(cursor);

            if (page.isDone() && !truncated) {
                return true;
            }
        }
        return false;
    }

    private MessageIdPage listPage(AccessTokenSource tokens, String cursor, int pageSize, CancellationToken cancellation) throws InterruptedException {
        for (int attempt = 0; ; attempt++) {
            try {
                return withPermit(() -> mailApiService.listMessageIds(tokens.getAccessToken(), cursor, pageSize));
            } catch (TransportException e) {
                if (attempt >= settings.getMaxRetries()) {
                    throw new TransportException("Listing messages failed after " + (attempt + 1) + " attempts: " + e.getMessage(), e);
                }
                log.warn("Listing messages failed (attempt {}), retrying: {}", attempt + 1, e.getMessage());
                if (waitBeforeRetry(e, attempt, cancellation)) {
                    return null;
                }
            }
        }
    }

    /**
     * Fetches and stores the uncached ids of one listing page, batch by batch in listing order.
     * @return false if the run was stopped before the page was finished
     */
    private boolean processPage(AccessTokenSource tokens, SyncState state, List<String> ids, CancellationToken cancellation) throws InterruptedException {
        Set<String> cached = cacheStore.findCachedIds(ids, staleCutoff());
        List<String> missing = new ArrayList<>();
        for (String id : ids) {
            if (!cached.contains(id)) {
                missing.add(id);
            }
        }
        state.advance(ids.size() - missing.size());
        log.debug("Listed {} ids, {} already cached, {} to fetch", ids.size(), ids.size() - missing.size(), missing.size());

        int batchSize = Math.min(settings.getFetchBatchSize(), MailApiService.MAX_BATCH_SIZE);
        for (int i = 0; i < missing.size(); i += batchSize) {
            if (cancellation.isCancelled()) {
                return false;
            }
            List<String> batch = missing.subList(i, Math.min(i + batchSize, missing.size()));
            fetchBatch(tokens, state, batch, cancellation);

            SyncStatusView progress = state.snapshot();
            state.setPhase("Fetching details... " + progress.getScannedCount() + "/" + progress.getTotalToScan());
        }
        return !cancellation.isCancelled();
    }

    /**
     * Fetches one batch with retries, stores what was fetched and skips what kept failing.
     */
    private void fetchBatch(AccessTokenSource tokens, SyncState state, List<String> batch, CancellationToken cancellation) throws InterruptedException {
        List<MessageRecord> fetched = new ArrayList<>();
        List<String> outstanding = new ArrayList<>(batch);
        String lastError = null;

        for (int attempt = 0; !outstanding.isEmpty(); attempt++) {
            List<String> request = List.copyOf(outstanding);
            RuntimeException failure = null;
            try {
                fetched.addAll(withPermit(() -> mailApiService.fetchHeaders(tokens.getAccessToken(), request)));
                outstanding.clear();
                break;
            } catch (PartialBatchFailureException e) {
                fetched.addAll(e.getFetched());
                outstanding.retainAll(e.getFailures().keySet());
                lastError = e.getFailures().values().iterator().next();
                failure = e;
            } catch (TransportException e) {
                lastError = e.getMessage();
                failure = e;
            }
            if (attempt >= settings.getMaxRetries()) {
                break;
            }
            log.debug("Header fetch for {} ids failed (attempt {}), retrying: {}", outstanding.size(), attempt + 1, lastError);
            if (waitBeforeRetry(failure, attempt, cancellation)) {
                break;
            }
        }

        cacheStore.upsert(fetched);
        state.recordFetched(fetched.size());
        if (!outstanding.isEmpty()) {
            log.warn("Skipping {} messages after repeated header fetch failures: {}", outstanding.size(), lastError);
            state.recordSkipped(outstanding.size(), "Skipped " + outstanding.size() + " messages: " + lastError);
        }
        state.advance(batch.size());
    }

    /**
     * Sleeps with exponential back-off; throttling also slows the shared rate limiter.
     * @return true if the run was stopped while waiting
     */
    private boolean waitBeforeRetry(RuntimeException failure, int attempt, CancellationToken cancellation) throws InterruptedException {
        Duration delay = settings.getInitialBackoff().multipliedBy(1L << Math.min(attempt, 10));
        if (failure instanceof RateLimitExceededException) {
            rateLimiter.backOff(delay);
        }
        return cancellation.awaitCancellation(delay);
    }

    private Instant staleCutoff() {
        Duration staleAfter = settings.getStaleAfter();
        if (staleAfter == null || staleAfter.isZero() || staleAfter.isNegative()) {
            return null;
        }
        return Instant.now().minus(staleAfter);
    }

    private <T> T withPermit(Supplier<T> call) throws InterruptedException {
        try (RateLimiter.Permit permit = rateLimiter.acquire()) {
            return call.get();
        }
    }
}

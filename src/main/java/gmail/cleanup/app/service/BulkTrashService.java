package gmail.cleanup.app.service;

import gmail.cleanup.app.exception.AuthException;
import gmail.cleanup.app.exception.RateLimitExceededException;
import gmail.cleanup.app.exception.StorageException;
import gmail.cleanup.app.exception.TransportException;
import gmail.cleanup.app.model.DeleteResult;
import gmail.cleanup.app.model.TrashOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Moves messages to Trash in rate-limited chunks.
 *
 * <p>Chunks may run concurrently on the trash executor. Each completed chunk removes its
 * successfully trashed ids from the cache right away, so an interrupted call leaves the cache
 * matching whatever Gmail actually trashed. Failed chunks are not retried; callers may resubmit
 * the failed ids.
 */
@Slf4j
@Service
public class BulkTrashService {
    private final MailApiService mailApiService;
    private final MessageCacheStore cacheStore;
    private final RateLimiter rateLimiter;
    private final Executor trashExecutor;
    private final int chunkSize;
    private final Duration throttleBackoff;

    public BulkTrashService(
            MailApiService mailApiService,
            MessageCacheStore cacheStore,
            RateLimiter rateLimiter,
            @Qualifier("trashExecutor") Executor trashExecutor,
            @Value("${cleanup.trash.batch-size:100}") int chunkSize,
            @Value("${cleanup.trash.throttle-backoff:2s}") Duration throttleBackoff) {
        if (chunkSize < 1 || chunkSize > MailApiService.MAX_BATCH_SIZE) {
            throw new IllegalArgumentException("cleanup.trash.batch-size must be between 1 and " + MailApiService.MAX_BATCH_SIZE);
        }
        this.mailApiService = mailApiService;
        this.cacheStore = cacheStore;
        this.rateLimiter = rateLimiter;
        this.trashExecutor = trashExecutor;
        this.chunkSize = chunkSize;
        this.throttleBackoff = throttleBackoff;
    }

    /**
     * Trashes the given messages.
     * @return number trashed and the ids that failed, in input order
     * @throws StorageException if the cache could not be updated; chunks not yet started are skipped
     */
    public DeleteResult delete(AccessTokenSource tokens, List<String> messageIds) {
        List<String> unique = messageIds == null ? List.of() : messageIds.stream()
                .filter(Objects::nonNull)
                .distinct()
                .collect(Collectors.toList());
        if (unique.isEmpty()) {
            return new DeleteResult(0, List.of());
        }

        List<List<String>> chunks = new ArrayList<>();
        for (int i = 0; i < unique.size(); i += chunkSize) {
            chunks.add(unique.subList(i, Math.min(i + chunkSize, unique.size())));
        }
        log.info("Trashing {} messages in {} chunks", unique.size(), chunks.size());

        AtomicBoolean aborted = new AtomicBoolean();
        List<CompletableFuture<Set<String>>> futures = chunks.stream()
                .map(chunk -> CompletableFuture.supplyAsync(() -> trashChunk(tokens, chunk, aborted), trashExecutor))
                .collect(Collectors.toList());

        // Every chunk is joined before any failure is rethrown, so no chunk is still running on return
        Set<String> trashed = new HashSet<>();
        StorageException storageFailure = null;
        RuntimeException unexpectedFailure = null;
        for (CompletableFuture<Set<String>> future : futures) {
            try {
                trashed.addAll(future.join());
            } catch (CompletionException e) {
                if (e.getCause() instanceof StorageException) {
                    storageFailure = storageFailure != null ? storageFailure : (StorageException) e.getCause();
                } else if (unexpectedFailure == null) {
                    unexpectedFailure = e.getCause() instanceof RuntimeException ? (RuntimeException) e.getCause() : e;
                }
            }
        }
        if (storageFailure != null) {
            log.error("Trash aborted after cache update failure, {} messages trashed before the failure", trashed.size());
            throw storageFailure;
        }
        if (unexpectedFailure != null) {
            log.error("Trash failed, {} messages trashed and removed from cache before the failure: {}",
                    trashed.size(), unexpectedFailure.getMessage(), unexpectedFailure);
            throw unexpectedFailure;
        }

        List<String> failed = unique.stream()
                .filter(id -> !trashed.contains(id))
                .collect(Collectors.toList());
        log.info("Trash completed: {} succeeded, {} failed out of {} total", trashed.size(), failed.size(), unique.size());
        return new DeleteResult(trashed.size(), failed);
    }

    /**
     * @return ids of the chunk that Gmail reported as trashed
     */
    private Set<String> trashChunk(AccessTokenSource tokens, List<String> chunk, AtomicBoolean aborted) {
        if (aborted.get()) {
            return Set.of();
        }

        Map<String, TrashOutcome> outcomes;
        try (RateLimiter.Permit permit = rateLimiter.acquire()) {
            outcomes = mailApiService.trash(tokens.getAccessToken(), chunk);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Trash of {} messages interrupted", chunk.size());
            return Set.of();
        } catch (RateLimitExceededException e) {
            rateLimiter.backOff(throttleBackoff);
            log.error("Gmail throttled trash of {} messages: {}", chunk.size(), e.getMessage());
            return Set.of();
        } catch (TransportException | AuthException e) {
            log.error("Error trashing {} messages: {}", chunk.size(), e.getMessage());
            return Set.of();
        }

        Set<String> succeeded = new LinkedHashSet<>();
        for (String id : chunk) {
            TrashOutcome outcome = outcomes.get(id);
            if (outcome != null && outcome.isSuccess()) {
                succeeded.add(id);
            } else {
                log.warn("Message {} was not trashed: {}", id, outcome != null ? outcome.getReason() : "no result returned");
            }
        }

        if (!succeeded.isEmpty()) {
            try {
                cacheStore.remove(succeeded);
            } catch (StorageException e) {
                aborted.set(true);
                throw e;
            }
        }
        return succeeded;
    }
}

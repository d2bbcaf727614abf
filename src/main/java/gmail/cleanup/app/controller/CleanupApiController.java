package gmail.cleanup.app.controller;

import gmail.cleanup.app.entity.MessageCategory;
import gmail.cleanup.app.exception.AuthException;
import gmail.cleanup.app.exception.RateLimitExceededException;
import gmail.cleanup.app.exception.TransportException;
import gmail.cleanup.app.model.DeleteRequest;
import gmail.cleanup.app.model.DeleteResult;
import gmail.cleanup.app.model.StatsFilter;
import gmail.cleanup.app.model.SyncStartResult;
import gmail.cleanup.app.service.AccessTokenSource;
import gmail.cleanup.app.service.AccountService;
import gmail.cleanup.app.service.BulkTrashService;
import gmail.cleanup.app.service.MailboxSyncService;
import gmail.cleanup.app.service.MessageCacheStore;
import gmail.cleanup.app.service.SenderStatsService;
import gmail.cleanup.app.service.TokenRefreshService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * JSON endpoints for the cleanup dashboard: sync control, account info, sender stats,
 * cache reset and bulk trash.
 */
@Slf4j
@RestController
@RequestMapping("/api")
public class CleanupApiController {
    static final int DEFAULT_MAX_RESULTS = 2000;

    private final MailboxSyncService mailboxSyncService;
    private final SenderStatsService senderStatsService;
    private final BulkTrashService bulkTrashService;
    private final AccountService accountService;
    private final MessageCacheStore cacheStore;
    private final TokenRefreshService tokenRefreshService;

    public CleanupApiController(
            MailboxSyncService mailboxSyncService,
            SenderStatsService senderStatsService,
            BulkTrashService bulkTrashService,
            AccountService accountService,
            MessageCacheStore cacheStore,
            TokenRefreshService tokenRefreshService) {
        this.mailboxSyncService = mailboxSyncService;
        this.senderStatsService = senderStatsService;
        this.bulkTrashService = bulkTrashService;
        this.accountService = accountService;
        this.cacheStore = cacheStore;
        this.tokenRefreshService = tokenRefreshService;
    }

    @PostMapping("/sync/start")
    public ResponseEntity<?> startSync(Authentication authentication) {
        try {
            AccessTokenSource tokens = tokenRefreshService.tokenSourceFor(authentication);
            SyncStartResult result = mailboxSyncService.start(tokens);
            return ResponseEntity.ok(Map.of("status", result.getLabel()));
        } catch (Exception e) {
            return failure("start sync", e);
        }
    }

    @PostMapping("/sync/stop")
    public ResponseEntity<?> stopSync() {
        boolean stopping = mailboxSyncService.stop();
        return ResponseEntity.ok(Map.of("status", stopping ? "Stopping..." : "Not running"));
    }

    @GetMapping("/sync/status")
    public ResponseEntity<?> syncStatus() {
        return ResponseEntity.ok(mailboxSyncService.status());
    }

    @GetMapping("/account")
    public ResponseEntity<?> account(Authentication authentication) {
        try {
            return ResponseEntity.ok(accountService.getAccountInfo(tokenRefreshService.tokenSourceFor(authentication)));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Interrupted while reading account info");
        } catch (Exception e) {
            return failure("read account info", e);
        }
    }

    /**
     * Sender ranking over the local cache.
     * @param before   yyyy-MM-dd, only messages received before that day count
     * @param category primary, social, promotions, updates, forums, unknown or all
     */
    @GetMapping("/stats")
    public ResponseEntity<?> stats(
            @RequestParam(required = false) String before,
            @RequestParam(required = false) String category,
            @RequestParam(name = "max_results", required = false) String maxResults) {
        StatsFilter filter;
        int limit;
        try {
            LocalDate beforeDate = before == null || before.isBlank() ? null : LocalDate.parse(before.trim());
            filter = new StatsFilter(beforeDate, MessageCategory.fromParameter(category));
            limit = maxResults == null || maxResults.isBlank() ? DEFAULT_MAX_RESULTS : Integer.parseInt(maxResults.trim());
        } catch (DateTimeParseException e) {
            return error(HttpStatus.BAD_REQUEST, "Invalid date, expected yyyy-MM-dd: " + before);
        } catch (NumberFormatException e) {
            return error(HttpStatus.BAD_REQUEST, "Invalid max_results: " + maxResults);
        } catch (IllegalArgumentException e) {
            return error(HttpStatus.BAD_REQUEST, e.getMessage());
        }

        try {
            return ResponseEntity.ok(senderStatsService.compute(filter, limit));
        } catch (Exception e) {
            return failure("compute stats", e);
        }
    }

    @PostMapping("/cache/clear")
    public ResponseEntity<?> clearCache() {
        try {
            cacheStore.clear();
            log.info("Message cache cleared");
            return ResponseEntity.ok(Map.of("success", true));
        } catch (Exception e) {
            return failure("clear cache", e);
        }
    }

    @PostMapping("/delete")
    public ResponseEntity<?> delete(@RequestBody(required = false) DeleteRequest request, Authentication authentication) {
        List<String> ids = request != null && request.getIds() != null ? request.getIds() : List.of();
        if (ids.isEmpty()) {
            return ResponseEntity.ok(new DeleteResult(0, List.of()));
        }
        try {
            return ResponseEntity.ok(bulkTrashService.delete(tokenRefreshService.tokenSourceFor(authentication), ids));
        } catch (Exception e) {
            return failure("trash messages", e);
        }
    }

    private ResponseEntity<Map<String, String>> failure(String action, Exception e) {
        if (e instanceof IllegalArgumentException) {
            return error(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        if (e instanceof AuthException) {
            log.warn("Could not {}: {}", action, e.getMessage());
            return error(HttpStatus.UNAUTHORIZED, e.getMessage());
        }
        if (e instanceof RateLimitExceededException) {
            log.warn("Could not {}: {}", action, e.getMessage());
            return error(HttpStatus.TOO_MANY_REQUESTS, e.getMessage());
        }
        if (e instanceof TransportException) {
            log.error("Could not {}: {}", action, e.getMessage());
            return error(HttpStatus.BAD_GATEWAY, e.getMessage());
        }
        log.error("Could not {}: {}", action, e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message != null ? message : status.getReasonPhrase()));
    }
}

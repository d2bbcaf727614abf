package gmail.cleanup.app.service;

import gmail.cleanup.app.entity.MessageCategory;
import gmail.cleanup.app.entity.SyncStatus;
import gmail.cleanup.app.exception.AuthException;
import gmail.cleanup.app.exception.PartialBatchFailureException;
import gmail.cleanup.app.exception.StorageException;
import gmail.cleanup.app.exception.TransportException;
import gmail.cleanup.app.model.AccountInfo;
import gmail.cleanup.app.model.MessageIdPage;
import gmail.cleanup.app.model.MessageRecord;
import gmail.cleanup.app.model.SyncStartResult;
import gmail.cleanup.app.model.SyncStatusView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MailboxSyncServiceTest {
    private static final AccessTokenSource TOKENS = () -> "token";

    @Mock
    private MailApiService mailApiService;

    @Mock
    private MessageCacheStore cacheStore;

    private RateLimiter rateLimiter;
    private SyncStateHolder stateHolder;
    private List<Runnable> scheduled;

    @BeforeEach
    void setUp() {
        rateLimiter = new RateLimiter(4, 10_000, Duration.ofSeconds(1));
        stateHolder = new SyncStateHolder();
        scheduled = new ArrayList<>();
    }

    @Test
    void start_WhileRunning_ShouldReturnAlreadyRunningAndKeepState() {
        // Given
        MailboxSyncService syncService = service(settings(100, 10), scheduled::add);

        // When
        SyncStartResult first = syncService.start(TOKENS);
        SyncState running = stateHolder.current();
        SyncStartResult second = syncService.start(TOKENS);

        // Then
        assertEquals(SyncStartResult.STARTED, first);
        assertEquals(SyncStartResult.ALREADY_RUNNING, second);
        assertSame(running, stateHolder.current());
        assertEquals(1, scheduled.size());
        assertTrue(syncService.status().isRunning());
    }

    @Test
    void start_ShouldFetchOnlyUncachedIdsAndComplete() {
        // Given
        MailboxSyncService syncService = service(settings(100, 10), Runnable::run);
        givenMailboxSize(3);
        when(mailApiService.listMessageIds(eq("token"), isNull(), anyInt()))
                .thenReturn(new MessageIdPage(List.of("m1", "m2", "m3"), null, true));
        when(cacheStore.findCachedIds(List.of("m1", "m2", "m3"), null)).thenReturn(Set.of("m1"));
        List<MessageRecord> fetched = List.of(record("m2"), record("m3"));
        when(mailApiService.fetchHeaders("token", List.of("m2", "m3"))).thenReturn(fetched);

        // When
        SyncStartResult result = syncService.start(TOKENS);

        // Then
        assertEquals(SyncStartResult.STARTED, result);
        verify(cacheStore).upsert(fetched);
        verify(mailApiService, never()).fetchHeaders(eq("token"), argThat(ids -> ids.contains("m1")));
        SyncStatusView status = syncService.status();
        assertEquals(SyncStatus.COMPLETE, status.getStatus());
        assertEquals(3, status.getScannedCount());
        assertEquals(3, status.getTotalToScan());
        assertEquals(100, status.getPercent());
        assertEquals(2, status.getFetchedCount());
        assertFalse(status.isRunning());
        assertEquals(0, rateLimiter.outstanding());
    }

    @Test
    void start_AcrossPages_ShouldReportMonotonicProgress() {
        // Given
        MailboxSyncService syncService = service(settings(100, 2), Runnable::run);
        givenMailboxSize(4);
        when(mailApiService.listMessageIds(eq("token"), isNull(), anyInt()))
                .thenReturn(new MessageIdPage(List.of("a", "b"), "page-2", false));
        when(mailApiService.listMessageIds(eq("token"), eq("page-2"), anyInt()))
                .thenReturn(new MessageIdPage(List.of("c", "d"), null, true));
        when(mailApiService.fetchHeaders(eq("token"), anyList()))
                .thenAnswer(invocation -> {
                    List<String> ids = invocation.getArgument(1);
                    List<MessageRecord> records = new ArrayList<>();
                    ids.forEach(id -> records.add(record(id)));
                    return records;
                });
        List<Integer> observed = new ArrayList<>();
        doAnswer(invocation -> observed.add(stateHolder.current().getScannedCount()))
                .when(cacheStore).upsert(anyList());

        // When
        syncService.start(TOKENS);

        // Then
        assertEquals(List.of(0, 2), observed);
        SyncStatusView status = syncService.status();
        assertEquals(SyncStatus.COMPLETE, status.getStatus());
        assertEquals(4, status.getScannedCount());
        assertNull(status.getCursor());
    }

    @Test
    void start_WithPersistentFetchFailure_ShouldSkipBatchAfterRetries() {
        // Given
        MailboxSyncService syncService = service(settings(100, 2), Runnable::run);
        givenMailboxSize(4);
        when(mailApiService.listMessageIds(eq("token"), isNull(), anyInt()))
                .thenReturn(new MessageIdPage(List.of("a", "b", "c", "d"), null, true));
        when(mailApiService.fetchHeaders("token", List.of("a", "b")))
                .thenThrow(new TransportException("Failed to fetch message headers: HTTP 500"));
        when(mailApiService.fetchHeaders("token", List.of("c", "d")))
                .thenReturn(List.of(record("c"), record("d")));

        // When
        syncService.start(TOKENS);

        // Then
        verify(mailApiService, times(3)).fetchHeaders("token", List.of("a", "b"));
        SyncStatusView status = syncService.status();
        assertEquals(SyncStatus.COMPLETE, status.getStatus());
        assertEquals(4, status.getScannedCount());
        assertEquals(2, status.getSkippedCount());
        assertEquals(2, status.getFetchedCount());
        assertEquals(1, status.getErrors().size());
        assertTrue(status.getErrors().get(0).contains("HTTP 500"));
    }

    @Test
    void start_WithPartialBatchFailure_ShouldRetryOnlyFailedIds() {
        // Given
        MailboxSyncService syncService = service(settings(100, 10), Runnable::run);
        givenMailboxSize(2);
        when(mailApiService.listMessageIds(eq("token"), isNull(), anyInt()))
                .thenReturn(new MessageIdPage(List.of("a", "b"), null, true));
        when(mailApiService.fetchHeaders("token", List.of("a", "b")))
                .thenThrow(new PartialBatchFailureException(List.of(record("a")), Map.of("b", "500 Backend Error")));
        when(mailApiService.fetchHeaders("token", List.of("b")))
                .thenReturn(List.of(record("b")));

        // When
        syncService.start(TOKENS);

        // Then
        verify(cacheStore).upsert(List.of(record("a"), record("b")));
        SyncStatusView status = syncService.status();
        assertEquals(SyncStatus.COMPLETE, status.getStatus());
        assertEquals(0, status.getSkippedCount());
        assertEquals(2, status.getFetchedCount());
    }

    @Test
    void start_WithRejectedToken_ShouldEndInError() {
        // Given
        MailboxSyncService syncService = service(settings(100, 10), Runnable::run);
        givenMailboxSize(10);
        when(mailApiService.listMessageIds(eq("token"), isNull(), anyInt()))
                .thenThrow(new AuthException("Failed to list messages: HTTP 401 Unauthorized"));

        // When
        syncService.start(TOKENS);

        // Then
        SyncStatusView status = syncService.status();
        assertEquals(SyncStatus.ERROR, status.getStatus());
        assertTrue(status.getMessage().contains("401"));
        assertNotNull(status.getFinishedAt());
        verify(cacheStore, never()).upsert(anyList());
    }

    @Test
    void start_WhenCacheWriteFails_ShouldEndInError() {
        // Given
        MailboxSyncService syncService = service(settings(100, 2), Runnable::run);
        givenMailboxSize(4);
        when(mailApiService.listMessageIds(eq("token"), isNull(), anyInt()))
                .thenReturn(new MessageIdPage(List.of("a", "b", "c", "d"), null, true));
        when(mailApiService.fetchHeaders("token", List.of("a", "b")))
                .thenReturn(List.of(record("a"), record("b")));
        doThrow(new StorageException("Failed to upsert 2 messages: disk full", null))
                .when(cacheStore).upsert(anyList());

        // When
        syncService.start(TOKENS);

        // Then
        SyncStatusView status = syncService.status();
        assertEquals(SyncStatus.ERROR, status.getStatus());
        assertTrue(status.getMessage().contains("disk full"));
        assertEquals(0, status.getScannedCount());
        verify(mailApiService, never()).fetchHeaders("token", List.of("c", "d"));
        assertEquals(0, rateLimiter.outstanding());
    }

    @Test
    void start_AfterError_ShouldBeAllowedAgain() {
        // Given
        MailboxSyncService syncService = service(settings(100, 10), Runnable::run);
        givenMailboxSize(0);
        when(mailApiService.listMessageIds(eq("token"), isNull(), anyInt()))
                .thenThrow(new AuthException("expired"))
                .thenReturn(new MessageIdPage(List.of(), null, true));
        syncService.start(TOKENS);
        assertEquals(SyncStatus.ERROR, syncService.status().getStatus());

        // When
        SyncStartResult result = syncService.start(TOKENS);

        // Then
        assertEquals(SyncStartResult.STARTED, result);
        assertEquals(SyncStatus.COMPLETE, syncService.status().getStatus());
        assertEquals(100, syncService.status().getPercent());
    }

    @Test
    void start_WithListingFailingPastRetries_ShouldEndInError() {
        // Given
        MailboxSyncService syncService = service(settings(100, 10), Runnable::run);
        givenMailboxSize(10);
        when(mailApiService.listMessageIds(eq("token"), isNull(), anyInt()))
                .thenThrow(new TransportException("Failed to list messages: HTTP 503"));

        // When
        syncService.start(TOKENS);

        // Then
        verify(mailApiService, times(3)).listMessageIds(eq("token"), isNull(), anyInt());
        assertEquals(SyncStatus.ERROR, syncService.status().getStatus());
    }

    @Test
    void start_WithMailboxLargerThanCeiling_ShouldStopAtCeiling() {
        // Given
        MailboxSyncService syncService = service(settings(3, 10), Runnable::run);
        givenMailboxSize(5000);
        when(mailApiService.listMessageIds("token", null, 3))
                .thenReturn(new MessageIdPage(List.of("a", "b", "c", "d", "e"), "page-2", false));
        when(mailApiService.fetchHeaders("token", List.of("a", "b", "c")))
                .thenReturn(List.of(record("a"), record("b"), record("c")));

        // When
        syncService.start(TOKENS);

        // Then
        verify(mailApiService, times(1)).listMessageIds(anyString(), any(), anyInt());
        SyncStatusView status = syncService.status();
        assertEquals(SyncStatus.COMPLETE, status.getStatus());
        assertEquals(3, status.getScannedCount());
        assertEquals(3, status.getTotalToScan());
    }

    @Test
    void stop_WhileRunning_ShouldFinishWithStoppedByUser() {
        // Given
        MailboxSyncService syncService = service(settings(100, 10), scheduled::add);
        givenMailboxSize(10);
        syncService.start(TOKENS);

        // When
        boolean stopping = syncService.stop();
        scheduled.get(0).run();

        // Then
        assertTrue(stopping);
        SyncStatusView status = syncService.status();
        assertEquals(SyncStatus.COMPLETE, status.getStatus());
        assertTrue(status.isStoppedByUser());
        assertEquals(0, status.getPercent());
        verify(mailApiService, never()).listMessageIds(anyString(), any(), anyInt());
    }

    @Test
    void stop_WhenIdle_ShouldReturnFalse() {
        // Given
        MailboxSyncService syncService = service(settings(100, 10), Runnable::run);

        // When & Then
        assertFalse(syncService.stop());
        assertEquals(SyncStatus.IDLE, syncService.status().getStatus());
    }

    private MailboxSyncService service(SyncSettings settings, Executor executor) {
        return new MailboxSyncService(mailApiService, cacheStore, rateLimiter, stateHolder, executor, settings);
    }

    private void givenMailboxSize(long messages) {
        when(mailApiService.getAccountInfo("token"))
                .thenReturn(new AccountInfo("me@example.com", messages, messages, "1"));
    }

    private static SyncSettings settings(int maxMessages, int fetchBatchSize) {
        return SyncSettings.builder()
                .maxMessages(maxMessages)
                .fetchBatchSize(fetchBatchSize)
                .maxRetries(2)
                .initialBackoff(Duration.ZERO)
                .staleAfter(Duration.ZERO)
                .build();
    }

    private static MessageRecord record(String id) {
        return MessageRecord.builder()
                .id(id)
                .senderEmail("sender@example.com")
                .senderName("Sender")
                .receivedAt(Instant.parse("2022-06-01T10:00:00Z"))
                .category(MessageCategory.UPDATES)
                .threadId("t-" + id)
                .build();
    }
}

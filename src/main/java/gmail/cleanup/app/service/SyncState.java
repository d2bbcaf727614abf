package gmail.cleanup.app.service;

import gmail.cleanup.app.entity.SyncStatus;
import gmail.cleanup.app.model.SyncStatusView;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Progress of one sync run. Written only by {@link MailboxSyncService}; everyone else reads
 * immutable snapshots.
 */
public class SyncState {
    static final int MAX_ERRORS = 50;

    private final int maxMessages;
    private SyncStatus status;
    private int scannedCount;
    private int totalToScan;
    private int fetchedCount;
    private int skippedCount;
    private String cursor;
    private String phase;
    private String message;
    private final Instant startedAt;
    private Instant finishedAt;
    private boolean stoppedByUser;
    private final List<String> errors = new ArrayList<>();

    private SyncState(SyncStatus status, int maxMessages, int totalToScan, String phase, Instant startedAt) {
        this.status = status;
        this.maxMessages = maxMessages;
        this.totalToScan = totalToScan;
        this.phase = phase;
        this.startedAt = startedAt;
    }

    public static SyncState idle() {
        return new SyncState(SyncStatus.IDLE, 0, 0, "Idle", null);
    }

    /**
     * A fresh running state whose total starts at the scan ceiling until a better estimate is known.
     */
    public static SyncState running(int maxMessages, Instant startedAt) {
        return new SyncState(SyncStatus.RUNNING, maxMessages, maxMessages, "Starting sync...", startedAt);
    }

    public synchronized SyncStatus getStatus() {
        return status;
    }

    public synchronized int getScannedCount() {
        return scannedCount;
    }

    synchronized void estimateTotal(long messagesInMailbox) {
        long bounded = Math.min(messagesInMailbox, maxMessages);
        totalToScan = (int) Math.max(bounded, scannedCount);
    }

    /**
     * Counts {@code processed} more listed messages. Never moves past the scan ceiling.
     */
    synchronized void advance(int processed) {
        scannedCount = Math.min(scannedCount + processed, maxMessages);
        if (scannedCount > totalToScan) {
            totalToScan = scannedCount;
        }
    }

    synchronized void recordFetched(int count) {
        fetchedCount += count;
    }

    synchronized void recordSkipped(int count, String reason) {
        skippedCount += count;
        addError(reason);
    }

    synchronized void addError(String error) {
        if (errors.size() < MAX_ERRORS) {
            errors.add(error);
        }
    }

    synchronized void setCursor(String cursor) {
        this.cursor = cursor;
    }

    synchronized void setPhase(String phase) {
        this.phase = phase;
    }

    /**
     * Ends the run successfully. When the listing was exhausted the total shrinks to what was
     * actually found so progress reads 100%.
     */
    synchronized void complete(Instant now, boolean listingExhausted, boolean stopped) {
        status = SyncStatus.COMPLETE;
        finishedAt = now;
        stoppedByUser = stopped;
        if (listingExhausted) {
            totalToScan = scannedCount;
        }
        phase = stopped ? "Stopped by user" : "Complete";
    }

    synchronized void fail(String message, Instant now) {
        status = SyncStatus.ERROR;
        finishedAt = now;
        this.message = message;
        phase = "Error: " + message;
    }

    public synchronized SyncStatusView snapshot() {
        return SyncStatusView.builder()
            .status(status)
            .scannedCount(scannedCount)
            .totalToScan(totalToScan)
            .percent(percent())
            .phase(phase)
            .message(message)
            .cursor(cursor)
            .startedAt(startedAt)
            .finishedAt(finishedAt)
            .stoppedByUser(stoppedByUser)
            .fetchedCount(fetchedCount)
            .skippedCount(skippedCount)
            .errors(List.copyOf(errors))
            .build();
    }

    // Always relative to totalToScan, which starts at the ceiling and is narrowed by the profile
    private int percent() {
        if (status == SyncStatus.COMPLETE && !stoppedByUser) {
            return 100;
        }
        if (totalToScan <= 0) {
            return 0;
        }
        return (int) ((long) scannedCount * 100 / totalToScan);
    }
}

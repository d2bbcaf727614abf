package gmail.cleanup.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import gmail.cleanup.app.entity.SyncStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of a sync run, safe to hand to any number of pollers.
 */
@Value
@Builder
public class SyncStatusView {
    SyncStatus status;
    int scannedCount;
    int totalToScan;
    int percent;
    String phase;
    String message;
    String cursor;
    Instant startedAt;
    Instant finishedAt;
    boolean stoppedByUser;
    int fetchedCount;
    int skippedCount;
    List<String> errors;

    @JsonProperty("is_running")
    public boolean isRunning() {
        return status == SyncStatus.RUNNING;
    }
}

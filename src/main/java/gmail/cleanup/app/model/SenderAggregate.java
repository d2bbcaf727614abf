package gmail.cleanup.app.model;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Per-sender rollup of the cached messages that survive a stats filter.
 */
@Value
public class SenderAggregate {
    String email;
    String displayName;
    int count;
    Instant lastDate;
    List<String> ids;
}

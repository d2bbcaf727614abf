package gmail.cleanup.app.model;

import lombok.Value;

import java.util.List;

@Value
public class StatsResult {
    List<SenderAggregate> stats;
    CacheMetadata meta;
}

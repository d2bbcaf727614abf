package gmail.cleanup.app.model;

import lombok.Value;

/**
 * Health of the whole cache, independent of any filter.
 */
@Value
public class CacheMetadata {
    public static final String NO_DATE = "N/A";

    long totalScanned;
    String oldestDate;
}

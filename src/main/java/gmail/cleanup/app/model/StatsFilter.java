package gmail.cleanup.app.model;

import gmail.cleanup.app.entity.MessageCategory;
import lombok.Value;

import java.time.LocalDate;

/**
 * Optional filters for a stats query; a null field means "no restriction".
 */
@Value
public class StatsFilter {
    public static final StatsFilter NONE = new StatsFilter(null, null);

    LocalDate before;
    MessageCategory category;
}

package gmail.cleanup.app.entity;

import java.util.Collection;
import java.util.Locale;

/**
 * Gmail inbox tab a message was sorted into. Messages without a category label are UNKNOWN.
 */
public enum MessageCategory {
    PRIMARY("CATEGORY_PERSONAL"),
    SOCIAL("CATEGORY_SOCIAL"),
    PROMOTIONS("CATEGORY_PROMOTIONS"),
    UPDATES("CATEGORY_UPDATES"),
    FORUMS("CATEGORY_FORUMS"),
    UNKNOWN(null);

    private final String labelId;

    MessageCategory(String labelId) {
        this.labelId = labelId;
    }

    public String getLabelId() {
        return labelId;
    }

    public static MessageCategory fromLabelIds(Collection<String> labelIds) {
        if (labelIds == null) {
            return UNKNOWN;
        }
        for (MessageCategory category : values()) {
            if (category.labelId != null && labelIds.contains(category.labelId)) {
                return category;
            }
        }
        return UNKNOWN;
    }

    /**
     * Parses a request parameter. Returns null for "all" or blank, meaning no category filter.
     * @throws IllegalArgumentException for an unknown category name
     */
    public static MessageCategory fromParameter(String value) {
        if (value == null || value.isBlank() || value.trim().equalsIgnoreCase("all")) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (MessageCategory category : values()) {
            if (category.name().equals(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown category: " + value);
    }
}

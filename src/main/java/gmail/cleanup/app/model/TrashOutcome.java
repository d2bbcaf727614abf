package gmail.cleanup.app.model;

import lombok.Value;

@Value
public class TrashOutcome {
    private static final TrashOutcome SUCCESS = new TrashOutcome(true, null);

    boolean success;
    String reason;

    public static TrashOutcome success() {
        return SUCCESS;
    }

    public static TrashOutcome failure(String reason) {
        return new TrashOutcome(false, reason);
    }
}

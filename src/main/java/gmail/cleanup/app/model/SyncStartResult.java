package gmail.cleanup.app.model;

public enum SyncStartResult {
    STARTED("Started"),
    ALREADY_RUNNING("Already running");

    private final String label;

    SyncStartResult(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}

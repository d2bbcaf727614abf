package gmail.cleanup.app.entity;

public enum SyncStatus {
    IDLE,
    RUNNING,
    COMPLETE,
    ERROR
}

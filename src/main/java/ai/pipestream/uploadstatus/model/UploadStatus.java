package ai.pipestream.uploadstatus.model;

/**
 * Lifecycle status of an upload record.
 * <p>
 * Transitions only leave {@link #PENDING}; every other status is terminal.
 */
public enum UploadStatus {

    PENDING,
    UPLOADED,
    FAILED,
    EXPIRED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    /**
     * Whether a record currently in this status may move to {@code next}.
     */
    public boolean canTransitionTo(UploadStatus next) {
        return this == PENDING && next != null && next != PENDING;
    }

    /**
     * Live records hold their object key. Failed and expired records release it,
     * so a new upload may be requested for the same key.
     */
    public boolean isLive() {
        return this == PENDING || this == UPLOADED;
    }
}

package ai.pipestream.uploadstatus.events;

/**
 * Canonical storage event kinds.
 */
public enum EventType {
    CREATED,
    REMOVED,
    UNKNOWN
}

package ai.pipestream.uploadstatus.authorization;

/**
 * The single object-store operation an upload credential grants.
 */
public enum UploadOperation {
    PUT_OBJECT
}

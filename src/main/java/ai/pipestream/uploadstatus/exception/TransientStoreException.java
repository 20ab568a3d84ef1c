package ai.pipestream.uploadstatus.exception;

/**
 * Thrown when the record store is temporarily unavailable.
 * The only failure the notification consumer retries.
 */
public class TransientStoreException extends UploadStatusException {

    public TransientStoreException(String operation, Throwable cause) {
        super("STORE_UNAVAILABLE", operation, "Record store operation failed: "
                + (cause != null ? cause.getMessage() : "unknown"), cause);
    }
}

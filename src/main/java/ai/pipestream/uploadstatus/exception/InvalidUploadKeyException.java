package ai.pipestream.uploadstatus.exception;

/**
 * Thrown when a caller-supplied object key cannot be used as an upload target.
 */
public class InvalidUploadKeyException extends UploadStatusException {

    public InvalidUploadKeyException(String key, String reason) {
        super("INVALID_UPLOAD_KEY", "requestUpload", String.format("Invalid object key '%s': %s", key, reason));
    }
}

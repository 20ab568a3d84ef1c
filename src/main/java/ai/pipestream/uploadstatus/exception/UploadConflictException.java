package ai.pipestream.uploadstatus.exception;

/**
 * Thrown at intake when a live upload record already holds the requested object key.
 */
public class UploadConflictException extends UploadStatusException {

    private final String objectKey;

    public UploadConflictException(String objectKey) {
        super("UPLOAD_CONFLICT", "requestUpload",
                String.format("An upload for key '%s' is already pending or uploaded", objectKey));
        this.objectKey = objectKey;
    }

    public String getObjectKey() {
        return objectKey;
    }
}

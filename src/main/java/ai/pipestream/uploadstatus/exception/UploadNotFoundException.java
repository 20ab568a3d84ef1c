package ai.pipestream.uploadstatus.exception;

/**
 * Thrown when an upload record cannot be found by id.
 */
public class UploadNotFoundException extends UploadStatusException {

    public UploadNotFoundException(String recordId) {
        super("UPLOAD_NOT_FOUND", "getUpload", "Upload not found: " + recordId);
    }
}

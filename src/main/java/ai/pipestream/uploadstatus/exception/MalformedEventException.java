package ai.pipestream.uploadstatus.exception;

/**
 * Thrown when a storage notification can never be parsed.
 * Terminal for the message: it is dead-lettered, not retried.
 */
public class MalformedEventException extends UploadStatusException {

    public MalformedEventException(String reason) {
        super("MALFORMED_EVENT", "normalize", reason);
    }

    public MalformedEventException(String reason, Throwable cause) {
        super("MALFORMED_EVENT", "normalize", reason, cause);
    }
}

package ai.pipestream.uploadstatus.exception;

import java.util.UUID;

/**
 * Thrown when a downstream action was not acknowledged.
 * Never rolls back the status transition; the dispatch retry job re-drives it.
 */
public class DispatchException extends UploadStatusException {

    public DispatchException(String action, UUID recordId, Throwable cause) {
        super("DISPATCH_FAILED", "dispatch",
                String.format("Action '%s' not acknowledged for record %s", action, recordId), cause);
    }

    public static DispatchException timedOut(String action, UUID recordId) {
        return new DispatchException(action, recordId, null);
    }
}

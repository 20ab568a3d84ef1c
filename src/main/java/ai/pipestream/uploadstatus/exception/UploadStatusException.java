package ai.pipestream.uploadstatus.exception;

/**
 * Base exception for all upload status operations.
 * Carries a stable error code and the operation that failed.
 */
public class UploadStatusException extends RuntimeException {

    private final String errorCode;
    private final String operation;
    private final String detail;

    public UploadStatusException(String errorCode, String operation, String detail) {
        super(String.format("[%s] %s: %s", errorCode, operation, detail));
        this.errorCode = errorCode;
        this.operation = operation;
        this.detail = detail;
    }

    public UploadStatusException(String errorCode, String operation, String detail, Throwable cause) {
        super(String.format("[%s] %s: %s", errorCode, operation, detail), cause);
        this.errorCode = errorCode;
        this.operation = operation;
        this.detail = detail;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getOperation() {
        return operation;
    }

    /**
     * Message without the code/operation prefix, suitable for API responses.
     */
    public String getDetail() {
        return detail;
    }
}

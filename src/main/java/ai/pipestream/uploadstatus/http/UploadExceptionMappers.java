package ai.pipestream.uploadstatus.http;

import ai.pipestream.uploadstatus.exception.InvalidUploadKeyException;
import ai.pipestream.uploadstatus.exception.TransientStoreException;
import ai.pipestream.uploadstatus.exception.UploadConflictException;
import ai.pipestream.uploadstatus.exception.UploadNotFoundException;
import ai.pipestream.uploadstatus.exception.UploadStatusException;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.RestResponse;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

/**
 * Renders upload exceptions as {@code {"code", "message"}} bodies.
 */
public class UploadExceptionMappers {

    private static final Logger LOG = Logger.getLogger(UploadExceptionMappers.class);

    @ServerExceptionMapper
    public RestResponse<ErrorResponse> conflict(UploadConflictException e) {
        return error(Response.Status.CONFLICT, e);
    }

    @ServerExceptionMapper
    public RestResponse<ErrorResponse> invalidKey(InvalidUploadKeyException e) {
        return error(Response.Status.BAD_REQUEST, e);
    }

    @ServerExceptionMapper
    public RestResponse<ErrorResponse> notFound(UploadNotFoundException e) {
        return error(Response.Status.NOT_FOUND, e);
    }

    @ServerExceptionMapper
    public RestResponse<ErrorResponse> storeUnavailable(TransientStoreException e) {
        LOG.warnf(e, "Record store unavailable during %s", e.getOperation());
        return error(Response.Status.SERVICE_UNAVAILABLE, e);
    }

    static RestResponse<ErrorResponse> error(Response.Status status, UploadStatusException e) {
        return RestResponse.status(status, new ErrorResponse(e.getErrorCode(), e.getDetail()));
    }
}

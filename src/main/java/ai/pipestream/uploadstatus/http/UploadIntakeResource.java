package ai.pipestream.uploadstatus.http;

import ai.pipestream.uploadstatus.exception.UploadNotFoundException;
import ai.pipestream.uploadstatus.intake.UploadIntakeService;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.resteasy.reactive.RestResponse;

import java.util.UUID;

/**
 * Upload intake API.
 * <p>
 * Callers get a pre-signed credential here and send the bytes straight to the
 * object store; the service learns about completion from storage notifications only.
 */
@Path("/uploads")
@Produces(MediaType.APPLICATION_JSON)
public class UploadIntakeResource {

    @Inject
    UploadIntakeService intakeService;

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<RestResponse<UploadGrantResponse>> requestUpload(UploadRequest request) {
        String desiredKey = request != null ? request.objectKey() : null;
        return intakeService.requestUpload(desiredKey)
                .map(grant -> RestResponse.status(Response.Status.CREATED, UploadGrantResponse.from(grant)));
    }

    @GET
    @Path("/{id}")
    public Uni<UploadStatusView> getUpload(@PathParam("id") String id) {
        UUID recordId;
        try {
            recordId = UUID.fromString(id);
        } catch (IllegalArgumentException e) {
            return Uni.createFrom().failure(new UploadNotFoundException(id));
        }
        return intakeService.getUpload(recordId).map(UploadStatusView::from);
    }
}

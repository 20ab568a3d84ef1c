package ai.pipestream.uploadstatus.health;

import ai.pipestream.uploadstatus.model.UploadStatus;
import ai.pipestream.uploadstatus.store.UploadRecordStore;
import io.smallrye.health.api.AsyncHealthCheck;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * Readiness check for the upload status service.
 * Checks record store connectivity and reports pending and uploaded counts.
 */
@Readiness
@ApplicationScoped
public class UploadStatusHealthCheck implements AsyncHealthCheck {

    static final String NAME = "upload-status-service";

    @Inject
    UploadRecordStore store;

    @Override
    public Uni<HealthCheckResponse> call() {
        return store.countByStatus(UploadStatus.PENDING)
                .flatMap(pending -> store.countByStatus(UploadStatus.UPLOADED)
                        .map(uploaded -> HealthCheckResponse.named(NAME)
                                .withData("recordStore", "connected")
                                .withData("pending", pending)
                                .withData("uploaded", uploaded)
                                .up()
                                .build()))
                .onFailure().recoverWithItem(e -> HealthCheckResponse.named(NAME)
                        .withData("recordStore", "disconnected")
                        .withData("error", String.valueOf(e.getMessage()))
                        .down()
                        .build());
    }
}

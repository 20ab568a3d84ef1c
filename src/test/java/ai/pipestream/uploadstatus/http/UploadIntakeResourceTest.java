package ai.pipestream.uploadstatus.http;

import ai.pipestream.uploadstatus.authorization.UploadCredential;
import ai.pipestream.uploadstatus.exception.InvalidUploadKeyException;
import ai.pipestream.uploadstatus.exception.TransientStoreException;
import ai.pipestream.uploadstatus.exception.UploadConflictException;
import ai.pipestream.uploadstatus.exception.UploadNotFoundException;
import ai.pipestream.uploadstatus.intake.UploadGrant;
import ai.pipestream.uploadstatus.intake.UploadIntakeService;
import ai.pipestream.uploadstatus.model.StatusChange;
import ai.pipestream.uploadstatus.model.UploadRecord;
import ai.pipestream.uploadstatus.model.UploadStatus;
import io.smallrye.mutiny.Uni;
import org.jboss.resteasy.reactive.RestResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URL;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UploadIntakeResourceTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private UploadIntakeService intakeService;

    private UploadIntakeResource resource;
    private final UploadExceptionMappers mappers = new UploadExceptionMappers();

    @BeforeEach
    void setUp() {
        resource = new UploadIntakeResource();
        resource.intakeService = intakeService;
    }

    @Test
    void requestUploadReturnsCreatedGrant() throws Exception {
        UUID recordId = UUID.randomUUID();
        UploadCredential credential = new UploadCredential(new URL("http://localhost:9000/b/uploads/42?X-Amz-Signature=s"),
                "PUT", Map.of("host", List.of("localhost:9000")), T0.plusSeconds(900));
        when(intakeService.requestUpload("uploads/42"))
                .thenReturn(Uni.createFrom().item(new UploadGrant(credential, recordId, "uploads/42", T0.plusSeconds(900))));

        RestResponse<UploadGrantResponse> response = resource.requestUpload(new UploadRequest("uploads/42"))
                .await().indefinitely();

        assertThat(response.getStatus()).isEqualTo(201);
        UploadGrantResponse body = response.getEntity();
        assertThat(body.recordId()).isEqualTo(recordId);
        assertThat(body.uploadUrl()).isEqualTo("http://localhost:9000/b/uploads/42?X-Amz-Signature=s");
        assertThat(body.method()).isEqualTo("PUT");
        assertThat(body.headers()).containsKey("host");
        assertThat(body.expiresAt()).isEqualTo(T0.plusSeconds(900));
    }

    @Test
    void requestWithoutBodyAsksForGeneratedKey() {
        when(intakeService.requestUpload(isNull()))
                .thenReturn(Uni.createFrom().failure(new UploadConflictException("uploads/x")));

        assertThatThrownBy(() -> resource.requestUpload(null).await().indefinitely())
                .isInstanceOf(UploadConflictException.class);
        verify(intakeService).requestUpload(null);
    }

    @Test
    void getUploadReturnsStatusView() {
        UploadRecord record = UploadRecord.pending(UUID.randomUUID(), "uploads/42", T0.plusSeconds(900), T0)
                .apply(StatusChange.uploaded(T0.plusSeconds(40), T0.plusSeconds(30), 7L, null))
                .withDispatchedAction("scan")
                .withDispatchedAction("audit");
        when(intakeService.getUpload(record.id())).thenReturn(Uni.createFrom().item(record));

        UploadStatusView view = resource.getUpload(record.id().toString()).await().indefinitely();

        assertThat(view.recordId()).isEqualTo(record.id());
        assertThat(view.status()).isEqualTo(UploadStatus.UPLOADED);
        assertThat(view.uploadedAt()).isEqualTo(T0.plusSeconds(30));
        assertThat(view.dispatchedActions()).containsExactly("audit", "scan");
    }

    @Test
    void malformedIdIsNotFound() {
        assertThatThrownBy(() -> resource.getUpload("not-a-uuid").await().indefinitely())
                .isInstanceOf(UploadNotFoundException.class);
        verifyNoInteractions(intakeService);
    }

    @Test
    void mapsExceptionsToStatusAndCode() {
        RestResponse<ErrorResponse> conflict = mappers.conflict(new UploadConflictException("uploads/42"));
        assertThat(conflict.getStatus()).isEqualTo(409);
        assertThat(conflict.getEntity().code()).isEqualTo("UPLOAD_CONFLICT");
        assertThat(conflict.getEntity().message()).contains("uploads/42").doesNotStartWith("[");

        assertThat(mappers.invalidKey(new InvalidUploadKeyException("a/../b", "relative")).getStatus()).isEqualTo(400);
        assertThat(mappers.notFound(new UploadNotFoundException("x")).getEntity().code()).isEqualTo("UPLOAD_NOT_FOUND");
        assertThat(mappers.storeUnavailable(new TransientStoreException("get", new IllegalStateException("down")))
                .getStatus()).isEqualTo(503);
    }
}

package ai.pipestream.uploadstatus.health;

import ai.pipestream.uploadstatus.exception.TransientStoreException;
import ai.pipestream.uploadstatus.model.UploadRecord;
import ai.pipestream.uploadstatus.model.UploadStatus;
import ai.pipestream.uploadstatus.store.InMemoryUploadRecordStore;
import ai.pipestream.uploadstatus.store.UploadRecordStore;
import io.smallrye.mutiny.Uni;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class UploadStatusHealthCheckTest {

    @Test
    void upWithCountsWhenStoreAnswers() {
        InMemoryUploadRecordStore store = new InMemoryUploadRecordStore();
        Instant now = Instant.now();
        store.createIfAbsent(UploadRecord.pending(UUID.randomUUID(), "uploads/1", now.plusSeconds(60), now))
                .await().indefinitely();
        UploadStatusHealthCheck check = new UploadStatusHealthCheck();
        check.store = store;

        HealthCheckResponse response = check.call().await().indefinitely();

        assertThat(response.getName()).isEqualTo("upload-status-service");
        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getData()).hasValueSatisfying(data -> {
            assertThat(data).containsEntry("pending", 1L);
            assertThat(data).containsEntry("uploaded", 0L);
        });
    }

    @Test
    void downWhenStoreFails() {
        UploadRecordStore store = mock(UploadRecordStore.class);
        when(store.countByStatus(any(UploadStatus.class)))
                .thenReturn(Uni.createFrom().failure(new TransientStoreException("countByStatus",
                        new IllegalStateException("connection refused"))));
        UploadStatusHealthCheck check = new UploadStatusHealthCheck();
        check.store = store;

        HealthCheckResponse response = check.call().await().indefinitely();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.DOWN);
        assertThat(response.getData()).hasValueSatisfying(data ->
                assertThat(data).containsEntry("recordStore", "disconnected"));
    }
}

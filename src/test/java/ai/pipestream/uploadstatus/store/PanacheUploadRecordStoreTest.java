package ai.pipestream.uploadstatus.store;

import ai.pipestream.uploadstatus.entity.UploadRecordEntity;
import ai.pipestream.uploadstatus.model.StatusChange;
import ai.pipestream.uploadstatus.model.UploadRecord;
import ai.pipestream.uploadstatus.model.UploadStatus;
import jakarta.persistence.EntityExistsException;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Mapping and failure classification of the durable store. Queries run against PostgreSQL in
 * {@link PanacheUploadRecordStoreDatabaseTest}.
 */
class PanacheUploadRecordStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void liveRecordOccupiesLiveKeyColumn() {
        UploadRecord record = UploadRecord.pending(UUID.randomUUID(), "uploads/42", NOW.plusSeconds(60), NOW);

        UploadRecordEntity entity = PanacheUploadRecordStore.toEntity(record);

        assertThat(entity.liveObjectKey).isEqualTo("uploads/42");
        assertThat(entity.status).isEqualTo(UploadStatus.PENDING);
    }

    @Test
    void expiredRecordFreesLiveKeyColumn() {
        UploadRecord expired = UploadRecord.pending(UUID.randomUUID(), "uploads/42", NOW, NOW)
                .apply(StatusChange.expired(NOW));

        assertThat(PanacheUploadRecordStore.toEntity(expired).liveObjectKey).isNull();
    }

    @Test
    void failedRecordFreesLiveKeyColumn() {
        UploadRecord failed = UploadRecord.pending(UUID.randomUUID(), "uploads/42", NOW, NOW)
                .apply(StatusChange.failed(NOW, 10L, "e"));

        assertThat(PanacheUploadRecordStore.toEntity(failed).liveObjectKey).isNull();
    }

    @Test
    void entityRoundTripKeepsFields() {
        UploadRecord record = UploadRecord.pending(UUID.randomUUID(), "uploads/42", NOW.plusSeconds(60), NOW)
                .apply(StatusChange.uploaded(NOW.plusSeconds(5), NOW.plusSeconds(4), 99L, "etag-1"));

        UploadRecord mapped = PanacheUploadRecordStore.toModel(PanacheUploadRecordStore.toEntity(record), Set.of("scan"));

        assertThat(mapped).usingRecursiveComparison().ignoringFields("dispatchedActions").isEqualTo(record);
        assertThat(mapped.dispatchedActions()).containsExactly("scan");
    }

    @Test
    void recognisesUniqueViolations() {
        assertThat(PanacheUploadRecordStore.isUniqueViolation(new EntityExistsException("exists"))).isTrue();
        assertThat(PanacheUploadRecordStore.isUniqueViolation(
                new RuntimeException(new SQLException("ERROR: duplicate key value violates unique constraint"))))
                .isTrue();
        assertThat(PanacheUploadRecordStore.isUniqueViolation(new RuntimeException("connection refused"))).isFalse();
    }
}

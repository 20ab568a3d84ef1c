package ai.pipestream.uploadstatus.entity;

import ai.pipestream.uploadstatus.model.UploadStatus;
import io.quarkus.hibernate.reactive.panache.PanacheEntityBase;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Persisted upload record.
 * <p>
 * {@code liveObjectKey} mirrors {@code objectKey} while the record is live and is
 * cleared when the record fails or expires, so the unique constraint only spans live records.
 */
@Entity
@Table(name = "upload_records",
        uniqueConstraints = @UniqueConstraint(name = "uk_upload_records_live_key", columnNames = "live_object_key"),
        indexes = {
                @Index(name = "ix_upload_records_object_key", columnList = "object_key"),
                @Index(name = "ix_upload_records_status_expiry", columnList = "status, credential_expiry")
        })
public class UploadRecordEntity extends PanacheEntityBase {

    @Id
    @Column(name = "id", nullable = false)
    public UUID id;

    @Column(name = "object_key", nullable = false, length = 1024)
    public String objectKey;

    @Column(name = "live_object_key", length = 1024)
    public String liveObjectKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    public UploadStatus status;

    @Column(name = "credential_expiry", nullable = false)
    public Instant credentialExpiry;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    @Column(name = "uploaded_at")
    public Instant uploadedAt;

    @Column(name = "size_bytes")
    public Long sizeBytes;

    public String etag;
}

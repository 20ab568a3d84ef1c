package ai.pipestream.uploadstatus.http;

import ai.pipestream.uploadstatus.model.UploadRecord;
import ai.pipestream.uploadstatus.model.UploadStatus;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record UploadStatusView(
        UUID recordId,
        String objectKey,
        UploadStatus status,
        Instant credentialExpiry,
        Instant createdAt,
        Instant updatedAt,
        Instant uploadedAt,
        Long sizeBytes,
        List<String> dispatchedActions
) {

    static UploadStatusView from(UploadRecord record) {
        return new UploadStatusView(
                record.id(),
                record.objectKey(),
                record.status(),
                record.credentialExpiry(),
                record.createdAt(),
                record.updatedAt(),
                record.uploadedAt(),
                record.sizeBytes(),
                record.dispatchedActions().stream().sorted().toList());
    }
}

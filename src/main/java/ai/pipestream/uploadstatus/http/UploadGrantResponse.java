package ai.pipestream.uploadstatus.http;

import ai.pipestream.uploadstatus.intake.UploadGrant;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * What the client needs to upload directly to the object store.
 */
public record UploadGrantResponse(
        UUID recordId,
        String objectKey,
        String uploadUrl,
        String method,
        Map<String, List<String>> headers,
        Instant expiresAt
) {

    static UploadGrantResponse from(UploadGrant grant) {
        return new UploadGrantResponse(
                grant.recordId(),
                grant.objectKey(),
                grant.credential().url().toString(),
                grant.credential().method(),
                grant.credential().signedHeaders(),
                grant.expiresAt());
    }
}

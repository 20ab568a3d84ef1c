package ai.pipestream.uploadstatus.intake;

import ai.pipestream.uploadstatus.authorization.UploadCredential;

import java.time.Instant;
import java.util.UUID;

/**
 * Result of a successful upload request: what the client needs to upload, and how to follow it up.
 */
public record UploadGrant(UploadCredential credential, UUID recordId, String objectKey, Instant expiresAt) {
}

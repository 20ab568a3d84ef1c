package ai.pipestream.uploadstatus.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Snapshot of one requested upload.
 * <p>
 * Instances are immutable; the record store hands out a new snapshot after every change.
 *
 * @param id                opaque identifier assigned at creation
 * @param objectKey         target key in the bucket, join key for reconciliation
 * @param status            current lifecycle status
 * @param credentialExpiry  when the issued upload credential stops being valid
 * @param createdAt         creation time
 * @param updatedAt         last status or action change
 * @param uploadedAt        provider completion time, set once {@link UploadStatus#UPLOADED}
 * @param sizeBytes         object size from the completing notification, if reported
 * @param etag              object ETag from the completing notification, if reported
 * @param dispatchedActions downstream actions already acknowledged for this record
 */
public record UploadRecord(
        UUID id,
        String objectKey,
        UploadStatus status,
        Instant credentialExpiry,
        Instant createdAt,
        Instant updatedAt,
        Instant uploadedAt,
        Long sizeBytes,
        String etag,
        Set<String> dispatchedActions
) {

    public UploadRecord {
        dispatchedActions = dispatchedActions == null ? Set.of() : Set.copyOf(dispatchedActions);
    }

    /**
     * New pending record as created by intake.
     */
    public static UploadRecord pending(UUID id, String objectKey, Instant credentialExpiry, Instant now) {
        return new UploadRecord(id, objectKey, UploadStatus.PENDING, credentialExpiry, now, now,
                null, null, null, Set.of());
    }

    public boolean isCredentialExpired(Instant now) {
        return credentialExpiry != null && !credentialExpiry.isAfter(now);
    }

    /**
     * Configured actions that have not been acknowledged yet, in configured order.
     */
    public List<String> missingActions(Collection<String> configuredActions) {
        List<String> missing = new ArrayList<>();
        for (String action : configuredActions) {
            if (!dispatchedActions.contains(action)) {
                missing.add(action);
            }
        }
        return missing;
    }

    /**
     * Apply a status change. Callers must have checked the expected prior status.
     */
    public UploadRecord apply(StatusChange change) {
        if (!status.canTransitionTo(change.target())) {
            throw new IllegalStateException("Illegal transition " + status + " -> " + change.target() + " for " + id);
        }
        return new UploadRecord(id, objectKey, change.target(), credentialExpiry, createdAt, change.at(),
                change.uploadedAt(),
                change.sizeBytes() != null ? change.sizeBytes() : sizeBytes,
                change.etag() != null ? change.etag() : etag,
                dispatchedActions);
    }

    public UploadRecord withDispatchedAction(String action) {
        Set<String> actions = new LinkedHashSet<>(dispatchedActions);
        actions.add(action);
        return new UploadRecord(id, objectKey, status, credentialExpiry, createdAt, updatedAt,
                uploadedAt, sizeBytes, etag, actions);
    }
}

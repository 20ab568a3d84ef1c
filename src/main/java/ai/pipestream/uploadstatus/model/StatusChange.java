package ai.pipestream.uploadstatus.model;

import java.time.Instant;

/**
 * A requested status transition, applied by the record store only if the record
 * is still in the expected prior status.
 *
 * @param target     the status to move to
 * @param at         when the transition happens (becomes {@code updatedAt})
 * @param uploadedAt provider completion time, only for {@link UploadStatus#UPLOADED}
 * @param sizeBytes  object size reported by the provider, if any
 * @param etag       object ETag reported by the provider, if any
 */
public record StatusChange(UploadStatus target, Instant at, Instant uploadedAt, Long sizeBytes, String etag) {

    public StatusChange {
        if (target == null || target == UploadStatus.PENDING) {
            throw new IllegalArgumentException("target must be a terminal status");
        }
        if (at == null) {
            throw new IllegalArgumentException("at is required");
        }
    }

    public static StatusChange uploaded(Instant at, Instant providerTimestamp, Long sizeBytes, String etag) {
        return new StatusChange(UploadStatus.UPLOADED, at,
                providerTimestamp != null ? providerTimestamp : at, sizeBytes, etag);
    }

    public static StatusChange failed(Instant at, Long sizeBytes, String etag) {
        return new StatusChange(UploadStatus.FAILED, at, null, sizeBytes, etag);
    }

    public static StatusChange expired(Instant at) {
        return new StatusChange(UploadStatus.EXPIRED, at, null, null, null);
    }
}

package ai.pipestream.uploadstatus.events;

import java.time.Instant;

/**
 * Provider-neutral storage notification, consumed once by the reconciler.
 *
 * @param objectKey         decoded object key
 * @param eventType         what happened to the object
 * @param providerTimestamp when the provider says it happened, may be null
 * @param rawEventId        stable identifier of the provider notification, used for deduplication
 * @param bucket            bucket name, may be null
 * @param sizeBytes         object size for created objects, may be null
 * @param etag              object ETag for created objects, may be null
 */
public record NormalizedEvent(
        String objectKey,
        EventType eventType,
        Instant providerTimestamp,
        String rawEventId,
        String bucket,
        Long sizeBytes,
        String etag
) {

    public static NormalizedEvent created(String objectKey, String rawEventId, Instant providerTimestamp) {
        return new NormalizedEvent(objectKey, EventType.CREATED, providerTimestamp, rawEventId, null, null, null);
    }

    public static NormalizedEvent removed(String objectKey, String rawEventId, Instant providerTimestamp) {
        return new NormalizedEvent(objectKey, EventType.REMOVED, providerTimestamp, rawEventId, null, null, null);
    }
}

package ai.pipestream.uploadstatus.dispatch;

import java.time.Instant;
import java.util.UUID;

/**
 * Payload delivered to a downstream action subscriber.
 * <p>
 * Delivery is at-least-once; subscribers deduplicate on {@code dispatchId}.
 *
 * @param dispatchId deterministic id of the (record, action) pair
 * @param action     downstream action name, e.g. {@code scan}
 * @param recordId   upload record id
 * @param objectKey  uploaded object key
 * @param uploadedAt provider completion time
 * @param sizeBytes  object size, if the provider reported it
 */
public record DownstreamActionMessage(
        UUID dispatchId,
        String action,
        UUID recordId,
        String objectKey,
        Instant uploadedAt,
        Long sizeBytes
) {
}

package ai.pipestream.uploadstatus.dispatch;

import ai.pipestream.uploadstatus.model.UploadRecord;
import io.smallrye.mutiny.Uni;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Notifies downstream subscribers (scan, audit, quota) about a completed upload.
 * <p>
 * At-least-once: the returned {@link Uni} emits an item once the dispatch is acknowledged
 * and fails otherwise. Subscribers must be idempotent on {@code (record.id, action)}.
 */
public interface Dispatcher {

    Uni<Void> dispatch(String action, UploadRecord record);

    /**
     * Deterministic id for one (record, action) pair, stable across redeliveries.
     */
    static UUID dispatchId(UUID recordId, String action) {
        return UUID.nameUUIDFromBytes((recordId + "|" + action).getBytes(StandardCharsets.UTF_8));
    }
}

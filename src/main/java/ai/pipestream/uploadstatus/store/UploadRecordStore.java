package ai.pipestream.uploadstatus.store;

import ai.pipestream.uploadstatus.model.StatusChange;
import ai.pipestream.uploadstatus.model.UploadRecord;
import ai.pipestream.uploadstatus.model.UploadStatus;
import io.smallrye.mutiny.Uni;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable keyed storage for upload records.
 * <p>
 * The conditional status update is the only mutual exclusion between concurrent
 * reconciler workers; implementations must make it atomic per record.
 * Infrastructure failures surface as {@link ai.pipestream.uploadstatus.exception.TransientStoreException}.
 */
public interface UploadRecordStore {

    /**
     * Create a record unless a live record already holds its object key.
     *
     * @return the stored record, or a failure with
     *         {@link ai.pipestream.uploadstatus.exception.UploadConflictException}
     */
    Uni<UploadRecord> createIfAbsent(UploadRecord record);

    /**
     * @return the record, or a {@code null} item when unknown
     */
    Uni<UploadRecord> get(UUID id);

    /**
     * @return the live (pending or uploaded) record for the key, or a {@code null} item
     */
    Uni<UploadRecord> findLiveByObjectKey(String objectKey);

    /**
     * Apply {@code change} only if the record is currently in {@code expected} status.
     *
     * @return the updated record, or empty when the precondition did not hold
     */
    Uni<Optional<UploadRecord>> compareAndSetStatus(UUID id, UploadStatus expected, StatusChange change);

    /**
     * Record that a downstream action was acknowledged.
     *
     * @return true if this call added the action, false if it was already recorded
     */
    Uni<Boolean> markActionDispatched(UUID id, String action);

    /**
     * Pending records whose credential expired before {@code cutoff}, oldest first.
     */
    Uni<List<UploadRecord>> findPendingExpiredBefore(Instant cutoff, int limit);

    /**
     * Uploaded records that lack at least one of {@code actions}, least recently updated first.
     */
    Uni<List<UploadRecord>> findUploadedWithMissingActions(Collection<String> actions, int limit);

    Uni<Long> countByStatus(UploadStatus status);
}

package ai.pipestream.uploadstatus.store;

import ai.pipestream.uploadstatus.exception.UploadConflictException;
import ai.pipestream.uploadstatus.model.StatusChange;
import ai.pipestream.uploadstatus.model.UploadRecord;
import ai.pipestream.uploadstatus.model.UploadStatus;
import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory record store for local development and tests.
 * <p>
 * Enabled with {@code record-store.kind=memory}. Records are lost on restart.
 * Per-record atomicity comes from {@link ConcurrentHashMap#computeIfPresent}.
 */
@ApplicationScoped
@IfBuildProperty(name = "record-store.kind", stringValue = "memory")
public class InMemoryUploadRecordStore implements UploadRecordStore {

    private static final Logger LOG = Logger.getLogger(InMemoryUploadRecordStore.class);

    private final ConcurrentHashMap<UUID, UploadRecord> records = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, UUID> liveKeyIndex = new ConcurrentHashMap<>();

    @Override
    public Uni<UploadRecord> createIfAbsent(UploadRecord record) {
        return Uni.createFrom().item(() -> {
            records.put(record.id(), record);
            UUID holder = liveKeyIndex.putIfAbsent(record.objectKey(), record.id());
            if (holder != null && !holder.equals(record.id())) {
                records.remove(record.id());
                throw new UploadConflictException(record.objectKey());
            }
            LOG.debugf("Created upload record: id=%s, objectKey=%s", record.id(), record.objectKey());
            return record;
        });
    }

    @Override
    public Uni<UploadRecord> get(UUID id) {
        return Uni.createFrom().item(() -> records.get(id));
    }

    @Override
    public Uni<UploadRecord> findLiveByObjectKey(String objectKey) {
        return Uni.createFrom().item(() -> {
            UUID id = liveKeyIndex.get(objectKey);
            return id == null ? null : records.get(id);
        });
    }

    @Override
    public Uni<Optional<UploadRecord>> compareAndSetStatus(UUID id, UploadStatus expected, StatusChange change) {
        return Uni.createFrom().item(() -> {
            AtomicReference<UploadRecord> applied = new AtomicReference<>();
            records.computeIfPresent(id, (key, current) -> {
                if (current.status() != expected || !current.status().canTransitionTo(change.target())) {
                    return current;
                }
                UploadRecord next = current.apply(change);
                applied.set(next);
                return next;
            });
            UploadRecord next = applied.get();
            if (next != null && !next.status().isLive()) {
                liveKeyIndex.remove(next.objectKey(), next.id());
            }
            return Optional.ofNullable(next);
        });
    }

    @Override
    public Uni<Boolean> markActionDispatched(UUID id, String action) {
        return Uni.createFrom().item(() -> {
            AtomicBoolean added = new AtomicBoolean(false);
            records.computeIfPresent(id, (key, current) -> {
                if (current.dispatchedActions().contains(action)) {
                    return current;
                }
                added.set(true);
                return current.withDispatchedAction(action);
            });
            return added.get();
        });
    }

    @Override
    public Uni<List<UploadRecord>> findPendingExpiredBefore(Instant cutoff, int limit) {
        return Uni.createFrom().item(() -> records.values().stream()
                .filter(r -> r.status() == UploadStatus.PENDING)
                .filter(r -> r.credentialExpiry().isBefore(cutoff))
                .sorted(Comparator.comparing(UploadRecord::credentialExpiry))
                .limit(limit)
                .toList());
    }

    @Override
    public Uni<List<UploadRecord>> findUploadedWithMissingActions(Collection<String> actions, int limit) {
        return Uni.createFrom().item(() -> records.values().stream()
                .filter(r -> r.status() == UploadStatus.UPLOADED)
                .filter(r -> !r.missingActions(actions).isEmpty())
                .sorted(Comparator.comparing(UploadRecord::updatedAt))
                .limit(limit)
                .toList());
    }

    @Override
    public Uni<Long> countByStatus(UploadStatus status) {
        return Uni.createFrom().item(() -> records.values().stream()
                .filter(r -> r.status() == status)
                .count());
    }

    /**
     * Drop all records.
     */
    public void clear() {
        records.clear();
        liveKeyIndex.clear();
    }
}

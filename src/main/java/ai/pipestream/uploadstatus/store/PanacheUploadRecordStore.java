package ai.pipestream.uploadstatus.store;

import ai.pipestream.uploadstatus.entity.DispatchedActionEntity;
import ai.pipestream.uploadstatus.entity.UploadRecordEntity;
import ai.pipestream.uploadstatus.exception.TransientStoreException;
import ai.pipestream.uploadstatus.exception.UploadConflictException;
import ai.pipestream.uploadstatus.exception.UploadStatusException;
import ai.pipestream.uploadstatus.model.StatusChange;
import ai.pipestream.uploadstatus.model.UploadRecord;
import ai.pipestream.uploadstatus.model.UploadStatus;
import io.quarkus.arc.DefaultBean;
import io.quarkus.hibernate.reactive.panache.Panache;
import io.quarkus.panache.common.Sort;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.EntityExistsException;
import org.hibernate.exception.ConstraintViolationException;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * PostgreSQL-backed record store using Hibernate Reactive Panache.
 * <p>
 * The conditional update is a single {@code UPDATE ... WHERE id = ? AND status = ?};
 * the database row lock makes it atomic, so exactly one concurrent caller sees one updated row.
 */
@ApplicationScoped
@DefaultBean
public class PanacheUploadRecordStore implements UploadRecordStore {

    private static final Logger LOG = Logger.getLogger(PanacheUploadRecordStore.class);

    private static final String UNIQUE_VIOLATION_SQL_STATE = "23505";

    @Override
    public Uni<UploadRecord> createIfAbsent(UploadRecord record) {
        return Panache.withTransaction(() ->
                        UploadRecordEntity.<UploadRecordEntity>find("liveObjectKey", record.objectKey()).firstResult()
                                .flatMap(existing -> {
                                    if (existing != null) {
                                        return Uni.createFrom().failure(new UploadConflictException(record.objectKey()));
                                    }
                                    return toEntity(record).persistAndFlush().replaceWith(record);
                                }))
                .onFailure(PanacheUploadRecordStore::isUniqueViolation)
                .transform(e -> new UploadConflictException(record.objectKey()))
                .onFailure(PanacheUploadRecordStore::isInfrastructureFailure)
                .transform(e -> new TransientStoreException("createIfAbsent", e))
                .invoke(created -> LOG.debugf("Created upload record: id=%s, objectKey=%s",
                        created.id(), created.objectKey()));
    }

    @Override
    public Uni<UploadRecord> get(UUID id) {
        return Panache.withSession(() ->
                        UploadRecordEntity.<UploadRecordEntity>findById(id)
                                .flatMap(this::withActions))
                .onFailure(PanacheUploadRecordStore::isInfrastructureFailure)
                .transform(e -> new TransientStoreException("get", e));
    }

    @Override
    public Uni<UploadRecord> findLiveByObjectKey(String objectKey) {
        return Panache.withSession(() ->
                        UploadRecordEntity.<UploadRecordEntity>find("liveObjectKey", objectKey).firstResult()
                                .flatMap(this::withActions))
                .onFailure(PanacheUploadRecordStore::isInfrastructureFailure)
                .transform(e -> new TransientStoreException("findLiveByObjectKey", e));
    }

    @Override
    public Uni<Optional<UploadRecord>> compareAndSetStatus(UUID id, UploadStatus expected, StatusChange change) {
        if (!expected.canTransitionTo(change.target())) {
            return Uni.createFrom().item(Optional.empty());
        }
        return Panache.withTransaction(() -> conditionalUpdate(id, expected, change)
                        .flatMap(updated -> {
                            if (updated == 0) {
                                return Uni.createFrom().item(Optional.<UploadRecord>empty());
                            }
                            return UploadRecordEntity.<UploadRecordEntity>findById(id)
                                    .flatMap(this::withActions)
                                    .map(Optional::ofNullable);
                        }))
                .onFailure(PanacheUploadRecordStore::isInfrastructureFailure)
                .transform(e -> new TransientStoreException("compareAndSetStatus", e));
    }

    private static Uni<Integer> conditionalUpdate(UUID id, UploadStatus expected, StatusChange change) {
        if (change.target() == UploadStatus.EXPIRED) {
            return UploadRecordEntity.update(
                    "status = ?1, updatedAt = ?2, liveObjectKey = null where id = ?3 and status = ?4",
                    change.target(), change.at(), id, expected);
        }
        if (!change.target().isLive()) {
            return UploadRecordEntity.update(
                    "status = ?1, updatedAt = ?2, uploadedAt = ?3, sizeBytes = ?4, etag = ?5, liveObjectKey = null "
                            + "where id = ?6 and status = ?7",
                    change.target(), change.at(), change.uploadedAt(), change.sizeBytes(), change.etag(), id, expected);
        }
        return UploadRecordEntity.update(
                "status = ?1, updatedAt = ?2, uploadedAt = ?3, sizeBytes = ?4, etag = ?5 where id = ?6 and status = ?7",
                change.target(), change.at(), change.uploadedAt(), change.sizeBytes(), change.etag(), id, expected);
    }

    @Override
    public Uni<Boolean> markActionDispatched(UUID id, String action) {
        return Panache.withTransaction(() ->
                        DispatchedActionEntity.count("recordId = ?1 and action = ?2", id, action)
                                .flatMap(count -> {
                                    if (count > 0) {
                                        return Uni.createFrom().item(false);
                                    }
                                    DispatchedActionEntity entity = new DispatchedActionEntity();
                                    entity.recordId = id;
                                    entity.action = action;
                                    entity.dispatchedAt = Instant.now();
                                    return entity.persistAndFlush().replaceWith(true);
                                }))
                .onFailure(PanacheUploadRecordStore::isUniqueViolation).recoverWithItem(false)
                .onFailure(PanacheUploadRecordStore::isInfrastructureFailure)
                .transform(e -> new TransientStoreException("markActionDispatched", e));
    }

    @Override
    public Uni<List<UploadRecord>> findPendingExpiredBefore(Instant cutoff, int limit) {
        return Panache.withSession(() ->
                        UploadRecordEntity.<UploadRecordEntity>find("status = ?1 and credentialExpiry < ?2",
                                        Sort.by("credentialExpiry"), UploadStatus.PENDING, cutoff)
                                .page(0, limit)
                                .list())
                .map(entities -> entities.stream()
                        .map(entity -> toModel(entity, Set.of()))
                        .toList())
                .onFailure(PanacheUploadRecordStore::isInfrastructureFailure)
                .transform(e -> new TransientStoreException("findPendingExpiredBefore", e));
    }

    @Override
    public Uni<List<UploadRecord>> findUploadedWithMissingActions(Collection<String> actions, int limit) {
        if (actions.isEmpty()) {
            return Uni.createFrom().item(List.of());
        }
        List<String> wanted = List.copyOf(actions);
        return Panache.withSession(() ->
                        UploadRecordEntity.<UploadRecordEntity>find(
                                        "from UploadRecordEntity r where r.status = ?1 and "
                                                + "(select count(a) from DispatchedActionEntity a "
                                                + "where a.recordId = r.id and a.action in ?2) < ?3 "
                                                + "order by r.updatedAt",
                                        UploadStatus.UPLOADED, wanted, (long) wanted.size())
                                .page(0, limit)
                                .list()
                                .flatMap(this::withActionsAll))
                .onFailure(PanacheUploadRecordStore::isInfrastructureFailure)
                .transform(e -> new TransientStoreException("findUploadedWithMissingActions", e));
    }

    @Override
    public Uni<Long> countByStatus(UploadStatus status) {
        return Panache.withSession(() -> UploadRecordEntity.count("status", status))
                .onFailure(PanacheUploadRecordStore::isInfrastructureFailure)
                .transform(e -> new TransientStoreException("countByStatus", e));
    }

    private Uni<UploadRecord> withActions(UploadRecordEntity entity) {
        if (entity == null) {
            return Uni.createFrom().nullItem();
        }
        return DispatchedActionEntity.<DispatchedActionEntity>list("recordId", entity.id)
                .map(actions -> {
                    Set<String> names = new HashSet<>();
                    actions.forEach(a -> names.add(a.action));
                    return toModel(entity, names);
                });
    }

    private Uni<List<UploadRecord>> withActionsAll(List<UploadRecordEntity> entities) {
        if (entities.isEmpty()) {
            return Uni.createFrom().item(List.of());
        }
        List<UUID> ids = entities.stream().map(e -> e.id).toList();
        return DispatchedActionEntity.<DispatchedActionEntity>list("recordId in ?1", ids)
                .map(actions -> {
                    Map<UUID, Set<String>> byRecord = new HashMap<>();
                    for (DispatchedActionEntity action : actions) {
                        byRecord.computeIfAbsent(action.recordId, k -> new HashSet<>()).add(action.action);
                    }
                    return entities.stream()
                            .map(e -> toModel(e, byRecord.getOrDefault(e.id, Set.of())))
                            .toList();
                });
    }

    static UploadRecordEntity toEntity(UploadRecord record) {
        UploadRecordEntity entity = new UploadRecordEntity();
        entity.id = record.id();
        entity.objectKey = record.objectKey();
        entity.liveObjectKey = record.status().isLive() ? record.objectKey() : null;
        entity.status = record.status();
        entity.credentialExpiry = record.credentialExpiry();
        entity.createdAt = record.createdAt();
        entity.updatedAt = record.updatedAt();
        entity.uploadedAt = record.uploadedAt();
        entity.sizeBytes = record.sizeBytes();
        entity.etag = record.etag();
        return entity;
    }

    static UploadRecord toModel(UploadRecordEntity entity, Set<String> dispatchedActions) {
        return new UploadRecord(
                entity.id,
                entity.objectKey,
                entity.status,
                entity.credentialExpiry,
                entity.createdAt,
                entity.updatedAt,
                entity.uploadedAt,
                entity.sizeBytes,
                entity.etag,
                dispatchedActions);
    }

    static boolean isUniqueViolation(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof ConstraintViolationException || t instanceof EntityExistsException) {
                return true;
            }
            String message = t.getMessage();
            if (message != null && (message.contains(UNIQUE_VIOLATION_SQL_STATE) || message.contains("duplicate key"))) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    private static boolean isInfrastructureFailure(Throwable failure) {
        return !(failure instanceof UploadStatusException);
    }
}

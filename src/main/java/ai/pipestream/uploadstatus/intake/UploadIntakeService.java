package ai.pipestream.uploadstatus.intake;

import ai.pipestream.uploadstatus.authorization.AuthorizationIssuer;
import ai.pipestream.uploadstatus.authorization.UploadCredential;
import ai.pipestream.uploadstatus.authorization.UploadOperation;
import ai.pipestream.uploadstatus.config.KeyScope;
import ai.pipestream.uploadstatus.config.UploadConfiguration;
import ai.pipestream.uploadstatus.exception.InvalidUploadKeyException;
import ai.pipestream.uploadstatus.exception.UploadConflictException;
import ai.pipestream.uploadstatus.exception.UploadNotFoundException;
import ai.pipestream.uploadstatus.model.UploadRecord;
import ai.pipestream.uploadstatus.store.UploadRecordStore;
import io.micrometer.core.instrument.Timer;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.UUID;

/**
 * Creates pending upload records and hands out the credential to upload them.
 * <p>
 * Intake never marks anything uploaded: completion is only ever learned from
 * storage notifications, see {@link ai.pipestream.uploadstatus.reconcile.Reconciler}.
 */
@ApplicationScoped
public class UploadIntakeService {

    private static final Logger LOG = Logger.getLogger(UploadIntakeService.class);

    @Inject
    UploadConfiguration config;

    @Inject
    AuthorizationIssuer authorizationIssuer;

    @Inject
    UploadRecordStore store;

    @Inject
    IntakeMetrics metrics;

    /**
     * Request an upload to {@code desiredKey}, or to a generated key when blank.
     *
     * @return the credential and the pending record identifier; fails with
     *         {@link UploadConflictException} when a live upload holds the key, or with
     *         {@link InvalidUploadKeyException} when the key is unusable or outside the reconciled prefixes
     */
    public Uni<UploadGrant> requestUpload(String desiredKey) {
        Timer.Sample timerSample = metrics.startRequestUploadTimer();

        String objectKey;
        try {
            objectKey = ObjectKeys.resolve(desiredKey, config.keyPrefix());
            if (!KeyScope.covers(config.events(), objectKey)) {
                // notifications for this key would be discarded and the record could never complete
                throw new InvalidUploadKeyException(objectKey,
                        "outside the reconciled key prefixes " + KeyScope.describe(config.events()));
            }
        } catch (InvalidUploadKeyException e) {
            metrics.recordInvalidKey();
            metrics.stopRequestUploadTimer(timerSample);
            return Uni.createFrom().failure(e);
        }

        return store.findLiveByObjectKey(objectKey)
                .flatMap(existing -> {
                    if (existing != null) {
                        return Uni.createFrom().<UploadGrant>failure(new UploadConflictException(objectKey));
                    }
                    UploadCredential credential = authorizationIssuer.issueCredential(
                            objectKey, UploadOperation.PUT_OBJECT, config.credentialTtl());
                    UploadRecord pending = UploadRecord.pending(
                            UUID.randomUUID(), objectKey, credential.expiresAt(), Instant.now());
                    return store.createIfAbsent(pending)
                            .map(created -> new UploadGrant(credential, created.id(), created.objectKey(),
                                    credential.expiresAt()));
                })
                .invoke(grant -> {
                    metrics.recordUploadRequested();
                    LOG.infof("Upload requested: recordId=%s, objectKey=%s, expiresAt=%s",
                            grant.recordId(), grant.objectKey(), grant.expiresAt());
                })
                .onFailure(UploadConflictException.class).invoke(e -> {
                    metrics.recordConflict();
                    LOG.infof("Upload request conflicts with live upload: objectKey=%s", objectKey);
                })
                .eventually(() -> metrics.stopRequestUploadTimer(timerSample));
    }

    /**
     * Look up an upload record by id.
     *
     * @return the record, or a failure with {@link UploadNotFoundException}
     */
    public Uni<UploadRecord> getUpload(UUID recordId) {
        return store.get(recordId)
                .onItem().ifNull().failWith(() -> new UploadNotFoundException(recordId.toString()));
    }
}

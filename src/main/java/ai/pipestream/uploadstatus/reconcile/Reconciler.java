package ai.pipestream.uploadstatus.reconcile;

import ai.pipestream.uploadstatus.config.UploadConfiguration;
import ai.pipestream.uploadstatus.dispatch.Dispatcher;
import ai.pipestream.uploadstatus.events.EventType;
import ai.pipestream.uploadstatus.events.NormalizedEvent;
import ai.pipestream.uploadstatus.model.StatusChange;
import ai.pipestream.uploadstatus.model.UploadRecord;
import ai.pipestream.uploadstatus.model.UploadStatus;
import ai.pipestream.uploadstatus.store.UploadRecordStore;
import io.micrometer.core.instrument.Timer;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Applies storage events to upload records.
 * <p>
 * The only mutual exclusion between concurrent workers is the record store's
 * conditional update: for any number of deliveries of the same completion, exactly
 * one caller wins {@code PENDING -> UPLOADED} and only the winner dispatches.
 * Actions are marked dispatched after the dispatcher acknowledges them, so a crash
 * between the two leaves the action missing and the retry job re-drives it.
 */
@ApplicationScoped
public class Reconciler {

    private static final Logger LOG = Logger.getLogger(Reconciler.class);

    @Inject
    UploadRecordStore store;

    @Inject
    Dispatcher dispatcher;

    @Inject
    DedupWindow dedupWindow;

    @Inject
    ReconcileMetrics metrics;

    @Inject
    UploadConfiguration config;

    Clock clock = Clock.systemUTC();

    public Uni<Outcome> reconcile(NormalizedEvent event) {
        Timer.Sample sample = metrics.startReconcileTimer();
        return store.findLiveByObjectKey(event.objectKey())
                .flatMap(record -> {
                    if (record == null) {
                        LOG.debugf("No live upload for key %s (event %s), ignoring",
                                event.objectKey(), event.rawEventId());
                        return Uni.createFrom().item(Outcome.IGNORED);
                    }
                    return switch (record.status()) {
                        case PENDING -> onPending(record, event);
                        case UPLOADED -> onUploaded(record, event);
                        default -> onTerminal(record, event);
                    };
                })
                .invoke(outcome -> {
                    metrics.recordOutcome(outcome);
                    LOG.debugf("Reconciled event %s for key %s: %s",
                            event.rawEventId(), event.objectKey(), outcome);
                })
                .onTermination().invoke(() -> metrics.stopReconcileTimer(sample));
    }

    /**
     * Dispatch every configured action the record has not been acknowledged for yet.
     *
     * @return number of actions newly acknowledged
     */
    public Uni<Integer> redispatchMissing(UploadRecord record) {
        if (record.status() != UploadStatus.UPLOADED) {
            return Uni.createFrom().item(0);
        }
        List<String> missing = record.missingActions(config.dispatch().actions());
        if (missing.isEmpty()) {
            return Uni.createFrom().item(0);
        }
        return Multi.createFrom().iterable(missing)
                .onItem().transformToUniAndConcatenate(action -> dispatchOne(action, record))
                .collect().asList()
                .map(results -> (int) results.stream().filter(Boolean::booleanValue).count());
    }

    /**
     * How long after the transition to {@code UPLOADED} the winning worker may still be
     * dispatching: every action is sent in turn, each bounded by the dispatch timeout.
     * A missing action is only re-driven once this window has passed.
     */
    public static Duration dispatchWindow(UploadConfiguration.Dispatch dispatch) {
        return dispatch.timeout().multipliedBy(Math.max(1, dispatch.actions().size()));
    }

    /**
     * Whether the initial dispatch of an uploaded record can no longer be in flight at {@code now}.
     */
    public static boolean isDispatchSettled(UploadRecord record, UploadConfiguration.Dispatch dispatch, Instant now) {
        return !record.updatedAt().plus(dispatchWindow(dispatch)).isAfter(now);
    }

    private Uni<Outcome> onPending(UploadRecord record, NormalizedEvent event) {
        if (event.eventType() != EventType.CREATED) {
            LOG.debugf("Ignoring %s event for pending upload %s", event.eventType(), record.id());
            return Uni.createFrom().item(Outcome.IGNORED);
        }

        // must precede the transition: a redelivery that already sees UPLOADED may not re-drive actions
        dedupWindow.remember(event.rawEventId());

        Instant now = clock.instant();
        if (record.isCredentialExpired(now)) {
            // the bytes landed; a late notification still completes the upload
            LOG.infof("Accepting late completion for upload %s, credential expired at %s",
                    record.id(), record.credentialExpiry());
        }

        if (exceedsSizeLimit(event)) {
            return store.compareAndSetStatus(record.id(), UploadStatus.PENDING,
                            StatusChange.failed(now, event.sizeBytes(), event.etag()))
                    .map(updated -> {
                        if (updated.isEmpty()) {
                            return Outcome.DUPLICATE_IGNORED;
                        }
                        LOG.warnf("Rejected upload %s: object %s is %d bytes, limit %d",
                                record.id(), record.objectKey(), event.sizeBytes(),
                                config.maxObjectSize().getAsLong());
                        return Outcome.REJECTED;
                    });
        }

        return store.compareAndSetStatus(record.id(), UploadStatus.PENDING,
                        StatusChange.uploaded(now, event.providerTimestamp(), event.sizeBytes(), event.etag()))
                .flatMap(updated -> {
                    if (updated.isEmpty()) {
                        LOG.debugf("Lost transition race for upload %s (event %s)", record.id(), event.rawEventId());
                        return Uni.createFrom().item(Outcome.DUPLICATE_IGNORED);
                    }
                    UploadRecord uploaded = updated.get();
                    LOG.infof("Upload %s completed: key=%s, size=%s", uploaded.id(), uploaded.objectKey(),
                            uploaded.sizeBytes());
                    return redispatchMissing(uploaded).replaceWith(Outcome.RECONCILED);
                });
    }

    private Uni<Outcome> onUploaded(UploadRecord record, NormalizedEvent event) {
        if (event.eventType() == EventType.REMOVED) {
            LOG.warnf("Object %s of uploaded record %s was removed from the store (event %s)",
                    record.objectKey(), record.id(), event.rawEventId());
            return Uni.createFrom().item(Outcome.ANOMALY);
        }
        if (dedupWindow.contains(event.rawEventId())) {
            return Uni.createFrom().item(Outcome.DUPLICATE_IGNORED);
        }
        if (!isDispatchSettled(record, config.dispatch(), clock.instant())) {
            LOG.debugf("Upload %s completed at %s, its dispatch may still be running; not re-driving",
                    record.id(), record.updatedAt());
            return Uni.createFrom().item(Outcome.IGNORED);
        }
        return redispatchMissing(record)
                .map(redriven -> {
                    if (redriven > 0) {
                        LOG.infof("Re-drove %d missing action(s) for upload %s", redriven, record.id());
                    }
                    return Outcome.IGNORED;
                });
    }

    private Uni<Outcome> onTerminal(UploadRecord record, NormalizedEvent event) {
        if (dedupWindow.contains(event.rawEventId())) {
            return Uni.createFrom().item(Outcome.DUPLICATE_IGNORED);
        }
        LOG.debugf("Ignoring %s event for %s upload %s", event.eventType(), record.status(), record.id());
        return Uni.createFrom().item(Outcome.IGNORED);
    }

    private Uni<Boolean> dispatchOne(String action, UploadRecord record) {
        return dispatcher.dispatch(action, record)
                .flatMap(ack -> store.markActionDispatched(record.id(), action))
                .invoke(added -> metrics.recordDispatch(action, true))
                .onFailure().recoverWithItem(failure -> {
                    metrics.recordDispatch(action, false);
                    LOG.warnf(failure, "Dispatch of %s for upload %s failed, leaving it for retry",
                            action, record.id());
                    return false;
                });
    }

    private boolean exceedsSizeLimit(NormalizedEvent event) {
        return event.sizeBytes() != null
                && config.maxObjectSize().isPresent()
                && event.sizeBytes() > config.maxObjectSize().getAsLong();
    }
}

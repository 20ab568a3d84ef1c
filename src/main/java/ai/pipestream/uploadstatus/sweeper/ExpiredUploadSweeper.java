package ai.pipestream.uploadstatus.sweeper;

import ai.pipestream.uploadstatus.config.UploadConfiguration;
import ai.pipestream.uploadstatus.model.StatusChange;
import ai.pipestream.uploadstatus.model.UploadRecord;
import ai.pipestream.uploadstatus.model.UploadStatus;
import ai.pipestream.uploadstatus.reconcile.ReconcileMetrics;
import ai.pipestream.uploadstatus.store.UploadRecordStore;
import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;

/**
 * Expires pending uploads whose credential ran out more than the grace period ago.
 * Uses the same conditional update as the reconciler, so a completion that lands
 * first always wins.
 */
@ApplicationScoped
public class ExpiredUploadSweeper {

    private static final Logger LOG = Logger.getLogger(ExpiredUploadSweeper.class);

    @Inject
    UploadRecordStore store;

    @Inject
    ReconcileMetrics metrics;

    @Inject
    UploadConfiguration config;

    Clock clock = Clock.systemUTC();

    @Scheduled(every = "{uploads.sweeper.interval}", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    Uni<Void> scheduledSweep() {
        return sweep()
                .onFailure().invoke(e -> LOG.warnf(e, "Expiry sweep failed, retrying next interval"))
                .onFailure().recoverWithItem(0)
                .replaceWithVoid();
    }

    /**
     * @return number of records moved to {@link UploadStatus#EXPIRED}
     */
    public Uni<Integer> sweep() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(config.sweeper().grace());
        return store.findPendingExpiredBefore(cutoff, config.sweeper().batchSize())
                .flatMap(candidates -> Multi.createFrom().iterable(candidates)
                        .onItem().transformToUniAndConcatenate(record -> expire(record, now))
                        .collect().asList())
                .map(results -> {
                    int expired = (int) results.stream().filter(Boolean::booleanValue).count();
                    if (expired > 0) {
                        LOG.infof("Expired %d pending upload(s) with credentials older than %s", expired, cutoff);
                    }
                    return expired;
                });
    }

    private Uni<Boolean> expire(UploadRecord record, Instant now) {
        return store.compareAndSetStatus(record.id(), UploadStatus.PENDING, StatusChange.expired(now))
                .map(updated -> {
                    if (updated.isPresent()) {
                        metrics.recordExpired();
                        LOG.debugf("Expired upload %s (key %s)", record.id(), record.objectKey());
                        return true;
                    }
                    metrics.recordExpiryRaceLost();
                    LOG.debugf("Upload %s left pending state before it could expire", record.id());
                    return false;
                });
    }
}

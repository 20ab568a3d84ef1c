package ai.pipestream.uploadstatus.sweeper;

import ai.pipestream.uploadstatus.config.UploadConfiguration;
import ai.pipestream.uploadstatus.reconcile.Reconciler;
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
 * Re-drives downstream actions that were never acknowledged for uploaded records.
 * Records completed within the last {@link Reconciler#dispatchWindow dispatch window} are left alone.
 */
@ApplicationScoped
public class DispatchRetryJob {

    private static final Logger LOG = Logger.getLogger(DispatchRetryJob.class);

    @Inject
    UploadRecordStore store;

    @Inject
    Reconciler reconciler;

    @Inject
    UploadConfiguration config;

    Clock clock = Clock.systemUTC();

    @Scheduled(every = "{uploads.dispatch.retry-interval}", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    Uni<Void> scheduledRetry() {
        return retryMissingDispatches()
                .onFailure().invoke(e -> LOG.warnf(e, "Dispatch retry run failed"))
                .onFailure().recoverWithItem(0)
                .replaceWithVoid();
    }

    /**
     * @return number of actions acknowledged in this run
     */
    public Uni<Integer> retryMissingDispatches() {
        Instant now = clock.instant();
        return store.findUploadedWithMissingActions(config.dispatch().actions(), config.dispatch().retryBatchSize())
                .map(records -> records.stream()
                        // the worker that completed a fresh upload may still be dispatching it
                        .filter(record -> Reconciler.isDispatchSettled(record, config.dispatch(), now))
                        .toList())
                .flatMap(records -> Multi.createFrom().iterable(records)
                        .onItem().transformToUniAndConcatenate(reconciler::redispatchMissing)
                        .collect().asList())
                .map(counts -> {
                    int total = counts.stream().mapToInt(Integer::intValue).sum();
                    if (total > 0) {
                        LOG.infof("Dispatch retry acknowledged %d action(s) across %d upload(s)", total, counts.size());
                    }
                    return total;
                });
    }
}

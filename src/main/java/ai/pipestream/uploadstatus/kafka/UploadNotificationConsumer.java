package ai.pipestream.uploadstatus.kafka;

import ai.pipestream.uploadstatus.config.UploadConfiguration;
import ai.pipestream.uploadstatus.events.EventNormalizer;
import ai.pipestream.uploadstatus.events.NormalizedEvent;
import ai.pipestream.uploadstatus.exception.MalformedEventException;
import ai.pipestream.uploadstatus.exception.TransientStoreException;
import ai.pipestream.uploadstatus.reconcile.Outcome;
import ai.pipestream.uploadstatus.reconcile.ReconcileMetrics;
import ai.pipestream.uploadstatus.reconcile.Reconciler;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Incoming;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Consumes storage notifications and feeds them through the normalizer and reconciler.
 * <p>
 * A message is acked only after every event it carries has been reconciled. Transient
 * store failures are retried with backoff; when retries run out, or the payload is
 * malformed, the message is nacked and the channel's dead-letter strategy takes it.
 */
@ApplicationScoped
public class UploadNotificationConsumer {

    private static final Logger LOG = Logger.getLogger(UploadNotificationConsumer.class);

    @Inject
    EventNormalizer normalizer;

    @Inject
    Reconciler reconciler;

    @Inject
    ReconcileMetrics metrics;

    @Inject
    UploadConfiguration config;

    @Incoming("storage-notifications-in")
    public Uni<Void> consume(Message<String> message) {
        metrics.recordNotificationReceived();

        List<NormalizedEvent> events;
        try {
            events = normalizer.normalize(message.getPayload());
        } catch (MalformedEventException e) {
            metrics.recordMalformed();
            LOG.warnf("Dead-lettering malformed storage notification: %s", e.getMessage());
            return nack(message, e);
        }

        if (events.isEmpty()) {
            metrics.recordNotificationDiscarded();
            return ack(message);
        }

        return Multi.createFrom().iterable(events)
                .onItem().transformToUniAndConcatenate(this::reconcileWithRetry)
                .collect().asList()
                .flatMap(outcomes -> {
                    LOG.debugf("Notification processed: %d event(s), outcomes=%s", outcomes.size(), outcomes);
                    return ack(message);
                })
                .onFailure().recoverWithUni(failure -> {
                    LOG.errorf(failure, "Failed to reconcile storage notification, dead-lettering");
                    return nack(message, failure);
                });
    }

    Uni<Outcome> reconcileWithRetry(NormalizedEvent event) {
        UploadConfiguration.Consumer.Retry retry = config.consumer().retry();
        Uni<Outcome> attempt = Uni.createFrom().deferred(() -> reconciler.reconcile(event));
        if (retry.maxAttempts() <= 1) {
            return attempt;
        }
        return attempt
                .onFailure(TransientStoreException.class).invoke(e -> {
                    metrics.recordTransientRetry();
                    LOG.warnf("Transient store failure for key %s: %s", event.objectKey(), e.getMessage());
                })
                .onFailure(TransientStoreException.class).retry()
                .withBackOff(retry.initialBackoff(), retry.maxBackoff())
                .atMost(retry.maxAttempts() - 1L);
    }

    private Uni<Void> ack(Message<String> message) {
        return Uni.createFrom().completionStage(message.ack());
    }

    private Uni<Void> nack(Message<String> message, Throwable reason) {
        metrics.recordDeadLettered();
        return Uni.createFrom().completionStage(message.nack(reason));
    }
}

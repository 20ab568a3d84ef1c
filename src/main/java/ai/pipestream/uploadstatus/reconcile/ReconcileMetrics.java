package ai.pipestream.uploadstatus.reconcile;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.Locale;

/**
 * Metrics for notification consumption, reconciliation, dispatch and sweeping.
 */
@ApplicationScoped
public class ReconcileMetrics {

    @Inject
    MeterRegistry registry;

    private Counter notificationsReceivedTotal;
    private Counter notificationsDiscardedTotal;
    private Counter notificationsMalformedTotal;
    private Counter notificationsDeadLetteredTotal;
    private Counter transientRetriesTotal;
    private Counter uploadsExpiredTotal;
    private Counter expiryRacesLostTotal;

    private Timer reconcileLatency;

    @PostConstruct
    void init() {
        notificationsReceivedTotal = Counter.builder("storage_notifications_received_total")
                .description("Storage notification messages received from the queue")
                .register(registry);

        notificationsDiscardedTotal = Counter.builder("storage_notifications_discarded_total")
                .description("Messages that carried no upload event (test events, foreign prefixes)")
                .register(registry);

        notificationsMalformedTotal = Counter.builder("storage_notifications_malformed_total")
                .description("Messages that could not be parsed")
                .register(registry);

        notificationsDeadLetteredTotal = Counter.builder("storage_notifications_dead_lettered_total")
                .description("Messages nacked to the dead-letter topic")
                .register(registry);

        transientRetriesTotal = Counter.builder("reconcile_transient_retries_total")
                .description("Retries after transient record store failures")
                .register(registry);

        uploadsExpiredTotal = Counter.builder("uploads_expired_total")
                .description("Pending uploads expired by the sweeper")
                .register(registry);

        expiryRacesLostTotal = Counter.builder("uploads_expiry_race_lost_total")
                .description("Expiry attempts that lost to a concurrent transition")
                .register(registry);

        reconcileLatency = Timer.builder("reconcile_latency")
                .description("Latency of reconciling one storage event")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordOutcome(Outcome outcome) {
        Counter.builder("reconcile_outcomes_total")
                .description("Reconcile outcomes by kind")
                .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordDispatch(String action, boolean acknowledged) {
        Counter.builder("dispatch_attempts_total")
                .description("Downstream dispatch attempts by action and result")
                .tag("action", action)
                .tag("result", acknowledged ? "ack" : "fail")
                .register(registry)
                .increment();
    }

    public void recordNotificationReceived() {
        notificationsReceivedTotal.increment();
    }

    public void recordNotificationDiscarded() {
        notificationsDiscardedTotal.increment();
    }

    public void recordMalformed() {
        notificationsMalformedTotal.increment();
    }

    public void recordDeadLettered() {
        notificationsDeadLetteredTotal.increment();
    }

    public void recordTransientRetry() {
        transientRetriesTotal.increment();
    }

    public void recordExpired() {
        uploadsExpiredTotal.increment();
    }

    public void recordExpiryRaceLost() {
        expiryRacesLostTotal.increment();
    }

    public Timer.Sample startReconcileTimer() {
        return Timer.start(registry);
    }

    public void stopReconcileTimer(Timer.Sample sample) {
        sample.stop(reconcileLatency);
    }
}

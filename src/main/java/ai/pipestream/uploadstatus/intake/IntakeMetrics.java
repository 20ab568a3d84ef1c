package ai.pipestream.uploadstatus.intake;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Metrics for upload intake.
 */
@ApplicationScoped
public class IntakeMetrics {

    @Inject
    MeterRegistry registry;

    private Counter uploadRequestedTotal;
    private Counter uploadConflictTotal;
    private Counter uploadRejectedKeyTotal;

    private Timer requestUploadLatency;

    @PostConstruct
    void init() {
        uploadRequestedTotal = Counter.builder("upload_requested_total")
                .description("Total number of upload credentials issued")
                .register(registry);

        uploadConflictTotal = Counter.builder("upload_conflict_total")
                .description("Upload requests rejected because the key is held by a live upload")
                .register(registry);

        uploadRejectedKeyTotal = Counter.builder("upload_invalid_key_total")
                .description("Upload requests rejected because the key is not usable")
                .register(registry);

        requestUploadLatency = Timer.builder("upload_request_latency")
                .description("Latency of upload requests")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordUploadRequested() {
        uploadRequestedTotal.increment();
    }

    public void recordConflict() {
        uploadConflictTotal.increment();
    }

    public void recordInvalidKey() {
        uploadRejectedKeyTotal.increment();
    }

    public Timer.Sample startRequestUploadTimer() {
        return Timer.start(registry);
    }

    public void stopRequestUploadTimer(Timer.Sample sample) {
        sample.stop(requestUploadLatency);
    }
}

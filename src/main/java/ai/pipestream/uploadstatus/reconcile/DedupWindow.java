package ai.pipestream.uploadstatus.reconcile;

import ai.pipestream.uploadstatus.config.UploadConfiguration;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.GuavaCacheMetrics;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Bounded, time-expiring memory of notification ids already applied.
 * <p>
 * Only distinguishes a redelivery from a fresh re-notification for reporting;
 * correctness never depends on it, since the conditional update and the
 * dispatched-action set already make duplicates harmless.
 */
@ApplicationScoped
public class DedupWindow {

    private static final Logger LOG = Logger.getLogger(DedupWindow.class);

    @Inject
    UploadConfiguration config;

    @Inject
    MeterRegistry meterRegistry;

    private Cache<String, Instant> seen;

    @PostConstruct
    void init() {
        seen = CacheBuilder.newBuilder()
                .maximumSize(config.dedup().maxEntries())
                .expireAfterWrite(config.dedup().window().toMillis(), TimeUnit.MILLISECONDS)
                .recordStats()
                .build();

        GuavaCacheMetrics.monitor(meterRegistry, seen, "reconcile_dedup_window");

        LOG.infof("DedupWindow initialized: maxEntries=%d, window=%s",
                config.dedup().maxEntries(), config.dedup().window());
    }

    /**
     * @return true if {@code rawEventId} was applied within the window
     */
    public boolean contains(String rawEventId) {
        return rawEventId != null && seen.getIfPresent(rawEventId) != null;
    }

    /**
     * Remember an applied notification id.
     *
     * @return true if the id was not remembered yet
     */
    public boolean remember(String rawEventId) {
        if (rawEventId == null) {
            return false;
        }
        return seen.asMap().putIfAbsent(rawEventId, Instant.now()) == null;
    }

    public long size() {
        return seen.size();
    }

    public void cleanup() {
        seen.cleanUp();
    }
}

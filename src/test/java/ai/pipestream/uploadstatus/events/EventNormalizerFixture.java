package ai.pipestream.uploadstatus.events;

import ai.pipestream.uploadstatus.config.UploadConfiguration;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Builds an {@link EventNormalizer} outside CDI for tests in other packages.
 */
public final class EventNormalizerFixture {

    private EventNormalizerFixture() {
    }

    public static EventNormalizer create(UploadConfiguration config, MeterRegistry registry) {
        EventNormalizer normalizer = new EventNormalizer();
        normalizer.objectMapper = new ObjectMapper();
        normalizer.config = config;
        normalizer.registry = registry;
        normalizer.init();
        return normalizer;
    }
}

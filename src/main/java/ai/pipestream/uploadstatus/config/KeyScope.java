package ai.pipestream.uploadstatus.config;

import java.util.List;
import java.util.Optional;

/**
 * The set of object keys this service reconciles, from {@code uploads.events.key-prefixes}.
 * <p>
 * Intake and the event normalizer both consult it, so every key handed out at intake
 * is one whose notifications are reconciled.
 */
public final class KeyScope {

    private KeyScope() {
    }

    /**
     * @return whether notifications for {@code key} are reconciled; all keys when no prefixes are configured
     */
    public static boolean covers(UploadConfiguration.Events events, String key) {
        Optional<List<String>> prefixes = events.keyPrefixes();
        return prefixes.isEmpty() || prefixes.get().stream().anyMatch(key::startsWith);
    }

    public static String describe(UploadConfiguration.Events events) {
        return events.keyPrefixes().map(List::toString).orElse("[any]");
    }
}

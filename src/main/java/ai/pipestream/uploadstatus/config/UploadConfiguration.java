package ai.pipestream.uploadstatus.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Configuration for upload intake and reconciliation.
 * All keys are namespaced under {@code uploads.*}.
 */
@ConfigMapping(prefix = "uploads")
public interface UploadConfiguration {

    /**
     * Lifetime of an issued upload credential.
     * Default: 15 minutes.
     */
    @WithDefault("PT15M")
    Duration credentialTtl();

    /**
     * Prefix for generated object keys when the caller does not supply one.
     * Default: uploads.
     */
    @WithDefault("uploads")
    String keyPrefix();

    /**
     * Largest object accepted on completion. Larger uploads are marked failed.
     * Unset means no limit.
     */
    OptionalLong maxObjectSize();

    Dedup dedup();

    Sweeper sweeper();

    Dispatch dispatch();

    Consumer consumer();

    Events events();

    interface Dedup {
        /**
         * How long an applied notification id is remembered.
         * Default: 1 hour.
         */
        @WithDefault("PT1H")
        Duration window();

        /**
         * Upper bound on remembered notification ids.
         * Default: 100000.
         */
        @WithDefault("100000")
        int maxEntries();
    }

    interface Sweeper {
        /**
         * Interval between expiry sweeps.
         * Default: 60 seconds.
         */
        @WithDefault("PT60S")
        Duration interval();

        /**
         * Extra time after credential expiry before a pending record is expired,
         * so in-flight notifications can still land.
         * Default: 5 minutes.
         */
        @WithDefault("PT5M")
        Duration grace();

        /**
         * Maximum records expired per sweep.
         * Default: 200.
         */
        @WithDefault("200")
        int batchSize();
    }

    interface Dispatch {
        /**
         * Downstream actions triggered once per successful upload, in dispatch order.
         * Default: scan, audit, quota.
         */
        @WithDefault("scan,audit,quota")
        List<String> actions();

        /**
         * Kafka topic prefix; the action name is appended.
         * Default: upload-actions.
         */
        @WithDefault("upload-actions.")
        String topicPrefix();

        /**
         * Time to wait for a broker acknowledgement per dispatch.
         * Default: 10 seconds.
         */
        @WithDefault("PT10S")
        Duration timeout();

        /**
         * Interval between retries of unacknowledged dispatches.
         * Default: 2 minutes.
         */
        @WithDefault("PT2M")
        Duration retryInterval();

        /**
         * Maximum records re-driven per retry run.
         * Default: 100.
         */
        @WithDefault("100")
        int retryBatchSize();
    }

    interface Consumer {
        Retry retry();

        interface Retry {
            /**
             * Attempts for transient store failures before the message is dead-lettered.
             * Default: 5.
             */
            @WithDefault("5")
            int maxAttempts();

            @WithDefault("PT0.2S")
            Duration initialBackoff();

            @WithDefault("PT10S")
            Duration maxBackoff();
        }
    }

    interface Events {
        /**
         * Only keys under one of these prefixes are reconciled. Unset means all keys.
         */
        Optional<List<String>> keyPrefixes();

        /**
         * Only notifications for this bucket are reconciled. Unset means any bucket.
         */
        Optional<String> bucket();
    }
}

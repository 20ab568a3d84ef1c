package ai.pipestream.uploadstatus.config;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Mutable {@link UploadConfiguration} for unit tests, preset with the production defaults.
 */
public class TestUploadConfiguration implements UploadConfiguration {

    public Duration credentialTtl = Duration.ofMinutes(15);
    public String keyPrefix = "uploads";
    public OptionalLong maxObjectSize = OptionalLong.empty();

    public Duration dedupWindow = Duration.ofHours(1);
    public int dedupMaxEntries = 100_000;

    public Duration sweeperInterval = Duration.ofSeconds(60);
    public Duration sweeperGrace = Duration.ofMinutes(5);
    public int sweeperBatchSize = 200;

    public List<String> actions = List.of("scan", "audit", "quota");
    public String topicPrefix = "upload-actions.";
    public Duration dispatchTimeout = Duration.ofSeconds(10);
    public Duration retryInterval = Duration.ofMinutes(2);
    public int retryBatchSize = 100;

    public int maxAttempts = 5;
    public Duration initialBackoff = Duration.ofMillis(1);
    public Duration maxBackoff = Duration.ofMillis(5);

    public Optional<List<String>> keyPrefixes = Optional.empty();
    public Optional<String> bucket = Optional.empty();

    @Override
    public Duration credentialTtl() {
        return credentialTtl;
    }

    @Override
    public String keyPrefix() {
        return keyPrefix;
    }

    @Override
    public OptionalLong maxObjectSize() {
        return maxObjectSize;
    }

    @Override
    public Dedup dedup() {
        return new Dedup() {
            @Override
            public Duration window() {
                return dedupWindow;
            }

            @Override
            public int maxEntries() {
                return dedupMaxEntries;
            }
        };
    }

    @Override
    public Sweeper sweeper() {
        return new Sweeper() {
            @Override
            public Duration interval() {
                return sweeperInterval;
            }

            @Override
            public Duration grace() {
                return sweeperGrace;
            }

            @Override
            public int batchSize() {
                return sweeperBatchSize;
            }
        };
    }

    @Override
    public Dispatch dispatch() {
        return new Dispatch() {
            @Override
            public List<String> actions() {
                return actions;
            }

            @Override
            public String topicPrefix() {
                return topicPrefix;
            }

            @Override
            public Duration timeout() {
                return dispatchTimeout;
            }

            @Override
            public Duration retryInterval() {
                return retryInterval;
            }

            @Override
            public int retryBatchSize() {
                return retryBatchSize;
            }
        };
    }

    @Override
    public Consumer consumer() {
        return () -> new Consumer.Retry() {
            @Override
            public int maxAttempts() {
                return maxAttempts;
            }

            @Override
            public Duration initialBackoff() {
                return initialBackoff;
            }

            @Override
            public Duration maxBackoff() {
                return maxBackoff;
            }
        };
    }

    @Override
    public Events events() {
        return new Events() {
            @Override
            public Optional<List<String>> keyPrefixes() {
                return keyPrefixes;
            }

            @Override
            public Optional<String> bucket() {
                return bucket;
            }
        };
    }
}

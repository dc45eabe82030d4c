package github.sarthakdev143.matte_embed.pool;

import java.time.Duration;

public record ExecutorConfig(int workerCount, String threadNamePrefix, Duration pollInterval) {

    public ExecutorConfig {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be at least 1.");
        }
        threadNamePrefix = threadNamePrefix == null || threadNamePrefix.isBlank() ? "matte-embed-" : threadNamePrefix;
        pollInterval = pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()
                ? Duration.ofMillis(100)
                : pollInterval;
    }
}

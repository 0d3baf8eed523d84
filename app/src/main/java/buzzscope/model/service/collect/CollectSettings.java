package buzzscope.model.service.collect;

import buzzscope.collector.core.Mode;

import java.time.Duration;

/**
 * @param cacheMaxAge        entries older than this are refetched
 * @param retryBackoff       pause before the single retry of a retryable failure
 * @param perPlatformTimeout budget of one platform, from submission
 * @param overallTimeout     budget of the whole call
 */
public record CollectSettings(
        Duration cacheMaxAge,
        int historicalLimit,
        int hotLimit,
        Duration retryBackoff,
        Duration perPlatformTimeout,
        Duration overallTimeout,
        int workerThreads
) {
    public static final CollectSettings DEFAULTS = new CollectSettings(
            Duration.ofHours(24), 100, 50, Duration.ofSeconds(2),
            Duration.ofSeconds(60), Duration.ofSeconds(180), 4);

    public CollectSettings {
        if (historicalLimit <= 0 || hotLimit <= 0) throw new IllegalArgumentException("limits must be positive");
        if (workerThreads <= 0) throw new IllegalArgumentException("workerThreads must be positive");
        if (cacheMaxAge.isNegative() || retryBackoff.isNegative()) {
            throw new IllegalArgumentException("durations must not be negative");
        }
        if (perPlatformTimeout.isNegative() || perPlatformTimeout.isZero()
                || overallTimeout.isNegative() || overallTimeout.isZero()) {
            throw new IllegalArgumentException("timeouts must be positive");
        }
    }

    public int limitFor(Mode mode) {
        return mode == Mode.HOT ? hotLimit : historicalLimit;
    }

    public CollectSettings withRetryBackoff(Duration d) {
        return new CollectSettings(cacheMaxAge, historicalLimit, hotLimit, d, perPlatformTimeout, overallTimeout, workerThreads);
    }

    public CollectSettings withTimeouts(Duration perPlatform, Duration overall) {
        return new CollectSettings(cacheMaxAge, historicalLimit, hotLimit, retryBackoff, perPlatform, overall, workerThreads);
    }
}

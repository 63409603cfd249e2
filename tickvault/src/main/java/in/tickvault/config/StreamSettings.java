package in.tickvault.config;

import in.tickvault.domain.model.Granularity;

import java.time.Duration;
import java.util.List;

/**
 * Realtime stream worker tuning.
 *
 * @param batchSize          records buffered before a write
 * @param batchFlushInterval max age of a non-empty batch
 * @param heartbeatTimeout   silence after which the connection is torn down
 * @param degradedAfter      consecutive failed connects before the stream is flagged degraded
 * @param persistRaw         also keep every payload in trades_raw
 */
public record StreamSettings(
    int batchSize,
    Duration batchFlushInterval,
    Duration heartbeatTimeout,
    Duration reconnectInitialDelay,
    Duration reconnectMaxDelay,
    double reconnectMultiplier,
    double reconnectJitter,
    int degradedAfter,
    List<Granularity> granularities,
    Duration latenessWindow,
    boolean persistRaw
) {
    public StreamSettings {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        if (batchFlushInterval == null || batchFlushInterval.isZero() || batchFlushInterval.isNegative()) {
            throw new IllegalArgumentException("batchFlushInterval must be positive: " + batchFlushInterval);
        }
        if (granularities == null || granularities.isEmpty()) {
            throw new IllegalArgumentException("At least one granularity is required");
        }
        granularities = List.copyOf(granularities);
    }

    public static StreamSettings defaults() {
        return new StreamSettings(200, Duration.ofSeconds(1), Duration.ofSeconds(30),
            Duration.ofSeconds(1), Duration.ofMinutes(1), 2.0, 0.2, 5,
            List.of(Granularity.ONE_SECOND, Granularity.ONE_MINUTE), Duration.ofMinutes(2), true);
    }

    /**
     * How long one poll may block; short enough to honour the flush interval and stop requests.
     */
    public Duration pollInterval() {
        Duration cap = Duration.ofMillis(500);
        return batchFlushInterval.compareTo(cap) < 0 ? batchFlushInterval : cap;
    }
}

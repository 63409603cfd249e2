package in.tickvault.config;

import in.tickvault.domain.model.QuoteMode;

import java.time.Duration;

/**
 * Storage writer tuning.
 *
 * @param batchSize            max records per database round trip
 * @param maxRetries           retries of a batch after a transient failure
 * @param maxConcurrentBatches batches in flight at once; matches the connection pool size
 */
public record StorageSettings(
    int batchSize,
    int maxRetries,
    int maxConcurrentBatches,
    Duration initialBackoff,
    Duration maxBackoff,
    QuoteMode quoteMode
) {
    public StorageSettings {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
        }
        if (maxConcurrentBatches <= 0) {
            throw new IllegalArgumentException("maxConcurrentBatches must be positive: " + maxConcurrentBatches);
        }
        if (quoteMode == null) {
            quoteMode = QuoteMode.LATEST;
        }
    }

    public static StorageSettings defaults() {
        return new StorageSettings(500, 3, 10, Duration.ofMillis(200), Duration.ofSeconds(5), QuoteMode.LATEST);
    }
}

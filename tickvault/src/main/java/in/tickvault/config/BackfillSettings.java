package in.tickvault.config;

import in.tickvault.domain.model.Granularity;

import java.time.Duration;
import java.util.List;

/**
 * Fetch job manager tuning.
 *
 * @param chunkSize          width of one fetch-normalize-write-checkpoint step
 * @param parallelism        jobs running at once; chunks of one job stay sequential
 * @param maxJobAttempts     automatic FAILED to PENDING retries before a job stays FAILED
 * @param chunkMaxAttempts   attempts per chunk fetch on transient provider errors
 * @param chunkMaxElapsed    time budget per chunk fetch including backoff
 * @param aggregation        granularities historical trades are rolled up into
 */
public record BackfillSettings(
    Duration chunkSize,
    int parallelism,
    int maxJobAttempts,
    int chunkMaxAttempts,
    Duration chunkMaxElapsed,
    Duration initialBackoff,
    Duration maxBackoff,
    List<Granularity> aggregation,
    Duration latenessWindow
) {
    public BackfillSettings {
        if (chunkSize == null || chunkSize.isZero() || chunkSize.isNegative()) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive: " + parallelism);
        }
        if (maxJobAttempts <= 0) {
            throw new IllegalArgumentException("maxJobAttempts must be positive: " + maxJobAttempts);
        }
        aggregation = aggregation == null ? List.of() : List.copyOf(aggregation);
    }

    public static BackfillSettings defaults() {
        return new BackfillSettings(Duration.ofDays(1), 4, 3, 5, Duration.ofMinutes(5),
            Duration.ofMillis(500), Duration.ofSeconds(30),
            List.of(Granularity.ONE_SECOND, Granularity.ONE_MINUTE), Duration.ofMinutes(2));
    }
}

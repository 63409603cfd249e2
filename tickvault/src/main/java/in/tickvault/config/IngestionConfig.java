package in.tickvault.config;

import in.tickvault.domain.model.Granularity;
import in.tickvault.domain.model.QuoteMode;
import in.tickvault.util.Env;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything the process is configured with, read once at startup.
 *
 * Lookup is env var, then system property, then the default shown in {@link #fromEnv()}.
 */
public record IngestionConfig(
    DatabaseSettings database,
    ProviderCatalog catalog,
    StorageSettings storage,
    StreamSettings streams,
    BackfillSettings backfill,
    Duration maxFutureSkew,
    int httpPort,
    int partitionMonthsAhead,
    Duration shutdownGrace,
    Duration connectTimeout,
    Duration simulatedTickInterval
) {

    public static IngestionConfig fromEnv() {
        int poolSize = Env.getInt("DB_POOL_SIZE", 10);
        DatabaseSettings database = new DatabaseSettings(
            Env.get("DB_URL", "jdbc:postgresql://localhost:5432/tickvault"),
            Env.get("DB_USER", "postgres"),
            Env.get("DB_PASS", "postgres"),
            poolSize,
            Env.getDuration("DB_CONNECTION_TIMEOUT", Duration.ofSeconds(5)));

        List<Granularity> granularities = parseGranularities(Env.get("TICKVAULT_GRANULARITIES", "1s,1m"));
        Duration lateness = Env.getDuration("TICKVAULT_LATENESS_WINDOW", Duration.ofMinutes(2));

        StorageSettings storage = new StorageSettings(
            Env.getInt("TICKVAULT_STORAGE_BATCH_SIZE", 500),
            Env.getInt("TICKVAULT_STORAGE_MAX_RETRIES", 3),
            poolSize,
            Env.getDuration("TICKVAULT_STORAGE_INITIAL_BACKOFF", Duration.ofMillis(200)),
            Env.getDuration("TICKVAULT_STORAGE_MAX_BACKOFF", Duration.ofSeconds(5)),
            QuoteMode.valueOf(Env.get("TICKVAULT_QUOTE_MODE", "LATEST").trim().toUpperCase()));

        StreamSettings streams = new StreamSettings(
            Env.getInt("TICKVAULT_STREAM_BATCH_SIZE", 200),
            Env.getDuration("TICKVAULT_BATCH_FLUSH_INTERVAL", Duration.ofSeconds(1)),
            Env.getDuration("TICKVAULT_HEARTBEAT_TIMEOUT", Duration.ofSeconds(30)),
            Env.getDuration("TICKVAULT_RECONNECT_INITIAL", Duration.ofSeconds(1)),
            Env.getDuration("TICKVAULT_RECONNECT_MAX", Duration.ofMinutes(1)),
            Env.getDouble("TICKVAULT_RECONNECT_MULTIPLIER", 2.0),
            Env.getDouble("TICKVAULT_RECONNECT_JITTER", 0.2),
            Env.getInt("TICKVAULT_DEGRADED_AFTER", 5),
            granularities,
            lateness,
            Env.getBool("TICKVAULT_PERSIST_RAW", true));

        BackfillSettings backfill = new BackfillSettings(
            Env.getDuration("TICKVAULT_CHUNK_SIZE", Duration.ofDays(1)),
            Env.getInt("TICKVAULT_BACKFILL_PARALLELISM", 4),
            Env.getInt("TICKVAULT_MAX_JOB_ATTEMPTS", 3),
            Env.getInt("TICKVAULT_FETCH_MAX_ATTEMPTS", 5),
            Env.getDuration("TICKVAULT_FETCH_MAX_ELAPSED", Duration.ofMinutes(5)),
            Env.getDuration("TICKVAULT_FETCH_INITIAL_BACKOFF", Duration.ofMillis(500)),
            Env.getDuration("TICKVAULT_FETCH_MAX_BACKOFF", Duration.ofSeconds(30)),
            granularities,
            lateness);

        return new IngestionConfig(
            database,
            ProviderCatalog.load(),
            storage,
            streams,
            backfill,
            Env.getDuration("TICKVAULT_MAX_FUTURE_SKEW", Duration.ofSeconds(5)),
            Env.getInt("TICKVAULT_HTTP_PORT", 8080),
            Env.getInt("TICKVAULT_PARTITION_MONTHS_AHEAD", 3),
            Env.getDuration("TICKVAULT_SHUTDOWN_GRACE", Duration.ofSeconds(10)),
            Env.getDuration("TICKVAULT_CONNECT_TIMEOUT", Duration.ofSeconds(10)),
            Env.getDuration("TICKVAULT_SIMULATED_TICK", Duration.ofMillis(250)));
    }

    /**
     * Comma-separated granularity labels, e.g. {@code 1s,1m,1h}.
     */
    public static List<Granularity> parseGranularities(String text) {
        List<Granularity> result = new ArrayList<>();
        for (String part : text.split(",")) {
            if (!part.isBlank()) {
                Granularity granularity = Granularity.parse(part.trim());
                if (!result.contains(granularity)) {
                    result.add(granularity);
                }
            }
        }
        if (result.isEmpty()) {
            throw new IllegalArgumentException("No granularities in '" + text + "'");
        }
        return result;
    }
}

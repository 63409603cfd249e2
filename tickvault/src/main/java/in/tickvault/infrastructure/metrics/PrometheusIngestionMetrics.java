package in.tickvault.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of IngestionMetrics.
 *
 * Key Metrics:
 * - ingest_records_total{provider, kind}
 * - ingest_normalization_failures_total{provider, reason}
 * - ingest_dead_letter_total{provider, reason}
 * - late_trades_dropped_total{provider, granularity}
 * - candle_corrections_total{provider, granularity}
 * - stream_reconnects_total{provider, symbol, cause}
 * - stream_lag_seconds{provider, symbol}
 * - stream_degraded{provider, symbol} (1=degraded, 0=healthy)
 * - provider_active_connections{provider}
 * - provider_last_success_timestamp_seconds{provider}
 * - backfill_chunks_total{provider, outcome}
 * - storage_batch_latency_seconds{table, status}
 */
public class PrometheusIngestionMetrics implements IngestionMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusIngestionMetrics.class);

    private final CollectorRegistry registry;

    private final Counter ingestedCounter;
    private final Counter normalizationFailureCounter;
    private final Counter deadLetterCounter;
    private final Counter lateDropCounter;
    private final Counter correctionCounter;
    private final Counter reconnectCounter;
    private final Counter rateLimitCounter;
    private final Counter backfillChunkCounter;

    private final Gauge streamLag;
    private final Gauge streamDegraded;
    private final Gauge activeConnections;
    private final Gauge lastSuccess;

    private final Histogram storageBatchLatency;

    public PrometheusIngestionMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusIngestionMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.ingestedCounter = Counter.build()
            .name("ingest_records_total")
            .help("Total number of records written")
            .labelNames("provider", "kind")
            .register(registry);

        this.normalizationFailureCounter = Counter.build()
            .name("ingest_normalization_failures_total")
            .help("Total number of records rejected by the normalizer")
            .labelNames("provider", "reason")
            .register(registry);

        this.deadLetterCounter = Counter.build()
            .name("ingest_dead_letter_total")
            .help("Total number of records written to the dead letter store")
            .labelNames("provider", "reason")
            .register(registry);

        this.lateDropCounter = Counter.build()
            .name("late_trades_dropped_total")
            .help("Trades older than the lateness window")
            .labelNames("provider", "granularity")
            .register(registry);

        this.correctionCounter = Counter.build()
            .name("candle_corrections_total")
            .help("Flushed candles corrected by late trades")
            .labelNames("provider", "granularity")
            .register(registry);

        this.reconnectCounter = Counter.build()
            .name("stream_reconnects_total")
            .help("Total number of live stream reconnects")
            .labelNames("provider", "symbol", "cause")
            .register(registry);

        this.rateLimitCounter = Counter.build()
            .name("provider_rate_limited_total")
            .help("Throttle responses received from providers")
            .labelNames("provider")
            .register(registry);

        this.backfillChunkCounter = Counter.build()
            .name("backfill_chunks_total")
            .help("Backfill chunks processed")
            .labelNames("provider", "outcome")
            .register(registry);

        this.streamLag = Gauge.build()
            .name("stream_lag_seconds")
            .help("Seconds between now and the newest event time seen on the stream")
            .labelNames("provider", "symbol")
            .register(registry);

        this.streamDegraded = Gauge.build()
            .name("stream_degraded")
            .help("Stream degraded flag (1=degraded, 0=healthy)")
            .labelNames("provider", "symbol")
            .register(registry);

        this.activeConnections = Gauge.build()
            .name("provider_active_connections")
            .help("Open live connections per provider")
            .labelNames("provider")
            .register(registry);

        this.lastSuccess = Gauge.build()
            .name("provider_last_success_timestamp_seconds")
            .help("Unix time of the last successful write for the provider")
            .labelNames("provider")
            .register(registry);

        this.storageBatchLatency = Histogram.build()
            .name("storage_batch_latency_seconds")
            .help("Storage batch write latency in seconds")
            .labelNames("table", "status")
            .buckets(0.005, 0.01, 0.05, 0.1, 0.25, 0.5, 1.0, 2.5, 5.0)
            .register(registry);

        log.info("[PrometheusIngestionMetrics] Initialized ingestion metrics");
    }

    @Override
    public void recordIngested(String provider, String kind, int count) {
        if (count <= 0) {
            return;
        }
        ingestedCounter.labels(provider, kind).inc(count);
        lastSuccess.labels(provider).setToCurrentTime();
    }

    @Override
    public void recordNormalizationFailure(String provider, String reason) {
        normalizationFailureCounter.labels(provider, reason).inc();
    }

    @Override
    public void recordDeadLetter(String provider, String reason) {
        deadLetterCounter.labels(provider, reasonLabel(reason)).inc();
    }

    @Override
    public void recordLateTradeDropped(String provider, String granularity) {
        lateDropCounter.labels(provider, granularity).inc();
    }

    @Override
    public void recordCandleCorrection(String provider, String granularity) {
        correctionCounter.labels(provider, granularity).inc();
    }

    @Override
    public void recordReconnect(String provider, String symbol, String cause) {
        reconnectCounter.labels(provider, symbol, cause).inc();
    }

    @Override
    public void recordRateLimited(String provider) {
        rateLimitCounter.labels(provider).inc();
    }

    @Override
    public void recordBackfillChunk(String provider, String outcome) {
        backfillChunkCounter.labels(provider, outcome).inc();
    }

    @Override
    public void recordStreamLag(String provider, String symbol, Duration lag) {
        streamLag.labels(provider, symbol).set(Math.max(0.0, lag.toMillis() / 1000.0));
    }

    @Override
    public void setStreamDegraded(String provider, String symbol, boolean degraded) {
        streamDegraded.labels(provider, symbol).set(degraded ? 1 : 0);
    }

    @Override
    public void setActiveConnections(String provider, int connections) {
        activeConnections.labels(provider).set(connections);
    }

    @Override
    public void recordStorageBatch(String table, Duration latency, boolean success) {
        storageBatchLatency.labels(table, success ? "success" : "failure").observe(latency.toNanos() / 1_000_000_000.0);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    /**
     * Keep label cardinality bounded: "storage_rejected: duplicate key ..." becomes "storage_rejected".
     */
    private static String reasonLabel(String reason) {
        if (reason == null) {
            return "unknown";
        }
        int colon = reason.indexOf(':');
        return colon > 0 ? reason.substring(0, colon) : reason;
    }
}

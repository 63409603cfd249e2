package in.tickvault.infrastructure.metrics;

import java.time.Duration;

/**
 * Ingestion pipeline metrics for monitoring and alerting.
 *
 * Implementations can publish to Prometheus, CloudWatch, etc.
 *
 * Key metrics:
 * - Records ingested per provider and kind
 * - Normalization failures and dead-letter writes
 * - Late trades dropped and candle corrections
 * - Stream reconnects, lag and degraded state
 * - Backfill chunks and storage batch latency
 */
public interface IngestionMetrics {

    /**
     * @param kind trade, quote, candle or raw
     */
    void recordIngested(String provider, String kind, int count);

    /**
     * @param reason reject reason code (missing_field, out_of_range, ...)
     */
    void recordNormalizationFailure(String provider, String reason);

    void recordDeadLetter(String provider, String reason);

    void recordLateTradeDropped(String provider, String granularity);

    void recordCandleCorrection(String provider, String granularity);

    void recordReconnect(String provider, String symbol, String cause);

    void recordRateLimited(String provider);

    /**
     * @param outcome completed, failed or retried
     */
    void recordBackfillChunk(String provider, String outcome);

    /**
     * Lag between now and the event time of the newest record seen on a stream.
     */
    void recordStreamLag(String provider, String symbol, Duration lag);

    void setStreamDegraded(String provider, String symbol, boolean degraded);

    void setActiveConnections(String provider, int connections);

    void recordStorageBatch(String table, Duration latency, boolean success);
}

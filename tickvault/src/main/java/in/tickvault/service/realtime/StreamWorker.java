package in.tickvault.service.realtime;

import in.tickvault.application.port.output.StreamOffsetRepository;
import in.tickvault.config.StreamSettings;
import in.tickvault.domain.model.Candle;
import in.tickvault.domain.model.ProviderRecord;
import in.tickvault.domain.model.Quote;
import in.tickvault.domain.model.RawEnvelope;
import in.tickvault.domain.model.StreamKind;
import in.tickvault.domain.model.StreamOffset;
import in.tickvault.domain.model.Trade;
import in.tickvault.domain.model.WriteOutcome;
import in.tickvault.infrastructure.metrics.IngestionMetrics;
import in.tickvault.infrastructure.provider.LiveStream;
import in.tickvault.infrastructure.provider.MalformedPayloadException;
import in.tickvault.infrastructure.provider.ProviderAdapter;
import in.tickvault.infrastructure.provider.ProviderException;
import in.tickvault.infrastructure.provider.common.HeartbeatMonitor;
import in.tickvault.infrastructure.provider.common.ReconnectionPolicy;
import in.tickvault.infrastructure.provider.common.Sleeper;
import in.tickvault.service.candle.CandleAggregator;
import in.tickvault.service.normalize.NormalizationResult;
import in.tickvault.service.normalize.Normalizer;
import in.tickvault.service.storage.StorageUnavailableException;
import in.tickvault.service.storage.StorageWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps one (provider, symbol) live stream flowing into storage.
 *
 * States: CONNECTING -> STREAMING -> DISCONNECTED -> CONNECTING ..., or STOPPED.
 *
 * Records are normalized, batched and written; the stream offset is committed
 * only after its batch was written. Trades reach the candle aggregator only
 * once they were newly stored. A connection that goes silent for longer than
 * the heartbeat timeout is torn down and re-established. Failed connects and
 * connections that drop before delivering anything back off exponentially;
 * after {@code degradedAfter} consecutive failures the stream is flagged
 * degraded but retries continue at the capped delay. The first record or
 * keepalive on a connection resets the backoff and clears the flag.
 */
public final class StreamWorker implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(StreamWorker.class);

    public enum State {
        CONNECTING,
        STREAMING,
        DISCONNECTED,
        STOPPED
    }

    private final String provider;
    private final String symbol;
    private final ProviderAdapter adapter;
    private final Normalizer normalizer;
    private final StorageWriter writer;
    private final StreamOffsetRepository offsetRepository;
    private final IngestionMetrics metrics;
    private final StreamSettings settings;
    private final Clock clock;
    private final Sleeper sleeper;
    private final AtomicInteger activeConnections;

    private final ReconnectionPolicy reconnectionPolicy;
    private final StreamOffsetTracker offsets;
    private final CandleAggregator aggregator;

    // Pending batch, owned by the worker thread
    private final List<RawEnvelope> pendingRaw = new ArrayList<>();
    private final List<Trade> pendingTrades = new ArrayList<>();
    private final List<Quote> pendingQuotes = new ArrayList<>();
    private final List<Candle> pendingCandles = new ArrayList<>();
    private final List<Trade> pendingAggregation = new ArrayList<>();
    private Instant batchStartedAt;

    private volatile State state = State.CONNECTING;
    private volatile boolean stopping = false;
    private volatile boolean degraded = false;
    private volatile LiveStream currentStream;
    private volatile Instant lastEventTime;
    private volatile long reconnects = 0;
    private volatile long recordsProcessed = 0;

    public StreamWorker(String provider,
                        String symbol,
                        ProviderAdapter adapter,
                        Normalizer normalizer,
                        StorageWriter writer,
                        StreamOffsetRepository offsetRepository,
                        IngestionMetrics metrics,
                        StreamSettings settings,
                        Clock clock,
                        Sleeper sleeper,
                        AtomicInteger activeConnections) {
        this.provider = provider;
        this.symbol = symbol;
        this.adapter = adapter;
        this.normalizer = normalizer;
        this.writer = writer;
        this.offsetRepository = offsetRepository;
        this.metrics = metrics;
        this.settings = settings;
        this.clock = clock;
        this.sleeper = sleeper;
        this.activeConnections = activeConnections;

        this.reconnectionPolicy = ReconnectionPolicy.builder()
            .initialDelay(settings.reconnectInitialDelay())
            .maxDelay(settings.reconnectMaxDelay())
            .multiplier(settings.reconnectMultiplier())
            .jitterFraction(settings.reconnectJitter())
            .degradedAfter(settings.degradedAfter())
            .clock(clock)
            .build();
        this.offsets = new StreamOffsetTracker(provider, symbol, clock);
        this.aggregator = new CandleAggregator(settings.granularities(), settings.latenessWindow(),
            pendingCandles::add, writer::findCandle, metrics);
    }

    @Override
    public void run() {
        log.info("[{}:{}] Stream worker starting", provider, symbol);
        try {
            offsets.load(offsetRepository);
        } catch (RuntimeException e) {
            log.error("[{}:{}] Cannot read committed offsets, starting without them: {}", provider, symbol, e.getMessage());
        }

        while (!stopping) {
            if (hasPendingBatch() && !tryFlushPending()) {
                backoff("storage_unavailable");
                continue;
            }

            state = State.CONNECTING;
            LiveStream stream;
            try {
                stream = adapter.streamLive(symbol, offsets.resumeFrom());
            } catch (ProviderException e) {
                log.warn("[{}:{}] Connect failed: {}", provider, symbol, e.getMessage());
                backoff(e.isTransient() ? "connect_failed" : "connect_rejected");
                continue;
            }

            String cause = consume(stream);
            if (!stopping) {
                backoff(cause);
            }
        }

        shutdown();
    }

    /**
     * Read from one connection until it fails, goes silent or the worker stops.
     *
     * @return reconnect cause
     */
    private String consume(LiveStream stream) {
        currentStream = stream;
        state = State.STREAMING;
        boolean delivering = false;
        metrics.setActiveConnections(provider, activeConnections.incrementAndGet());

        HeartbeatMonitor heartbeat = new HeartbeatMonitor(provider, symbol, settings.heartbeatTimeout(),
            heartbeatCheckInterval(), () -> {
                log.warn("[{}:{}] No data for {}ms, forcing reconnect",
                    provider, symbol, settings.heartbeatTimeout().toMillis());
                stream.close();
            }, clock);
        heartbeat.start();
        log.info("[{}:{}] Streaming", provider, symbol);

        try {
            while (!stopping) {
                ProviderRecord record;
                try {
                    record = stream.poll(settings.pollInterval());
                } catch (MalformedPayloadException e) {
                    heartbeat.recordActivity();
                    metrics.recordNormalizationFailure(provider, "malformed_payload");
                    writer.deadLetter(provider, symbol, e.getRawPayload(), "malformed_payload: " + e.getMessage(), 0);
                    continue;
                }

                Instant now = clock.instant();
                if (record == null) {
                    // wall-clock hint would expire buckets that unaggregated trades still belong to
                    if (pendingTrades.isEmpty() && pendingAggregation.isEmpty()) {
                        aggregator.advanceWatermark(now);
                    }
                } else {
                    heartbeat.recordActivity();
                    if (!delivering) {
                        delivering = true;
                        reconnectionPolicy.recordSuccess();
                        setDegraded(false);
                    }
                    handle(record, now);
                }
                if (isBatchDue(now)) {
                    flushPending();
                }
            }
            return "stopped";

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopping = true;
            return "interrupted";

        } catch (StorageUnavailableException e) {
            log.error("[{}:{}] Storage unavailable, offset not committed: {}", provider, symbol, e.getMessage());
            return "storage_unavailable";

        } catch (ProviderException e) {
            String cause = heartbeat.isExpired() ? "heartbeat_timeout" : "stream_closed";
            log.warn("[{}:{}] Stream ended ({}): {}", provider, symbol, cause, e.getMessage());
            return cause;

        } finally {
            heartbeat.stop();
            stream.close();
            currentStream = null;
            metrics.setActiveConnections(provider, activeConnections.decrementAndGet());
        }
    }

    private void handle(ProviderRecord record, Instant now) {
        if (record.isKeepalive()) {
            return;
        }

        NormalizationResult result = normalizer.normalize(record, provider, symbol);
        if (!result.isAccepted()) {
            metrics.recordNormalizationFailure(provider, result.rejectReason().code());
            writer.deadLetter(provider, symbol, record.rawPayload(), result.rejectionText(), 0);
            return;
        }

        if (result.trade() != null) {
            Trade trade = result.trade();
            if (offsets.isAlreadyCommitted(StreamKind.TRADES, trade.sequence(), trade.eventTime())) {
                return;
            }
            startBatchIfEmpty(now);
            pendingTrades.add(trade);
            offsets.advance(StreamKind.TRADES, trade.sequence(), trade.eventTime());
            observed(record, trade.eventTime(), trade.correlationId(), now);

        } else if (result.quote() != null) {
            Quote quote = result.quote();
            if (offsets.isAlreadyCommitted(StreamKind.QUOTES, record.sequence(), quote.eventTime())) {
                return;
            }
            startBatchIfEmpty(now);
            pendingQuotes.add(quote);
            offsets.advance(StreamKind.QUOTES, record.sequence(), quote.eventTime());
            observed(record, quote.eventTime(), quote.correlationId(), now);

        } else {
            startBatchIfEmpty(now);
            pendingCandles.add(result.candle());
            observed(record, result.candle().lastEventTime(), result.candle().correlationId(), now);
        }
    }

    private void observed(ProviderRecord record, Instant eventTime, String correlationId, Instant now) {
        recordsProcessed++;
        if (eventTime != null) {
            lastEventTime = eventTime;
            metrics.recordStreamLag(provider, symbol, Duration.between(eventTime, now));
        }
        if (settings.persistRaw() && record.rawPayload() != null) {
            pendingRaw.add(new RawEnvelope(provider, symbol, eventTime, record.receivedAt(),
                record.rawPayload(), correlationId));
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Batching
    // ═══════════════════════════════════════════════════════════════

    private void startBatchIfEmpty(Instant now) {
        if (batchStartedAt == null) {
            batchStartedAt = now;
        }
    }

    private boolean hasPendingBatch() {
        return !pendingRaw.isEmpty() || !pendingTrades.isEmpty() || !pendingQuotes.isEmpty()
            || !pendingCandles.isEmpty() || !pendingAggregation.isEmpty();
    }

    private boolean isBatchDue(Instant now) {
        if (!hasPendingBatch()) {
            return false;
        }
        int size = pendingTrades.size() + pendingQuotes.size() + pendingCandles.size();
        if (size >= settings.batchSize()) {
            return true;
        }
        Instant started = batchStartedAt != null ? batchStartedAt : now;
        return !Duration.between(started, now).minus(settings.batchFlushInterval()).isNegative();
    }

    /**
     * Write the pending batch, then commit offsets. The batch is kept when the store is unavailable.
     */
    private void flushPending() {
        if (!pendingRaw.isEmpty()) {
            writer.writeRaw(List.copyOf(pendingRaw));
            pendingRaw.clear();
        }
        if (!pendingTrades.isEmpty()) {
            List<WriteOutcome> outcomes = writer.writeTrades(List.copyOf(pendingTrades));
            for (int i = 0; i < pendingTrades.size() && i < outcomes.size(); i++) {
                if (outcomes.get(i) == WriteOutcome.INSERTED) {
                    pendingAggregation.add(pendingTrades.get(i));
                }
            }
            pendingTrades.clear();
        }
        drainAggregation();
        if (!pendingQuotes.isEmpty()) {
            writer.writeQuotes(List.copyOf(pendingQuotes));
            pendingQuotes.clear();
        }
        if (!pendingCandles.isEmpty()) {
            writer.writeCandles(List.copyOf(pendingCandles));
            pendingCandles.clear();
        }
        for (StreamOffset offset : offsets.pending()) {
            writer.commitOffset(offset);
            offsets.markCommitted(offset);
        }
        batchStartedAt = null;
    }

    /**
     * Feed stored trades to the aggregator. A trade stays queued if its stored candle cannot be read.
     */
    private void drainAggregation() {
        Iterator<Trade> it = pendingAggregation.iterator();
        while (it.hasNext()) {
            aggregator.addTrade(it.next());
            it.remove();
        }
    }

    private boolean tryFlushPending() {
        try {
            flushPending();
            return true;
        } catch (StorageUnavailableException e) {
            log.error("[{}:{}] Pending batch still not writable: {}", provider, symbol, e.getMessage());
            return false;
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Reconnect / shutdown
    // ═══════════════════════════════════════════════════════════════

    private void backoff(String cause) {
        state = State.DISCONNECTED;
        reconnects++;
        metrics.recordReconnect(provider, symbol, cause);

        Duration delay = reconnectionPolicy.getNextDelay();
        reconnectionPolicy.recordFailure();
        if (reconnectionPolicy.isDegraded() && !degraded) {
            log.warn("[{}:{}] Degraded after {} consecutive failures, retrying every {}ms",
                provider, symbol, reconnectionPolicy.getAttemptCount(), reconnectionPolicy.getMaxDelay().toMillis());
            setDegraded(true);
        }

        log.info("[{}:{}] Reconnecting in {}ms ({})", provider, symbol, delay.toMillis(), cause);
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopping = true;
        }
    }

    private void setDegraded(boolean value) {
        if (degraded != value) {
            degraded = value;
            metrics.setStreamDegraded(provider, symbol, value);
        }
    }

    private void shutdown() {
        boolean written = tryFlushPending();
        if (written) {
            aggregator.flushAll();
            written = tryFlushPending();
        }
        if (!written) {
            log.error("[{}:{}] Dropping unwritten batch on shutdown; offsets stay at last commit", provider, symbol);
        }
        state = State.STOPPED;
        log.info("[{}:{}] Stream worker stopped ({} records, {} reconnects)", provider, symbol, recordsProcessed, reconnects);
    }

    private Duration heartbeatCheckInterval() {
        long millis = Math.max(10L, settings.heartbeatTimeout().toMillis() / 4);
        return Duration.ofMillis(millis);
    }

    /**
     * Cooperative stop; a blocked poll is released by closing the connection.
     */
    public void stop() {
        stopping = true;
        LiveStream stream = currentStream;
        if (stream != null) {
            stream.close();
        }
    }

    public StreamStatus status() {
        return new StreamStatus(provider, symbol, state, degraded, reconnects, recordsProcessed, lastEventTime);
    }

    public String provider() {
        return provider;
    }

    public String symbol() {
        return symbol;
    }
}

package in.tickvault.service.realtime;

import in.tickvault.application.port.output.StorageException;
import in.tickvault.config.StreamSettings;
import in.tickvault.domain.model.Candle;
import in.tickvault.domain.model.DeadLetterRecord;
import in.tickvault.domain.model.Granularity;
import in.tickvault.domain.model.ProviderRecord;
import in.tickvault.domain.model.StreamKind;
import in.tickvault.domain.model.StreamOffset;
import in.tickvault.domain.model.Trade;
import in.tickvault.infrastructure.provider.MalformedPayloadException;
import in.tickvault.infrastructure.provider.TransientProviderException;
import in.tickvault.infrastructure.provider.common.Sleeper;
import in.tickvault.service.normalize.Normalizer;
import in.tickvault.support.Await;
import in.tickvault.support.ScriptedLiveStream;
import in.tickvault.support.ScriptedProviderAdapter;
import in.tickvault.support.StorageHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StreamWorker running on a real thread against a scripted stream.
 *
 * Tests:
 * - Offsets are committed only after the batch is written
 * - Bad payloads go to the dead-letter store and the stream continues
 * - Heartbeat timeouts and failed connects lead to reconnects
 * - Degraded flag after repeated connect failures, cleared once data flows
 * - Connections that drop before any data count as failures
 * - Replayed records at or before the committed offset are skipped
 * - Candles continue the stored bar of the bucket the worker starts in
 */
class StreamWorkerTest {

    private static final String[] PROVIDER_SYMBOL_CAUSE = {"provider", "symbol", "cause"};

    private final StorageHarness h = new StorageHarness();
    private final ScriptedProviderAdapter adapter = new ScriptedProviderAdapter("binance");
    private final List<Duration> backoffs = new CopyOnWriteArrayList<>();
    private final Sleeper sleeper = d -> {
        backoffs.add(d);
        Thread.sleep(2);
    };
    private final Instant base = Instant.now().minus(10, ChronoUnit.MINUTES).truncatedTo(ChronoUnit.MINUTES);

    private StreamWorker worker;
    private Thread thread;

    @AfterEach
    void tearDown() throws InterruptedException {
        if (worker != null) {
            worker.stop();
            thread.join(5_000);
        }
    }

    @Test
    void testTradesAreWrittenBeforeOffsetCommit() throws InterruptedException {
        ScriptedLiveStream stream = new ScriptedLiveStream("binance", "BTCUSDT")
            .push(trade(1)).push(trade(2)).push(trade(3));
        adapter.nextStream(stream);

        start(settings(2, Duration.ofSeconds(30), 5));

        Await.until("offset 3 committed", () -> committedTrades().map(o -> o.lastOffset().equals("3")).orElse(false));
        assertEquals(3, h.trades.rows().size(), "Every committed record is stored");
        assertEquals(3, h.raw.rows().size(), "Raw payloads are kept");
        assertEquals(base.plusSeconds(3), committedTrades().orElseThrow().lastEventTime());

        stopAndJoin();
        assertEquals(StreamWorker.State.STOPPED, worker.status().state());
        assertEquals(3, worker.status().recordsProcessed());
        assertFalse(h.candles.all().isEmpty(), "Open candles are flushed on stop");
        worker = null;
    }

    @Test
    void testOffsetNotCommittedWhenTradeWriteFails() {
        h.trades.batchFailures.failAlways(new StorageException(
            "connection refused", null, true, "08001"));
        h.deadLetters.failures.failAlways(new StorageException(
            "connection refused", null, true, "08001"));
        adapter.nextStream(new ScriptedLiveStream("binance", "BTCUSDT").push(trade(1)).push(trade(2)));

        start(settings(2, Duration.ofSeconds(30), 5));

        Await.until("storage_unavailable reconnect",
            () -> h.sample("stream_reconnects_total", PROVIDER_SYMBOL_CAUSE, "binance", "BTCUSDT", "storage_unavailable") >= 1);
        assertTrue(h.offsets.findAll().isEmpty(), "Offset must not move past unwritten records");
    }

    @Test
    void testMalformedPayloadIsDeadLettered() {
        ScriptedLiveStream stream = new ScriptedLiveStream("binance", "BTCUSDT")
            .fail(new MalformedPayloadException("binance", "BTCUSDT", "{not json",
                new IllegalArgumentException("Unexpected character")))
            .push(trade(1)).push(trade(2));
        adapter.nextStream(stream);

        start(settings(2, Duration.ofSeconds(30), 5));

        Await.until("trades stored", () -> h.trades.rows().size() == 2);
        List<DeadLetterRecord> dlq = h.deadLetters.rows();
        assertEquals(1, dlq.size());
        assertEquals("{not json", dlq.get(0).payload());
        assertTrue(dlq.get(0).errorReason().startsWith("malformed_payload"));
        assertEquals(1, adapter.connectCount(), "A bad payload does not drop the connection");
    }

    @Test
    void testInvalidRecordIsDeadLettered() {
        ProviderRecord noPrice = ProviderRecord.trade("binance", "BTCUSDT", "9", null, BigDecimal.ONE, "buy",
            Long.toString(base.toEpochMilli()), Instant.now(), 9L, "{\"p\":null}");
        adapter.nextStream(new ScriptedLiveStream("binance", "BTCUSDT").push(noPrice).push(trade(1)).push(trade(2)));

        start(settings(2, Duration.ofSeconds(30), 5));

        Await.until("trades stored", () -> h.trades.rows().size() == 2);
        assertEquals("missing_field: price", h.deadLetters.rows().get(0).errorReason());
        assertEquals(1.0, h.sample("ingest_normalization_failures_total", new String[] {"provider", "reason"},
            "binance", "missing_field"));
    }

    @Test
    void testHeartbeatTimeoutForcesReconnect() {
        adapter.nextStream(new ScriptedLiveStream("binance", "BTCUSDT"));

        start(settings(2, Duration.ofMillis(200), 5));

        Await.until("second connect", () -> adapter.connectCount() >= 2);
        Await.until("heartbeat reconnect counted",
            () -> h.sample("stream_reconnects_total", PROVIDER_SYMBOL_CAUSE, "binance", "BTCUSDT", "heartbeat_timeout") >= 1);
    }

    @Test
    void testClosedStreamReconnects() {
        adapter.nextStream(new ScriptedLiveStream("binance", "BTCUSDT")
            .push(trade(1))
            .fail(new TransientProviderException("binance", "BTCUSDT", "connection reset")));

        start(settings(10, Duration.ofSeconds(30), 5));

        Await.until("reconnected", () -> adapter.connectCount() >= 2);
        assertEquals(1.0, h.sample("stream_reconnects_total", PROVIDER_SYMBOL_CAUSE, "binance", "BTCUSDT", "stream_closed"));
    }

    @Test
    void testDegradedAfterRepeatedConnectFailures() {
        for (int i = 0; i < 1_000; i++) {
            adapter.failConnect(new TransientProviderException("binance", "BTCUSDT", "connection refused"));
        }

        start(settings(2, Duration.ofSeconds(30), 3));

        Await.until("degraded", () -> worker.status().degraded());
        assertTrue(worker.status().reconnects() >= 3);
        assertEquals(1.0, h.sample("stream_degraded", new String[] {"provider", "symbol"}, "binance", "BTCUSDT"));
        assertTrue(backoffs.stream().allMatch(d -> d.compareTo(Duration.ofMillis(50)) <= 0), "Backoff is capped");
    }

    @Test
    void testSuccessfulConnectClearsDegraded() {
        for (int i = 0; i < 3; i++) {
            adapter.failConnect(new TransientProviderException("binance", "BTCUSDT", "connection refused"));
        }
        adapter.nextStream(new ScriptedLiveStream("binance", "BTCUSDT").push(trade(1)));

        start(settings(1, Duration.ofSeconds(30), 3));

        Await.until("streaming again", () -> h.trades.rows().size() == 1);
        StreamStatus status = worker.status();
        assertFalse(status.degraded(), "First record on a connection clears degraded");
        assertEquals(StreamWorker.State.STREAMING, status.state());
        assertEquals(3, status.reconnects());
        assertEquals(List.of(Duration.ofMillis(10), Duration.ofMillis(20), Duration.ofMillis(40)), backoffs,
            "Backoff grows between failed connects");
    }

    @Test
    void testStreamDroppingBeforeAnyDataBacksOffAndDegrades() {
        for (int i = 0; i < 200; i++) {
            adapter.nextStream(new ScriptedLiveStream("binance", "BTCUSDT")
                .fail(new TransientProviderException("binance", "BTCUSDT", "connection reset")));
        }

        start(settings(2, Duration.ofSeconds(30), 3));

        Await.until("degraded", () -> worker.status().degraded());
        assertEquals(List.of(Duration.ofMillis(10), Duration.ofMillis(20), Duration.ofMillis(40)),
            List.copyOf(backoffs).subList(0, 3), "Each empty connection grows the backoff");
        assertEquals(1.0, h.sample("stream_degraded", new String[] {"provider", "symbol"}, "binance", "BTCUSDT"));
    }

    @Test
    void testConnectWithoutDataKeepsDegraded() {
        for (int i = 0; i < 3; i++) {
            adapter.failConnect(new TransientProviderException("binance", "BTCUSDT", "connection refused"));
        }
        adapter.nextStream(new ScriptedLiveStream("binance", "BTCUSDT"));

        start(settings(1, Duration.ofSeconds(30), 3));

        Await.until("connected", () -> adapter.connectCount() == 4
            && worker.status().state() == StreamWorker.State.STREAMING);
        assertTrue(worker.status().degraded(), "An open socket alone is not a recovery");
    }

    @Test
    void testRestartedWorkerExtendsStoredCandle() throws InterruptedException {
        h.candles.upsert(new Candle("binance", "BTCUSDT", Granularity.ONE_MINUTE, base,
            new BigDecimal("49000"), new BigDecimal("49500"), new BigDecimal("48000"), new BigDecimal("49500"),
            new BigDecimal("3"), base, "corr-before-restart"));
        adapter.nextStream(new ScriptedLiveStream("binance", "BTCUSDT").push(trade(1)).push(trade(2)).push(trade(3)));

        start(settings(2, Duration.ofSeconds(30), 5));
        Await.until("trades stored", () -> h.trades.rows().size() == 3);
        stopAndJoin();
        worker = null;

        List<Candle> candles = h.candles.all();
        assertEquals(1, candles.size());
        Candle candle = candles.get(0);
        assertEquals(new BigDecimal("49000"), candle.open(), "Stored open survives the restart");
        assertEquals(new BigDecimal("50000"), candle.high());
        assertEquals(new BigDecimal("48000"), candle.low(), "Low never shrinks");
        assertEquals(new BigDecimal("50000"), candle.close());
        assertEquals(0, new BigDecimal("3.3").compareTo(candle.volume()), "New trades add to the stored volume");
    }

    @Test
    void testTradesAlreadyStoredAreNotCountedAgain() throws InterruptedException {
        adapter.nextStream(new ScriptedLiveStream("binance", "BTCUSDT").push(trade(1)).push(trade(2)));
        start(settings(2, Duration.ofSeconds(30), 5));
        Await.until("trades stored", () -> h.trades.rows().size() == 2);
        stopAndJoin();

        // offsets lost, so the provider replays both trades
        h.offsets.clear();
        adapter.nextStream(new ScriptedLiveStream("binance", "BTCUSDT").push(trade(1)).push(trade(2)));
        start(settings(2, Duration.ofSeconds(30), 5));
        Await.until("replay written", () -> h.trades.batchCalls() >= 2);
        stopAndJoin();
        worker = null;

        Candle candle = h.candles.all().get(0);
        assertEquals(0, new BigDecimal("0.2").compareTo(candle.volume()), "Replayed duplicates leave the volume alone");
    }

    @Test
    void testReplayedRecordsAreSkipped() {
        h.offsets.commit(new StreamOffset("binance", "BTCUSDT", StreamKind.TRADES, "5", base.plusSeconds(5), Instant.now()));
        adapter.nextStream(new ScriptedLiveStream("binance", "BTCUSDT").push(trade(4)).push(trade(5)).push(trade(6)));

        start(settings(1, Duration.ofSeconds(30), 5));

        Await.until("offset 6 committed", () -> committedTrades().map(o -> o.lastOffset().equals("6")).orElse(false));
        List<Trade> stored = h.trades.rows();
        assertEquals(1, stored.size(), "Only the record after the committed offset is written");
        assertEquals(6L, stored.get(0).sequence());
        assertEquals("5", adapter.resumeOffsets().get(0).lastOffset(), "Adapter is told where to resume");
    }

    @Test
    void testStopReleasesBlockedPoll() throws InterruptedException {
        adapter.nextStream(new ScriptedLiveStream("binance", "BTCUSDT"));
        start(settings(2, Duration.ofSeconds(30), 5));
        Await.until("streaming", () -> worker.status().state() == StreamWorker.State.STREAMING);

        stopAndJoin();

        assertFalse(thread.isAlive());
        assertEquals(StreamWorker.State.STOPPED, worker.status().state());
        worker = null;
    }

    private void start(StreamSettings settings) {
        worker = new StreamWorker("binance", "BTCUSDT", adapter, new Normalizer(Clock.systemUTC(), Duration.ofSeconds(5)),
            h.writer, h.offsets, h.metrics, settings, Clock.systemUTC(), sleeper, new AtomicInteger());
        thread = new Thread(worker, "stream-binance-BTCUSDT-test");
        thread.start();
    }

    private void stopAndJoin() throws InterruptedException {
        worker.stop();
        thread.join(5_000);
    }

    private Optional<StreamOffset> committedTrades() {
        return h.offsets.find("binance", "BTCUSDT", StreamKind.TRADES);
    }

    private static StreamSettings settings(int batchSize, Duration heartbeatTimeout, int degradedAfter) {
        return new StreamSettings(batchSize, Duration.ofMillis(50), heartbeatTimeout,
            Duration.ofMillis(10), Duration.ofMillis(50), 2.0, 0.0, degradedAfter,
            List.of(Granularity.ONE_MINUTE), Duration.ofMinutes(2), true);
    }

    private ProviderRecord trade(long sequence) {
        Instant eventTime = base.plusSeconds(sequence);
        return ProviderRecord.trade("binance", "BTCUSDT", Long.toString(sequence), new BigDecimal("50000"),
            new BigDecimal("0.1"), "buy", Long.toString(eventTime.toEpochMilli()), Instant.now(), sequence,
            "{\"t\":" + sequence + "}");
    }
}

package in.tickvault.service.storage;

import in.tickvault.application.port.output.StorageException;
import in.tickvault.config.StorageSettings;
import in.tickvault.domain.model.Candle;
import in.tickvault.domain.model.DeadLetterRecord;
import in.tickvault.domain.model.Granularity;
import in.tickvault.domain.model.QuoteMode;
import in.tickvault.domain.model.RawEnvelope;
import in.tickvault.domain.model.StreamKind;
import in.tickvault.domain.model.StreamOffset;
import in.tickvault.domain.model.Trade;
import in.tickvault.domain.model.WriteOutcome;
import in.tickvault.support.StorageHarness;
import in.tickvault.support.TestData;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StorageWriter.
 *
 * Tests:
 * - Idempotent re-submission
 * - Per-record fallback on rejected batches
 * - Dead-lettering when the store stays unavailable
 * - Offset commits and quote modes
 */
class StorageWriterTest {

    private static final Instant T0 = Instant.parse("2026-03-10T11:00:00Z");
    private static final String[] PROVIDER_KIND = {"provider", "kind"};
    private static final String[] PROVIDER_REASON = {"provider", "reason"};

    private final StorageHarness h = new StorageHarness();

    @Test
    void testResubmittedBatchIsIgnored() {
        List<Trade> batch = trades(5);

        List<WriteOutcome> first = h.writer.writeTrades(batch);
        List<WriteOutcome> second = h.writer.writeTrades(batch);

        assertEquals(Collections.nCopies(5, WriteOutcome.INSERTED), first);
        assertEquals(Collections.nCopies(5, WriteOutcome.DUPLICATE_IGNORED), second);
        assertEquals(5, h.trades.rows().size(), "No duplicate rows");
        assertEquals(4, h.trades.batchCalls(), "Five records in batches of three is two round trips per write");
        assertEquals(5.0, h.sample("ingest_records_total", PROVIDER_KIND, "binance", "trade"),
            "Only inserted rows are counted");
    }

    @Test
    void testTradeIdKeyIgnoresPriceDifferences() {
        Trade original = TestData.trade("binance", "BTCUSDT", "77", "100", "1", T0);
        Trade replay = TestData.trade("binance", "BTCUSDT", "77", "100.00", "1.0", T0);

        h.writer.writeTrades(List.of(original));
        assertEquals(List.of(WriteOutcome.DUPLICATE_IGNORED), h.writer.writeTrades(List.of(replay)));
    }

    @Test
    void testRejectedBatchFallsBackToSingleWrites() {
        h.trades.rejectWhen(t -> t.price().compareTo(new BigDecimal("13")) == 0);
        List<Trade> batch = List.of(
            TestData.trade("BTCUSDT", "12", "1", T0),
            TestData.trade("BTCUSDT", "13", "1", T0.plusSeconds(1)),
            TestData.trade("BTCUSDT", "14", "1", T0.plusSeconds(2)));

        List<WriteOutcome> outcomes = h.writer.writeTrades(batch);

        assertEquals(List.of(WriteOutcome.INSERTED, WriteOutcome.FAILED, WriteOutcome.INSERTED), outcomes);
        assertEquals(2, h.trades.rows().size());
        List<DeadLetterRecord> dlq = h.deadLetters.rows();
        assertEquals(1, dlq.size(), "Only the bad record is dead-lettered");
        assertTrue(dlq.get(0).errorReason().startsWith(StorageWriter.REASON_REJECTED), dlq.get(0).errorReason());
        assertTrue(dlq.get(0).payload().contains("\"price\":13"), "Payload is the record as JSON");
        assertEquals(1.0, h.sample("ingest_dead_letter_total", PROVIDER_REASON, "binance", "storage_rejected"));
        assertTrue(h.sleeper.sleeps().isEmpty(), "Record-level failures are not retried with backoff");
    }

    @Test
    void testTransientFailureIsRetried() {
        h.trades.batchFailures.failNext(transientFailure());

        List<WriteOutcome> outcomes = h.writer.writeTrades(trades(2));

        assertEquals(Collections.nCopies(2, WriteOutcome.INSERTED), outcomes);
        assertEquals(List.of(Duration.ofMillis(100)), h.sleeper.sleeps());
        assertTrue(h.deadLetters.rows().isEmpty());
    }

    @Test
    void testUnavailableStoreDeadLettersBatch() {
        h.trades.batchFailures.failAlways(transientFailure());

        List<WriteOutcome> outcomes = h.writer.writeTrades(trades(3));

        assertEquals(Collections.nCopies(3, WriteOutcome.FAILED), outcomes);
        assertEquals(3, h.trades.batchCalls(), "maxRetries=2 means three attempts");
        List<DeadLetterRecord> dlq = h.deadLetters.rows();
        assertEquals(3, dlq.size());
        for (DeadLetterRecord record : dlq) {
            assertEquals(StorageWriter.REASON_UNAVAILABLE, record.errorReason());
            assertEquals(2, record.retryCount());
            assertEquals("BTCUSDT", record.symbol());
        }
    }

    @Test
    void testDeadLetterStoreDownIsFatal() {
        h.trades.batchFailures.failAlways(transientFailure());
        h.deadLetters.failures.failAlways(transientFailure());

        assertThrows(StorageUnavailableException.class, () -> h.writer.writeTrades(trades(1)));
    }

    @Test
    void testCommitOffsetIsMonotonic() {
        StreamOffset newer = offset("10", T0.plusSeconds(10));
        StreamOffset older = offset("5", T0.plusSeconds(5));

        assertTrue(h.writer.commitOffset(newer));
        assertFalse(h.writer.commitOffset(older), "Offsets never move backwards");
        assertEquals("10", h.offsets.find("binance", "BTCUSDT", StreamKind.TRADES).orElseThrow().lastOffset());
    }

    @Test
    void testCommitOffsetUnavailable() {
        h.offsets.failures.failAlways(transientFailure());

        assertThrows(StorageUnavailableException.class, () -> h.writer.commitOffset(offset("1", T0)));
    }

    @Test
    void testCommitOffsetNonTransientIsWrapped() {
        h.offsets.failures.failNext(new StorageException("bad offset", null, false, "22001"));

        StorageUnavailableException e = assertThrows(StorageUnavailableException.class,
            () -> h.writer.commitOffset(offset("1", T0)));
        assertTrue(h.sleeper.sleeps().isEmpty(), "Non-transient failures are not retried");
        assertTrue(e.getMessage().contains("bad offset"));
    }

    @Test
    void testLatestQuoteKeepsNewest() {
        h.writer.writeQuotes(List.of(TestData.quote("binance", "BTCUSDT", "99", "101", T0.plusSeconds(5))));

        List<WriteOutcome> outcomes = h.writer.writeQuotes(
            List.of(TestData.quote("binance", "BTCUSDT", "98", "102", T0)));

        assertEquals(List.of(WriteOutcome.DUPLICATE_IGNORED), outcomes, "Older snapshot does not replace newer");
        assertEquals(new BigDecimal("99"), h.quotes.latest("binance", "BTCUSDT").bidPrice());
    }

    @Test
    void testHistoryQuoteModeKeepsEverySnapshot() {
        StorageHarness history = new StorageHarness(
            new StorageSettings(10, 1, 1, Duration.ofMillis(10), Duration.ofMillis(100), QuoteMode.HISTORY));

        history.writer.writeQuotes(List.of(
            TestData.quote("binance", "BTCUSDT", "99", "101", T0),
            TestData.quote("binance", "BTCUSDT", "98", "102", T0.plusSeconds(1)),
            TestData.quote("binance", "BTCUSDT", "98", "102", T0.plusSeconds(1))));

        assertEquals(2, history.quotes.history().size());
    }

    @Test
    void testCandleUpsertReplacesCorrectedCandle() {
        Candle first = TestData.candle("binance", "BTCUSDT", Granularity.ONE_MINUTE, T0, "10", "12", "9", "11", "5");
        Candle corrected = TestData.candle("binance", "BTCUSDT", Granularity.ONE_MINUTE, T0, "10", "15", "9", "11", "6");

        assertEquals(List.of(WriteOutcome.INSERTED), h.writer.writeCandles(List.of(first)));
        assertEquals(List.of(WriteOutcome.DUPLICATE_IGNORED), h.writer.writeCandles(List.of(first)));
        h.writer.writeCandles(List.of(corrected));

        List<Candle> stored = h.candles.all();
        assertEquals(1, stored.size(), "One row per natural key");
        assertEquals(new BigDecimal("15"), stored.get(0).high());
    }

    @Test
    void testRawPayloadIsKeptVerbatim() {
        RawEnvelope envelope = new RawEnvelope("binance", "BTCUSDT", T0, T0, "{\"e\":\"trade\"}", "c-1");

        h.writer.writeRaw(List.of(envelope));

        assertEquals(List.of(envelope), h.raw.rows());
        assertEquals("{\"e\":\"trade\"}", StorageWriter.toPayload(envelope));
    }

    @Test
    void testEmptyBatchIsNoOp() {
        assertTrue(h.writer.writeTrades(List.of()).isEmpty());
        assertEquals(0, h.trades.batchCalls());
    }

    private static List<Trade> trades(int count) {
        List<Trade> result = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            result.add(TestData.trade("BTCUSDT", "100", "1", T0.plusSeconds(i)));
        }
        return result;
    }

    private StreamOffset offset(String value, Instant eventTime) {
        return new StreamOffset("binance", "BTCUSDT", StreamKind.TRADES, value, eventTime, h.clock.instant());
    }

    private static StorageException transientFailure() {
        return new StorageException("connection refused", null, true, "08001");
    }
}

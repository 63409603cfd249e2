package in.tickvault.service.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import in.tickvault.application.port.output.CandleRepository;
import in.tickvault.application.port.output.DeadLetterRepository;
import in.tickvault.application.port.output.QuoteRepository;
import in.tickvault.application.port.output.RawEnvelopeRepository;
import in.tickvault.application.port.output.StorageException;
import in.tickvault.application.port.output.StreamOffsetRepository;
import in.tickvault.application.port.output.TradeRepository;
import in.tickvault.config.StorageSettings;
import in.tickvault.domain.model.Candle;
import in.tickvault.domain.model.DeadLetterRecord;
import in.tickvault.domain.model.Granularity;
import in.tickvault.domain.model.Quote;
import in.tickvault.domain.model.RawEnvelope;
import in.tickvault.domain.model.StreamOffset;
import in.tickvault.domain.model.Trade;
import in.tickvault.domain.model.WriteOutcome;
import in.tickvault.infrastructure.metrics.IngestionMetrics;
import in.tickvault.infrastructure.provider.common.RetryPolicy;
import in.tickvault.infrastructure.provider.common.Sleeper;
import in.tickvault.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Semaphore;
import java.util.function.Function;

/**
 * Single write path for ingested data.
 *
 * Inserts are natural-key idempotent, so re-submitting a batch yields
 * DUPLICATE_IGNORED instead of duplicates. A batch that fails transiently is
 * retried with backoff and then dead-lettered as {@code storage_unavailable};
 * a batch that fails for record-level reasons is retried one record at a time
 * and only the records that still fail are dead-lettered.
 */
public final class StorageWriter {
    private static final Logger log = LoggerFactory.getLogger(StorageWriter.class);

    public static final String REASON_UNAVAILABLE = "storage_unavailable";
    public static final String REASON_REJECTED = "storage_rejected";

    private final TradeRepository trades;
    private final QuoteRepository quotes;
    private final CandleRepository candles;
    private final RawEnvelopeRepository rawEnvelopes;
    private final StreamOffsetRepository offsets;
    private final DeadLetterRepository deadLetters;
    private final IngestionMetrics metrics;
    private final StorageSettings settings;
    private final RetryPolicy retryPolicy;
    private final Semaphore permits;
    private final Clock clock;

    private final Target<Trade> tradeTarget;
    private final Target<Quote> quoteTarget;
    private final Target<Candle> candleTarget;
    private final Target<RawEnvelope> rawTarget;

    public StorageWriter(TradeRepository trades,
                         QuoteRepository quotes,
                         CandleRepository candles,
                         RawEnvelopeRepository rawEnvelopes,
                         StreamOffsetRepository offsets,
                         DeadLetterRepository deadLetters,
                         IngestionMetrics metrics,
                         StorageSettings settings,
                         Clock clock,
                         Sleeper sleeper) {
        this.trades = trades;
        this.quotes = quotes;
        this.candles = candles;
        this.rawEnvelopes = rawEnvelopes;
        this.offsets = offsets;
        this.deadLetters = deadLetters;
        this.metrics = metrics;
        this.settings = settings;
        this.clock = clock;
        this.permits = new Semaphore(settings.maxConcurrentBatches(), true);
        this.retryPolicy = RetryPolicy.builder()
            .maxAttempts(settings.maxRetries() + 1)
            .initialBackoff(settings.initialBackoff())
            .maxBackoff(settings.maxBackoff())
            .maxElapsed(Duration.ofMinutes(2))
            .clock(clock)
            .sleeper(sleeper)
            .build();

        this.tradeTarget = new Target<>("trades", "trade",
            this.trades::insertBatch, this.trades::insert, Trade::provider, Trade::symbol);
        this.quoteTarget = new Target<>("quotes", "quote",
            batch -> this.quotes.insertBatch(batch, settings.quoteMode()),
            quote -> this.quotes.insert(quote, settings.quoteMode()),
            Quote::provider, Quote::symbol);
        this.candleTarget = new Target<>("candles", "candle",
            this.candles::upsertBatch, this.candles::upsert, Candle::provider, Candle::symbol);
        this.rawTarget = new Target<>("trades_raw", "raw",
            this.rawEnvelopes::insertBatch,
            envelope -> this.rawEnvelopes.insertBatch(List.of(envelope)).get(0),
            RawEnvelope::provider, RawEnvelope::symbol);
    }

    // ═══════════════════════════════════════════════════════════════
    // Write operations
    // ═══════════════════════════════════════════════════════════════

    public List<WriteOutcome> writeTrades(List<Trade> records) {
        return write(tradeTarget, records);
    }

    public List<WriteOutcome> writeQuotes(List<Quote> records) {
        return write(quoteTarget, records);
    }

    public List<WriteOutcome> writeCandles(List<Candle> records) {
        return write(candleTarget, records);
    }

    public List<WriteOutcome> writeRaw(List<RawEnvelope> records) {
        return write(rawTarget, records);
    }

    /**
     * Persist a stream offset. Call only after the records it covers were written.
     *
     * @return false when the stored offset was already newer
     * @throws StorageUnavailableException when the store stays unreachable
     */
    public boolean commitOffset(StreamOffset offset) {
        try {
            return retryPolicy.execute("offset:" + offset.provider() + ":" + offset.symbol(),
                () -> offsets.commit(offset), StorageWriter::isTransient);
        } catch (StorageException e) {
            throw new StorageUnavailableException(String.format("[%s:%s] Offset commit failed: %s",
                offset.provider(), offset.symbol(), e.getMessage()), e);
        }
    }

    /**
     * Stored candle for one bucket, read with the same retry policy as writes.
     *
     * @throws StorageUnavailableException when the store stays unreachable
     */
    public Optional<Candle> findCandle(String provider, String symbol, Granularity granularity, Instant bucketStart) {
        try {
            List<Candle> found = retryPolicy.execute("candles:" + provider + ":" + symbol,
                () -> candles.findRange(provider, symbol, granularity, bucketStart, granularity.bucketEnd(bucketStart)),
                StorageWriter::isTransient);
            return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
        } catch (StorageException e) {
            throw new StorageUnavailableException(String.format("[%s:%s] Candle read failed for %s %s: %s",
                provider, symbol, granularity, bucketStart, e.getMessage()), e);
        }
    }

    /**
     * Append records to the dead-letter store.
     *
     * @throws StorageUnavailableException when the dead-letter store cannot be written either
     */
    public void deadLetter(List<DeadLetterRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        try {
            retryPolicy.run("dead_letter", () -> deadLetters.insertBatch(records), StorageWriter::isTransient);
        } catch (StorageException e) {
            log.error("[STORAGE] Dead-letter write failed for {} records: {}", records.size(), e.getMessage());
            throw new StorageUnavailableException("Dead-letter store unavailable: " + e.getMessage(), e);
        }
        for (DeadLetterRecord record : records) {
            metrics.recordDeadLetter(record.provider(), record.errorReason());
        }
        log.warn("[STORAGE] Dead-lettered {} records (first reason: {})", records.size(), records.get(0).errorReason());
    }

    public void deadLetter(String provider, String symbol, String payload, String reason, int retryCount) {
        deadLetter(List.of(DeadLetterRecord.of(provider, symbol, payload, reason, retryCount, clock.instant())));
    }

    public StorageSettings settings() {
        return settings;
    }

    // ═══════════════════════════════════════════════════════════════
    // Batching
    // ═══════════════════════════════════════════════════════════════

    private <T> List<WriteOutcome> write(Target<T> target, List<T> records) {
        if (records.isEmpty()) {
            return List.of();
        }
        List<WriteOutcome> outcomes = new ArrayList<>(records.size());
        for (int from = 0; from < records.size(); from += settings.batchSize()) {
            List<T> chunk = records.subList(from, Math.min(records.size(), from + settings.batchSize()));
            outcomes.addAll(writeChunk(target, chunk));
        }
        return outcomes;
    }

    private <T> List<WriteOutcome> writeChunk(Target<T> target, List<T> chunk) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("[STORAGE] Interrupted waiting for a batch permit");
        }

        long startNanos = System.nanoTime();
        try {
            List<WriteOutcome> outcomes = retryPolicy.execute(target.table(),
                () -> target.batch().apply(chunk), StorageWriter::isTransient);
            metrics.recordStorageBatch(target.table(), Duration.ofNanos(System.nanoTime() - startNanos), true);
            recordInserted(target, chunk, outcomes);
            return outcomes;

        } catch (StorageException e) {
            metrics.recordStorageBatch(target.table(), Duration.ofNanos(System.nanoTime() - startNanos), false);
            if (e.isTransient()) {
                log.error("[STORAGE] {} batch of {} failed after {} attempts: {}",
                    target.table(), chunk.size(), retryPolicy.getMaxAttempts(), e.getMessage());
                List<DeadLetterRecord> failed = new ArrayList<>(chunk.size());
                for (T record : chunk) {
                    failed.add(toDeadLetter(target, record, REASON_UNAVAILABLE, settings.maxRetries()));
                }
                deadLetter(failed);
                return Collections.nCopies(chunk.size(), WriteOutcome.FAILED);
            }
            log.warn("[STORAGE] {} batch of {} rejected ({}), falling back to per-record writes",
                target.table(), chunk.size(), e.getMessage());
            return writeOneByOne(target, chunk);

        } finally {
            permits.release();
        }
    }

    private <T> List<WriteOutcome> writeOneByOne(Target<T> target, List<T> chunk) {
        List<WriteOutcome> outcomes = new ArrayList<>(chunk.size());
        List<DeadLetterRecord> failed = new ArrayList<>();
        for (T record : chunk) {
            WriteOutcome outcome;
            try {
                outcome = target.single().apply(record);
            } catch (StorageException e) {
                String reason = e.isTransient() ? REASON_UNAVAILABLE : REASON_REJECTED + ": " + e.getMessage();
                failed.add(toDeadLetter(target, record, reason, 0));
                outcome = WriteOutcome.FAILED;
            }
            outcomes.add(outcome);
        }
        recordInserted(target, chunk, outcomes);
        deadLetter(failed);
        return outcomes;
    }

    private <T> void recordInserted(Target<T> target, List<T> chunk, List<WriteOutcome> outcomes) {
        Map<String, Integer> perProvider = new LinkedHashMap<>();
        for (int i = 0; i < chunk.size() && i < outcomes.size(); i++) {
            if (outcomes.get(i) == WriteOutcome.INSERTED) {
                perProvider.merge(target.provider().apply(chunk.get(i)), 1, Integer::sum);
            }
        }
        perProvider.forEach((provider, count) -> metrics.recordIngested(provider, target.kind(), count));
    }

    private <T> DeadLetterRecord toDeadLetter(Target<T> target, T record, String reason, int retryCount) {
        return DeadLetterRecord.of(target.provider().apply(record), target.symbol().apply(record),
            toPayload(record), reason, retryCount, clock.instant());
    }

    static String toPayload(Object record) {
        if (record instanceof RawEnvelope envelope) {
            return envelope.payload();
        }
        try {
            return Json.mapper().writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + record.getClass().getSimpleName(), e);
        }
    }

    private static boolean isTransient(RuntimeException e) {
        return e instanceof StorageException se && se.isTransient();
    }

    private record Target<T>(
        String table,
        String kind,
        Function<List<T>, List<WriteOutcome>> batch,
        Function<T, WriteOutcome> single,
        Function<T, String> provider,
        Function<T, String> symbol
    ) {}
}

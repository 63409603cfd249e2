package in.tickvault.service.candle;

import in.tickvault.domain.model.Candle;
import in.tickvault.domain.model.Granularity;
import in.tickvault.domain.model.Trade;
import in.tickvault.infrastructure.metrics.IngestionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds OHLCV candles from trade prints for several granularities at once.
 *
 * Pattern: one open bucket per (provider, symbol, granularity)
 * - Trade in the open bucket: O(1) update
 * - Trade in a newer bucket: open bucket is flushed, a new one opens
 * - Trade in an older bucket still inside the lateness window: the flushed
 *   candle is corrected and re-emitted (high/low widen, volume adds, close
 *   follows the latest event time, open never changes)
 * - Older than the lateness window: dropped and counted
 *
 * A bucket this instance has no history for (the first bucket of a series,
 * or a late trade for a bucket never seen) starts from the stored candle when
 * one exists, so a restarted worker or the next backfill chunk extends the
 * persisted bar. Only trades that were newly stored may be fed in, otherwise
 * a replay counts its volume twice.
 *
 * The watermark is the max of observed event times and wall-clock hints; it
 * never moves backwards. Buckets whose end it passes are flushed, and flushed
 * candles are forgotten once their bucket end plus lateness falls behind it.
 *
 * One instance belongs to one worker or one backfill job.
 */
public final class CandleAggregator {
    private static final Logger log = LoggerFactory.getLogger(CandleAggregator.class);

    private final List<Granularity> granularities;
    private final Duration latenessWindow;
    private final CandleSink sink;
    private final StoredCandleLookup stored;
    private final IngestionMetrics metrics;

    private final Map<SeriesKey, Series> series = new HashMap<>();
    private Instant watermark = Instant.EPOCH;

    private long lateDropped;
    private long corrections;

    public CandleAggregator(List<Granularity> granularities, Duration latenessWindow,
                            CandleSink sink, StoredCandleLookup stored, IngestionMetrics metrics) {
        if (granularities == null || granularities.isEmpty()) {
            throw new IllegalArgumentException("At least one granularity is required");
        }
        if (latenessWindow.isNegative()) {
            throw new IllegalArgumentException("Lateness window must not be negative");
        }
        this.granularities = List.copyOf(granularities);
        this.latenessWindow = latenessWindow;
        this.sink = sink;
        this.stored = stored;
        this.metrics = metrics;
    }

    /**
     * Fold one trade into every granularity.
     *
     * Stored candles are read before any bucket changes, so a failed read leaves
     * the aggregator as it was and the trade can be offered again.
     */
    public synchronized void addTrade(Trade trade) {
        List<Candle> seeds = new ArrayList<>(granularities.size());
        for (Granularity granularity : granularities) {
            seeds.add(seedFor(new SeriesKey(trade.provider(), trade.symbol(), granularity), trade));
        }

        if (trade.eventTime().isAfter(watermark)) {
            watermark = trade.eventTime();
        }

        for (int i = 0; i < granularities.size(); i++) {
            Series s = series.computeIfAbsent(
                new SeriesKey(trade.provider(), trade.symbol(), granularities.get(i)), Series::new);
            apply(s, trade, seeds.get(i));
            expire(s);
        }
    }

    /**
     * Move the watermark forward (wall-clock hint on idle streams). Flushes buckets that have ended.
     */
    public synchronized void advanceWatermark(Instant hint) {
        if (!hint.isAfter(watermark)) {
            return;
        }
        watermark = hint;
        for (Series s : series.values()) {
            expire(s);
        }
    }

    /**
     * Finalize every open bucket (shutdown, end of a backfill chunk).
     */
    public synchronized void flushAll() {
        for (Series s : series.values()) {
            if (s.open != null) {
                flush(s);
            }
        }
    }

    public synchronized Instant watermark() {
        return watermark;
    }

    public synchronized long lateDroppedCount() {
        return lateDropped;
    }

    public synchronized long correctionCount() {
        return corrections;
    }

    /**
     * Snapshot of the open bucket, or null.
     */
    public synchronized Candle openCandle(String provider, String symbol, Granularity granularity) {
        Series s = series.get(new SeriesKey(provider, symbol, granularity));
        return s == null || s.open == null ? null : s.open.toCandle(s.key);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // BUCKET LOGIC
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Stored candle for the trade's bucket when this instance has no history for that bucket.
     */
    private Candle seedFor(SeriesKey key, Trade trade) {
        Granularity g = key.granularity();
        Instant bucket = g.bucketStart(trade.eventTime());
        Series s = series.get(key);

        if (s != null) {
            if (s.open != null && bucket.equals(s.open.bucketStart)) {
                return null;
            }
            if (s.recent.containsKey(bucket)) {
                return null;
            }
            boolean fresh = s.open == null && s.lastFlushedStart == null;
            if (!fresh && (opensNewBucket(s, bucket) || isBeyondLateness(g, bucket))) {
                return null;
            }
        }
        return stored.find(key.provider(), key.symbol(), g, bucket).orElse(null);
    }

    private void apply(Series s, Trade trade, Candle seed) {
        Granularity g = s.key.granularity();
        Instant bucket = g.bucketStart(trade.eventTime());

        if (s.open != null && bucket.equals(s.open.bucketStart)) {
            s.open.add(trade);
            return;
        }

        if (opensNewBucket(s, bucket)) {
            if (s.open != null) {
                flush(s);
            }
            s.open = Accumulator.start(bucket, seed, trade);
            return;
        }

        applyLate(s, bucket, trade, seed);
    }

    private static boolean opensNewBucket(Series s, Instant bucket) {
        if (s.open != null) {
            return bucket.isAfter(s.open.bucketStart);
        }
        return s.lastFlushedStart == null || bucket.isAfter(s.lastFlushedStart);
    }

    private boolean isBeyondLateness(Granularity g, Instant bucket) {
        return g.bucketEnd(bucket).plus(latenessWindow).isBefore(watermark);
    }

    private void applyLate(Series s, Instant bucket, Trade trade, Candle seed) {
        Granularity g = s.key.granularity();
        if (isBeyondLateness(g, bucket)) {
            lateDropped++;
            metrics.recordLateTradeDropped(s.key.provider(), g.label());
            log.debug("[{}:{}] Dropped late trade at {} for {} bucket {} (watermark {})",
                s.key.provider(), s.key.symbol(), trade.eventTime(), g, bucket, watermark);
            return;
        }

        Accumulator flushed = s.recent.get(bucket);
        if (flushed != null) {
            flushed.correct(trade);
            corrections++;
            metrics.recordCandleCorrection(s.key.provider(), g.label());
            log.debug("[{}:{}] Corrected {} candle {} with late trade at {}",
                s.key.provider(), s.key.symbol(), g, bucket, trade.eventTime());
            sink.emit(flushed.toCandle(s.key));
            return;
        }

        // late trade for a bucket never seen here: extend the stored bar, or start a one-trade candle
        Accumulator created = Accumulator.start(bucket, seed, trade);
        s.recent.put(bucket, created);
        sink.emit(created.toCandle(s.key));
    }

    private void flush(Series s) {
        Accumulator open = s.open;
        s.open = null;
        s.recent.put(open.bucketStart, open);
        if (s.lastFlushedStart == null || open.bucketStart.isAfter(s.lastFlushedStart)) {
            s.lastFlushedStart = open.bucketStart;
        }
        sink.emit(open.toCandle(s.key));
    }

    private void expire(Series s) {
        Granularity g = s.key.granularity();
        if (s.open != null && !g.bucketEnd(s.open.bucketStart).isAfter(watermark)) {
            flush(s);
        }
        Iterator<Map.Entry<Instant, Accumulator>> it = s.recent.entrySet().iterator();
        while (it.hasNext()) {
            Instant start = it.next().getKey();
            if (isBeyondLateness(g, start)) {
                it.remove();
            } else {
                break;
            }
        }
    }

    List<Instant> retainedBuckets(String provider, String symbol, Granularity granularity) {
        Series s = series.get(new SeriesKey(provider, symbol, granularity));
        return s == null ? List.of() : new ArrayList<>(s.recent.keySet());
    }

    private record SeriesKey(String provider, String symbol, Granularity granularity) {}

    private static final class Series {
        final SeriesKey key;
        final TreeMap<Instant, Accumulator> recent = new TreeMap<>();
        Accumulator open;
        Instant lastFlushedStart;

        Series(SeriesKey key) {
            this.key = key;
        }
    }

    /**
     * Mutable OHLCV state for one bucket.
     */
    private static final class Accumulator {
        final Instant bucketStart;
        final String correlationId;
        final BigDecimal open;
        BigDecimal high;
        BigDecimal low;
        BigDecimal close;
        BigDecimal volume;
        Instant lastEventTime;

        Accumulator(Instant bucketStart, Trade first) {
            this.bucketStart = bucketStart;
            this.correlationId = first.correlationId();
            this.open = first.price();
            this.high = first.price();
            this.low = first.price();
            this.close = first.price();
            this.volume = first.size();
            this.lastEventTime = first.eventTime();
        }

        Accumulator(Candle stored) {
            this.bucketStart = stored.bucketStart();
            this.correlationId = stored.correlationId();
            this.open = stored.open();
            this.high = stored.high();
            this.low = stored.low();
            this.close = stored.close();
            this.volume = stored.volume();
            this.lastEventTime = stored.lastEventTime() != null ? stored.lastEventTime() : stored.bucketStart();
        }

        static Accumulator start(Instant bucketStart, Candle stored, Trade first) {
            if (stored == null) {
                return new Accumulator(bucketStart, first);
            }
            Accumulator seeded = new Accumulator(stored);
            seeded.add(first);
            return seeded;
        }

        void add(Trade trade) {
            correct(trade);
        }

        void correct(Trade trade) {
            high = high.max(trade.price());
            low = low.min(trade.price());
            volume = volume.add(trade.size());
            if (!trade.eventTime().isBefore(lastEventTime)) {
                close = trade.price();
                lastEventTime = trade.eventTime();
            }
        }

        Candle toCandle(SeriesKey key) {
            return new Candle(key.provider(), key.symbol(), key.granularity(), bucketStart,
                open, high, low, close, volume, lastEventTime, correlationId);
        }
    }
}

package in.tickvault.application.port.output;

import in.tickvault.domain.model.Candle;
import in.tickvault.domain.model.Granularity;
import in.tickvault.domain.model.WriteOutcome;

import java.time.Instant;
import java.util.List;

public interface CandleRepository {
    /**
     * Upsert on (provider, symbol, granularity, bucketStart). Re-submitting an
     * identical candle is DUPLICATE_IGNORED; a changed one replaces the row.
     */
    List<WriteOutcome> upsertBatch(List<Candle> candles);

    WriteOutcome upsert(Candle candle);

    List<Candle> findRange(String provider, String symbol, Granularity granularity, Instant from, Instant to);
}

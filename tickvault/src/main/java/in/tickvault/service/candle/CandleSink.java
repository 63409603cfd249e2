package in.tickvault.service.candle;

import in.tickvault.domain.model.Candle;

/**
 * Receives finished and corrected candles. Writes must be idempotent upserts:
 * a corrected candle replaces the earlier emission with the same key.
 */
@FunctionalInterface
public interface CandleSink {
    void emit(Candle candle);
}

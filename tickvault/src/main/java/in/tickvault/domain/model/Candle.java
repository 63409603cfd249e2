package in.tickvault.domain.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * OHLCV bar. Natural key: (provider, symbol, granularity, bucketStart).
 */
public record Candle(
    String provider,
    String symbol,
    Granularity granularity,
    Instant bucketStart,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    BigDecimal volume,
    Instant lastEventTime,
    String correlationId
) {
    /**
     * high >= max(open, close), low <= min(open, close), volume >= 0.
     */
    public boolean isConsistent() {
        return high.compareTo(open.max(close)) >= 0
            && low.compareTo(open.min(close)) <= 0
            && volume.signum() >= 0;
    }
}

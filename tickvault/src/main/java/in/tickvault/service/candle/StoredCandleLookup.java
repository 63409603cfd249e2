package in.tickvault.service.candle;

import in.tickvault.domain.model.Candle;
import in.tickvault.domain.model.Granularity;

import java.time.Instant;
import java.util.Optional;

/**
 * Reads a candle that is already persisted, so an aggregator without in-memory
 * history for a bucket continues the stored bar instead of replacing it.
 */
@FunctionalInterface
public interface StoredCandleLookup {

    StoredCandleLookup NONE = (provider, symbol, granularity, bucketStart) -> Optional.empty();

    Optional<Candle> find(String provider, String symbol, Granularity granularity, Instant bucketStart);
}

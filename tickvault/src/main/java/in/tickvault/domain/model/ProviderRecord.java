package in.tickvault.domain.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Decoded provider message before normalization.
 *
 * Field values are kept close to the wire: prices may be null when the
 * provider omitted them and eventTime is the raw timestamp text. Only the
 * fields relevant to the record type are populated.
 */
public record ProviderRecord(
    RecordType type,
    String provider,
    String symbol,
    String tradeId,
    BigDecimal price,
    BigDecimal size,
    String side,
    BigDecimal bidPrice,
    BigDecimal bidSize,
    BigDecimal askPrice,
    BigDecimal askSize,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    BigDecimal volume,
    String eventTime,
    Instant receivedAt,
    Long sequence,
    String rawPayload
) {
    public static ProviderRecord trade(String provider, String symbol, String tradeId,
                                       BigDecimal price, BigDecimal size, String side,
                                       String eventTime, Instant receivedAt, Long sequence,
                                       String rawPayload) {
        return new ProviderRecord(RecordType.TRADE, provider, symbol, tradeId, price, size, side,
            null, null, null, null, null, null, null, null, null,
            eventTime, receivedAt, sequence, rawPayload);
    }

    public static ProviderRecord quote(String provider, String symbol,
                                       BigDecimal bidPrice, BigDecimal bidSize,
                                       BigDecimal askPrice, BigDecimal askSize,
                                       BigDecimal lastPrice, BigDecimal lastSize,
                                       String eventTime, Instant receivedAt, Long sequence,
                                       String rawPayload) {
        return new ProviderRecord(RecordType.QUOTE, provider, symbol, null, lastPrice, lastSize, null,
            bidPrice, bidSize, askPrice, askSize, null, null, null, null, null,
            eventTime, receivedAt, sequence, rawPayload);
    }

    public static ProviderRecord candle(String provider, String symbol,
                                        BigDecimal open, BigDecimal high, BigDecimal low,
                                        BigDecimal close, BigDecimal volume,
                                        String bucketStart, Instant receivedAt, String rawPayload) {
        return new ProviderRecord(RecordType.CANDLE, provider, symbol, null, null, null, null,
            null, null, null, null, open, high, low, close, volume,
            bucketStart, receivedAt, null, rawPayload);
    }

    public static ProviderRecord keepalive(String provider, Instant receivedAt, String rawPayload) {
        return new ProviderRecord(RecordType.KEEPALIVE, provider, null, null, null, null, null,
            null, null, null, null, null, null, null, null, null,
            null, receivedAt, null, rawPayload);
    }

    public boolean isKeepalive() {
        return type == RecordType.KEEPALIVE;
    }
}

package in.tickvault.domain.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Canonical trade print.
 *
 * Natural key: (symbol, eventTime, tradeId) when the provider assigns a trade id,
 * otherwise (provider, symbol, eventTime, price, size).
 */
public record Trade(
    String provider,
    String symbol,
    String tradeId,
    BigDecimal price,
    BigDecimal size,
    TradeSide side,
    Instant eventTime,
    Instant receivedAt,
    String correlationId,
    Long sequence
) {
    public boolean hasTradeId() {
        return tradeId != null && !tradeId.isBlank();
    }
}

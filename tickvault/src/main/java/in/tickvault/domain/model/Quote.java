package in.tickvault.domain.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Canonical top-of-book snapshot. Any price/size field may be null when the
 * provider did not send that side.
 */
public record Quote(
    String provider,
    String symbol,
    BigDecimal bidPrice,
    BigDecimal bidSize,
    BigDecimal askPrice,
    BigDecimal askSize,
    BigDecimal lastPrice,
    BigDecimal lastSize,
    Instant eventTime,
    Instant receivedAt,
    String correlationId
) {}

package in.tickvault.service.normalize;

import in.tickvault.domain.model.Candle;
import in.tickvault.domain.model.Quote;
import in.tickvault.domain.model.Trade;

/**
 * Either exactly one canonical record or a rejection.
 */
public record NormalizationResult(
    Trade trade,
    Quote quote,
    Candle candle,
    RejectReason rejectReason,
    String detail
) {
    public static NormalizationResult ofTrade(Trade trade) {
        return new NormalizationResult(trade, null, null, null, null);
    }

    public static NormalizationResult ofQuote(Quote quote) {
        return new NormalizationResult(null, quote, null, null, null);
    }

    public static NormalizationResult ofCandle(Candle candle) {
        return new NormalizationResult(null, null, candle, null, null);
    }

    public static NormalizationResult rejected(RejectReason reason, String detail) {
        return new NormalizationResult(null, null, null, reason, detail);
    }

    public boolean isAccepted() {
        return rejectReason == null;
    }

    /**
     * "out_of_range: price -1 < 0".
     */
    public String rejectionText() {
        return rejectReason == null ? null : rejectReason.code() + ": " + detail;
    }
}

package in.tickvault.domain.model;

import java.time.Instant;

/**
 * Record that could not be processed. Append-only; replayed out of band.
 */
public record DeadLetterRecord(
    Long id,
    String provider,
    String symbol,
    String payload,
    String errorReason,
    int retryCount,
    Instant createdAt
) {
    public static DeadLetterRecord of(String provider, String symbol, String payload,
                                      String errorReason, int retryCount, Instant now) {
        return new DeadLetterRecord(null, provider, symbol, payload, errorReason, retryCount, now);
    }
}

package in.tickvault.domain.model;

import java.time.Instant;

/**
 * Resume cursor for one live stream. lastOffset is the provider sequence when
 * the feed has one, otherwise the epoch-millis of lastEventTime.
 */
public record StreamOffset(
    String provider,
    String symbol,
    StreamKind streamKind,
    String lastOffset,
    Instant lastEventTime,
    Instant updatedAt
) {
    public Long sequenceOrNull() {
        if (lastOffset == null) {
            return null;
        }
        try {
            return Long.parseLong(lastOffset);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}

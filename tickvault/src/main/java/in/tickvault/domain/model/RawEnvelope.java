package in.tickvault.domain.model;

import java.time.Instant;

/**
 * As-received provider payload, kept for replay and debugging.
 * Nothing downstream interprets the payload.
 */
public record RawEnvelope(
    String provider,
    String symbol,
    Instant eventTime,
    Instant receivedAt,
    String payload,
    String correlationId
) {
    /**
     * Time used to place the envelope in a partition.
     */
    public Instant partitionTime() {
        return eventTime != null ? eventTime : receivedAt;
    }
}

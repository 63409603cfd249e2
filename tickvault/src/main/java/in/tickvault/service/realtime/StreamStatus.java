package in.tickvault.service.realtime;

import java.time.Instant;

/**
 * Point-in-time view of one stream worker, for health checks and the CLI summary.
 */
public record StreamStatus(
    String provider,
    String symbol,
    StreamWorker.State state,
    boolean degraded,
    long reconnects,
    long recordsProcessed,
    Instant lastEventTime
) {}

package in.tickvault.domain.model;

import java.time.Instant;

/**
 * Backfill unit of work over [requestedStart, requestedEnd).
 *
 * lastProcessedTime is the checkpoint: everything before it has been fetched and written.
 */
public record FetchJob(
    long id,
    String provider,
    String symbol,
    FetchJobKind kind,
    Granularity granularity,
    Instant requestedStart,
    Instant requestedEnd,
    FetchJobStatus status,
    Instant lastProcessedTime,
    int attempts,
    String errorMessage,
    Instant createdAt,
    Instant updatedAt
) {
    /**
     * Where the next chunk starts.
     */
    public Instant resumePoint() {
        if (lastProcessedTime == null || lastProcessedTime.isBefore(requestedStart)) {
            return requestedStart;
        }
        return lastProcessedTime;
    }

    public boolean isRangeExhausted() {
        return !resumePoint().isBefore(requestedEnd);
    }

    public FetchJob withStatus(FetchJobStatus next, String error, Instant now) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Fetch job " + id + " cannot move from " + status + " to " + next);
        }
        int nextAttempts = next == FetchJobStatus.RUNNING ? attempts + 1 : attempts;
        return new FetchJob(id, provider, symbol, kind, granularity, requestedStart, requestedEnd,
            next, lastProcessedTime, nextAttempts, error, createdAt, now);
    }

    public FetchJob withCheckpoint(Instant processedUpTo, Instant now) {
        return new FetchJob(id, provider, symbol, kind, granularity, requestedStart, requestedEnd,
            status, processedUpTo, attempts, errorMessage, createdAt, now);
    }
}

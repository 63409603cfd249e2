package in.tickvault.service.realtime;

import in.tickvault.application.port.output.StreamOffsetRepository;
import in.tickvault.domain.model.StreamKind;
import in.tickvault.domain.model.StreamOffset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Committed and candidate offsets of one (provider, symbol) stream.
 *
 * A candidate only becomes committed after the records it covers were written.
 * Records at or before the committed position are reported as already seen:
 * by sequence when both sides have one, otherwise by strictly older event time.
 * Not thread-safe; owned by one stream worker.
 */
public final class StreamOffsetTracker {
    private static final Logger log = LoggerFactory.getLogger(StreamOffsetTracker.class);

    private final String provider;
    private final String symbol;
    private final Clock clock;

    private final Map<StreamKind, StreamOffset> committed = new EnumMap<>(StreamKind.class);
    private final Map<StreamKind, Position> candidates = new EnumMap<>(StreamKind.class);

    public StreamOffsetTracker(String provider, String symbol, Clock clock) {
        this.provider = provider;
        this.symbol = symbol;
        this.clock = clock;
    }

    /**
     * Load committed offsets from the store.
     */
    public void load(StreamOffsetRepository repository) {
        for (StreamKind kind : StreamKind.values()) {
            repository.find(provider, symbol, kind).ifPresent(offset -> {
                committed.put(kind, offset);
                log.info("[{}:{}] Resuming {} after offset {} ({})",
                    provider, symbol, kind, offset.lastOffset(), offset.lastEventTime());
            });
        }
    }

    public boolean isAlreadyCommitted(StreamKind kind, Long sequence, Instant eventTime) {
        StreamOffset offset = committed.get(kind);
        if (offset == null) {
            return false;
        }
        Long committedSequence = offset.sequenceOrNull();
        if (sequence != null && committedSequence != null) {
            return sequence <= committedSequence;
        }
        return offset.lastEventTime() != null && eventTime.isBefore(offset.lastEventTime());
    }

    /**
     * Move the candidate forward; never backwards.
     */
    public void advance(StreamKind kind, Long sequence, Instant eventTime) {
        candidates.merge(kind, new Position(sequence, eventTime), Position::max);
    }

    /**
     * Candidates newer than what is committed, ready to be persisted.
     */
    public List<StreamOffset> pending() {
        Instant now = clock.instant();
        List<StreamOffset> result = new ArrayList<>();
        candidates.forEach((kind, position) -> {
            StreamOffset current = committed.get(kind);
            if (current == null || current.lastEventTime() == null
                    || position.isAfter(current)) {
                result.add(new StreamOffset(provider, symbol, kind, position.offsetText(),
                    position.eventTime(), now));
            }
        });
        return result;
    }

    public void markCommitted(StreamOffset offset) {
        committed.put(offset.streamKind(), offset);
    }

    /**
     * Offset handed to the adapter on (re)connect; the trade cursor wins when both exist.
     */
    public StreamOffset resumeFrom() {
        StreamOffset trades = committed.get(StreamKind.TRADES);
        return trades != null ? trades : committed.get(StreamKind.QUOTES);
    }

    public StreamOffset committed(StreamKind kind) {
        return committed.get(kind);
    }

    private record Position(Long sequence, Instant eventTime) {

        Position max(Position other) {
            if (sequence != null && other.sequence != null) {
                return other.sequence > sequence ? other : this;
            }
            return other.eventTime.isAfter(eventTime) ? other : this;
        }

        boolean isAfter(StreamOffset offset) {
            Long committedSequence = offset.sequenceOrNull();
            if (sequence != null && committedSequence != null) {
                return sequence > committedSequence;
            }
            return eventTime.isAfter(offset.lastEventTime());
        }

        String offsetText() {
            return sequence != null ? String.valueOf(sequence) : String.valueOf(eventTime.toEpochMilli());
        }
    }
}

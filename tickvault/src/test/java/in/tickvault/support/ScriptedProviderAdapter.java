package in.tickvault.support;

import in.tickvault.domain.model.Granularity;
import in.tickvault.domain.model.ProviderRecord;
import in.tickvault.domain.model.StreamOffset;
import in.tickvault.infrastructure.provider.LiveStream;
import in.tickvault.infrastructure.provider.ProviderAdapter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.BiFunction;

/**
 * Provider adapter driven by the test.
 *
 * Historical fetches are answered by a function of the chunk range, after any
 * queued failures have been thrown. Live connects hand out queued streams (or
 * throw queued failures); when the queue is empty an idle stream is returned.
 */
public final class ScriptedProviderAdapter implements ProviderAdapter {
    private final String name;
    private final ConcurrentLinkedQueue<RuntimeException> fetchFailures = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<Object> connects = new ConcurrentLinkedQueue<>();
    private final List<Instant[]> fetches = Collections.synchronizedList(new ArrayList<>());
    private final List<StreamOffset> resumeOffsets = Collections.synchronizedList(new ArrayList<>());
    private volatile BiFunction<Instant, Instant, List<ProviderRecord>> history = (from, to) -> List.of();
    private volatile int connectCount;

    public ScriptedProviderAdapter(String name) {
        this.name = name;
    }

    public ScriptedProviderAdapter history(BiFunction<Instant, Instant, List<ProviderRecord>> history) {
        this.history = history;
        return this;
    }

    public ScriptedProviderAdapter failFetch(RuntimeException e) {
        fetchFailures.add(e);
        return this;
    }

    public ScriptedProviderAdapter nextStream(LiveStream stream) {
        connects.add(stream);
        return this;
    }

    public ScriptedProviderAdapter failConnect(RuntimeException e) {
        connects.add(e);
        return this;
    }

    @Override
    public String providerName() {
        return name;
    }

    @Override
    public List<ProviderRecord> fetchHistorical(String symbol, Instant start, Instant end, Granularity granularity) {
        fetches.add(new Instant[] {start, end});
        RuntimeException failure = fetchFailures.poll();
        if (failure != null) {
            throw failure;
        }
        return history.apply(start, end);
    }

    @Override
    public LiveStream streamLive(String symbol, StreamOffset resumeFrom) {
        connectCount++;
        resumeOffsets.add(resumeFrom);
        Object next = connects.poll();
        if (next instanceof RuntimeException e) {
            throw e;
        }
        if (next != null) {
            return (LiveStream) next;
        }
        return new ScriptedLiveStream(name, symbol);
    }

    public List<Instant[]> fetches() {
        synchronized (fetches) {
            return List.copyOf(fetches);
        }
    }

    public List<StreamOffset> resumeOffsets() {
        synchronized (resumeOffsets) {
            return new ArrayList<>(resumeOffsets);
        }
    }

    public int connectCount() {
        return connectCount;
    }

    @Override
    public void close() {
    }
}

package in.tickvault.service.realtime;

import in.tickvault.application.port.output.StreamOffsetRepository;
import in.tickvault.config.StreamSettings;
import in.tickvault.infrastructure.metrics.IngestionMetrics;
import in.tickvault.infrastructure.provider.ProviderAdapter;
import in.tickvault.infrastructure.provider.common.Sleeper;
import in.tickvault.service.normalize.Normalizer;
import in.tickvault.service.storage.StorageWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Supervises one stream worker per (provider, symbol), each on its own named thread.
 */
public final class RealtimePipeline {
    private static final Logger log = LoggerFactory.getLogger(RealtimePipeline.class);

    private final Map<String, ProviderAdapter> adapters;
    private final Normalizer normalizer;
    private final StorageWriter writer;
    private final StreamOffsetRepository offsetRepository;
    private final IngestionMetrics metrics;
    private final StreamSettings settings;
    private final Clock clock;
    private final Sleeper sleeper;

    private final List<StreamWorker> workers = new CopyOnWriteArrayList<>();
    private final List<Thread> threads = new CopyOnWriteArrayList<>();
    private final Map<String, AtomicInteger> connectionsByProvider = new ConcurrentHashMap<>();

    public RealtimePipeline(Map<String, ProviderAdapter> adapters,
                            Normalizer normalizer,
                            StorageWriter writer,
                            StreamOffsetRepository offsetRepository,
                            IngestionMetrics metrics,
                            StreamSettings settings,
                            Clock clock,
                            Sleeper sleeper) {
        this.adapters = Map.copyOf(adapters);
        this.normalizer = normalizer;
        this.writer = writer;
        this.offsetRepository = offsetRepository;
        this.metrics = metrics;
        this.settings = settings;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Start one worker per symbol for the given provider.
     *
     * @throws IllegalArgumentException if no adapter is configured for the provider
     */
    public void start(String provider, List<String> symbols) {
        ProviderAdapter adapter = adapters.get(provider);
        if (adapter == null) {
            throw new IllegalArgumentException("No adapter configured for provider " + provider);
        }
        AtomicInteger connections = connectionsByProvider.computeIfAbsent(provider, p -> new AtomicInteger());

        for (String symbol : symbols) {
            StreamWorker worker = new StreamWorker(provider, symbol, adapter, normalizer, writer,
                offsetRepository, metrics, settings, clock, sleeper, connections);
            Thread thread = new Thread(worker, "stream-" + provider + "-" + symbol);
            thread.setUncaughtExceptionHandler((t, e) ->
                log.error("[{}:{}] Stream worker crashed: {}", provider, symbol, e.getMessage(), e));
            workers.add(worker);
            threads.add(thread);
            thread.start();
        }
        log.info("[REALTIME] Started {} workers for {}", symbols.size(), provider);
    }

    /**
     * Ask every worker to stop; open candles are flushed by each worker on its way out.
     */
    public void stop() {
        log.info("[REALTIME] Stopping {} workers", workers.size());
        workers.forEach(StreamWorker::stop);
    }

    /**
     * Wait for workers to finish. Workers still running after the grace period are interrupted.
     *
     * @return true if every worker stopped within the grace period
     */
    public boolean awaitTermination(Duration grace) throws InterruptedException {
        long deadline = System.nanoTime() + grace.toNanos();
        boolean clean = true;
        for (Thread thread : threads) {
            long remainingMillis = Math.max(0L, (deadline - System.nanoTime()) / 1_000_000L);
            thread.join(Math.max(1L, remainingMillis));
            if (thread.isAlive()) {
                log.warn("[REALTIME] {} did not stop within {}ms, interrupting", thread.getName(), grace.toMillis());
                thread.interrupt();
                clean = false;
            }
        }
        return clean;
    }

    public List<StreamStatus> statuses() {
        List<StreamStatus> result = new ArrayList<>(workers.size());
        for (StreamWorker worker : workers) {
            result.add(worker.status());
        }
        return result;
    }

    public boolean hasStreams() {
        return !workers.isEmpty();
    }

    /**
     * True when streams exist and every one of them is degraded.
     */
    public boolean allDegraded() {
        List<StreamStatus> current = statuses();
        return !current.isEmpty() && current.stream().allMatch(StreamStatus::degraded);
    }
}

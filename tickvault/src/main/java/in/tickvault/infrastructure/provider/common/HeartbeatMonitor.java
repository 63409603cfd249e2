package in.tickvault.infrastructure.provider.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Liveness monitor for one live stream.
 *
 * Every record (provider keepalives included) counts as activity. When no
 * activity is seen within the timeout the callback fires once; the stream
 * owner is expected to tear the connection down and reconnect, whether or
 * not the transport itself ever reported a closure.
 *
 * Usage:
 * <pre>
 * HeartbeatMonitor heartbeat = new HeartbeatMonitor(
 *     "binance", "BTCUSDT",
 *     Duration.ofSeconds(30),
 *     () -> stream.close());
 *
 * heartbeat.start();
 * // on every message:
 * heartbeat.recordActivity();
 * heartbeat.stop();
 * </pre>
 */
public class HeartbeatMonitor {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatMonitor.class);

    private final String provider;
    private final String symbol;
    private final Duration timeout;
    private final Duration checkInterval;
    private final Runnable onTimeout;
    private final Clock clock;

    private final ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> checkTask;
    private volatile Instant lastActivityTime;
    private volatile boolean running = false;
    private volatile boolean expired = false;

    public HeartbeatMonitor(String provider, String symbol, Duration timeout, Runnable onTimeout) {
        this(provider, symbol, timeout, defaultCheckInterval(timeout), onTimeout, Clock.systemUTC());
    }

    public HeartbeatMonitor(String provider, String symbol,
                            Duration timeout, Duration checkInterval,
                            Runnable onTimeout, Clock clock) {
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Heartbeat timeout must be positive");
        }
        this.provider = provider;
        this.symbol = symbol;
        this.timeout = timeout;
        this.checkInterval = checkInterval;
        this.onTimeout = onTimeout;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Heartbeat-" + provider + "-" + symbol);
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (running) {
            log.warn("[{}:{}] Heartbeat monitor already running", provider, symbol);
            return;
        }

        log.debug("[{}:{}] Starting heartbeat monitor (timeout: {}ms)", provider, symbol, timeout.toMillis());

        running = true;
        expired = false;
        lastActivityTime = clock.instant();

        checkTask = scheduler.scheduleAtFixedRate(this::check,
            checkInterval.toMillis(), checkInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (!running) {
            scheduler.shutdownNow();
            return;
        }

        running = false;
        if (checkTask != null) {
            checkTask.cancel(false);
            checkTask = null;
        }

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Record receipt of any message, data or keepalive.
     */
    public void recordActivity() {
        lastActivityTime = clock.instant();
    }

    public boolean isHealthy() {
        return !expired && isWithinTimeout();
    }

    public boolean isExpired() {
        return expired;
    }

    /**
     * @return Duration since last activity, or null if never started
     */
    public Duration getTimeSinceLastActivity() {
        Instant last = lastActivityTime;
        if (last == null) {
            return null;
        }
        return Duration.between(last, clock.instant());
    }

    /**
     * Run one liveness check. Called by the scheduler; exposed for tests driving a fake clock.
     */
    void check() {
        if (!running || expired || isWithinTimeout()) {
            return;
        }

        expired = true;
        log.warn("[{}:{}] Heartbeat timeout - no data or keepalive for {}ms, forcing reconnect",
            provider, symbol, timeout.toMillis());
        try {
            onTimeout.run();
        } catch (RuntimeException e) {
            log.error("[{}:{}] Heartbeat timeout callback threw exception", provider, symbol, e);
        }
    }

    private boolean isWithinTimeout() {
        Instant last = lastActivityTime;
        if (last == null) {
            return false;
        }
        return Duration.between(last, clock.instant()).compareTo(timeout) < 0;
    }

    private static Duration defaultCheckInterval(Duration timeout) {
        long millis = Math.max(10L, timeout.toMillis() / 4);
        return Duration.ofMillis(millis);
    }
}

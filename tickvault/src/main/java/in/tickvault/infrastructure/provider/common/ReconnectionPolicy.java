package in.tickvault.infrastructure.provider.common;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Random;
import java.util.function.DoubleSupplier;

/**
 * Reconnection policy with exponential backoff for live provider streams.
 *
 * Features:
 * - Exponential backoff with configurable multiplier
 * - Maximum backoff duration (cap)
 * - Random jitter of +/- jitterFraction around the base delay
 * - Degraded flag after N consecutive failures (retries never stop)
 * - Reset after successful connection
 *
 * Usage:
 * <pre>
 * ReconnectionPolicy policy = ReconnectionPolicy.builder()
 *     .initialDelay(Duration.ofSeconds(1))
 *     .maxDelay(Duration.ofMinutes(1))
 *     .multiplier(2.0)
 *     .jitterFraction(0.2)
 *     .degradedAfter(5)
 *     .build();
 *
 * while (running) {
 *     try {
 *         stream = adapter.streamLive(symbol, offset);
 *         policy.recordSuccess();
 *         consume(stream);
 *     } catch (TransientProviderException e) {
 *         Duration delay = policy.getNextDelay();
 *         policy.recordFailure();
 *         sleeper.sleep(delay);
 *     }
 * }
 * </pre>
 */
public class ReconnectionPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final double jitterFraction;
    private final int degradedAfter;
    private final Clock clock;
    private final DoubleSupplier random;

    private int attemptCount = 0;
    private Duration currentDelay;
    private Instant lastAttemptTime;
    private boolean degraded = false;

    private ReconnectionPolicy(Builder builder) {
        this.initialDelay = builder.initialDelay;
        this.maxDelay = builder.maxDelay;
        this.multiplier = builder.multiplier;
        this.jitterFraction = builder.jitterFraction;
        this.degradedAfter = builder.degradedAfter;
        this.clock = builder.clock;
        this.random = builder.random;
        this.currentDelay = initialDelay;
    }

    /**
     * Base delay before the next attempt, without jitter.
     * Non-decreasing across failures until it reaches maxDelay.
     */
    public synchronized Duration getBaseDelay() {
        return currentDelay;
    }

    /**
     * Delay before the next attempt with jitter applied, never above maxDelay.
     */
    public synchronized Duration getNextDelay() {
        if (jitterFraction == 0.0) {
            return currentDelay;
        }
        double factor = 1.0 + jitterFraction * (2.0 * random.getAsDouble() - 1.0);
        long jittered = Math.round(currentDelay.toMillis() * factor);
        return Duration.ofMillis(Math.max(1L, Math.min(jittered, maxDelay.toMillis())));
    }

    /**
     * Record a failed connection attempt.
     * Increments attempt count and calculates next backoff delay.
     */
    public synchronized void recordFailure() {
        attemptCount++;
        lastAttemptTime = clock.instant();

        long newDelayMillis = (long) (currentDelay.toMillis() * multiplier);
        currentDelay = Duration.ofMillis(Math.min(newDelayMillis, maxDelay.toMillis()));

        if (attemptCount >= degradedAfter) {
            degraded = true;
        }
    }

    /**
     * Record a successful connection.
     * Resets all counters and clears the degraded flag.
     */
    public synchronized void recordSuccess() {
        attemptCount = 0;
        currentDelay = initialDelay;
        lastAttemptTime = null;
        degraded = false;
    }

    public synchronized void reset() {
        recordSuccess();
    }

    /**
     * @return true once degradedAfter consecutive failures have been recorded
     */
    public synchronized boolean isDegraded() {
        return degraded;
    }

    public synchronized boolean isAtMaxDelay() {
        return currentDelay.compareTo(maxDelay) >= 0;
    }

    /**
     * @return Number of failed attempts since last success
     */
    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    /**
     * @return Instant of last failed attempt, or null if none since last success
     */
    public synchronized Instant getLastAttemptTime() {
        return lastAttemptTime;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Default policy for live provider streams.
     */
    public static ReconnectionPolicy forLiveStream() {
        return builder()
            .initialDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofMinutes(1))
            .multiplier(2.0)
            .jitterFraction(0.2)
            .degradedAfter(5)
            .build();
    }

    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofMinutes(1);
        private double multiplier = 2.0;
        private double jitterFraction = 0.2;
        private int degradedAfter = 5;
        private Clock clock = Clock.systemUTC();
        private DoubleSupplier random = new Random()::nextDouble;

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier <= 1.0) {
                throw new IllegalArgumentException("Multiplier must be greater than 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder jitterFraction(double jitterFraction) {
            if (jitterFraction < 0.0 || jitterFraction >= 1.0) {
                throw new IllegalArgumentException("Jitter fraction must be in [0, 1)");
            }
            this.jitterFraction = jitterFraction;
            return this;
        }

        public Builder degradedAfter(int degradedAfter) {
            if (degradedAfter <= 0) {
                throw new IllegalArgumentException("Degraded threshold must be positive");
            }
            this.degradedAfter = degradedAfter;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder random(DoubleSupplier random) {
            this.random = random;
            return this;
        }

        public ReconnectionPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new ReconnectionPolicy(this);
        }
    }
}

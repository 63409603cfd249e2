package in.tickvault.infrastructure.provider.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff.
 *
 * An action is retried while the failure is retryable, fewer than maxAttempts
 * have been made and maxElapsed has not passed. Failures carrying a
 * {@link RetryHint} wait at least the hinted duration.
 */
public class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final Duration maxElapsed;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final double multiplier;
    private final Clock clock;
    private final Sleeper sleeper;

    private RetryPolicy(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.maxElapsed = builder.maxElapsed;
        this.initialBackoff = builder.initialBackoff;
        this.maxBackoff = builder.maxBackoff;
        this.multiplier = builder.multiplier;
        this.clock = builder.clock;
        this.sleeper = builder.sleeper;
    }

    /**
     * Run the action, retrying retryable failures. The last failure is rethrown when retries are exhausted.
     *
     * @throws CancellationException if interrupted while backing off
     */
    public <T> T execute(String label, Supplier<T> action, Predicate<RuntimeException> retryable) {
        Instant started = clock.instant();
        Duration backoff = initialBackoff;
        int attempt = 0;

        while (true) {
            attempt++;
            try {
                return action.get();
            } catch (RuntimeException e) {
                if (!retryable.test(e)) {
                    throw e;
                }

                Duration wait = backoff;
                if (e instanceof RetryHint hint && hint.retryAfter().compareTo(wait) > 0) {
                    wait = hint.retryAfter();
                }

                Duration elapsed = Duration.between(started, clock.instant());
                if (attempt >= maxAttempts || elapsed.plus(wait).compareTo(maxElapsed) > 0) {
                    log.warn("[{}] Giving up after {} attempts ({}ms): {}",
                        label, attempt, elapsed.toMillis(), e.getMessage());
                    throw e;
                }

                log.info("[{}] Attempt {} failed ({}), retrying in {}ms",
                    label, attempt, e.getMessage(), wait.toMillis());
                try {
                    sleeper.sleep(wait);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    CancellationException cancelled = new CancellationException("[" + label + "] Retry interrupted");
                    cancelled.addSuppressed(e);
                    throw cancelled;
                }

                long next = (long) (backoff.toMillis() * multiplier);
                backoff = Duration.ofMillis(Math.min(next, maxBackoff.toMillis()));
            }
        }
    }

    public void run(String label, Runnable action, Predicate<RuntimeException> retryable) {
        execute(label, () -> {
            action.run();
            return null;
        }, retryable);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxAttempts = 5;
        private Duration maxElapsed = Duration.ofMinutes(5);
        private Duration initialBackoff = Duration.ofMillis(500);
        private Duration maxBackoff = Duration.ofSeconds(30);
        private double multiplier = 2.0;
        private Clock clock = Clock.systemUTC();
        private Sleeper sleeper = Sleeper.SYSTEM;

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder maxElapsed(Duration maxElapsed) {
            if (maxElapsed.isNegative() || maxElapsed.isZero()) {
                throw new IllegalArgumentException("Max elapsed must be positive");
            }
            this.maxElapsed = maxElapsed;
            return this;
        }

        public Builder initialBackoff(Duration initialBackoff) {
            if (initialBackoff.isNegative()) {
                throw new IllegalArgumentException("Initial backoff must not be negative");
            }
            this.initialBackoff = initialBackoff;
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("Multiplier must be at least 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public RetryPolicy build() {
            if (initialBackoff.compareTo(maxBackoff) > 0) {
                throw new IllegalArgumentException("Initial backoff cannot exceed max backoff");
            }
            return new RetryPolicy(this);
        }
    }
}

package in.tickvault.infrastructure.provider.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token bucket shared by every caller of one provider.
 *
 * Waiters are served in arrival order (fair lock held while waiting), so one
 * busy instrument cannot starve another. A penalty from a provider throttle
 * response blocks all callers until its deadline; penalties only ever extend
 * the block.
 */
public class TokenBucketRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(TokenBucketRateLimiter.class);

    private final String provider;
    private final double capacity;
    private final double refillPerNano;
    private final Clock clock;
    private final Sleeper sleeper;

    private final ReentrantLock lock = new ReentrantLock(true);
    private final AtomicReference<Instant> blockedUntil = new AtomicReference<>(Instant.EPOCH);

    private double tokens;
    private Instant lastRefill;

    public TokenBucketRateLimiter(String provider, int requestsPerMinute, int burst) {
        this(provider, requestsPerMinute, burst, Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public TokenBucketRateLimiter(String provider, int requestsPerMinute, int burst,
                                  Clock clock, Sleeper sleeper) {
        if (requestsPerMinute <= 0) {
            throw new IllegalArgumentException("requestsPerMinute must be positive");
        }
        if (burst <= 0) {
            throw new IllegalArgumentException("burst must be positive");
        }
        this.provider = provider;
        this.capacity = burst;
        this.refillPerNano = requestsPerMinute / (double) Duration.ofMinutes(1).toNanos();
        this.clock = clock;
        this.sleeper = sleeper;
        this.tokens = burst;
        this.lastRefill = clock.instant();
    }

    /**
     * Take one permit, blocking while the bucket is empty or a penalty is active.
     *
     * @return how long the caller waited
     */
    public Duration acquire() throws InterruptedException {
        Instant started = clock.instant();
        lock.lockInterruptibly();
        try {
            while (true) {
                Instant now = clock.instant();
                Instant blocked = blockedUntil.get();
                if (now.isBefore(blocked)) {
                    Duration pause = Duration.between(now, blocked);
                    log.debug("[{}] Rate limiter paused for {}ms", provider, pause.toMillis());
                    sleeper.sleep(pause);
                    continue;
                }

                refill(now);
                if (tokens >= 1.0) {
                    tokens -= 1.0;
                    return Duration.between(started, clock.instant());
                }

                long nanosUntilToken = (long) Math.ceil((1.0 - tokens) / refillPerNano);
                sleeper.sleep(Duration.ofNanos(Math.max(1L, nanosUntilToken)));
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Block every caller for at least retryAfter from now.
     */
    public void penalize(Duration retryAfter) {
        Instant until = clock.instant().plus(retryAfter);
        Instant effective = blockedUntil.accumulateAndGet(until, (a, b) -> a.isAfter(b) ? a : b);
        log.warn("[{}] Provider throttled, all requests paused until {}", provider, effective);
    }

    public Instant blockedUntil() {
        return blockedUntil.get();
    }

    public boolean isPaused() {
        return clock.instant().isBefore(blockedUntil.get());
    }

    public double availableTokens() {
        lock.lock();
        try {
            refill(clock.instant());
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    public String provider() {
        return provider;
    }

    private void refill(Instant now) {
        long elapsed = Duration.between(lastRefill, now).toNanos();
        if (elapsed > 0) {
            tokens = Math.min(capacity, tokens + elapsed * refillPerNano);
            lastRefill = now;
        }
    }
}

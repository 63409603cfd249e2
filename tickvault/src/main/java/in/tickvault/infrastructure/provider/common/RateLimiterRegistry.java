package in.tickvault.infrastructure.provider.common;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One limiter per provider name, shared by backfill jobs and live workers.
 */
public class RateLimiterRegistry {

    private final Map<String, TokenBucketRateLimiter> limiters = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Sleeper sleeper;

    public RateLimiterRegistry() {
        this(Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public RateLimiterRegistry(Clock clock, Sleeper sleeper) {
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Limiter for the provider. The first caller's budget wins; later calls reuse it.
     */
    public TokenBucketRateLimiter forProvider(String provider, int requestsPerMinute, int burst) {
        return limiters.computeIfAbsent(provider,
            name -> new TokenBucketRateLimiter(name, requestsPerMinute, burst, clock, sleeper));
    }

    public TokenBucketRateLimiter get(String provider) {
        return limiters.get(provider);
    }
}

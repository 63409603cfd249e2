package in.tickvault.infrastructure.provider;

import in.tickvault.infrastructure.provider.common.RetryHint;

import java.time.Duration;

/**
 * Provider answered with a throttle response (HTTP 429 or equivalent).
 */
public class RateLimitedException extends TransientProviderException implements RetryHint {

    private final Duration retryAfter;

    public RateLimitedException(String provider, String symbol, Duration retryAfter) {
        super(provider, symbol, "Rate limited, retry after " + retryAfter.toMillis() + "ms");
        this.retryAfter = retryAfter;
    }

    @Override
    public Duration retryAfter() {
        return retryAfter;
    }
}

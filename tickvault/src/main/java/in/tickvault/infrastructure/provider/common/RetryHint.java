package in.tickvault.infrastructure.provider.common;

import java.time.Duration;

/**
 * Implemented by failures that tell the caller how long to back off.
 */
public interface RetryHint {
    Duration retryAfter();
}

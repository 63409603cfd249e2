package in.tickvault.infrastructure.provider.common;

import java.time.Duration;

/**
 * Blocking wait used by limiters and retry loops; replaced with a clock-advancing fake in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        if (!duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}

package in.tickvault.infrastructure.provider.common;

import in.tickvault.infrastructure.provider.ProviderException;
import in.tickvault.infrastructure.provider.RateLimitedException;
import in.tickvault.infrastructure.provider.TransientProviderException;
import in.tickvault.support.FakeSleeper;
import in.tickvault.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RetryPolicy.
 */
class RetryPolicyTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-05T10:00:00Z"));
    private final FakeSleeper sleeper = new FakeSleeper(clock);

    @Test
    void testSucceedsAfterTransientFailures() {
        RetryPolicy policy = policy(5, Duration.ofMinutes(5));
        AtomicInteger calls = new AtomicInteger();

        String result = policy.execute("fetch", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new TransientProviderException("polygon", "AAPL", "503");
            }
            return "ok";
        }, RetryPolicyTest::isTransient);

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), sleeper.sleeps(), "Backoff doubles");
    }

    @Test
    void testGivesUpAfterMaxAttempts() {
        RetryPolicy policy = policy(3, Duration.ofMinutes(5));
        AtomicInteger calls = new AtomicInteger();

        assertThrows(TransientProviderException.class, () -> policy.run("fetch", () -> {
            calls.incrementAndGet();
            throw new TransientProviderException("polygon", "AAPL", "timeout");
        }, RetryPolicyTest::isTransient));

        assertEquals(3, calls.get(), "Attempts are bounded");
    }

    @Test
    void testGivesUpWhenElapsedBudgetWouldBeExceeded() {
        RetryPolicy policy = policy(100, Duration.ofMillis(250));
        AtomicInteger calls = new AtomicInteger();

        assertThrows(TransientProviderException.class, () -> policy.run("fetch", () -> {
            calls.incrementAndGet();
            throw new TransientProviderException("polygon", "AAPL", "timeout");
        }, RetryPolicyTest::isTransient));

        assertEquals(2, calls.get(), "100ms then 200ms would pass the 250ms budget");
    }

    @Test
    void testNonRetryableFailsImmediately() {
        RetryPolicy policy = policy(5, Duration.ofMinutes(5));
        AtomicInteger calls = new AtomicInteger();

        assertThrows(ProviderException.class, () -> policy.run("fetch", () -> {
            calls.incrementAndGet();
            throw new ProviderException("polygon", "NOPE", "unknown symbol");
        }, RetryPolicyTest::isTransient));

        assertEquals(1, calls.get());
        assertTrue(sleeper.sleeps().isEmpty());
    }

    @Test
    void testRetryHintExtendsWait() {
        RetryPolicy policy = policy(3, Duration.ofMinutes(5));
        AtomicInteger calls = new AtomicInteger();

        policy.run("fetch", () -> {
            if (calls.incrementAndGet() == 1) {
                throw new RateLimitedException("polygon", "AAPL", Duration.ofSeconds(30));
            }
        }, RetryPolicyTest::isTransient);

        assertEquals(List.of(Duration.ofSeconds(30)), sleeper.sleeps(), "Hint wins over a shorter backoff");
    }

    @Test
    void testInterruptedBackoffCancels() {
        RetryPolicy policy = RetryPolicy.builder()
            .maxAttempts(3)
            .initialBackoff(Duration.ofMillis(100))
            .maxBackoff(Duration.ofSeconds(1))
            .clock(clock)
            .sleeper(d -> {
                throw new InterruptedException("stop");
            })
            .build();

        CancellationException e = assertThrows(CancellationException.class, () -> policy.run("fetch", () -> {
            throw new TransientProviderException("polygon", "AAPL", "timeout");
        }, RetryPolicyTest::isTransient));

        assertEquals(1, e.getSuppressed().length, "Original failure is kept");
        assertTrue(Thread.interrupted(), "Interrupt flag is restored");
    }

    private RetryPolicy policy(int attempts, Duration maxElapsed) {
        return RetryPolicy.builder()
            .maxAttempts(attempts)
            .maxElapsed(maxElapsed)
            .initialBackoff(Duration.ofMillis(100))
            .maxBackoff(Duration.ofSeconds(1))
            .multiplier(2.0)
            .clock(clock)
            .sleeper(sleeper)
            .build();
    }

    private static boolean isTransient(RuntimeException e) {
        return e instanceof ProviderException pe && pe.isTransient();
    }
}

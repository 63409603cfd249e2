package in.tickvault.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class GranularityTest {

    @Test
    void testParseUnits() {
        assertEquals(Duration.ofSeconds(1), Granularity.parse("1s").width());
        assertEquals(Duration.ofMinutes(5), Granularity.parse("5m").width());
        assertEquals(Duration.ofHours(1), Granularity.parse(" 1H ").width());
        assertEquals(Duration.ofDays(10), Granularity.parseDuration("10d"));
        assertEquals(Duration.ofDays(14), Granularity.parseDuration("2w"));
    }

    @Test
    void testParseRejectsGarbage() {
        assertThrows(IllegalArgumentException.class, () -> Granularity.parse("1y"));
        assertThrows(IllegalArgumentException.class, () -> Granularity.parse("0m"));
        assertThrows(IllegalArgumentException.class, () -> Granularity.parse("m"));
        assertThrows(IllegalArgumentException.class, () -> Granularity.parse(null));
    }

    @Test
    void testBucketStartAlignsOnEpoch() {
        Granularity minute = Granularity.ONE_MINUTE;
        Instant t = Instant.parse("2026-01-05T10:15:42.123Z");

        assertEquals(Instant.parse("2026-01-05T10:15:00Z"), minute.bucketStart(t));
        assertEquals(Instant.parse("2026-01-05T10:15:42Z"), Granularity.ONE_SECOND.bucketStart(t));
        assertEquals(Instant.parse("2026-01-05T10:16:00Z"), minute.bucketEnd(minute.bucketStart(t)));
    }

    @Test
    void testBucketStartBeforeEpoch() {
        Instant t = Instant.parse("1969-12-31T23:59:30.500Z");
        assertEquals(Instant.parse("1969-12-31T23:59:00Z"), Granularity.ONE_MINUTE.bucketStart(t),
            "Negative times floor, not truncate");
    }

    @Test
    void testLabelRoundTrip() {
        for (String label : new String[] {"1s", "30s", "1m", "15m", "1h", "4h", "1d", "1w"}) {
            assertEquals(label, Granularity.parse(label).label());
            assertEquals(Granularity.parse(label), Granularity.parse(Granularity.parse(label).label()));
        }
        assertEquals("90s", new Granularity(Duration.ofSeconds(90)).label());
    }

    @Test
    void testRejectsSubMillisecondWidth() {
        assertThrows(IllegalArgumentException.class, () -> new Granularity(Duration.ofNanos(1500)));
        assertThrows(IllegalArgumentException.class, () -> new Granularity(Duration.ZERO));
    }
}

package in.tickvault.migration;

import in.tickvault.migration.PartitionPlanner.MonthlyPartition;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PartitionPlanner.
 */
class PartitionPlannerTest {

    @Test
    void testPlansCurrentAndFollowingMonths() {
        Clock clock = Clock.fixed(Instant.parse("2026-11-15T08:00:00Z"), ZoneId.of("UTC"));

        List<MonthlyPartition> plan = new PartitionPlanner(clock, 2).plan("trades_raw");

        assertEquals(3, plan.size());
        assertEquals("trades_raw_y2026m11", plan.get(0).name());
        assertEquals("trades_raw_y2026m12", plan.get(1).name());
        assertEquals("trades_raw_y2027m01", plan.get(2).name(), "Rolls over the year");
        assertEquals(LocalDate.of(2027, 1, 1), plan.get(2).from());
        assertEquals(LocalDate.of(2027, 2, 1), plan.get(2).to());
    }

    @Test
    void testMonthIsTakenInUtc() {
        // 23:30 on Jan 31 in New York is already February in UTC
        Clock clock = Clock.fixed(Instant.parse("2026-02-01T04:30:00Z"), ZoneId.of("America/New_York"));

        List<MonthlyPartition> plan = new PartitionPlanner(clock, 0).plan("trades_raw");

        assertEquals(1, plan.size());
        assertEquals("trades_raw_y2026m02", plan.get(0).name());
    }

    @Test
    void testCreateSql() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-10T00:00:00Z"), ZoneId.of("UTC"));

        String sql = new PartitionPlanner(clock, 0).plan("trades_raw").get(0).createSql();

        assertEquals("CREATE TABLE IF NOT EXISTS trades_raw_y2026m03 PARTITION OF trades_raw "
            + "FOR VALUES FROM ('2026-03-01 00:00:00+00') TO ('2026-04-01 00:00:00+00')", sql);
    }

    @Test
    void testNegativeHorizonIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new PartitionPlanner(Clock.systemUTC(), -1));
    }
}

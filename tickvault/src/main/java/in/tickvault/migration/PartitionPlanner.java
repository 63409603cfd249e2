package in.tickvault.migration;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Plans monthly range partitions of trades_raw, starting at the current UTC month.
 */
public final class PartitionPlanner {

    private final Clock clock;
    private final int monthsAhead;

    public PartitionPlanner(Clock clock, int monthsAhead) {
        if (monthsAhead < 0) {
            throw new IllegalArgumentException("monthsAhead must be >= 0: " + monthsAhead);
        }
        this.clock = clock;
        this.monthsAhead = monthsAhead;
    }

    /**
     * Current month plus {@code monthsAhead} following months, oldest first.
     */
    public List<MonthlyPartition> plan(String parentTable) {
        YearMonth current = YearMonth.now(clock.withZone(ZoneOffset.UTC));
        List<MonthlyPartition> partitions = new ArrayList<>(monthsAhead + 1);
        for (int i = 0; i <= monthsAhead; i++) {
            partitions.add(MonthlyPartition.of(parentTable, current.plusMonths(i)));
        }
        return partitions;
    }

    public record MonthlyPartition(String parentTable, String name, LocalDate from, LocalDate to) {

        static MonthlyPartition of(String parentTable, YearMonth month) {
            String name = String.format("%s_y%04dm%02d", parentTable, month.getYear(), month.getMonthValue());
            return new MonthlyPartition(parentTable, name, month.atDay(1), month.plusMonths(1).atDay(1));
        }

        public String createSql() {
            return String.format(
                "CREATE TABLE IF NOT EXISTS %s PARTITION OF %s FOR VALUES FROM ('%s 00:00:00+00') TO ('%s 00:00:00+00')",
                name, parentTable, from, to);
        }
    }
}

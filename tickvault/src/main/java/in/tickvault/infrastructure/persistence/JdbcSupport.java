package in.tickvault.infrastructure.persistence;

import in.tickvault.domain.model.WriteOutcome;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Null-safe parameter binding shared by the JDBC repositories.
 */
final class JdbcSupport {

    static void setInstant(PreparedStatement ps, int index, Instant value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        } else {
            ps.setTimestamp(index, Timestamp.from(value));
        }
    }

    static void setDecimal(PreparedStatement ps, int index, BigDecimal value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.NUMERIC);
        } else {
            ps.setBigDecimal(index, value);
        }
    }

    static void setLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.BIGINT);
        } else {
            ps.setLong(index, value);
        }
    }

    static Instant getInstant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }

    static Long getLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    /**
     * Update counts of an INSERT ... ON CONFLICT batch: 1 written, 0 skipped.
     * Drivers that cannot report per-row counts return SUCCESS_NO_INFO, taken as written.
     */
    static List<WriteOutcome> outcomes(int[] counts) {
        List<WriteOutcome> result = new ArrayList<>(counts.length);
        for (int count : counts) {
            result.add(outcome(count));
        }
        return result;
    }

    static WriteOutcome outcome(int count) {
        if (count == Statement.EXECUTE_FAILED) {
            return WriteOutcome.FAILED;
        }
        if (count == 0) {
            return WriteOutcome.DUPLICATE_IGNORED;
        }
        return WriteOutcome.INSERTED;
    }

    private JdbcSupport() {}
}

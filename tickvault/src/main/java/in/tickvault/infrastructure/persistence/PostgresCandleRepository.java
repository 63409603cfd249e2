package in.tickvault.infrastructure.persistence;

import in.tickvault.application.port.output.CandleRepository;
import in.tickvault.application.port.output.StorageException;
import in.tickvault.domain.model.Candle;
import in.tickvault.domain.model.Granularity;
import in.tickvault.domain.model.WriteOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * PostgreSQL implementation of CandleRepository.
 */
public final class PostgresCandleRepository implements CandleRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresCandleRepository.class);

    // an identical re-submission matches no row in the DO UPDATE branch and reports 0
    private static final String UPSERT_SQL = """
        INSERT INTO candles (provider, symbol, granularity, bucket_start, open, high, low, close, volume,
                             last_event_time, correlation_id)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (provider, symbol, granularity, bucket_start) DO UPDATE SET
            open = EXCLUDED.open,
            high = EXCLUDED.high,
            low = EXCLUDED.low,
            close = EXCLUDED.close,
            volume = EXCLUDED.volume,
            last_event_time = EXCLUDED.last_event_time,
            updated_at = CURRENT_TIMESTAMP
        WHERE candles.open <> EXCLUDED.open
           OR candles.high <> EXCLUDED.high
           OR candles.low <> EXCLUDED.low
           OR candles.close <> EXCLUDED.close
           OR candles.volume <> EXCLUDED.volume
        """;

    private final DataSource dataSource;

    public PostgresCandleRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<WriteOutcome> upsertBatch(List<Candle> candles) {
        if (candles.isEmpty()) {
            return List.of();
        }

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(UPSERT_SQL)) {

            conn.setAutoCommit(false);
            try {
                for (Candle candle : candles) {
                    bind(ps, candle);
                    ps.addBatch();
                }
                int[] counts = ps.executeBatch();
                conn.commit();
                log.debug("Upserted {} candles", candles.size());
                return JdbcSupport.outcomes(counts);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }

        } catch (SQLException e) {
            log.error("Failed to upsert candle batch: {}", e.getMessage());
            throw StorageException.from("Upsert candle batch", e);
        }
    }

    @Override
    public WriteOutcome upsert(Candle candle) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(UPSERT_SQL)) {

            bind(ps, candle);
            return JdbcSupport.outcome(ps.executeUpdate());

        } catch (SQLException e) {
            log.error("Failed to upsert candle {} {} {}: {}",
                candle.symbol(), candle.granularity(), candle.bucketStart(), e.getMessage());
            throw StorageException.from("Upsert candle", e);
        }
    }

    @Override
    public List<Candle> findRange(String provider, String symbol, Granularity granularity, Instant from, Instant to) {
        String sql = """
            SELECT provider, symbol, granularity, bucket_start, open, high, low, close, volume,
                   last_event_time, correlation_id
            FROM candles
            WHERE provider = ? AND symbol = ? AND granularity = ? AND bucket_start >= ? AND bucket_start < ?
            ORDER BY bucket_start ASC
            """;

        List<Candle> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, provider);
            ps.setString(2, symbol);
            ps.setString(3, granularity.label());
            JdbcSupport.setInstant(ps, 4, from);
            JdbcSupport.setInstant(ps, 5, to);

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapRow(rs));
                }
            }

        } catch (SQLException e) {
            log.error("Failed to find candles: {}", e.getMessage());
            throw StorageException.from("Find candles", e);
        }
        return result;
    }

    private static void bind(PreparedStatement ps, Candle candle) throws SQLException {
        ps.setString(1, candle.provider());
        ps.setString(2, candle.symbol());
        ps.setString(3, candle.granularity().label());
        JdbcSupport.setInstant(ps, 4, candle.bucketStart());
        ps.setBigDecimal(5, candle.open());
        ps.setBigDecimal(6, candle.high());
        ps.setBigDecimal(7, candle.low());
        ps.setBigDecimal(8, candle.close());
        ps.setBigDecimal(9, candle.volume());
        JdbcSupport.setInstant(ps, 10, candle.lastEventTime());
        ps.setString(11, candle.correlationId());
    }

    private static Candle mapRow(ResultSet rs) throws SQLException {
        return new Candle(
            rs.getString("provider"),
            rs.getString("symbol"),
            Granularity.parse(rs.getString("granularity")),
            JdbcSupport.getInstant(rs, "bucket_start"),
            rs.getBigDecimal("open"),
            rs.getBigDecimal("high"),
            rs.getBigDecimal("low"),
            rs.getBigDecimal("close"),
            rs.getBigDecimal("volume"),
            JdbcSupport.getInstant(rs, "last_event_time"),
            rs.getString("correlation_id"));
    }
}

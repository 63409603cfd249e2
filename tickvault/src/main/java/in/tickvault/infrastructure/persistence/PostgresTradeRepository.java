package in.tickvault.infrastructure.persistence;

import in.tickvault.application.port.output.StorageException;
import in.tickvault.application.port.output.TradeRepository;
import in.tickvault.domain.model.Trade;
import in.tickvault.domain.model.WriteOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;

/**
 * PostgreSQL implementation of TradeRepository.
 *
 * Two partial unique indexes carry the natural keys (with and without trade id),
 * so a plain ON CONFLICT DO NOTHING covers both.
 */
public final class PostgresTradeRepository implements TradeRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresTradeRepository.class);

    private static final String INSERT_SQL = """
        INSERT INTO trades (provider, symbol, trade_id, price, size, side, event_time, received_at, correlation_id, sequence)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT DO NOTHING
        """;

    private final DataSource dataSource;

    public PostgresTradeRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<WriteOutcome> insertBatch(List<Trade> trades) {
        if (trades.isEmpty()) {
            return List.of();
        }

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {

            conn.setAutoCommit(false);
            try {
                for (Trade trade : trades) {
                    bind(ps, trade);
                    ps.addBatch();
                }
                int[] counts = ps.executeBatch();
                conn.commit();
                log.debug("Inserted trade batch of {}", trades.size());
                return JdbcSupport.outcomes(counts);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }

        } catch (SQLException e) {
            log.error("Failed to insert trade batch: {}", e.getMessage());
            throw StorageException.from("Insert trade batch", e);
        }
    }

    @Override
    public WriteOutcome insert(Trade trade) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {

            bind(ps, trade);
            return JdbcSupport.outcome(ps.executeUpdate());

        } catch (SQLException e) {
            log.error("Failed to insert trade {}:{}: {}", trade.symbol(), trade.tradeId(), e.getMessage());
            throw StorageException.from("Insert trade", e);
        }
    }

    private static void bind(PreparedStatement ps, Trade trade) throws SQLException {
        ps.setString(1, trade.provider());
        ps.setString(2, trade.symbol());
        ps.setString(3, trade.hasTradeId() ? trade.tradeId() : null);
        ps.setBigDecimal(4, trade.price());
        ps.setBigDecimal(5, trade.size());
        ps.setString(6, trade.side().name());
        JdbcSupport.setInstant(ps, 7, trade.eventTime());
        JdbcSupport.setInstant(ps, 8, trade.receivedAt());
        ps.setString(9, trade.correlationId());
        JdbcSupport.setLong(ps, 10, trade.sequence());
    }
}

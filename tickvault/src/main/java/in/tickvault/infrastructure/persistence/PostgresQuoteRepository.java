package in.tickvault.infrastructure.persistence;

import in.tickvault.application.port.output.QuoteRepository;
import in.tickvault.application.port.output.StorageException;
import in.tickvault.domain.model.Quote;
import in.tickvault.domain.model.QuoteMode;
import in.tickvault.domain.model.WriteOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;

/**
 * PostgreSQL implementation of QuoteRepository.
 */
public final class PostgresQuoteRepository implements QuoteRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresQuoteRepository.class);

    // older or equal event time leaves the row alone, reported as a duplicate
    private static final String UPSERT_LATEST_SQL = """
        INSERT INTO quotes (provider, symbol, bid_price, bid_size, ask_price, ask_size,
                            last_price, last_size, event_time, received_at, correlation_id)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (provider, symbol) DO UPDATE SET
            bid_price = EXCLUDED.bid_price,
            bid_size = EXCLUDED.bid_size,
            ask_price = EXCLUDED.ask_price,
            ask_size = EXCLUDED.ask_size,
            last_price = EXCLUDED.last_price,
            last_size = EXCLUDED.last_size,
            event_time = EXCLUDED.event_time,
            received_at = EXCLUDED.received_at,
            correlation_id = EXCLUDED.correlation_id
        WHERE quotes.event_time < EXCLUDED.event_time
        """;

    private static final String INSERT_HISTORY_SQL = """
        INSERT INTO quotes_history (provider, symbol, bid_price, bid_size, ask_price, ask_size,
                                    last_price, last_size, event_time, received_at, correlation_id)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (provider, symbol, event_time) DO NOTHING
        """;

    private final DataSource dataSource;

    public PostgresQuoteRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<WriteOutcome> insertBatch(List<Quote> quotes, QuoteMode mode) {
        if (quotes.isEmpty()) {
            return List.of();
        }

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sqlFor(mode))) {

            conn.setAutoCommit(false);
            try {
                for (Quote quote : quotes) {
                    bind(ps, quote);
                    ps.addBatch();
                }
                int[] counts = ps.executeBatch();
                conn.commit();
                return JdbcSupport.outcomes(counts);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }

        } catch (SQLException e) {
            log.error("Failed to insert quote batch ({}): {}", mode, e.getMessage());
            throw StorageException.from("Insert quote batch", e);
        }
    }

    @Override
    public WriteOutcome insert(Quote quote, QuoteMode mode) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sqlFor(mode))) {

            bind(ps, quote);
            return JdbcSupport.outcome(ps.executeUpdate());

        } catch (SQLException e) {
            log.error("Failed to insert quote {} at {}: {}", quote.symbol(), quote.eventTime(), e.getMessage());
            throw StorageException.from("Insert quote", e);
        }
    }

    private static String sqlFor(QuoteMode mode) {
        return mode == QuoteMode.HISTORY ? INSERT_HISTORY_SQL : UPSERT_LATEST_SQL;
    }

    private static void bind(PreparedStatement ps, Quote quote) throws SQLException {
        ps.setString(1, quote.provider());
        ps.setString(2, quote.symbol());
        JdbcSupport.setDecimal(ps, 3, quote.bidPrice());
        JdbcSupport.setDecimal(ps, 4, quote.bidSize());
        JdbcSupport.setDecimal(ps, 5, quote.askPrice());
        JdbcSupport.setDecimal(ps, 6, quote.askSize());
        JdbcSupport.setDecimal(ps, 7, quote.lastPrice());
        JdbcSupport.setDecimal(ps, 8, quote.lastSize());
        JdbcSupport.setInstant(ps, 9, quote.eventTime());
        JdbcSupport.setInstant(ps, 10, quote.receivedAt());
        ps.setString(11, quote.correlationId());
    }
}

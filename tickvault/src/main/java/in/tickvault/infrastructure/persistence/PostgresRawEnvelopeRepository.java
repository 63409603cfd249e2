package in.tickvault.infrastructure.persistence;

import in.tickvault.application.port.output.RawEnvelopeRepository;
import in.tickvault.application.port.output.StorageException;
import in.tickvault.domain.model.RawEnvelope;
import in.tickvault.domain.model.WriteOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;

/**
 * Append-only writes to trades_raw. Rows are routed to the monthly partition by partition_time.
 */
public final class PostgresRawEnvelopeRepository implements RawEnvelopeRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresRawEnvelopeRepository.class);

    private static final String INSERT_SQL = """
        INSERT INTO trades_raw (provider, symbol, event_time, received_at, partition_time, payload, correlation_id)
        VALUES (?, ?, ?, ?, ?, ?, ?)
        """;

    private final DataSource dataSource;

    public PostgresRawEnvelopeRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<WriteOutcome> insertBatch(List<RawEnvelope> envelopes) {
        if (envelopes.isEmpty()) {
            return List.of();
        }

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {

            conn.setAutoCommit(false);
            try {
                for (RawEnvelope envelope : envelopes) {
                    ps.setString(1, envelope.provider());
                    ps.setString(2, envelope.symbol());
                    JdbcSupport.setInstant(ps, 3, envelope.eventTime());
                    JdbcSupport.setInstant(ps, 4, envelope.receivedAt());
                    JdbcSupport.setInstant(ps, 5, envelope.partitionTime());
                    ps.setString(6, envelope.payload());
                    ps.setString(7, envelope.correlationId());
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
            log.error("Failed to insert raw envelope batch: {}", e.getMessage());
            throw StorageException.from("Insert raw envelopes", e);
        }
    }
}

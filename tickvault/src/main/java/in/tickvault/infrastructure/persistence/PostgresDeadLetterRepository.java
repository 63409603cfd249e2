package in.tickvault.infrastructure.persistence;

import in.tickvault.application.port.output.DeadLetterRepository;
import in.tickvault.application.port.output.StorageException;
import in.tickvault.domain.model.DeadLetterRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only dead letter store. Rows are never updated or deleted by the pipeline.
 */
public final class PostgresDeadLetterRepository implements DeadLetterRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresDeadLetterRepository.class);

    private final DataSource dataSource;

    public PostgresDeadLetterRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void insertBatch(List<DeadLetterRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        String sql = """
            INSERT INTO dead_letter (provider, symbol, payload, error_reason, retry_count, created_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            conn.setAutoCommit(false);
            try {
                for (DeadLetterRecord record : records) {
                    ps.setString(1, record.provider());
                    ps.setString(2, record.symbol());
                    ps.setString(3, record.payload());
                    ps.setString(4, record.errorReason());
                    ps.setInt(5, record.retryCount());
                    JdbcSupport.setInstant(ps, 6, record.createdAt());
                    ps.addBatch();
                }
                ps.executeBatch();
                conn.commit();
                log.debug("Dead-lettered {} records", records.size());
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }

        } catch (SQLException e) {
            log.error("Failed to write {} dead letter records: {}", records.size(), e.getMessage());
            throw StorageException.from("Insert dead letters", e);
        }
    }

    @Override
    public long count() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM dead_letter");
             ResultSet rs = ps.executeQuery()) {

            return rs.next() ? rs.getLong(1) : 0L;

        } catch (SQLException e) {
            log.error("Failed to count dead letters: {}", e.getMessage());
            throw StorageException.from("Count dead letters", e);
        }
    }

    @Override
    public List<DeadLetterRecord> findRecent(int limit) {
        String sql = """
            SELECT id, provider, symbol, payload, error_reason, retry_count, created_at
            FROM dead_letter
            ORDER BY id DESC
            LIMIT ?
            """;

        List<DeadLetterRecord> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(new DeadLetterRecord(
                        rs.getLong("id"),
                        rs.getString("provider"),
                        rs.getString("symbol"),
                        rs.getString("payload"),
                        rs.getString("error_reason"),
                        rs.getInt("retry_count"),
                        JdbcSupport.getInstant(rs, "created_at")));
                }
            }

        } catch (SQLException e) {
            log.error("Failed to read dead letters: {}", e.getMessage());
            throw StorageException.from("Find dead letters", e);
        }
        return result;
    }
}

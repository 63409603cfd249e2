package in.tickvault.infrastructure.persistence;

import in.tickvault.application.port.output.StorageException;
import in.tickvault.application.port.output.StreamOffsetRepository;
import in.tickvault.domain.model.StreamKind;
import in.tickvault.domain.model.StreamOffset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL implementation of StreamOffsetRepository. One row per (provider, symbol, stream_kind).
 */
public final class PostgresStreamOffsetRepository implements StreamOffsetRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresStreamOffsetRepository.class);

    private final DataSource dataSource;

    public PostgresStreamOffsetRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<StreamOffset> find(String provider, String symbol, StreamKind kind) {
        String sql = """
            SELECT provider, symbol, stream_kind, last_offset, last_event_time, updated_at
            FROM stream_offsets
            WHERE provider = ? AND symbol = ? AND stream_kind = ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, provider);
            ps.setString(2, symbol);
            ps.setString(3, kind.name());

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();

        } catch (SQLException e) {
            log.error("Failed to load stream offset {}:{}:{}: {}", provider, symbol, kind, e.getMessage());
            throw StorageException.from("Find stream offset", e);
        }
    }

    @Override
    public boolean commit(StreamOffset offset) {
        String sql = """
            INSERT INTO stream_offsets (provider, symbol, stream_kind, last_offset, last_event_time, updated_at)
            VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT (provider, symbol, stream_kind) DO UPDATE SET
                last_offset = EXCLUDED.last_offset,
                last_event_time = EXCLUDED.last_event_time,
                updated_at = EXCLUDED.updated_at
            WHERE stream_offsets.last_event_time IS NULL
               OR stream_offsets.last_event_time <= EXCLUDED.last_event_time
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, offset.provider());
            ps.setString(2, offset.symbol());
            ps.setString(3, offset.streamKind().name());
            ps.setString(4, offset.lastOffset());
            JdbcSupport.setInstant(ps, 5, offset.lastEventTime());
            JdbcSupport.setInstant(ps, 6, offset.updatedAt());
            return ps.executeUpdate() > 0;

        } catch (SQLException e) {
            log.error("Failed to commit stream offset {}:{}:{}: {}",
                offset.provider(), offset.symbol(), offset.streamKind(), e.getMessage());
            throw StorageException.from("Commit stream offset", e);
        }
    }

    @Override
    public List<StreamOffset> findAll() {
        String sql = """
            SELECT provider, symbol, stream_kind, last_offset, last_event_time, updated_at
            FROM stream_offsets
            ORDER BY provider, symbol, stream_kind
            """;

        List<StreamOffset> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                result.add(mapRow(rs));
            }

        } catch (SQLException e) {
            log.error("Failed to list stream offsets: {}", e.getMessage());
            throw StorageException.from("List stream offsets", e);
        }
        return result;
    }

    private static StreamOffset mapRow(ResultSet rs) throws SQLException {
        return new StreamOffset(
            rs.getString("provider"),
            rs.getString("symbol"),
            StreamKind.valueOf(rs.getString("stream_kind")),
            rs.getString("last_offset"),
            JdbcSupport.getInstant(rs, "last_event_time"),
            JdbcSupport.getInstant(rs, "updated_at"));
    }
}

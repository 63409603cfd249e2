package in.tickvault.infrastructure.persistence;

import in.tickvault.application.port.output.FetchJobRepository;
import in.tickvault.application.port.output.StorageException;
import in.tickvault.domain.model.FetchJob;
import in.tickvault.domain.model.FetchJobKind;
import in.tickvault.domain.model.FetchJobStatus;
import in.tickvault.domain.model.Granularity;
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
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * PostgreSQL implementation of FetchJobRepository.
 */
public final class PostgresFetchJobRepository implements FetchJobRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresFetchJobRepository.class);

    private static final String COLUMNS = """
        id, provider, symbol, kind, granularity, requested_start, requested_end, status,
        last_processed_time, attempts, error_message, created_at, updated_at
        """;

    private final DataSource dataSource;

    public PostgresFetchJobRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public InsertResult insertIfAbsent(FetchJob job) {
        String sql = """
            INSERT INTO fetch_jobs (provider, symbol, kind, granularity, requested_start, requested_end, status,
                                    last_processed_time, attempts, error_message, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (provider, symbol, kind, requested_start) DO NOTHING
            RETURNING id
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, job.provider());
            ps.setString(2, job.symbol());
            ps.setString(3, job.kind().name());
            ps.setString(4, job.granularity().label());
            JdbcSupport.setInstant(ps, 5, job.requestedStart());
            JdbcSupport.setInstant(ps, 6, job.requestedEnd());
            ps.setString(7, job.status().name());
            JdbcSupport.setInstant(ps, 8, job.lastProcessedTime());
            ps.setInt(9, job.attempts());
            ps.setString(10, job.errorMessage());
            JdbcSupport.setInstant(ps, 11, job.createdAt());
            JdbcSupport.setInstant(ps, 12, job.updatedAt());

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    long id = rs.getLong(1);
                    return new InsertResult(new FetchJob(id, job.provider(), job.symbol(), job.kind(),
                        job.granularity(), job.requestedStart(), job.requestedEnd(), job.status(),
                        job.lastProcessedTime(), job.attempts(), job.errorMessage(),
                        job.createdAt(), job.updatedAt()), true);
                }
            }

        } catch (SQLException e) {
            log.error("Failed to insert fetch job {}:{}: {}", job.provider(), job.symbol(), e.getMessage());
            throw StorageException.from("Insert fetch job", e);
        }

        FetchJob existing = findByNaturalKey(job.provider(), job.symbol(), job.kind(), job.requestedStart())
            .orElseThrow(() -> new StorageException(
                "Fetch job conflict but no existing row for " + job.provider() + ":" + job.symbol(), null, false, null));
        return new InsertResult(existing, false);
    }

    @Override
    public Optional<FetchJob> findById(long id) {
        String sql = "SELECT " + COLUMNS + " FROM fetch_jobs WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }

        } catch (SQLException e) {
            log.error("Failed to find fetch job {}: {}", id, e.getMessage());
            throw StorageException.from("Find fetch job", e);
        }
    }

    @Override
    public Optional<FetchJob> findByNaturalKey(String provider, String symbol, FetchJobKind kind, Instant requestedStart) {
        String sql = "SELECT " + COLUMNS + """
             FROM fetch_jobs
            WHERE provider = ? AND symbol = ? AND kind = ? AND requested_start = ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, provider);
            ps.setString(2, symbol);
            ps.setString(3, kind.name());
            JdbcSupport.setInstant(ps, 4, requestedStart);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }

        } catch (SQLException e) {
            log.error("Failed to find fetch job {}:{}: {}", provider, symbol, e.getMessage());
            throw StorageException.from("Find fetch job", e);
        }
    }

    @Override
    public List<FetchJob> findByStatus(Set<FetchJobStatus> statuses) {
        if (statuses.isEmpty()) {
            return List.of();
        }
        String placeholders = statuses.stream().map(s -> "?").collect(Collectors.joining(", "));
        String sql = "SELECT " + COLUMNS + " FROM fetch_jobs WHERE status IN (" + placeholders + ") ORDER BY id";

        List<FetchJob> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            int index = 1;
            for (FetchJobStatus status : statuses) {
                ps.setString(index++, status.name());
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapRow(rs));
                }
            }

        } catch (SQLException e) {
            log.error("Failed to list fetch jobs by status {}: {}", statuses, e.getMessage());
            throw StorageException.from("Find fetch jobs", e);
        }
        return result;
    }

    @Override
    public void update(FetchJob job) {
        String sql = """
            UPDATE fetch_jobs
            SET status = ?, last_processed_time = ?, attempts = ?, error_message = ?, updated_at = ?
            WHERE id = ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, job.status().name());
            JdbcSupport.setInstant(ps, 2, job.lastProcessedTime());
            ps.setInt(3, job.attempts());
            ps.setString(4, job.errorMessage());
            JdbcSupport.setInstant(ps, 5, job.updatedAt());
            ps.setLong(6, job.id());

            if (ps.executeUpdate() == 0) {
                throw new StorageException("Fetch job " + job.id() + " not found", null, false, null);
            }

        } catch (SQLException e) {
            log.error("Failed to update fetch job {}: {}", job.id(), e.getMessage());
            throw StorageException.from("Update fetch job", e);
        }
    }

    private static FetchJob mapRow(ResultSet rs) throws SQLException {
        return new FetchJob(
            rs.getLong("id"),
            rs.getString("provider"),
            rs.getString("symbol"),
            FetchJobKind.valueOf(rs.getString("kind")),
            Granularity.parse(rs.getString("granularity")),
            JdbcSupport.getInstant(rs, "requested_start"),
            JdbcSupport.getInstant(rs, "requested_end"),
            FetchJobStatus.valueOf(rs.getString("status")),
            JdbcSupport.getInstant(rs, "last_processed_time"),
            rs.getInt("attempts"),
            rs.getString("error_message"),
            JdbcSupport.getInstant(rs, "created_at"),
            JdbcSupport.getInstant(rs, "updated_at"));
    }
}

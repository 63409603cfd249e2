package in.tickvault.infrastructure.persistence;

import in.tickvault.application.port.output.ProviderRepository;
import in.tickvault.application.port.output.StorageException;
import in.tickvault.domain.model.Provider;
import in.tickvault.domain.model.ProviderKind;
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
 * PostgreSQL implementation of ProviderRepository. The table has no credential columns.
 */
public final class PostgresProviderRepository implements ProviderRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresProviderRepository.class);

    private final DataSource dataSource;

    public PostgresProviderRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void upsert(Provider provider) {
        String sql = """
            INSERT INTO providers (name, kind, base_url, requests_per_minute, active)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT (name) DO UPDATE SET
                kind = EXCLUDED.kind,
                base_url = EXCLUDED.base_url,
                requests_per_minute = EXCLUDED.requests_per_minute,
                active = EXCLUDED.active
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, provider.name());
            ps.setString(2, provider.kind().name());
            ps.setString(3, provider.baseUrl());
            ps.setInt(4, provider.requestsPerMinute());
            ps.setBoolean(5, provider.active());
            ps.executeUpdate();

        } catch (SQLException e) {
            log.error("Failed to upsert provider {}: {}", provider.name(), e.getMessage());
            throw StorageException.from("Upsert provider", e);
        }
    }

    @Override
    public Optional<Provider> findByName(String name) {
        String sql = "SELECT name, kind, base_url, requests_per_minute, active FROM providers WHERE name = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }

        } catch (SQLException e) {
            log.error("Failed to find provider {}: {}", name, e.getMessage());
            throw StorageException.from("Find provider", e);
        }
    }

    @Override
    public List<Provider> findAll() {
        String sql = "SELECT name, kind, base_url, requests_per_minute, active FROM providers ORDER BY name";

        List<Provider> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                result.add(mapRow(rs));
            }

        } catch (SQLException e) {
            log.error("Failed to list providers: {}", e.getMessage());
            throw StorageException.from("List providers", e);
        }
        return result;
    }

    private static Provider mapRow(ResultSet rs) throws SQLException {
        return new Provider(
            rs.getString("name"),
            ProviderKind.valueOf(rs.getString("kind")),
            rs.getString("base_url"),
            rs.getInt("requests_per_minute"),
            rs.getBoolean("active"));
    }
}

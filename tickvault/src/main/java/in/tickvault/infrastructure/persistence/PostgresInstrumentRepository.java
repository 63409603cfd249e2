package in.tickvault.infrastructure.persistence;

import in.tickvault.application.port.output.InstrumentRepository;
import in.tickvault.application.port.output.StorageException;
import in.tickvault.domain.model.AssetKind;
import in.tickvault.domain.model.Instrument;
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
 * PostgreSQL implementation of InstrumentRepository.
 */
public final class PostgresInstrumentRepository implements InstrumentRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresInstrumentRepository.class);

    private final DataSource dataSource;

    public PostgresInstrumentRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void upsert(Instrument instrument) {
        String sql = """
            INSERT INTO instruments (symbol, provider_affinity, asset_kind, base_currency, quote_currency, active)
            VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT (symbol) DO UPDATE SET
                provider_affinity = COALESCE(EXCLUDED.provider_affinity, instruments.provider_affinity),
                base_currency = COALESCE(EXCLUDED.base_currency, instruments.base_currency),
                quote_currency = COALESCE(EXCLUDED.quote_currency, instruments.quote_currency),
                active = EXCLUDED.active
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, instrument.symbol());
            ps.setString(2, instrument.providerAffinity());
            ps.setString(3, instrument.assetKind().name());
            ps.setString(4, instrument.baseCurrency());
            ps.setString(5, instrument.quoteCurrency());
            ps.setBoolean(6, instrument.active());
            ps.executeUpdate();

        } catch (SQLException e) {
            log.error("Failed to upsert instrument {}: {}", instrument.symbol(), e.getMessage());
            throw StorageException.from("Upsert instrument", e);
        }
    }

    @Override
    public Optional<Instrument> findBySymbol(String symbol) {
        String sql = """
            SELECT symbol, provider_affinity, asset_kind, base_currency, quote_currency, active
            FROM instruments WHERE symbol = ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, symbol);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }

        } catch (SQLException e) {
            log.error("Failed to find instrument {}: {}", symbol, e.getMessage());
            throw StorageException.from("Find instrument", e);
        }
    }

    @Override
    public List<Instrument> findActive() {
        String sql = """
            SELECT symbol, provider_affinity, asset_kind, base_currency, quote_currency, active
            FROM instruments WHERE active = TRUE ORDER BY symbol
            """;

        List<Instrument> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                result.add(mapRow(rs));
            }

        } catch (SQLException e) {
            log.error("Failed to list instruments: {}", e.getMessage());
            throw StorageException.from("List instruments", e);
        }
        return result;
    }

    private static Instrument mapRow(ResultSet rs) throws SQLException {
        return new Instrument(
            rs.getString("symbol"),
            rs.getString("provider_affinity"),
            AssetKind.valueOf(rs.getString("asset_kind")),
            rs.getString("base_currency"),
            rs.getString("quote_currency"),
            rs.getBoolean("active"));
    }
}

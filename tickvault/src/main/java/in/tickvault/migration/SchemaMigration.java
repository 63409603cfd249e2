package in.tickvault.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Creates the ingestion schema. Every statement is idempotent, so running it twice is a no-op.
 *
 * trades_raw is range-partitioned by partition_time only when the engine reports PostgreSQL;
 * other engines get a plain table with the same columns.
 */
public final class SchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(SchemaMigration.class);

    static final String RAW_TABLE = "trades_raw";

    private static final List<String> TABLES = List.of(
        """
        CREATE TABLE IF NOT EXISTS providers (
            name VARCHAR(64) PRIMARY KEY,
            kind VARCHAR(16) NOT NULL,
            base_url VARCHAR(512),
            requests_per_minute INT NOT NULL,
            active BOOLEAN NOT NULL DEFAULT TRUE
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS instruments (
            symbol VARCHAR(64) PRIMARY KEY,
            provider_affinity VARCHAR(64),
            asset_kind VARCHAR(16) NOT NULL,
            base_currency VARCHAR(16),
            quote_currency VARCHAR(16),
            active BOOLEAN NOT NULL DEFAULT TRUE
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS fetch_jobs (
            id BIGSERIAL PRIMARY KEY,
            provider VARCHAR(64) NOT NULL,
            symbol VARCHAR(64) NOT NULL,
            kind VARCHAR(32) NOT NULL,
            granularity VARCHAR(16) NOT NULL,
            requested_start TIMESTAMPTZ NOT NULL,
            requested_end TIMESTAMPTZ NOT NULL,
            status VARCHAR(16) NOT NULL,
            last_processed_time TIMESTAMPTZ,
            attempts INT NOT NULL DEFAULT 0,
            error_message TEXT,
            created_at TIMESTAMPTZ NOT NULL,
            updated_at TIMESTAMPTZ NOT NULL,
            UNIQUE (provider, symbol, kind, requested_start)
        )
        """,
        "CREATE INDEX IF NOT EXISTS idx_fetch_jobs_status ON fetch_jobs (status)",
        """
        CREATE TABLE IF NOT EXISTS stream_offsets (
            provider VARCHAR(64) NOT NULL,
            symbol VARCHAR(64) NOT NULL,
            stream_kind VARCHAR(16) NOT NULL,
            last_offset VARCHAR(64),
            last_event_time TIMESTAMPTZ,
            updated_at TIMESTAMPTZ NOT NULL,
            PRIMARY KEY (provider, symbol, stream_kind)
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS dead_letter (
            id BIGSERIAL PRIMARY KEY,
            provider VARCHAR(64) NOT NULL,
            symbol VARCHAR(64),
            payload TEXT NOT NULL,
            error_reason TEXT NOT NULL,
            retry_count INT NOT NULL DEFAULT 0,
            created_at TIMESTAMPTZ NOT NULL
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS trades (
            id BIGSERIAL PRIMARY KEY,
            provider VARCHAR(64) NOT NULL,
            symbol VARCHAR(64) NOT NULL,
            trade_id VARCHAR(128),
            price NUMERIC(38, 18) NOT NULL CHECK (price >= 0),
            size NUMERIC(38, 18) NOT NULL CHECK (size >= 0),
            side VARCHAR(8) NOT NULL,
            event_time TIMESTAMPTZ NOT NULL,
            received_at TIMESTAMPTZ NOT NULL,
            correlation_id VARCHAR(64),
            sequence BIGINT
        )
        """,
        """
        CREATE UNIQUE INDEX IF NOT EXISTS ux_trades_trade_id
            ON trades (symbol, event_time, trade_id) WHERE trade_id IS NOT NULL
        """,
        """
        CREATE UNIQUE INDEX IF NOT EXISTS ux_trades_natural
            ON trades (provider, symbol, event_time, price, size) WHERE trade_id IS NULL
        """,
        """
        CREATE TABLE IF NOT EXISTS quotes (
            provider VARCHAR(64) NOT NULL,
            symbol VARCHAR(64) NOT NULL,
            bid_price NUMERIC(38, 18),
            bid_size NUMERIC(38, 18),
            ask_price NUMERIC(38, 18),
            ask_size NUMERIC(38, 18),
            last_price NUMERIC(38, 18),
            last_size NUMERIC(38, 18),
            event_time TIMESTAMPTZ NOT NULL,
            received_at TIMESTAMPTZ NOT NULL,
            correlation_id VARCHAR(64),
            PRIMARY KEY (provider, symbol)
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS quotes_history (
            provider VARCHAR(64) NOT NULL,
            symbol VARCHAR(64) NOT NULL,
            bid_price NUMERIC(38, 18),
            bid_size NUMERIC(38, 18),
            ask_price NUMERIC(38, 18),
            ask_size NUMERIC(38, 18),
            last_price NUMERIC(38, 18),
            last_size NUMERIC(38, 18),
            event_time TIMESTAMPTZ NOT NULL,
            received_at TIMESTAMPTZ NOT NULL,
            correlation_id VARCHAR(64),
            PRIMARY KEY (provider, symbol, event_time)
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS candles (
            provider VARCHAR(64) NOT NULL,
            symbol VARCHAR(64) NOT NULL,
            granularity VARCHAR(16) NOT NULL,
            bucket_start TIMESTAMPTZ NOT NULL,
            open NUMERIC(38, 18) NOT NULL,
            high NUMERIC(38, 18) NOT NULL,
            low NUMERIC(38, 18) NOT NULL,
            close NUMERIC(38, 18) NOT NULL,
            volume NUMERIC(38, 18) NOT NULL CHECK (volume >= 0),
            last_event_time TIMESTAMPTZ,
            correlation_id VARCHAR(64),
            updated_at TIMESTAMPTZ NOT NULL DEFAULT CURRENT_TIMESTAMP,
            PRIMARY KEY (provider, symbol, granularity, bucket_start)
        )
        """
    );

    private static final String RAW_COLUMNS = """
            id BIGSERIAL,
            provider VARCHAR(64) NOT NULL,
            symbol VARCHAR(64) NOT NULL,
            event_time TIMESTAMPTZ,
            received_at TIMESTAMPTZ NOT NULL,
            partition_time TIMESTAMPTZ NOT NULL,
            payload TEXT NOT NULL,
            correlation_id VARCHAR(64),
            PRIMARY KEY (id, partition_time)
        """;

    private final DataSource dataSource;
    private final PartitionPlanner partitionPlanner;

    public SchemaMigration(DataSource dataSource, PartitionPlanner partitionPlanner) {
        this.dataSource = dataSource;
        this.partitionPlanner = partitionPlanner;
    }

    /**
     * Apply tables, indexes and (on PostgreSQL) raw partitions.
     *
     * @return number of statements executed
     */
    public int migrate() {
        log.info("[MIGRATION] Applying ingestion schema");

        try (Connection conn = dataSource.getConnection();
             Statement st = conn.createStatement()) {

            int executed = 0;
            for (String ddl : TABLES) {
                st.execute(ddl);
                executed++;
            }

            boolean postgres = isPostgres(conn);
            if (postgres) {
                st.execute("CREATE TABLE IF NOT EXISTS " + RAW_TABLE + " (" + RAW_COLUMNS + ") PARTITION BY RANGE (partition_time)");
                executed++;
                for (PartitionPlanner.MonthlyPartition partition : partitionPlanner.plan(RAW_TABLE)) {
                    st.execute(partition.createSql());
                    log.info("[MIGRATION] Partition {} [{}, {})", partition.name(), partition.from(), partition.to());
                    executed++;
                }
                st.execute("CREATE TABLE IF NOT EXISTS " + RAW_TABLE + "_default PARTITION OF " + RAW_TABLE + " DEFAULT");
                executed++;
            } else {
                log.info("[MIGRATION] {} is not partitioned on this engine", RAW_TABLE);
                st.execute("CREATE TABLE IF NOT EXISTS " + RAW_TABLE + " (" + RAW_COLUMNS + ")");
                executed++;
            }
            st.execute("CREATE INDEX IF NOT EXISTS idx_trades_raw_symbol_time ON " + RAW_TABLE + " (provider, symbol, partition_time)");
            executed++;

            log.info("[MIGRATION] ✓ Schema applied ({} statements)", executed);
            return executed;

        } catch (SQLException e) {
            log.error("[MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new IllegalStateException("Schema migration failed", e);
        }
    }

    static boolean isPostgres(Connection conn) throws SQLException {
        String product = conn.getMetaData().getDatabaseProductName();
        return product != null && product.toLowerCase().contains("postgresql");
    }
}

package in.tickvault.config;

import java.time.Duration;

/**
 * JDBC pool settings. The password is masked in toString.
 */
public record DatabaseSettings(
    String jdbcUrl,
    String username,
    String password,
    int maximumPoolSize,
    Duration connectionTimeout
) {
    public DatabaseSettings {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalArgumentException("DB_URL is required");
        }
        if (maximumPoolSize <= 0) {
            throw new IllegalArgumentException("DB_POOL_SIZE must be positive: " + maximumPoolSize);
        }
    }

    @Override
    public String toString() {
        return "DatabaseSettings[jdbcUrl=" + jdbcUrl + ", username=" + username
            + ", maximumPoolSize=" + maximumPoolSize + ", connectionTimeout=" + connectionTimeout + "]";
    }
}

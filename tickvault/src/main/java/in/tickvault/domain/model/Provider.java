package in.tickvault.domain.model;

/**
 * External data source identity.
 * Created from configuration at startup; read-only while ingesting.
 * Credentials are never part of this record.
 */
public record Provider(
    String name,
    ProviderKind kind,
    String baseUrl,
    int requestsPerMinute,
    boolean active
) {}

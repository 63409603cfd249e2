package in.tickvault.domain.model;

/**
 * Kind of external market data source.
 */
public enum ProviderKind {
    EXCHANGE,
    BROKER,
    VENDOR
}

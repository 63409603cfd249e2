package in.tickvault.domain.model;

/**
 * How quotes are persisted.
 */
public enum QuoteMode {
    /** One row per (provider, symbol), overwritten by newer snapshots. */
    LATEST,
    /** One row per (provider, symbol, eventTime). */
    HISTORY
}

package in.tickvault.domain.model;

public enum StreamKind {
    TRADES,
    QUOTES
}

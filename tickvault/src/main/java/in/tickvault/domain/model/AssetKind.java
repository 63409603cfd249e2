package in.tickvault.domain.model;

public enum AssetKind {
    EQUITY,
    CRYPTO,
    FOREX,
    COMMODITY,
    INDEX
}

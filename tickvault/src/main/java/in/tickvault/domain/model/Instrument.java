package in.tickvault.domain.model;

/**
 * Tradable symbol. Unique on symbol.
 */
public record Instrument(
    String symbol,
    String providerAffinity,
    AssetKind assetKind,
    String baseCurrency,
    String quoteCurrency,
    boolean active
) {
    /**
     * Instrument discovered from a CLI symbol list, with nothing known beyond its provider.
     */
    public static Instrument discovered(String symbol, String provider) {
        return new Instrument(symbol, provider, AssetKind.EQUITY, null, null, true);
    }
}

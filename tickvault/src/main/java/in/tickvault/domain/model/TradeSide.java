package in.tickvault.domain.model;

public enum TradeSide {
    BUY,
    SELL,
    UNKNOWN;

    /**
     * Lenient parse of provider side strings ("buy", "B", "sell", "S", ...).
     */
    public static TradeSide parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        return switch (raw.trim().toUpperCase()) {
            case "BUY", "B", "BID" -> BUY;
            case "SELL", "S", "ASK" -> SELL;
            default -> UNKNOWN;
        };
    }
}

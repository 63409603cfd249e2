package in.tickvault.domain.model;

public enum RecordType {
    TRADE,
    QUOTE,
    CANDLE,
    KEEPALIVE
}

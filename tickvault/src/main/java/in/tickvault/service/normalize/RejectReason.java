package in.tickvault.service.normalize;

public enum RejectReason {
    MISSING_FIELD,
    OUT_OF_RANGE,
    MALFORMED_TIMESTAMP;

    /**
     * Dead-letter reason text, e.g. "missing_field".
     */
    public String code() {
        return name().toLowerCase();
    }
}

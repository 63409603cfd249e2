package in.tickvault.domain.model;

/**
 * Per-record result of a storage write.
 */
public enum WriteOutcome {
    INSERTED,
    DUPLICATE_IGNORED,
    FAILED;

    public boolean isDurable() {
        return this != FAILED;
    }
}

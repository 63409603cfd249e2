package in.tickvault.domain.model;

/**
 * Fetch job lifecycle: PENDING -> RUNNING -> COMPLETED | FAILED, and FAILED -> PENDING on retry.
 */
public enum FetchJobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean canTransitionTo(FetchJobStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING;
            case RUNNING -> next == COMPLETED || next == FAILED || next == PENDING;
            case FAILED -> next == PENDING;
            case COMPLETED -> false;
        };
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}

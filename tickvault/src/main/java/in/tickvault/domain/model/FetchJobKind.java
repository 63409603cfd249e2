package in.tickvault.domain.model;

public enum FetchJobKind {
    BACKFILL,
    REALTIME_CATCHUP
}

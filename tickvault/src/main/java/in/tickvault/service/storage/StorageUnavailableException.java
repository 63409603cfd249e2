package in.tickvault.service.storage;

/**
 * The store could not take a batch and could not dead-letter it either.
 * Callers must not commit offsets past the affected records.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

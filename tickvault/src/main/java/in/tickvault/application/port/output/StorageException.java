package in.tickvault.application.port.output;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;

/**
 * Persistence failure with a transient flag.
 *
 * Transient: the store is unreachable or overloaded, the same batch may
 * succeed later. Otherwise the failure is tied to the data itself (constraint,
 * bad value) and retrying the same rows will not help.
 */
public class StorageException extends RuntimeException {

    private final boolean transientFailure;
    private final String sqlState;

    public StorageException(String message, Throwable cause, boolean transientFailure, String sqlState) {
        super(message, cause);
        this.transientFailure = transientFailure;
        this.sqlState = sqlState;
    }

    public static StorageException from(String operation, SQLException e) {
        String state = e.getSQLState();
        return new StorageException(
            operation + " failed: " + e.getMessage() + (state != null ? " [" + state + "]" : ""),
            e, isTransient(e), state);
    }

    /**
     * SQLSTATE classes 08 (connection), 53 (insufficient resources), 57P0x
     * (server shutting down), 40001/40P01 (serialization, deadlock), plus the
     * JDBC transient and recoverable exception types.
     */
    public static boolean isTransient(SQLException e) {
        if (e instanceof SQLTransientException || e instanceof SQLRecoverableException) {
            return true;
        }
        String state = e.getSQLState();
        if (state == null) {
            return e.getCause() instanceof java.io.IOException;
        }
        return state.startsWith("08")
            || state.startsWith("53")
            || state.startsWith("57P0")
            || state.equals("40001")
            || state.equals("40P01");
    }

    public boolean isTransient() {
        return transientFailure;
    }

    public String getSqlState() {
        return sqlState;
    }
}

package in.tickvault.application.port.output;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientConnectionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StorageException SQLSTATE classification.
 */
class StorageExceptionTest {

    @Test
    void testTransientStates() {
        assertTrue(StorageException.isTransient(new SQLException("refused", "08001")), "connection");
        assertTrue(StorageException.isTransient(new SQLException("too many connections", "53300")), "resources");
        assertTrue(StorageException.isTransient(new SQLException("admin shutdown", "57P01")), "shutdown");
        assertTrue(StorageException.isTransient(new SQLException("serialization", "40001")));
        assertTrue(StorageException.isTransient(new SQLException("deadlock", "40P01")));
    }

    @Test
    void testPermanentStates() {
        assertFalse(StorageException.isTransient(new SQLException("check", "23514")));
        assertFalse(StorageException.isTransient(new SQLException("syntax", "42601")));
        assertFalse(StorageException.isTransient(new SQLException("no state")));
    }

    @Test
    void testTransientExceptionTypes() {
        assertTrue(StorageException.isTransient(new SQLTransientConnectionException("pool timeout")));
        assertTrue(StorageException.isTransient(new SQLRecoverableException("socket closed")));
        assertTrue(StorageException.isTransient(new SQLException("io", null, new IOException("reset"))));
    }

    @Test
    void testFromKeepsStateAndMessage() {
        StorageException e = StorageException.from("Insert trade batch", new SQLException("boom", "08006"));

        assertTrue(e.isTransient());
        assertEquals("08006", e.getSqlState());
        assertTrue(e.getMessage().startsWith("Insert trade batch failed: boom"));
        assertTrue(e.getMessage().contains("[08006]"));
    }
}

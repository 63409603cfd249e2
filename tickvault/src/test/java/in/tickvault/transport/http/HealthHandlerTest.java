package in.tickvault.transport.http;

import in.tickvault.service.realtime.StreamStatus;
import in.tickvault.service.realtime.StreamWorker;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

/**
 * Unit tests for HealthHandler.
 *
 * Tests:
 * - Readiness needs a valid store connection
 * - Readiness needs at least one non-degraded stream when streams exist
 * - HTTP status codes for live and ready
 */
class HealthHandlerTest {

    private static final int TEST_PORT = 19091;

    @Test
    void testReadyWhenStoreUpAndNoStreams() throws SQLException {
        HealthHandler handler = new HealthHandler(dataSource(true), List::of);

        HealthHandler.Readiness readiness = handler.check();

        assertTrue(readiness.ready());
        assertEquals("UP", readiness.details().get("store"));
    }

    @Test
    void testNotReadyWhenStoreInvalid() throws SQLException {
        HealthHandler handler = new HealthHandler(dataSource(false), List::of);

        assertFalse(handler.check().ready());
    }

    @Test
    void testNotReadyWhenStoreUnreachable() throws SQLException {
        DataSource dataSource = mock(DataSource.class);
        when(dataSource.getConnection()).thenThrow(new SQLException("Connection refused", "08001"));

        HealthHandler.Readiness readiness = new HealthHandler(dataSource, List::of).check();

        assertFalse(readiness.ready());
        assertEquals("DOWN", readiness.details().get("store"));
    }

    @Test
    void testReadyWhileOneStreamIsHealthy() throws SQLException {
        HealthHandler handler = new HealthHandler(dataSource(true), () -> List.of(
            status("AAPL", true), status("MSFT", false)));

        HealthHandler.Readiness readiness = handler.check();

        assertTrue(readiness.ready());
        List<?> streams = (List<?>) readiness.details().get("streams");
        assertEquals(2, streams.size());
        assertEquals(true, ((Map<?, ?>) streams.get(0)).get("degraded"));
    }

    @Test
    void testNotReadyWhenAllStreamsDegraded() throws SQLException {
        HealthHandler handler = new HealthHandler(dataSource(true), () -> List.of(
            status("AAPL", true), status("MSFT", true)));

        assertFalse(handler.check().ready());
    }

    @Test
    void testHttpEndpoints() throws Exception {
        HealthHandler handler = new HealthHandler(dataSource(false), List::of);
        Undertow server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(Handlers.routing()
                .get("/health/live", handler::live)
                .get("/health/ready", handler::ready))
            .build();
        server.start();
        try {
            HttpClient client = HttpClient.newHttpClient();

            HttpResponse<String> live = client.send(request("/health/live"), HttpResponse.BodyHandlers.ofString());
            assertEquals(200, live.statusCode());
            assertTrue(live.body().contains("\"UP\""));

            HttpResponse<String> ready = client.send(request("/health/ready"), HttpResponse.BodyHandlers.ofString());
            assertEquals(503, ready.statusCode(), "Invalid store means not ready");
            assertTrue(ready.body().contains("\"store\":\"DOWN\""), ready.body());
        } finally {
            server.stop();
        }
    }

    private static DataSource dataSource(boolean valid) throws SQLException {
        DataSource dataSource = mock(DataSource.class);
        Connection connection = mock(Connection.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.isValid(anyInt())).thenReturn(valid);
        return dataSource;
    }

    private static StreamStatus status(String symbol, boolean degraded) {
        return new StreamStatus("polygon", symbol, StreamWorker.State.STREAMING, degraded, degraded ? 5 : 0, 10,
            Instant.parse("2026-03-10T12:00:00Z"));
    }

    private static HttpRequest request(String path) {
        return HttpRequest.newBuilder().uri(URI.create("http://localhost:" + TEST_PORT + path)).GET().build();
    }
}

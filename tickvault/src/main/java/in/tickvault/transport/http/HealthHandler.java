package in.tickvault.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import in.tickvault.service.realtime.StreamStatus;
import in.tickvault.util.Json;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Operational health endpoints.
 *
 * - GET /health/live  - 200 while the process is up
 * - GET /health/ready - 200 when the store answers and, if streams exist, at least one is not degraded
 */
public final class HealthHandler {
    private static final Logger log = LoggerFactory.getLogger(HealthHandler.class);

    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private final DataSource dataSource;
    private final Supplier<List<StreamStatus>> streams;

    public HealthHandler(DataSource dataSource, Supplier<List<StreamStatus>> streams) {
        this.dataSource = dataSource;
        this.streams = streams;
    }

    public void live(HttpServerExchange exchange) {
        sendJson(exchange, StatusCodes.OK, Map.of("status", "UP"));
    }

    public void ready(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> ready(exchange));
            return;
        }
        Readiness readiness = check();
        sendJson(exchange, readiness.ready() ? StatusCodes.OK : StatusCodes.SERVICE_UNAVAILABLE, readiness.details());
    }

    /**
     * Evaluate readiness without an HTTP exchange.
     */
    public Readiness check() {
        boolean storeUp = isStoreValid();
        List<StreamStatus> current = streams.get();

        List<Map<String, Object>> streamDetails = new ArrayList<>();
        boolean anyHealthy = false;
        for (StreamStatus status : current) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("provider", status.provider());
            entry.put("symbol", status.symbol());
            entry.put("state", status.state().name());
            entry.put("degraded", status.degraded());
            entry.put("reconnects", status.reconnects());
            entry.put("lastEventTime", status.lastEventTime() != null ? status.lastEventTime().toString() : null);
            streamDetails.add(entry);
            anyHealthy |= !status.degraded();
        }

        boolean streamsOk = current.isEmpty() || anyHealthy;
        boolean ready = storeUp && streamsOk;

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", ready ? "UP" : "DOWN");
        details.put("store", storeUp ? "UP" : "DOWN");
        details.put("streams", streamDetails);
        return new Readiness(ready, details);
    }

    private boolean isStoreValid() {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            log.warn("[HEALTH] Store check failed: {}", e.getMessage());
            return false;
        }
    }

    private void sendJson(HttpServerExchange exchange, int statusCode, Object body) {
        String json;
        try {
            json = Json.mapper().writeValueAsString(body);
        } catch (JsonProcessingException e) {
            log.error("[HEALTH] Failed to serialize health response: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
            exchange.getResponseSender().send("Failed to serialize health response", StandardCharsets.UTF_8);
            return;
        }
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }

    public record Readiness(boolean ready, Map<String, Object> details) {}
}

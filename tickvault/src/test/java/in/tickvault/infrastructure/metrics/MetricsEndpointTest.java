package in.tickvault.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the Prometheus /metrics endpoint.
 *
 * Tests:
 * - Endpoint accessibility and text format
 * - Ingestion metrics registration
 * - Recording and export with labels
 * - name[] filtering
 */
public class MetricsEndpointTest {

    private static final int TEST_PORT = 19090;
    private Undertow server;
    private PrometheusIngestionMetrics metrics;
    private HttpClient httpClient;

    @BeforeEach
    public void setUp() {
        CollectorRegistry registry = new CollectorRegistry();
        metrics = new PrometheusIngestionMetrics(registry);

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(Handlers.routing()
                .get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry())))
            .build();
        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    @Test
    public void testMetricsEndpointAccessible() throws Exception {
        HttpResponse<String> response = get("/metrics");

        assertEquals(200, response.statusCode(), "Metrics endpoint should return HTTP 200");
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        assertTrue(contentType.contains("text/plain"), "Content-Type should be Prometheus text format");
        assertFalse(response.body().isEmpty(), "Response body should not be empty");
    }

    @Test
    public void testMetricsContainExpectedFamilies() throws Exception {
        String body = get("/metrics").body();

        assertTrue(body.contains("# TYPE ingest_records_total counter"), "ingest_records_total should be registered");
        assertTrue(body.contains("# TYPE ingest_dead_letter_total counter"));
        assertTrue(body.contains("# TYPE stream_reconnects_total counter"));
        assertTrue(body.contains("# TYPE stream_lag_seconds gauge"));
        assertTrue(body.contains("# TYPE storage_batch_latency_seconds histogram"));
        assertTrue(body.contains("# HELP"), "Metrics should contain HELP declarations");
    }

    @Test
    public void testMetricsRecordingAndExport() throws Exception {
        metrics.recordIngested("binance", "trade", 3);
        metrics.recordDeadLetter("binance", "storage_rejected: duplicate key value");
        metrics.recordReconnect("polygon", "AAPL", "heartbeat_timeout");
        metrics.setStreamDegraded("polygon", "AAPL", true);
        metrics.recordStorageBatch("trades", Duration.ofMillis(12), true);

        String body = get("/metrics").body();

        assertTrue(body.contains("ingest_records_total{provider=\"binance\",kind=\"trade\",} 3.0"),
            "Should show ingested trades: " + body);
        assertTrue(body.contains("ingest_dead_letter_total{provider=\"binance\",reason=\"storage_rejected\",} 1.0"),
            "Dead letter reason is cut to its code");
        assertTrue(body.contains("stream_reconnects_total{provider=\"polygon\",symbol=\"AAPL\",cause=\"heartbeat_timeout\",} 1.0"));
        assertTrue(body.contains("stream_degraded{provider=\"polygon\",symbol=\"AAPL\",} 1.0"));
        assertTrue(body.contains("storage_batch_latency_seconds_count{table=\"trades\",status=\"success\",} 1.0"));
        assertTrue(body.contains("provider_last_success_timestamp_seconds{provider=\"binance\",}"),
            "Successful ingestion stamps the provider");
    }

    @Test
    public void testNameFilter() throws Exception {
        metrics.recordIngested("binance", "trade", 1);
        metrics.recordRateLimited("polygon");

        String body = get("/metrics?name%5B%5D=provider_rate_limited_total").body();

        assertTrue(body.contains("provider_rate_limited_total{provider=\"polygon\",} 1.0"));
        assertFalse(body.contains("ingest_records_total"), "Unrequested families are filtered out");
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + path))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }
}

package in.tickvault.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;
import in.tickvault.config.ProviderSettings;
import in.tickvault.domain.model.Granularity;
import in.tickvault.domain.model.ProviderKind;
import in.tickvault.domain.model.ProviderRecord;
import in.tickvault.domain.model.RecordType;
import in.tickvault.infrastructure.provider.common.TokenBucketRateLimiter;
import in.tickvault.support.FakeSleeper;
import in.tickvault.support.MutableClock;
import in.tickvault.util.Json;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static in.tickvault.infrastructure.provider.BinanceAdapterTest.response;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PolygonAdapter.
 *
 * Tests:
 * - Stream message arrays (trades, quotes, status, auth failure)
 * - Aggregates decoding and next_url paging
 * - Missing credentials
 */
class PolygonAdapterTest {

    private static final Instant RECEIVED = Instant.parse("2026-03-10T12:00:00Z");
    private static final Instant START = Instant.parse("2026-01-02T00:00:00Z");

    private final MutableClock clock = new MutableClock(RECEIVED);
    private final HttpClient httpClient = mock(HttpClient.class);

    private PolygonAdapter adapter(String apiKey) {
        ProviderSettings settings = new ProviderSettings("polygon", ProviderKind.VENDOR,
            "http://localhost:1", null, apiKey, null, 300, 5, true);
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter("polygon", 300, 5, clock, new FakeSleeper(clock));
        return new PolygonAdapter(settings, httpClient, limiter, clock, Duration.ofSeconds(5));
    }

    @Test
    void testDecodeMixedEventArray() {
        String payload = "[{\"ev\":\"T\",\"sym\":\"AAPL\",\"i\":\"52983525029461\",\"p\":189.25,\"s\":100,"
            + "\"t\":1767355200123,\"q\":1001},"
            + "{\"ev\":\"Q\",\"sym\":\"AAPL\",\"bp\":189.20,\"bs\":3,\"ap\":189.30,\"as\":5,"
            + "\"t\":1767355200456,\"q\":1002}]";

        List<ProviderRecord> records = PolygonAdapter.decodeStreamMessage("polygon", "AAPL", payload, RECEIVED);

        assertEquals(2, records.size());
        ProviderRecord trade = records.get(0);
        assertEquals(RecordType.TRADE, trade.type());
        assertEquals("52983525029461", trade.tradeId());
        assertEquals(0, new BigDecimal("189.25").compareTo(trade.price()));
        assertEquals(0, new BigDecimal("100").compareTo(trade.size()));
        assertNull(trade.side(), "Polygon trades carry no aggressor side");
        assertEquals(1001L, trade.sequence());
        assertEquals("1767355200123", trade.eventTime());

        ProviderRecord quote = records.get(1);
        assertEquals(RecordType.QUOTE, quote.type());
        assertEquals(0, new BigDecimal("189.20").compareTo(quote.bidPrice()));
        assertEquals(0, new BigDecimal("189.30").compareTo(quote.askPrice()));
        assertEquals(0, new BigDecimal("5").compareTo(quote.askSize()));
        assertEquals(1002L, quote.sequence());
    }

    @Test
    void testStatusMessagesAreKeepalives() {
        String payload = "[{\"ev\":\"status\",\"status\":\"connected\",\"message\":\"Connected Successfully\"}]";

        List<ProviderRecord> records = PolygonAdapter.decodeStreamMessage("polygon", "AAPL", payload, RECEIVED);

        assertEquals(1, records.size());
        assertTrue(records.get(0).isKeepalive());
    }

    @Test
    void testAuthFailureOnStreamIsFatal() {
        String payload = "[{\"ev\":\"status\",\"status\":\"auth_failed\",\"message\":\"authentication failed\"}]";

        ProviderAuthenticationException e = assertThrows(ProviderAuthenticationException.class,
            () -> PolygonAdapter.decodeStreamMessage("polygon", "AAPL", payload, RECEIVED));

        assertTrue(e.getMessage().contains("authentication failed"));
        assertFalse(e.isTransient());
    }

    @Test
    void testSingleObjectMessageIsAccepted() {
        String payload = "{\"ev\":\"T\",\"sym\":\"MSFT\",\"i\":\"1\",\"p\":410,\"s\":1,\"t\":1767355200000}";

        List<ProviderRecord> records = PolygonAdapter.decodeStreamMessage("polygon", "MSFT", payload, RECEIVED);

        assertEquals(1, records.size());
        assertNull(records.get(0).sequence(), "No q field, no sequence");
    }

    @Test
    void testMalformedMessage() {
        assertThrows(MalformedPayloadException.class,
            () -> PolygonAdapter.decodeStreamMessage("polygon", "AAPL", "[{", RECEIVED));
    }

    @Test
    void testDecodeAggregates() throws Exception {
        JsonNode page = Json.mapper().readTree("{\"status\":\"OK\",\"results\":["
            + "{\"t\":1767312000000,\"o\":10,\"h\":12,\"l\":9.5,\"c\":11,\"v\":1000}]}");

        List<ProviderRecord> records = PolygonAdapter.decodeAggregates("polygon", "AAPL", page, RECEIVED);

        assertEquals(1, records.size());
        ProviderRecord bar = records.get(0);
        assertEquals(RecordType.CANDLE, bar.type());
        assertEquals("1767312000000", bar.eventTime());
        assertEquals(0, new BigDecimal("9.5").compareTo(bar.low()));
        assertEquals(0, new BigDecimal("1000").compareTo(bar.volume()));
    }

    @Test
    void testAggregatesWithoutResultsAreEmpty() throws Exception {
        JsonNode page = Json.mapper().readTree("{\"status\":\"OK\",\"resultsCount\":0}");

        assertTrue(PolygonAdapter.decodeAggregates("polygon", "AAPL", page, RECEIVED).isEmpty());
    }

    @Test
    void testAggregatesErrorStatus() throws Exception {
        JsonNode page = Json.mapper().readTree("{\"status\":\"ERROR\",\"error\":\"Unknown ticker\"}");

        ProviderException e = assertThrows(ProviderException.class,
            () -> PolygonAdapter.decodeAggregates("polygon", "ZZZZ", page, RECEIVED));
        assertTrue(e.getMessage().contains("Unknown ticker"));
    }

    @Test
    void testToRange() {
        assertArrayEquals(new String[]{"1", "minute"}, PolygonAdapter.toRange(Granularity.ONE_MINUTE));
        assertArrayEquals(new String[]{"5", "minute"}, PolygonAdapter.toRange(Granularity.parse("5m")));
        assertArrayEquals(new String[]{"4", "hour"}, PolygonAdapter.toRange(Granularity.parse("4h")));
        assertArrayEquals(new String[]{"1", "day"}, PolygonAdapter.toRange(Granularity.parse("1d")));
        assertArrayEquals(new String[]{"1", "week"}, PolygonAdapter.toRange(Granularity.parse("1w")));
        assertArrayEquals(new String[]{"30", "second"}, PolygonAdapter.toRange(Granularity.parse("30s")));
    }

    @Test
    void testFetchWithoutApiKeyFailsBeforeAnyRequest() throws Exception {
        PolygonAdapter adapter = adapter(null);

        assertThrows(ProviderAuthenticationException.class,
            () -> adapter.fetchHistorical("AAPL", START, START.plusSeconds(3600), Granularity.ONE_MINUTE));
        assertThrows(ProviderAuthenticationException.class, () -> adapter.streamLive("AAPL", null));

        verify(httpClient, never()).send(any(), any());
    }

    @Test
    void testFetchHistoricalFollowsNextUrl() throws Exception {
        long t0 = START.toEpochMilli();
        String first = "{\"status\":\"OK\",\"results\":["
            + bar(t0) + "," + bar(t0 + 60_000) + "],"
            + "\"next_url\":\"http://localhost:1/v2/aggs/ticker/AAPL/range/1/minute/x/y?cursor=abc\"}";
        String second = "{\"status\":\"OK\",\"results\":[" + bar(t0 + 120_000) + "," + bar(t0 + 3_600_000) + "]}";
        doReturn(response(200, first, Map.of()), response(200, second, Map.of()))
            .when(httpClient).send(any(), any());

        List<ProviderRecord> records = adapter("secret")
            .fetchHistorical("aapl", START, START.plusSeconds(3600), Granularity.ONE_MINUTE);

        assertEquals(3, records.size(), "Bar at the exclusive end is dropped");

        ArgumentCaptor<HttpRequest> requests = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient, times(2)).send(requests.capture(), any());
        String firstUri = requests.getAllValues().get(0).uri().toString();
        String secondUri = requests.getAllValues().get(1).uri().toString();
        assertTrue(firstUri.startsWith("http://localhost:1/v2/aggs/ticker/AAPL/range/1/minute/" + t0 + "/"), firstUri);
        assertTrue(firstUri.contains("apiKey=secret"), firstUri);
        assertEquals("http://localhost:1/v2/aggs/ticker/AAPL/range/1/minute/x/y?cursor=abc&apiKey=secret", secondUri,
            "next_url gets the key appended");
    }

    @Test
    void testForbiddenMapsToAuthentication() throws Exception {
        doReturn(response(403, "{\"status\":\"NOT_AUTHORIZED\"}", Map.of())).when(httpClient).send(any(), any());

        assertThrows(ProviderAuthenticationException.class,
            () -> adapter("bad").fetchHistorical("AAPL", START, START.plusSeconds(3600), Granularity.ONE_MINUTE));
    }

    private static String bar(long t) {
        return "{\"t\":" + t + ",\"o\":1,\"h\":2,\"l\":0.5,\"c\":1.5,\"v\":100}";
    }
}

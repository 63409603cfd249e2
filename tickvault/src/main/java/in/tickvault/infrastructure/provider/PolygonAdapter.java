package in.tickvault.infrastructure.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.tickvault.config.ProviderSettings;
import in.tickvault.domain.model.Granularity;
import in.tickvault.domain.model.ProviderRecord;
import in.tickvault.domain.model.StreamOffset;
import in.tickvault.infrastructure.provider.common.TokenBucketRateLimiter;
import in.tickvault.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Polygon.io market data vendor.
 *
 * Historical: aggregates endpoint, following next_url until exhausted.
 * Live: one socket per symbol, authenticated with an auth message, subscribed
 * to T.&lt;sym&gt; (trades) and Q.&lt;sym&gt; (quotes). Status messages are keepalives.
 */
public class PolygonAdapter extends AbstractHttpProviderAdapter {
    private static final Logger log = LoggerFactory.getLogger(PolygonAdapter.class);

    public static final String DEFAULT_BASE_URL = "https://api.polygon.io";
    public static final String DEFAULT_STREAM_URL = "wss://socket.polygon.io/stocks";

    private final Duration connectTimeout;

    public PolygonAdapter(ProviderSettings settings, HttpClient httpClient,
                          TokenBucketRateLimiter rateLimiter, Clock clock, Duration connectTimeout) {
        super(settings, httpClient, rateLimiter, clock);
        this.connectTimeout = connectTimeout;
    }

    @Override
    public List<ProviderRecord> fetchHistorical(String symbol, Instant start, Instant end, Granularity granularity) {
        if (settings.apiKey() == null) {
            throw new ProviderAuthenticationException(providerName(), symbol, "No API key configured");
        }
        String baseUrl = settings.baseUrl() != null ? settings.baseUrl() : DEFAULT_BASE_URL;
        String[] range = toRange(granularity);

        URI uri = URI.create(baseUrl + "/v2/aggs/ticker/" + encode(symbol.toUpperCase())
            + "/range/" + range[0] + "/" + range[1]
            + "/" + start.toEpochMilli() + "/" + (end.toEpochMilli() - 1)
            + "?adjusted=true&sort=asc&limit=50000&apiKey=" + encode(settings.apiKey()));

        List<ProviderRecord> records = new ArrayList<>();
        int pages = 0;
        while (uri != null) {
            JsonNode page = getJson(uri, symbol);
            pages++;
            for (ProviderRecord record : decodeAggregates(providerName(), symbol, page, clock.instant())) {
                long bucket = Long.parseLong(record.eventTime());
                if (bucket >= start.toEpochMilli() && bucket < end.toEpochMilli()) {
                    records.add(record);
                }
            }
            String next = Json.text(page, "next_url");
            uri = next == null || next.isBlank() ? null : URI.create(next + (next.contains("?") ? "&" : "?")
                + "apiKey=" + encode(settings.apiKey()));
        }

        log.debug("[{}:{}] Fetched {} aggregates in {} pages", providerName(), symbol, records.size(), pages);
        return records;
    }

    @Override
    public LiveStream streamLive(String symbol, StreamOffset resumeFrom) {
        if (settings.apiKey() == null) {
            throw new ProviderAuthenticationException(providerName(), symbol, "No API key configured");
        }
        String streamUrl = settings.streamUrl() != null ? settings.streamUrl() : DEFAULT_STREAM_URL;
        String sym = symbol.toUpperCase();

        ObjectNode auth = Json.mapper().createObjectNode()
            .put("action", "auth")
            .put("params", settings.apiKey());
        ObjectNode subscribe = Json.mapper().createObjectNode()
            .put("action", "subscribe")
            .put("params", "T." + sym + ",Q." + sym);

        return WebSocketLiveStream.connect(httpClient, URI.create(streamUrl), providerName(), symbol,
            (payload, receivedAt) -> decodeStreamMessage(providerName(), symbol, payload, receivedAt),
            List.of(auth.toString(), subscribe.toString()), connectTimeout, clock);
    }

    static String[] toRange(Granularity granularity) {
        long seconds = granularity.width().getSeconds();
        if (seconds % 604_800 == 0) return new String[]{String.valueOf(seconds / 604_800), "week"};
        if (seconds % 86_400 == 0) return new String[]{String.valueOf(seconds / 86_400), "day"};
        if (seconds % 3_600 == 0) return new String[]{String.valueOf(seconds / 3_600), "hour"};
        if (seconds % 60 == 0) return new String[]{String.valueOf(seconds / 60), "minute"};
        return new String[]{String.valueOf(seconds), "second"};
    }

    // ═══════════════════════════════════════════════════════════════════════
    // DECODING
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * {"results":[{"t":1672531200000,"o":1,"h":2,"l":0.5,"c":1.5,"v":100}], "next_url": "..."}.
     */
    static List<ProviderRecord> decodeAggregates(String provider, String symbol, JsonNode page, Instant receivedAt) {
        String status = Json.text(page, "status");
        if ("ERROR".equals(status) || "NOT_AUTHORIZED".equals(status)) {
            throw new ProviderException(provider, symbol, "Aggregates request failed: " + Json.text(page, "error"));
        }
        JsonNode results = page.get("results");
        if (results == null || !results.isArray()) {
            return List.of();
        }
        List<ProviderRecord> records = new ArrayList<>(results.size());
        for (JsonNode bar : results) {
            records.add(ProviderRecord.candle(provider, symbol,
                Json.decimal(bar, "o"),
                Json.decimal(bar, "h"),
                Json.decimal(bar, "l"),
                Json.decimal(bar, "c"),
                Json.decimal(bar, "v"),
                Json.text(bar, "t"),
                receivedAt,
                bar.toString()));
        }
        return records;
    }

    /**
     * Messages arrive as arrays of events keyed by "ev": T (trade), Q (quote), status.
     */
    static List<ProviderRecord> decodeStreamMessage(String provider, String symbol, String payload, Instant receivedAt) {
        JsonNode root;
        try {
            root = Json.mapper().readTree(payload);
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException(provider, symbol, payload, e);
        }

        List<ProviderRecord> records = new ArrayList<>();
        Iterable<JsonNode> events = root.isArray() ? root : List.of(root);
        for (JsonNode event : events) {
            String type = Json.text(event, "ev");
            if (type == null) {
                records.add(ProviderRecord.keepalive(provider, receivedAt, event.toString()));
                continue;
            }
            switch (type) {
                case "T" -> records.add(ProviderRecord.trade(provider,
                    Json.text(event, "sym"),
                    Json.text(event, "i"),
                    Json.decimal(event, "p"),
                    Json.decimal(event, "s"),
                    null,
                    Json.text(event, "t"),
                    receivedAt,
                    sequenceOf(event),
                    event.toString()));
                case "Q" -> records.add(ProviderRecord.quote(provider,
                    Json.text(event, "sym"),
                    Json.decimal(event, "bp"),
                    Json.decimal(event, "bs"),
                    Json.decimal(event, "ap"),
                    Json.decimal(event, "as"),
                    null,
                    null,
                    Json.text(event, "t"),
                    receivedAt,
                    sequenceOf(event),
                    event.toString()));
                case "status" -> {
                    String status = Json.text(event, "status");
                    if ("auth_failed".equals(status)) {
                        throw new ProviderAuthenticationException(provider, symbol,
                            "Stream authentication failed: " + Json.text(event, "message"));
                    }
                    records.add(ProviderRecord.keepalive(provider, receivedAt, event.toString()));
                }
                default -> records.add(ProviderRecord.keepalive(provider, receivedAt, event.toString()));
            }
        }
        return records;
    }

    private static Long sequenceOf(JsonNode event) {
        JsonNode q = event.get("q");
        return q != null && q.canConvertToLong() ? q.asLong() : null;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}

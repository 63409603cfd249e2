package in.tickvault.infrastructure.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
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
import java.util.Set;

/**
 * Binance spot exchange.
 *
 * Historical: GET /api/v3/klines, pages of up to 1000 bars advanced by startTime.
 * Live: &lt;symbol&gt;@trade WebSocket stream. Trade ids are strictly increasing per
 * symbol and double as the stream sequence.
 */
public class BinanceAdapter extends AbstractHttpProviderAdapter {
    private static final Logger log = LoggerFactory.getLogger(BinanceAdapter.class);

    static final int PAGE_LIMIT = 1000;
    private static final Set<String> SUPPORTED_INTERVALS = Set.of(
        "1s", "1m", "3m", "5m", "15m", "30m", "1h", "2h", "4h", "6h", "8h", "12h", "1d", "3d", "1w");

    public static final String DEFAULT_BASE_URL = "https://api.binance.com";
    public static final String DEFAULT_STREAM_URL = "wss://stream.binance.com:9443";

    private final Duration connectTimeout;

    public BinanceAdapter(ProviderSettings settings, HttpClient httpClient,
                          TokenBucketRateLimiter rateLimiter, Clock clock, Duration connectTimeout) {
        super(settings, httpClient, rateLimiter, clock);
        this.connectTimeout = connectTimeout;
    }

    @Override
    public List<ProviderRecord> fetchHistorical(String symbol, Instant start, Instant end, Granularity granularity) {
        String interval = granularity.label();
        if (!SUPPORTED_INTERVALS.contains(interval)) {
            throw new ProviderException(providerName(), symbol, "Unsupported kline interval " + interval);
        }

        String baseUrl = settings.baseUrl() != null ? settings.baseUrl() : DEFAULT_BASE_URL;
        long widthMillis = granularity.width().toMillis();
        long cursor = start.toEpochMilli();
        long endExclusive = end.toEpochMilli();
        List<ProviderRecord> records = new ArrayList<>();

        while (cursor < endExclusive) {
            URI uri = URI.create(baseUrl + "/api/v3/klines"
                + "?symbol=" + URLEncoder.encode(symbol.toUpperCase(), StandardCharsets.UTF_8)
                + "&interval=" + interval
                + "&startTime=" + cursor
                + "&endTime=" + (endExclusive - 1)
                + "&limit=" + PAGE_LIMIT);

            JsonNode page = getJson(uri, symbol);
            List<ProviderRecord> decoded = decodeKlines(providerName(), symbol, page, clock.instant());
            long lastOpen = -1;
            for (ProviderRecord record : decoded) {
                long openTime = Long.parseLong(record.eventTime());
                if (openTime >= cursor && openTime < endExclusive) {
                    records.add(record);
                }
                lastOpen = Math.max(lastOpen, openTime);
            }

            log.debug("[{}:{}] Fetched {} klines from {}", providerName(), symbol, decoded.size(), Instant.ofEpochMilli(cursor));
            if (decoded.size() < PAGE_LIMIT || lastOpen < cursor) {
                break;
            }
            cursor = lastOpen + widthMillis;
        }

        return records;
    }

    @Override
    public LiveStream streamLive(String symbol, StreamOffset resumeFrom) {
        String streamUrl = settings.streamUrl() != null ? settings.streamUrl() : DEFAULT_STREAM_URL;
        URI uri = URI.create(streamUrl + "/ws/" + symbol.toLowerCase() + "@trade");
        if (resumeFrom != null) {
            log.info("[{}:{}] Trade stream cannot replay; records up to offset {} will be skipped by the worker",
                providerName(), symbol, resumeFrom.lastOffset());
        }
        return WebSocketLiveStream.connect(httpClient, uri, providerName(), symbol,
            (payload, receivedAt) -> decodeStreamMessage(providerName(), symbol, payload, receivedAt),
            List.of(), connectTimeout, clock);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // DECODING
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Kline rows: [openTime, open, high, low, close, volume, closeTime, ...].
     */
    static List<ProviderRecord> decodeKlines(String provider, String symbol, JsonNode page, Instant receivedAt) {
        if (page == null || !page.isArray()) {
            throw new ProviderException(provider, symbol, "Unexpected klines response: " + page);
        }
        List<ProviderRecord> records = new ArrayList<>(page.size());
        for (JsonNode row : page) {
            if (!row.isArray() || row.size() < 6) {
                throw new MalformedPayloadException(provider, symbol, row.toString(),
                    new IllegalArgumentException("kline row has " + row.size() + " fields"));
            }
            records.add(ProviderRecord.candle(provider, symbol,
                Json.decimal(row.get(1)),
                Json.decimal(row.get(2)),
                Json.decimal(row.get(3)),
                Json.decimal(row.get(4)),
                Json.decimal(row.get(5)),
                row.get(0).asText(),
                receivedAt,
                row.toString()));
        }
        return records;
    }

    /**
     * {"e":"trade","s":"BTCUSDT","t":12345,"p":"0.001","q":"100","T":1672515782136,"m":true}.
     * Anything that is not a trade event counts as a keepalive.
     */
    static List<ProviderRecord> decodeStreamMessage(String provider, String symbol, String payload, Instant receivedAt) {
        JsonNode node;
        try {
            node = Json.mapper().readTree(payload);
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException(provider, symbol, payload, e);
        }

        if (!"trade".equals(Json.text(node, "e"))) {
            return List.of(ProviderRecord.keepalive(provider, receivedAt, payload));
        }

        String tradeId = Json.text(node, "t");
        Long sequence = node.hasNonNull("t") && node.get("t").canConvertToLong() ? node.get("t").asLong() : null;
        String side = null;
        if (node.hasNonNull("m")) {
            // m = buyer is the maker, so the aggressor sold
            side = node.get("m").asBoolean() ? "SELL" : "BUY";
        }
        String wireSymbol = Json.text(node, "s");

        return List.of(ProviderRecord.trade(provider,
            wireSymbol != null ? wireSymbol : symbol,
            tradeId,
            Json.decimal(node, "p"),
            Json.decimal(node, "q"),
            side,
            Json.text(node, "T"),
            receivedAt,
            sequence,
            payload));
    }
}

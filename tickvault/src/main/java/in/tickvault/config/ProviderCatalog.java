package in.tickvault.config;

import com.fasterxml.jackson.databind.JsonNode;
import in.tickvault.domain.model.AssetKind;
import in.tickvault.domain.model.Instrument;
import in.tickvault.domain.model.ProviderKind;
import in.tickvault.util.Env;
import in.tickvault.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Providers and instruments known to this deployment.
 *
 * Loaded from the JSON file named by TICKVAULT_CONFIG when set, otherwise the
 * built-in binance, polygon and simulated providers are used. String values
 * may reference environment variables as {@code ${NAME}} so secrets stay out
 * of the file.
 *
 * <pre>
 * {
 *   "providers": [
 *     {"name": "polygon", "kind": "VENDOR", "baseUrl": "https://api.polygon.io",
 *      "streamUrl": "wss://socket.polygon.io/stocks", "apiKey": "${POLYGON_API_KEY}",
 *      "requestsPerMinute": 5, "burst": 1}
 *   ],
 *   "instruments": [
 *     {"symbol": "AAPL", "provider": "polygon", "assetKind": "EQUITY", "quoteCurrency": "USD"}
 *   ]
 * }
 * </pre>
 */
public record ProviderCatalog(List<ProviderSettings> providers, List<Instrument> instruments) {
    private static final Logger log = LoggerFactory.getLogger(ProviderCatalog.class);

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z0-9_.]+)}");

    public ProviderCatalog {
        providers = List.copyOf(providers);
        instruments = List.copyOf(instruments);
    }

    public Optional<ProviderSettings> provider(String name) {
        String key = name.trim().toLowerCase();
        return providers.stream().filter(p -> p.name().equals(key)).findFirst();
    }

    public static ProviderCatalog load() {
        String file = Env.get("TICKVAULT_CONFIG", null);
        if (file == null) {
            log.info("[CONFIG] TICKVAULT_CONFIG not set, using built-in providers");
            return defaults();
        }
        log.info("[CONFIG] Loading providers from {}", file);
        try {
            return parse(Files.readString(Path.of(file)), name -> Env.get(name, null));
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read TICKVAULT_CONFIG file " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * @param lookup resolves {@code ${NAME}} placeholders; unresolved ones become null
     */
    public static ProviderCatalog parse(String json, UnaryOperator<String> lookup) {
        JsonNode root;
        try {
            root = Json.mapper().readTree(json);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid provider config JSON: " + e.getMessage(), e);
        }

        List<ProviderSettings> providers = new ArrayList<>();
        for (JsonNode node : root.path("providers")) {
            String name = expand(Json.text(node, "name"), lookup);
            String kind = expand(Json.text(node, "kind"), lookup);
            providers.add(new ProviderSettings(
                name,
                kind != null ? ProviderKind.valueOf(kind.toUpperCase()) : ProviderKind.VENDOR,
                expand(Json.text(node, "baseUrl"), lookup),
                expand(Json.text(node, "streamUrl"), lookup),
                expand(Json.text(node, "apiKey"), lookup),
                expand(Json.text(node, "apiSecret"), lookup),
                node.path("requestsPerMinute").asInt(60),
                node.path("burst").asInt(1),
                node.path("active").asBoolean(true)));
        }

        List<Instrument> instruments = new ArrayList<>();
        for (JsonNode node : root.path("instruments")) {
            String symbol = expand(Json.text(node, "symbol"), lookup);
            if (symbol == null || symbol.isBlank()) {
                throw new IllegalArgumentException("Instrument without symbol in provider config");
            }
            String assetKind = Json.text(node, "assetKind");
            instruments.add(new Instrument(
                symbol,
                expand(Json.text(node, "provider"), lookup),
                assetKind != null ? AssetKind.valueOf(assetKind.toUpperCase()) : AssetKind.EQUITY,
                expand(Json.text(node, "baseCurrency"), lookup),
                expand(Json.text(node, "quoteCurrency"), lookup),
                node.path("active").asBoolean(true)));
        }

        return new ProviderCatalog(providers, instruments);
    }

    public static ProviderCatalog defaults() {
        List<ProviderSettings> providers = List.of(
            new ProviderSettings("binance", ProviderKind.EXCHANGE,
                Env.get("BINANCE_BASE_URL", "https://api.binance.com"),
                Env.get("BINANCE_STREAM_URL", "wss://stream.binance.com:9443"),
                Env.get("BINANCE_API_KEY", null),
                Env.get("BINANCE_API_SECRET", null),
                Env.getInt("BINANCE_REQUESTS_PER_MINUTE", 1200),
                Env.getInt("BINANCE_BURST", 20),
                true),
            new ProviderSettings("polygon", ProviderKind.VENDOR,
                Env.get("POLYGON_BASE_URL", "https://api.polygon.io"),
                Env.get("POLYGON_STREAM_URL", "wss://socket.polygon.io/stocks"),
                Env.get("POLYGON_API_KEY", null),
                null,
                Env.getInt("POLYGON_REQUESTS_PER_MINUTE", 5),
                Env.getInt("POLYGON_BURST", 1),
                true),
            new ProviderSettings("simulated", ProviderKind.VENDOR, null, null, null, null,
                Env.getInt("SIMULATED_REQUESTS_PER_MINUTE", 6000), 100, true));
        return new ProviderCatalog(providers, List.of());
    }

    static String expand(String value, UnaryOperator<String> lookup) {
        if (value == null) {
            return null;
        }
        Matcher matcher = PLACEHOLDER.matcher(value);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String resolved = lookup.apply(matcher.group(1));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(resolved != null ? resolved : ""));
        }
        matcher.appendTail(sb);
        String result = sb.toString();
        return result.isEmpty() ? null : result;
    }
}

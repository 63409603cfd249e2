package in.tickvault.config;

import in.tickvault.domain.model.AssetKind;
import in.tickvault.domain.model.Instrument;
import in.tickvault.domain.model.ProviderKind;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ProviderCatalog.
 *
 * Tests:
 * - JSON parsing with defaults
 * - ${NAME} expansion from a lookup
 * - Built-in providers
 * - Secrets are masked in toString
 */
class ProviderCatalogTest {

    private static final String CONFIG = """
        {
          "providers": [
            {"name": "Polygon", "kind": "vendor", "baseUrl": "https://api.polygon.io",
             "streamUrl": "wss://socket.polygon.io/stocks", "apiKey": "${POLYGON_API_KEY}",
             "requestsPerMinute": 5, "burst": 1},
            {"name": "binance", "kind": "EXCHANGE", "apiKey": "${MISSING_KEY}", "active": false}
          ],
          "instruments": [
            {"symbol": "AAPL", "provider": "polygon", "assetKind": "equity", "quoteCurrency": "USD"},
            {"symbol": "BTCUSDT", "provider": "binance", "assetKind": "CRYPTO",
             "baseCurrency": "BTC", "quoteCurrency": "USDT"}
          ]
        }
        """;

    private final Map<String, String> env = Map.of("POLYGON_API_KEY", "pk_test");

    @Test
    void testParseProviders() {
        ProviderCatalog catalog = ProviderCatalog.parse(CONFIG, env::get);

        assertEquals(2, catalog.providers().size());
        ProviderSettings polygon = catalog.provider("POLYGON").orElseThrow();
        assertEquals("polygon", polygon.name(), "Names are normalized");
        assertEquals(ProviderKind.VENDOR, polygon.kind());
        assertEquals("pk_test", polygon.apiKey(), "Placeholder resolved from the lookup");
        assertEquals(5, polygon.requestsPerMinute());
        assertEquals(1, polygon.burst());
        assertTrue(polygon.active());
    }

    @Test
    void testUnresolvedPlaceholderBecomesNull() {
        ProviderSettings binance = ProviderCatalog.parse(CONFIG, env::get).provider("binance").orElseThrow();

        assertNull(binance.apiKey());
        assertFalse(binance.active());
        assertEquals(60, binance.requestsPerMinute(), "Default budget");
        assertNull(binance.baseUrl());
    }

    @Test
    void testParseInstruments() {
        ProviderCatalog catalog = ProviderCatalog.parse(CONFIG, env::get);

        assertEquals(2, catalog.instruments().size());
        Instrument aapl = catalog.instruments().get(0);
        assertEquals("AAPL", aapl.symbol());
        assertEquals("polygon", aapl.providerAffinity());
        assertEquals(AssetKind.EQUITY, aapl.assetKind());
        assertEquals("USD", aapl.quoteCurrency());
        assertEquals(AssetKind.CRYPTO, catalog.instruments().get(1).assetKind());
    }

    @Test
    void testInstrumentWithoutSymbolIsRejected() {
        String json = "{\"instruments\": [{\"provider\": \"polygon\"}]}";

        assertThrows(IllegalArgumentException.class, () -> ProviderCatalog.parse(json, env::get));
    }

    @Test
    void testInvalidJson() {
        assertThrows(IllegalArgumentException.class, () -> ProviderCatalog.parse("{providers:", env::get));
    }

    @Test
    void testExpandMixedText() {
        assertEquals("https://host/pk_test/x", ProviderCatalog.expand("https://host/${POLYGON_API_KEY}/x", env::get));
        assertEquals("plain", ProviderCatalog.expand("plain", env::get));
        assertNull(ProviderCatalog.expand("${NOPE}", env::get));
        assertNull(ProviderCatalog.expand(null, env::get));
    }

    @Test
    void testDefaultsContainBuiltInProviders() {
        ProviderCatalog catalog = ProviderCatalog.defaults();

        assertTrue(catalog.provider("binance").isPresent());
        assertTrue(catalog.provider("polygon").isPresent());
        assertTrue(catalog.provider("simulated").isPresent());
        assertTrue(catalog.provider("kraken").isEmpty());
    }

    @Test
    void testToStringMasksSecrets() {
        ProviderSettings polygon = ProviderCatalog.parse(CONFIG, env::get).provider("polygon").orElseThrow();

        assertFalse(polygon.toString().contains("pk_test"), "API key must not be logged");
        assertTrue(polygon.toString().contains("***"));
    }

    @Test
    void testInvalidBudgetIsRejected() {
        String json = "{\"providers\": [{\"name\": \"x\", \"requestsPerMinute\": 0}]}";

        assertThrows(IllegalArgumentException.class, () -> ProviderCatalog.parse(json, env::get));
    }
}

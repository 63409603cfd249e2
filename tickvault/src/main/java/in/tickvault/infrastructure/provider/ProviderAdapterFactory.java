package in.tickvault.infrastructure.provider;

import in.tickvault.config.ProviderSettings;
import in.tickvault.infrastructure.provider.common.RateLimiterRegistry;
import in.tickvault.infrastructure.provider.common.TokenBucketRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

/**
 * Creates adapters by provider name. Adapters of the same provider share one rate limiter.
 */
public class ProviderAdapterFactory {
    private static final Logger log = LoggerFactory.getLogger(ProviderAdapterFactory.class);

    private final RateLimiterRegistry rateLimiters;
    private final HttpClient httpClient;
    private final Clock clock;
    private final Duration connectTimeout;
    private final Duration simulatedTickInterval;

    public ProviderAdapterFactory(RateLimiterRegistry rateLimiters, HttpClient httpClient, Clock clock,
                                  Duration connectTimeout, Duration simulatedTickInterval) {
        this.rateLimiters = rateLimiters;
        this.httpClient = httpClient;
        this.clock = clock;
        this.connectTimeout = connectTimeout;
        this.simulatedTickInterval = simulatedTickInterval;
    }

    public ProviderAdapter create(ProviderSettings settings) {
        if (!settings.active()) {
            throw new IllegalArgumentException("Provider " + settings.name() + " is not active");
        }
        TokenBucketRateLimiter limiter = rateLimiters.forProvider(
            settings.name(), settings.requestsPerMinute(), settings.burst());

        ProviderAdapter adapter = switch (settings.name()) {
            case "binance" -> new BinanceAdapter(settings, httpClient, limiter, clock, connectTimeout);
            case "polygon" -> new PolygonAdapter(settings, httpClient, limiter, clock, connectTimeout);
            case "simulated" -> new SimulatedAdapter(settings, simulatedTickInterval, clock);
            default -> throw new IllegalArgumentException("Unknown provider: " + settings.name()
                + " (supported: binance, polygon, simulated)");
        };
        log.info("[{}] Adapter created ({} req/min, burst {})",
            settings.name(), settings.requestsPerMinute(), settings.burst());
        return adapter;
    }
}

package in.tickvault.infrastructure.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.tickvault.config.ProviderSettings;
import in.tickvault.infrastructure.provider.common.TokenBucketRateLimiter;
import in.tickvault.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Shared REST plumbing: rate limiting, status mapping and JSON parsing.
 */
public abstract class AbstractHttpProviderAdapter implements ProviderAdapter {
    private static final Logger log = LoggerFactory.getLogger(AbstractHttpProviderAdapter.class);

    static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(1);
    static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    protected final ProviderSettings settings;
    protected final HttpClient httpClient;
    protected final TokenBucketRateLimiter rateLimiter;
    protected final ObjectMapper objectMapper = Json.mapper();
    protected final Clock clock;

    protected AbstractHttpProviderAdapter(ProviderSettings settings, HttpClient httpClient,
                                          TokenBucketRateLimiter rateLimiter, Clock clock) {
        this.settings = settings;
        this.httpClient = httpClient;
        this.rateLimiter = rateLimiter;
        this.clock = clock;
    }

    @Override
    public String providerName() {
        return settings.name();
    }

    /**
     * GET a JSON document. Acquires a rate limit permit first.
     */
    protected JsonNode getJson(URI uri, String symbol) {
        acquirePermit(symbol);

        HttpRequest request = HttpRequest.newBuilder()
            .uri(uri)
            .timeout(REQUEST_TIMEOUT)
            .header("Accept", "application/json")
            .GET()
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransientProviderException(providerName(), symbol, "HTTP request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("[" + providerName() + ":" + symbol + "] Request interrupted");
        }

        int status = response.statusCode();
        if (status == 429 || status == 418) {
            Duration retryAfter = parseRetryAfter(response);
            rateLimiter.penalize(retryAfter);
            throw new RateLimitedException(providerName(), symbol, retryAfter);
        }
        if (status == 401 || status == 403) {
            throw new ProviderAuthenticationException(providerName(), symbol, "HTTP " + status + " from " + uri.getPath());
        }
        if (status >= 500) {
            throw new TransientProviderException(providerName(), symbol, "HTTP " + status + " from " + uri.getPath());
        }
        if (status != 200) {
            throw new ProviderException(providerName(), symbol,
                "HTTP " + status + " from " + uri.getPath() + ": " + abbreviate(response.body()));
        }

        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException(providerName(), symbol, response.body(), e);
        }
    }

    private void acquirePermit(String symbol) {
        try {
            Duration waited = rateLimiter.acquire();
            if (waited.toMillis() > 1000) {
                log.debug("[{}:{}] Waited {}ms for rate limit permit", providerName(), symbol, waited.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("[" + providerName() + ":" + symbol + "] Interrupted waiting for rate limit");
        }
    }

    static Duration parseRetryAfter(HttpResponse<?> response) {
        return response.headers().firstValue("Retry-After")
            .map(String::trim)
            .flatMap(value -> {
                try {
                    long seconds = Long.parseLong(value);
                    return Optional.of(Duration.ofSeconds(Math.max(1L, seconds)));
                } catch (NumberFormatException e) {
                    log.debug("Unparsable Retry-After header '{}', using default", value);
                    return Optional.empty();
                }
            })
            .orElse(DEFAULT_RETRY_AFTER);
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }

    @Override
    public void close() {
        log.debug("[{}] Adapter closed", providerName());
    }
}

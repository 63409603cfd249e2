package in.tickvault.infrastructure.provider;

import in.tickvault.domain.model.Granularity;
import in.tickvault.domain.model.ProviderRecord;
import in.tickvault.domain.model.StreamOffset;

import java.time.Instant;
import java.util.List;

/**
 * Contract every market data source implements.
 *
 * Adapters only decode: they never normalize, aggregate or write storage.
 * Every outbound request takes a permit from the provider's shared rate limiter first.
 *
 * Error Handling:
 * - {@link RateLimitedException}: provider throttled us; the shared limiter is already paused
 * - {@link TransientProviderException}: network or 5xx, retry with backoff
 * - {@link ProviderAuthenticationException}: credentials rejected, do not retry blindly
 * - {@link ProviderException}: any other non-retryable rejection (unknown symbol, bad request)
 */
public interface ProviderAdapter extends AutoCloseable {

    String providerName();

    /**
     * Historical records in [start, end), ordered by event time. Pagination is handled internally.
     */
    List<ProviderRecord> fetchHistorical(String symbol, Instant start, Instant end, Granularity granularity);

    /**
     * Open a live feed. resumeFrom is advisory: feeds that cannot replay simply start at "now"
     * and the caller filters what it has already committed.
     */
    LiveStream streamLive(String symbol, StreamOffset resumeFrom);

    @Override
    void close();
}

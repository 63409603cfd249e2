package in.tickvault.config;

import in.tickvault.domain.model.Provider;
import in.tickvault.domain.model.ProviderKind;

/**
 * Connection settings for one provider. Credentials live only here, never in storage.
 */
public record ProviderSettings(
    String name,
    ProviderKind kind,
    String baseUrl,
    String streamUrl,
    String apiKey,
    String apiSecret,
    int requestsPerMinute,
    int burst,
    boolean active
) {
    public ProviderSettings {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Provider name is required");
        }
        name = name.trim().toLowerCase();
        if (requestsPerMinute <= 0) {
            throw new IllegalArgumentException("[" + name + "] requestsPerMinute must be positive");
        }
        if (burst <= 0) {
            burst = 1;
        }
    }

    public Provider toProvider() {
        return new Provider(name, kind, baseUrl, requestsPerMinute, active);
    }

    @Override
    public String toString() {
        return "ProviderSettings[name=" + name + ", kind=" + kind + ", baseUrl=" + baseUrl
            + ", streamUrl=" + streamUrl + ", apiKey=" + (apiKey == null ? "none" : "***")
            + ", requestsPerMinute=" + requestsPerMinute + ", burst=" + burst + ", active=" + active + "]";
    }
}

package in.tickvault.application.port.output;

import in.tickvault.domain.model.Provider;

import java.util.List;
import java.util.Optional;

public interface ProviderRepository {
    /**
     * Insert or refresh a provider from configuration.
     */
    void upsert(Provider provider);

    Optional<Provider> findByName(String name);

    List<Provider> findAll();
}

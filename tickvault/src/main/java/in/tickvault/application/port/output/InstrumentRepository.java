package in.tickvault.application.port.output;

import in.tickvault.domain.model.Instrument;

import java.util.List;
import java.util.Optional;

public interface InstrumentRepository {
    /**
     * Register an instrument. An existing row keeps its asset kind and currencies
     * unless the new record carries them.
     */
    void upsert(Instrument instrument);

    Optional<Instrument> findBySymbol(String symbol);

    List<Instrument> findActive();
}

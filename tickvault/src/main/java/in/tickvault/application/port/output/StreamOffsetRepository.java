package in.tickvault.application.port.output;

import in.tickvault.domain.model.StreamKind;
import in.tickvault.domain.model.StreamOffset;

import java.util.List;
import java.util.Optional;

public interface StreamOffsetRepository {

    Optional<StreamOffset> find(String provider, String symbol, StreamKind kind);

    /**
     * Store the offset unless the stored one is already newer.
     *
     * @return true if the row was written
     */
    boolean commit(StreamOffset offset);

    List<StreamOffset> findAll();
}

package in.tickvault.application.port.output;

import in.tickvault.domain.model.FetchJob;
import in.tickvault.domain.model.FetchJobKind;
import in.tickvault.domain.model.FetchJobStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Fetch job persistence. Only the fetch job manager writes through this.
 */
public interface FetchJobRepository {

    /**
     * Insert unless a job with the same (provider, symbol, kind, requestedStart) exists.
     *
     * @return the stored job with its id, and whether it was newly created
     */
    InsertResult insertIfAbsent(FetchJob job);

    Optional<FetchJob> findById(long id);

    Optional<FetchJob> findByNaturalKey(String provider, String symbol, FetchJobKind kind, Instant requestedStart);

    List<FetchJob> findByStatus(Set<FetchJobStatus> statuses);

    /**
     * Persist status, checkpoint, attempts and error of an existing job.
     */
    void update(FetchJob job);

    record InsertResult(FetchJob job, boolean created) {}
}

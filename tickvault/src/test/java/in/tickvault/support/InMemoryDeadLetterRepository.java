package in.tickvault.support;

import in.tickvault.application.port.output.DeadLetterRepository;
import in.tickvault.domain.model.DeadLetterRecord;

import java.util.ArrayList;
import java.util.List;

public final class InMemoryDeadLetterRepository implements DeadLetterRepository {
    public final FailureInjector failures = new FailureInjector();

    private final List<DeadLetterRecord> rows = new ArrayList<>();

    @Override
    public synchronized void insertBatch(List<DeadLetterRecord> records) {
        failures.check();
        long id = rows.size();
        for (DeadLetterRecord r : records) {
            rows.add(new DeadLetterRecord(++id, r.provider(), r.symbol(), r.payload(), r.errorReason(),
                r.retryCount(), r.createdAt()));
        }
    }

    @Override
    public synchronized long count() {
        return rows.size();
    }

    @Override
    public synchronized List<DeadLetterRecord> findRecent(int limit) {
        List<DeadLetterRecord> result = new ArrayList<>();
        for (int i = rows.size() - 1; i >= 0 && result.size() < limit; i--) {
            result.add(rows.get(i));
        }
        return result;
    }

    public synchronized List<DeadLetterRecord> rows() {
        return List.copyOf(rows);
    }
}

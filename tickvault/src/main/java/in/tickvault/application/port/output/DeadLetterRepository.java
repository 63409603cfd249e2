package in.tickvault.application.port.output;

import in.tickvault.domain.model.DeadLetterRecord;

import java.util.List;

public interface DeadLetterRepository {

    void insertBatch(List<DeadLetterRecord> records);

    long count();

    List<DeadLetterRecord> findRecent(int limit);
}

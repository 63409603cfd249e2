package in.tickvault.application.port.output;

import in.tickvault.domain.model.Trade;
import in.tickvault.domain.model.WriteOutcome;

import java.util.List;

public interface TradeRepository {
    /**
     * Insert in one round trip. Outcomes are positional.
     *
     * @throws StorageException on failure; no per-record outcome is known then
     */
    List<WriteOutcome> insertBatch(List<Trade> trades);

    WriteOutcome insert(Trade trade);
}

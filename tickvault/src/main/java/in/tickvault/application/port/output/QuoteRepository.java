package in.tickvault.application.port.output;

import in.tickvault.domain.model.Quote;
import in.tickvault.domain.model.QuoteMode;
import in.tickvault.domain.model.WriteOutcome;

import java.util.List;

public interface QuoteRepository {
    /**
     * LATEST keeps one row per (provider, symbol) and never moves it to an older event time.
     * HISTORY keeps one row per (provider, symbol, eventTime).
     */
    List<WriteOutcome> insertBatch(List<Quote> quotes, QuoteMode mode);

    WriteOutcome insert(Quote quote, QuoteMode mode);
}

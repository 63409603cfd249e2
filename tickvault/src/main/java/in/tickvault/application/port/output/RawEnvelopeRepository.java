package in.tickvault.application.port.output;

import in.tickvault.domain.model.RawEnvelope;
import in.tickvault.domain.model.WriteOutcome;

import java.util.List;

public interface RawEnvelopeRepository {
    List<WriteOutcome> insertBatch(List<RawEnvelope> envelopes);
}

package in.tickvault.infrastructure.provider;

import in.tickvault.domain.model.ProviderRecord;

import java.time.Duration;

/**
 * Unbounded feed of records for one instrument.
 *
 * Records are delivered in arrival order. The next message is only requested
 * from the transport after the previous one has been consumed, so a slow
 * consumer slows the feed instead of growing a buffer.
 */
public interface LiveStream extends AutoCloseable {

    /**
     * Wait up to timeout for the next record.
     *
     * @return the next record, or null if none arrived in time
     * @throws TransientProviderException if the connection was closed or failed
     * @throws MalformedPayloadException if a message could not be decoded; the stream stays usable
     */
    ProviderRecord poll(Duration timeout) throws InterruptedException;

    boolean isOpen();

    /**
     * Close the connection. Safe to call from any thread; a blocked poll returns promptly.
     */
    @Override
    void close();
}

package relay.ingest;

import relay.model.InboundMessage;

import java.io.IOException;
import java.time.Duration;

/**
 * Pull-style source of inbound messages. The relay reads from a single thread; only
 * {@link #close()} may be called from another thread.
 */
public interface SourceEventStream extends AutoCloseable {

    /**
     * Connects to the source.
     *
     * @throws IOException if the source cannot be reached
     */
    void open() throws IOException;

    /**
     * Waits up to {@code timeout} for the next message.
     *
     * @return the next message, or {@code null} if none arrived in time
     */
    InboundMessage poll(Duration timeout) throws InterruptedException;

    @Override
    void close();
}

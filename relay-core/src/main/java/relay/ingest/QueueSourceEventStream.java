package relay.ingest;

import relay.model.InboundMessage;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * {@link SourceEventStream} fed by push-style clients through {@link #publish}.
 *
 * <p>The buffer is bounded; {@link #publish} returns {@code false} when it is full or the
 * stream is closed.
 */
public final class QueueSourceEventStream implements SourceEventStream {
    private static final Logger logger = Logger.getLogger(QueueSourceEventStream.class.getName());

    private final BlockingQueue<InboundMessage> buffer;
    private volatile boolean closed;

    public QueueSourceEventStream() {
        this(10_000);
    }

    public QueueSourceEventStream(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.buffer = new LinkedBlockingQueue<>(capacity);
    }

    public boolean publish(InboundMessage message) {
        Objects.requireNonNull(message, "message");
        if (closed) {
            return false;
        }
        boolean accepted = buffer.offer(message);
        if (!accepted) {
            logger.warning("Source buffer full; dropping message " + message.sourceMessageId()
                    + " from chat " + message.chatId());
        }
        return accepted;
    }

    @Override
    public void open() {
        if (closed) {
            throw new IllegalStateException("stream closed");
        }
    }

    @Override
    public InboundMessage poll(Duration timeout) throws InterruptedException {
        if (closed) {
            return null;
        }
        return buffer.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public int pending() {
        return buffer.size();
    }

    @Override
    public void close() {
        closed = true;
    }
}

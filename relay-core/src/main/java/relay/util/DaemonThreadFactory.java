package relay.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Threads for the relay's loop and pools: daemon, numbered after a prefix
 * ({@code relay-delivery-1}, {@code relay-delivery-2}), and logging anything that escapes
 * a task at SEVERE instead of printing to stderr.
 */
public final class DaemonThreadFactory implements ThreadFactory {
    private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

    private static final Thread.UncaughtExceptionHandler LOG_UNCAUGHT = (thread, error) ->
            logger.log(Level.SEVERE, "Uncaught failure on " + thread.getName(), error);

    private final String prefix;
    private final AtomicInteger sequence = new AtomicInteger();

    /**
     * @param prefix thread name prefix; a trailing {@code -} is added when missing
     */
    public DaemonThreadFactory(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        this.prefix = prefix.endsWith("-") ? prefix : prefix + "-";
    }

    @Override
    public Thread newThread(Runnable task) {
        Thread thread = new Thread(task, prefix + sequence.incrementAndGet());
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler(LOG_UNCAUGHT);
        return thread;
    }
}

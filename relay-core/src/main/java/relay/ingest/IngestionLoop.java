package relay.ingest;

import relay.SourceUnavailableException;
import relay.delivery.DeliveryDispatcher;
import relay.delivery.DeliveryOutcome;
import relay.model.DestinationConfig;
import relay.model.InboundMessage;
import relay.stats.RelayStats;
import relay.store.DestinationConfigStore;
import relay.transform.TransformResult;
import relay.transform.WatermarkEngine;
import relay.util.DaemonThreadFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads messages from a {@link SourceEventStream} and fans them out to their destinations.
 *
 * <p>One loop thread polls the stream, counts the message, drops duplicates, and hands the
 * message to a dispatch pool. It never waits for transforms or deliveries. Dispatch threads
 * resolve the destination, apply its filters and watermark, and queue the payload on the
 * {@link DeliveryDispatcher}; the delivery future updates {@link RelayStats} when it
 * completes.
 *
 * <p>Create instances via {@link #builder()}. {@link #start()} and {@link #stop()} are
 * synchronized.
 */
public final class IngestionLoop implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(IngestionLoop.class.getName());

    private final SourceEventStream stream;
    private final DestinationConfigStore store;
    private final WatermarkEngine engine;
    private final DeliveryDispatcher dispatcher;
    private final RelayStats stats;
    private final DeduplicationWindow dedup;
    private final int dispatchThreads;
    private final Duration pollTimeout;
    private final Duration stopTimeout;

    private final AtomicReference<IngestionState> state = new AtomicReference<>(IngestionState.IDLE);
    private volatile boolean running;
    private Thread loopThread;
    private ExecutorService dispatchPool;

    private IngestionLoop(Builder builder) {
        this.stream = Objects.requireNonNull(builder.stream, "stream");
        this.store = Objects.requireNonNull(builder.store, "store");
        this.engine = Objects.requireNonNull(builder.engine, "engine");
        this.dispatcher = Objects.requireNonNull(builder.dispatcher, "dispatcher");
        this.stats = Objects.requireNonNull(builder.stats, "stats");
        this.dedup = builder.dedup != null
                ? builder.dedup : new DeduplicationWindow(Duration.ofMinutes(10), 1000);
        this.pollTimeout = Objects.requireNonNull(builder.pollTimeout, "pollTimeout");
        this.stopTimeout = Objects.requireNonNull(builder.stopTimeout, "stopTimeout");
        if (builder.dispatchThreads < 1) {
            throw new IllegalArgumentException("dispatchThreads must be >= 1");
        }
        if (pollTimeout.isZero() || pollTimeout.isNegative()) {
            throw new IllegalArgumentException("pollTimeout must be positive");
        }
        this.dispatchThreads = builder.dispatchThreads;
    }

    public static Builder builder() {
        return new Builder();
    }

    public IngestionState state() {
        return state.get();
    }

    /**
     * Opens the source and starts the loop thread.
     *
     * @throws SourceUnavailableException if the source cannot be opened; the loop is then STOPPED
     * @throws IllegalStateException      if the loop was already started
     */
    public synchronized void start() {
        if (state.get() != IngestionState.IDLE) {
            throw new IllegalStateException("IngestionLoop already started (state=" + state.get() + ")");
        }
        try {
            stream.open();
        } catch (IOException | RuntimeException e) {
            state.set(IngestionState.STOPPED);
            throw new SourceUnavailableException("Cannot open source event stream", e);
        }
        dispatchPool = Executors.newFixedThreadPool(dispatchThreads, new DaemonThreadFactory("relay-ingest-"));
        running = true;
        state.set(IngestionState.LISTENING);
        loopThread = new DaemonThreadFactory("relay-ingest-loop-").newThread(this::run);
        loopThread.start();
        logger.info("Ingestion loop started with " + dispatchThreads + " dispatch thread(s)");
    }

    private void run() {
        while (running) {
            try {
                InboundMessage message = stream.poll(pollTimeout);
                if (message == null) {
                    continue;
                }
                state.compareAndSet(IngestionState.LISTENING, IngestionState.DISPATCHING);
                try {
                    onMessage(message);
                } finally {
                    state.compareAndSet(IngestionState.DISPATCHING, IngestionState.LISTENING);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Ingestion loop error", e);
                stats.recordError();
            }
        }
    }

    private void onMessage(InboundMessage message) {
        stats.recordSeen();
        if (!dedup.firstSeen(message.chatId(), message.sourceMessageId())) {
            logger.fine(() -> "Duplicate message " + message.sourceMessageId() + " in chat " + message.chatId());
            return;
        }
        try {
            dispatchPool.execute(() -> dispatch(message));
        } catch (RejectedExecutionException e) {
            logger.log(Level.SEVERE, "Dispatch pool rejected message " + message.sourceMessageId(), e);
            stats.recordError();
        }
    }

    /**
     * Returns the enabled destinations whose filters accept the message.
     */
    List<DestinationConfig> resolve(InboundMessage message) {
        return store.get(message.chatId())
                .filter(DestinationConfig::enabled)
                .filter(d -> d.filters().matches(message))
                .map(List::of)
                .orElse(List.of());
    }

    void dispatch(InboundMessage message) {
        try {
            List<DestinationConfig> destinations = resolve(message);
            if (destinations.isEmpty()) {
                logger.fine(() -> "No destination for message " + message.sourceMessageId()
                        + " in chat " + message.chatId());
                return;
            }
            message.media().ifPresent(media -> stats.recordMediaProcessed(media.kind()));
            for (DestinationConfig destination : destinations) {
                TransformResult result = engine.transform(message, destination);
                if (result.watermarkApplied()) {
                    stats.recordWatermark();
                }
                dispatcher.deliver(destination, result.payload())
                        .whenComplete((outcome, error) -> onOutcome(message, outcome, error));
            }
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to dispatch message " + message.sourceMessageId()
                    + " from chat " + message.chatId(), e);
            stats.recordError();
        }
    }

    private void onOutcome(InboundMessage message, DeliveryOutcome outcome, Throwable error) {
        if (error != null) {
            logger.log(Level.SEVERE, "Delivery of message " + message.sourceMessageId() + " failed", error);
            stats.recordError();
            return;
        }
        stats.recordOutcome(outcome);
        if (!outcome.isDelivered()) {
            logger.fine(() -> "Message " + message.sourceMessageId() + " not delivered to "
                    + outcome.destinationId() + ": " + outcome);
        }
    }

    /**
     * Stops polling, closes the source and waits up to the stop timeout for dispatch work
     * already handed off. Idempotent.
     */
    public synchronized void stop() {
        if (state.get() == IngestionState.STOPPED) {
            return;
        }
        running = false;
        state.set(IngestionState.STOPPED);
        if (loopThread != null) {
            loopThread.interrupt();
            try {
                loopThread.join(stopTimeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        stream.close();
        if (dispatchPool != null) {
            dispatchPool.shutdown();
            try {
                if (!dispatchPool.awaitTermination(stopTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    logger.warning("Dispatch pool did not drain within " + stopTimeout + "; forcing shutdown");
                    dispatchPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                dispatchPool.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        logger.info("Ingestion loop stopped");
    }

    @Override
    public void close() {
        stop();
    }

    /** Builder for {@link IngestionLoop}. */
    public static final class Builder {
        private SourceEventStream stream;
        private DestinationConfigStore store;
        private WatermarkEngine engine;
        private DeliveryDispatcher dispatcher;
        private RelayStats stats;
        private DeduplicationWindow dedup;
        private int dispatchThreads = 4;
        private Duration pollTimeout = Duration.ofMillis(250);
        private Duration stopTimeout = Duration.ofSeconds(5);

        private Builder() {}

        /** <b>Required.</b> */
        public Builder stream(SourceEventStream stream) {
            this.stream = stream;
            return this;
        }

        /** <b>Required.</b> */
        public Builder store(DestinationConfigStore store) {
            this.store = store;
            return this;
        }

        /** <b>Required.</b> */
        public Builder engine(WatermarkEngine engine) {
            this.engine = engine;
            return this;
        }

        /** <b>Required.</b> */
        public Builder dispatcher(DeliveryDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        /** <b>Required.</b> */
        public Builder stats(RelayStats stats) {
            this.stats = stats;
            return this;
        }

        /** Optional. Defaults to a 10 minute window with 1000 ids per chat. */
        public Builder dedup(DeduplicationWindow dedup) {
            this.dedup = dedup;
            return this;
        }

        /** Optional. Defaults to {@code 4}. */
        public Builder dispatchThreads(int dispatchThreads) {
            this.dispatchThreads = dispatchThreads;
            return this;
        }

        /** Optional. Defaults to 250 ms. */
        public Builder pollTimeout(Duration pollTimeout) {
            this.pollTimeout = pollTimeout;
            return this;
        }

        /** Optional. Defaults to 5 seconds. */
        public Builder stopTimeout(Duration stopTimeout) {
            this.stopTimeout = stopTimeout;
            return this;
        }

        public IngestionLoop build() {
            return new IngestionLoop(this);
        }
    }
}

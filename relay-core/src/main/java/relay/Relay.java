package relay;

import relay.delivery.CircuitBreakerRegistry;
import relay.delivery.DeliveryDispatcher;
import relay.delivery.ExponentialBackoffRetryPolicy;
import relay.ingest.DeduplicationWindow;
import relay.ingest.IngestionLoop;
import relay.ingest.IngestionState;
import relay.ingest.SourceEventStream;
import relay.spi.MetricsExporter;
import relay.stats.RelayStats;
import relay.store.DestinationConfigStore;
import relay.transform.OverlayCache;
import relay.transform.VideoWatermarker;
import relay.transform.WatermarkEngine;
import relay.webhook.HttpClientWebhookTransport;
import relay.webhook.WebhookTransport;
import relay.webhook.WebhookUrlPolicy;
import relay.webhook.WebhookValidator;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the ingestion loop, watermark engine, delivery dispatcher
 * and stats into a single {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * QueueSourceEventStream source = new QueueSourceEventStream();
 * try (Relay relay = Relay.builder()
 *     .store(new FileDestinationConfigStore(dir, new DestinationConfigValidator(WebhookUrlPolicy.discord())))
 *     .stream(source)
 *     .build()) {
 *   relay.start();
 *   source.publish(InboundMessage.text("-100123", "1", "42", "hello"));
 * }
 * }</pre>
 */
public final class Relay implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(Relay.class.getName());

    private final RelayStats stats;
    private final DestinationConfigStore store;
    private final DeliveryDispatcher dispatcher;
    private final IngestionLoop ingestion;
    private final RelayAdmin admin;
    private final MetricsExporter metrics;

    private Relay(Builder builder) {
        RelayConfig config = builder.config != null ? builder.config : new RelayConfig();
        Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.store = Objects.requireNonNull(builder.store, "store");
        SourceEventStream stream = Objects.requireNonNull(builder.stream, "stream");
        WebhookTransport transport = builder.transport != null ? builder.transport : new HttpClientWebhookTransport();
        VideoWatermarker videos = builder.videoWatermarker != null ? builder.videoWatermarker : new VideoWatermarker();

        this.stats = new RelayStats(metrics, clock);
        this.dispatcher = DeliveryDispatcher.builder()
                .transport(transport)
                .circuitBreakers(new CircuitBreakerRegistry(
                        config.getCircuitFailureThreshold(), config.getCircuitRecoveryTimeout(), clock))
                .retryPolicy(new ExponentialBackoffRetryPolicy(
                        config.getRetryBaseDelayMs(), config.getRetryMaxDelayMs(), config.getRetryJitter()))
                .stats(stats)
                .clock(clock)
                .maxAttempts(config.getMaxAttempts())
                .workerCount(config.getDeliveryWorkers())
                .queueCapacity(config.getDeliveryQueueCapacity())
                .retryQueueCapacity(config.getRetryQueueCapacity())
                .requestTimeout(config.getRequestTimeout())
                .drainTimeoutMs(config.getDrainTimeoutMs())
                .build();
        try {
            this.ingestion = IngestionLoop.builder()
                    .stream(stream)
                    .store(store)
                    .engine(new WatermarkEngine(new OverlayCache(), videos, stats))
                    .dispatcher(dispatcher)
                    .stats(stats)
                    .dedup(new DeduplicationWindow(config.getDedupWindow(), config.getDedupMaxPerChat(), clock))
                    .dispatchThreads(config.getDispatchThreads())
                    .build();
        } catch (RuntimeException e) {
            dispatcher.close();
            throw e;
        }
        WebhookValidator validator = new WebhookValidator(transport,
                new WebhookUrlPolicy(config.getAllowedWebhookPrefixes()), config.getValidatorTimeout());
        this.admin = new RelayAdmin(store, validator, dispatcher, stats);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Opens the source stream and starts relaying.
     *
     * @throws SourceUnavailableException if the source cannot be opened
     */
    public void start() {
        ingestion.start();
        logger.info("Relay started with " + store.listAll().size() + " destination(s)");
    }

    public RelayAdmin admin() {
        return admin;
    }

    public RelayStats stats() {
        return stats;
    }

    public DestinationConfigStore store() {
        return store;
    }

    public DeliveryDispatcher dispatcher() {
        return dispatcher;
    }

    public IngestionState state() {
        return ingestion.state();
    }

    /**
     * Shuts down components in order: ingestion loop, dispatcher, metrics exporter.
     */
    @Override
    public void close() {
        RuntimeException first = null;
        try {
            ingestion.close();
        } catch (RuntimeException e) {
            first = e;
        }
        try {
            dispatcher.close();
        } catch (RuntimeException e) {
            if (first == null) first = e; else first.addSuppressed(e);
        }
        if (metrics instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
                if (first == null) first = re; else first.addSuppressed(re);
            }
        }
        if (first != null) {
            throw first;
        }
    }

    /** Builder for {@link Relay}. */
    public static final class Builder {
        private RelayConfig config;
        private DestinationConfigStore store;
        private SourceEventStream stream;
        private WebhookTransport transport;
        private MetricsExporter metrics;
        private VideoWatermarker videoWatermarker;
        private Clock clock;
        private final AtomicBoolean built = new AtomicBoolean(false);

        private Builder() {}

        /**
         * Sets tuning values for delivery, retry, circuit breaking and ingestion.
         *
         * <p>Optional. Defaults to {@code new RelayConfig()}.
         */
        public Builder config(RelayConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Sets the destination config store.
         *
         * <p><b>Required.</b>
         */
        public Builder store(DestinationConfigStore store) {
            this.store = store;
            return this;
        }

        /**
         * Sets the source of inbound messages.
         *
         * <p><b>Required.</b>
         */
        public Builder stream(SourceEventStream stream) {
            this.stream = stream;
            return this;
        }

        /**
         * Sets the transport used for deliveries and webhook test messages.
         *
         * <p>Optional. Defaults to {@link HttpClientWebhookTransport}.
         */
        public Builder transport(WebhookTransport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * Sets the metrics exporter. Closed with the relay if it implements {@link AutoCloseable}.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets the video watermarker (for a non-default {@code ffmpeg} location).
         *
         * <p>Optional. Defaults to {@code new VideoWatermarker()}.
         */
        public Builder videoWatermarker(VideoWatermarker videoWatermarker) {
            this.videoWatermarker = videoWatermarker;
            return this;
        }

        /** Optional. Defaults to {@link Clock#systemUTC()}. */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * @throws IllegalStateException if build() was already called
         */
        public Relay build() {
            if (!built.compareAndSet(false, true)) {
                throw new IllegalStateException("build() already called on this builder");
            }
            return new Relay(this);
        }
    }
}

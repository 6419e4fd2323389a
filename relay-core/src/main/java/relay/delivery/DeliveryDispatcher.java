package relay.delivery;

import relay.RetryAfterException;
import relay.model.DestinationConfig;
import relay.model.OutboundPayload;
import relay.spi.MetricsExporter;
import relay.stats.RelayStats;
import relay.util.DaemonThreadFactory;
import relay.webhook.WebhookResponse;
import relay.webhook.WebhookTransport;
import relay.webhook.WebhookUrls;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded, retrying webhook delivery with a circuit breaker per destination.
 *
 * <p>New jobs go to a bounded main queue; jobs waiting for a retry sit in a scheduler until
 * their {@code notBefore} time and then move to a bounded retry queue. Worker threads drain
 * both queues using a weighted 2:1 round-robin favoring new jobs. A full queue or a closed
 * dispatcher completes the job at once as {@link DeliveryOutcome.Dropped} with
 * {@link ErrorKind#BACKPRESSURE}.
 *
 * <p>Each attempt checks the payload size against the destination's ceiling, then asks the
 * destination's {@link CircuitBreaker} for a permit (no request is made while it is open),
 * then sends through the {@link WebhookTransport} and classifies the answer with
 * {@link ResponseClassifier}.
 *
 * <p>Attempts for one destination start in submission order, but a job waiting for a retry
 * does not hold back later jobs, so the delivered order can differ from the submitted order.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and implements
 * {@link AutoCloseable} for graceful shutdown with a configurable drain timeout.
 */
public final class DeliveryDispatcher implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(DeliveryDispatcher.class.getName());

    private static final long QUEUE_POLL_TIMEOUT_MS = 50;

    private final BlockingQueue<DeliveryJob> mainQueue;
    private final BlockingQueue<DeliveryJob> retryQueue;
    private final ExecutorService workers;
    private final ScheduledExecutorService retryScheduler;
    private final ConcurrentMap<DeliveryJob, ScheduledFuture<?>> scheduledRetries = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicBoolean accepting = new AtomicBoolean(true);
    private final AtomicInteger pollCounter = new AtomicInteger(0);

    private final WebhookTransport transport;
    private final CircuitBreakerRegistry circuitBreakers;
    private final ResponseClassifier classifier;
    private final RetryPolicy retryPolicy;
    private final int maxAttempts;
    private final Duration requestTimeout;
    private final long drainTimeoutMs;
    private final RelayStats stats;
    private final MetricsExporter metrics;
    private final Clock clock;

    private DeliveryDispatcher(Builder builder) {
        this.transport = Objects.requireNonNull(builder.transport, "transport");
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.circuitBreakers = builder.circuitBreakers != null
                ? builder.circuitBreakers : new CircuitBreakerRegistry(5, Duration.ofSeconds(60), clock);
        this.classifier = new ResponseClassifier();
        this.retryPolicy = builder.retryPolicy != null
                ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(1000, 30_000, 0.5);
        this.stats = builder.stats != null ? builder.stats : new RelayStats();
        this.metrics = stats.metrics();
        this.requestTimeout = Objects.requireNonNull(builder.requestTimeout, "requestTimeout");
        this.drainTimeoutMs = builder.drainTimeoutMs;

        if (builder.maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (builder.workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1");
        }
        if (builder.queueCapacity <= 0 || builder.retryQueueCapacity <= 0) {
            throw new IllegalArgumentException("Queue capacities must be > 0");
        }
        if (requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
        if (drainTimeoutMs < 0) {
            throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
        }
        this.maxAttempts = builder.maxAttempts;

        this.mainQueue = new ArrayBlockingQueue<>(builder.queueCapacity);
        this.retryQueue = new ArrayBlockingQueue<>(builder.retryQueueCapacity);
        this.retryScheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("relay-retry-"));
        this.workers = Executors.newFixedThreadPool(builder.workerCount, new DaemonThreadFactory("relay-delivery-"));
        for (int i = 0; i < builder.workerCount; i++) {
            workers.submit(this::workerLoop);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Queues a payload for delivery to one destination.
     *
     * <p>Never blocks and never throws for delivery problems; the returned future completes with
     * the terminal outcome. The destination config is captured as given, so later updates to the
     * store do not affect jobs already queued.
     *
     * @param destination destination snapshot
     * @param payload     payload to send
     * @return future completed when the job reaches a terminal state
     */
    public CompletableFuture<DeliveryOutcome> deliver(DestinationConfig destination, OutboundPayload payload) {
        DeliveryJob job = new DeliveryJob(destination, payload);
        if (!accepting.get()) {
            dropBackpressure(job, "dispatcher closed");
            return job.result();
        }
        if (!mainQueue.offer(job)) {
            dropBackpressure(job, "delivery queue full");
        }
        metrics.recordQueueDepths(mainQueue.size(), retryQueue.size());
        return job.result();
    }

    /**
     * Returns the circuit breaker view for a destination; destinations that never had a
     * delivery attempt report a closed circuit.
     */
    public CircuitBreaker.Snapshot circuit(String destinationId) {
        return circuitBreakers.find(destinationId)
                .map(CircuitBreaker::snapshot)
                .orElseGet(() -> CircuitBreaker.Snapshot.closed(destinationId));
    }

    /** Forgets the breaker of a destination that no longer exists. */
    public void forget(String destinationId) {
        circuitBreakers.remove(destinationId);
    }

    public int queueDepth() {
        return mainQueue.size();
    }

    public int retryQueueDepth() {
        return retryQueue.size();
    }

    /** Number of jobs waiting for their retry time. */
    public int scheduledRetryCount() {
        return scheduledRetries.size();
    }

    private void dropBackpressure(DeliveryJob job, String reason) {
        logger.warning("Dropping delivery to destination " + job.destinationId() + ": " + reason);
        job.complete(new DeliveryOutcome.Dropped(job.destinationId(), ErrorKind.BACKPRESSURE, job.attempts(), reason));
    }

    private DeliveryJob pollFairly() throws InterruptedException {
        int cycle = pollCounter.getAndIncrement();
        BlockingQueue<DeliveryJob> primary;
        BlockingQueue<DeliveryJob> secondary;
        // Mask sign bit to stay non-negative after int overflow
        if ((cycle & 0x7FFFFFFF) % 3 == 2) {
            primary = retryQueue;
            secondary = mainQueue;
        } else {
            primary = mainQueue;
            secondary = retryQueue;
        }
        DeliveryJob job = primary.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        if (job == null) {
            job = secondary.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        }
        return job;
    }

    private void workerLoop() {
        while (!Thread.currentThread().isInterrupted()) {
            try {
                if (!running.get() && mainQueue.isEmpty() && retryQueue.isEmpty()) {
                    break;
                }
                DeliveryJob job = pollFairly();
                if (job == null) {
                    if (!running.get()) break;
                    continue;
                }
                attempt(job);
                metrics.recordQueueDepths(mainQueue.size(), retryQueue.size());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (Throwable t) {
                logger.log(Level.SEVERE, "Delivery loop error", t);
            }
        }
    }

    private void attempt(DeliveryJob job) {
        DestinationConfig destination = job.destination();
        String destinationId = destination.destinationId();

        long size = job.payload().sizeBytes();
        if (size > destination.maxMediaBytes()) {
            String message = "payload of " + size + " bytes exceeds limit of " + destination.maxMediaBytes();
            logger.warning("Not sending to destination " + destinationId + ": " + message);
            job.complete(new DeliveryOutcome.Failed(destinationId, ErrorKind.PAYLOAD_TOO_LARGE, job.attempts(), message));
            return;
        }

        CircuitBreaker breaker = circuitBreakers.forDestination(destinationId);
        if (!breaker.tryAcquire()) {
            logger.warning("Circuit open for destination " + destinationId + "; dropping job " + job.jobId());
            job.complete(new DeliveryOutcome.Dropped(destinationId, ErrorKind.CIRCUIT_OPEN, job.attempts(), "circuit open"));
            return;
        }

        int attempts = job.incrementAttempts();
        long start = System.nanoTime();
        WebhookResponse response;
        try {
            response = transport.send(destination.webhookUrl(), job.payload(), null, requestTimeout);
        } catch (RetryAfterException e) {
            breaker.recordNeutral();
            onRateLimited(job, attempts, e.retryAfter().toMillis(), e.getMessage());
            return;
        } catch (IOException e) {
            breaker.recordFailure();
            onTransient(job, attempts, e.getClass().getSimpleName() + ": " + e.getMessage());
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            breaker.recordNeutral();
            job.complete(new DeliveryOutcome.Dropped(destinationId, ErrorKind.SHUTDOWN, attempts, "interrupted"));
            return;
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Transport failed unexpectedly for destination " + destinationId, e);
            breaker.recordFailure();
            onTransient(job, attempts, e.toString());
            return;
        } finally {
            metrics.recordDeliveryLatencyMs(Math.max(0L, (System.nanoTime() - start) / 1_000_000L));
        }

        ResponseClassifier.Classification classification = classifier.classify(response);
        switch (classification.verdict()) {
            case DELIVERED -> {
                breaker.recordSuccess();
                logger.fine(() -> "Delivered job " + job.jobId() + " to destination " + destinationId
                        + " after " + attempts + " attempt(s)");
                job.complete(new DeliveryOutcome.Delivered(destinationId, attempts, response.statusCode()));
            }
            case RATE_LIMITED -> {
                breaker.recordNeutral();
                long delayMs = classification.retryAfter().map(Duration::toMillis).orElse(-1L);
                onRateLimited(job, attempts, delayMs, classification.message());
            }
            case PERMANENT -> {
                breaker.recordNeutral();
                logger.severe("Destination " + destinationId + " (" + WebhookUrls.redact(destination.webhookUrl())
                        + ") rejected job " + job.jobId() + ": " + classification.message());
                job.complete(new DeliveryOutcome.Failed(destinationId, ErrorKind.PERMANENT, attempts, classification.message()));
            }
            case TRANSIENT -> {
                breaker.recordFailure();
                onTransient(job, attempts, classification.message());
            }
            default -> throw new IllegalStateException("Unknown verdict " + classification.verdict());
        }
    }

    private void onTransient(DeliveryJob job, int attempts, String message) {
        if (attempts < maxAttempts) {
            scheduleRetry(job, retryPolicy.computeDelayMs(attempts), message);
        } else {
            logger.severe("Delivery to destination " + job.destinationId() + " failed after "
                    + attempts + " attempts: " + message);
            job.complete(new DeliveryOutcome.Failed(job.destinationId(), ErrorKind.TRANSIENT, attempts, message));
        }
    }

    private void onRateLimited(DeliveryJob job, int attempts, long requestedDelayMs, String message) {
        stats.recordRateLimited(job.destinationId());
        logger.warning("Destination " + job.destinationId() + " rate limited job " + job.jobId()
                + (requestedDelayMs >= 0 ? "; retry after " + requestedDelayMs + " ms" : ""));
        if (attempts < maxAttempts) {
            long delayMs = requestedDelayMs >= 0 ? requestedDelayMs : retryPolicy.computeDelayMs(attempts);
            scheduleRetry(job, delayMs, message);
        } else {
            job.complete(new DeliveryOutcome.Failed(job.destinationId(), ErrorKind.RATE_LIMITED, attempts, message));
        }
    }

    private void scheduleRetry(DeliveryJob job, long delayMs, String reason) {
        job.notBefore(clock.instant().plusMillis(delayMs));
        stats.recordRetry(job.destinationId());
        logger.fine(() -> "Retrying job " + job.jobId() + " in " + delayMs + " ms: " + reason);
        synchronized (scheduledRetries) {
            if (!accepting.get()) {
                job.complete(new DeliveryOutcome.Dropped(job.destinationId(), ErrorKind.SHUTDOWN, job.attempts(),
                        "dispatcher closed before retry"));
                return;
            }
            ScheduledFuture<?> future = retryScheduler.schedule(() -> releaseRetry(job), delayMs, TimeUnit.MILLISECONDS);
            scheduledRetries.put(job, future);
        }
    }

    private void releaseRetry(DeliveryJob job) {
        scheduledRetries.remove(job);
        if (!retryQueue.offer(job)) {
            dropBackpressure(job, "retry queue full");
        }
        metrics.recordQueueDepths(mainQueue.size(), retryQueue.size());
    }

    /**
     * Initiates graceful shutdown: stops accepting jobs, completes jobs still waiting for a
     * retry as {@link ErrorKind#SHUTDOWN}, drains the queues within the drain timeout, then
     * shuts down worker threads. Jobs left after a forced shutdown are completed as
     * {@link ErrorKind#SHUTDOWN}.
     */
    @Override
    public void close() {
        List<DeliveryJob> cancelled = new ArrayList<>();
        synchronized (scheduledRetries) {
            if (!accepting.getAndSet(false)) {
                return;
            }
            scheduledRetries.forEach((job, future) -> {
                future.cancel(false);
                cancelled.add(job);
            });
            scheduledRetries.clear();
        }
        retryScheduler.shutdownNow();
        for (DeliveryJob job : cancelled) {
            job.complete(new DeliveryOutcome.Dropped(job.destinationId(), ErrorKind.SHUTDOWN, job.attempts(),
                    "dispatcher closed before retry"));
        }

        running.set(false);
        workers.shutdown();
        try {
            if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
                logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown. "
                        + "Main remaining: " + mainQueue.size() + ", Retry remaining: " + retryQueue.size());
                workers.shutdownNow();
                workers.awaitTermination(5, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        abandon(mainQueue);
        abandon(retryQueue);
    }

    private void abandon(BlockingQueue<DeliveryJob> queue) {
        List<DeliveryJob> left = new ArrayList<>();
        queue.drainTo(left);
        for (DeliveryJob job : left) {
            job.complete(new DeliveryOutcome.Dropped(job.destinationId(), ErrorKind.SHUTDOWN, job.attempts(),
                    "dispatcher closed"));
        }
    }

    /** Builder for {@link DeliveryDispatcher}. */
    public static final class Builder {
        private WebhookTransport transport;
        private CircuitBreakerRegistry circuitBreakers;
        private RetryPolicy retryPolicy;
        private RelayStats stats;
        private Clock clock;
        private int maxAttempts = 3;
        private int workerCount = 3;
        private int queueCapacity = 1000;
        private int retryQueueCapacity = 1000;
        private Duration requestTimeout = Duration.ofSeconds(60);
        private long drainTimeoutMs = 5000;

        private Builder() {}

        /**
         * Sets the transport used for every attempt.
         *
         * <p><b>Required.</b>
         *
         * @param transport the webhook transport
         * @return this builder
         */
        public Builder transport(WebhookTransport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * Sets the circuit breaker registry.
         *
         * <p>Optional. Defaults to a threshold of 5 failures and a 60 second recovery timeout.
         *
         * @param circuitBreakers the registry
         * @return this builder
         */
        public Builder circuitBreakers(CircuitBreakerRegistry circuitBreakers) {
            this.circuitBreakers = circuitBreakers;
            return this;
        }

        /**
         * Sets the retry policy for transient failures.
         *
         * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with
         * {@code baseDelayMs=1000}, {@code maxDelayMs=30000} and {@code jitter=0.5}.
         *
         * @param retryPolicy the retry policy
         * @return this builder
         */
        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        /**
         * Sets the stats aggregator that receives retry and rate-limit counts. Its
         * {@link MetricsExporter} also receives queue depths and attempt latency.
         *
         * <p>Optional. Defaults to a private {@link RelayStats} with no exporter.
         *
         * @param stats the stats aggregator
         * @return this builder
         */
        public Builder stats(RelayStats stats) {
            this.stats = stats;
            return this;
        }

        /**
         * Sets the clock used for retry timestamps and, when no registry is given, circuit breakers.
         *
         * <p>Optional. Defaults to {@link Clock#systemUTC()}.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Sets the maximum number of HTTP attempts per job, rate-limited attempts included.
         *
         * <p>Optional. Defaults to {@code 3}. Must be &ge; 1.
         *
         * @param maxAttempts maximum attempts per job
         * @return this builder
         */
        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * Sets the number of worker threads.
         *
         * <p>Optional. Defaults to {@code 3}. Must be &ge; 1.
         *
         * @param workerCount number of delivery worker threads
         * @return this builder
         */
        public Builder workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        /**
         * Sets the capacity of the queue for jobs awaiting their first attempt.
         *
         * <p>Optional. Defaults to {@code 1000}. Must be &gt; 0.
         *
         * @param queueCapacity maximum number of queued new jobs
         * @return this builder
         */
        public Builder queueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        /**
         * Sets the capacity of the queue for retries that are due.
         *
         * <p>Optional. Defaults to {@code 1000}. Must be &gt; 0.
         *
         * @param retryQueueCapacity maximum number of due retries
         * @return this builder
         */
        public Builder retryQueueCapacity(int retryQueueCapacity) {
            this.retryQueueCapacity = retryQueueCapacity;
            return this;
        }

        /**
         * Sets the timeout of a single HTTP attempt.
         *
         * <p>Optional. Defaults to 60 seconds.
         *
         * @param requestTimeout per-request timeout
         * @return this builder
         */
        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        /**
         * Sets the maximum time in milliseconds to wait for queued jobs during shutdown.
         *
         * <p>Optional. Defaults to {@code 5000} ms.
         *
         * @param drainTimeoutMs drain timeout in milliseconds
         * @return this builder
         */
        public Builder drainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
            return this;
        }

        /**
         * Builds and starts the dispatcher. Worker threads begin draining queues immediately.
         *
         * @return a new {@link DeliveryDispatcher}
         * @throws NullPointerException     if {@code transport} is null
         * @throws IllegalArgumentException if a count, capacity or timeout is out of range
         */
        public DeliveryDispatcher build() {
            return new DeliveryDispatcher(this);
        }
    }
}

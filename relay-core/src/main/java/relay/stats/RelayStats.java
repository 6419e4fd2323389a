package relay.stats;

import relay.delivery.DeliveryOutcome;
import relay.delivery.ErrorKind;
import relay.model.MediaKind;
import relay.spi.MetricsExporter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Process-wide relay counters.
 *
 * <p>All record methods are lock-free ({@link LongAdder}) and forward to the configured
 * {@link MetricsExporter}. {@link #snapshot()} never blocks writers. {@link #reset()} zeroes
 * the local counters and restarts the uptime clock; exported metrics are cumulative and are
 * not reset.
 */
public final class RelayStats {
    private final MetricsExporter metrics;
    private final Clock clock;

    private final LongAdder seen = new LongAdder();
    private final LongAdder replicated = new LongAdder();
    private final Map<MediaKind, LongAdder> media = new EnumMap<>(MediaKind.class);
    private final LongAdder watermarks = new LongAdder();
    private final LongAdder errors = new LongAdder();
    private final LongAdder retries = new LongAdder();
    private final LongAdder failures = new LongAdder();
    private final LongAdder circuitDrops = new LongAdder();
    private final LongAdder backpressureDrops = new LongAdder();
    private final LongAdder rateLimited = new LongAdder();
    private final ConcurrentMap<String, Counters> destinations = new ConcurrentHashMap<>();

    private volatile Instant startedAt;

    public RelayStats() {
        this(MetricsExporter.NOOP, Clock.systemUTC());
    }

    public RelayStats(MetricsExporter metrics) {
        this(metrics, Clock.systemUTC());
    }

    public RelayStats(MetricsExporter metrics, Clock clock) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        for (MediaKind kind : MediaKind.values()) {
            media.put(kind, new LongAdder());
        }
        this.startedAt = clock.instant();
    }

    public MetricsExporter metrics() {
        return metrics;
    }

    public void recordSeen() {
        seen.increment();
        metrics.incrementMessagesSeen();
    }

    public void recordReplicated(String destinationId) {
        replicated.increment();
        counters(destinationId).delivered.increment();
        metrics.incrementMessagesReplicated(destinationId);
    }

    public void recordMediaProcessed(MediaKind kind) {
        media.get(kind).increment();
        metrics.incrementMediaProcessed(kind);
    }

    public void recordWatermark() {
        watermarks.increment();
        metrics.incrementWatermarksApplied();
    }

    public void recordError() {
        errors.increment();
        metrics.incrementErrors();
    }

    public void recordDeliveryFailure(String destinationId, ErrorKind kind) {
        failures.increment();
        counters(destinationId).failed.increment();
        metrics.incrementDeliveryFailure(destinationId, kind);
    }

    public void recordCircuitDrop(String destinationId) {
        circuitDrops.increment();
        counters(destinationId).circuitDrops.increment();
        metrics.incrementCircuitDropped();
    }

    public void recordBackpressureDrop(String destinationId) {
        backpressureDrops.increment();
        counters(destinationId).backpressureDrops.increment();
        metrics.incrementBackpressureDropped();
    }

    public void recordRetry(String destinationId) {
        retries.increment();
        counters(destinationId).retries.increment();
        metrics.incrementDeliveryRetry();
    }

    public void recordRateLimited(String destinationId) {
        rateLimited.increment();
        counters(destinationId).rateLimited.increment();
        metrics.incrementRateLimited();
    }

    /**
     * Records the terminal outcome of a delivery job in the matching counter.
     */
    public void recordOutcome(DeliveryOutcome outcome) {
        String id = outcome.destinationId();
        if (outcome instanceof DeliveryOutcome.Delivered) {
            recordReplicated(id);
        } else if (outcome instanceof DeliveryOutcome.Failed failed) {
            recordDeliveryFailure(id, failed.kind());
        } else if (outcome instanceof DeliveryOutcome.Dropped dropped) {
            switch (dropped.kind()) {
                case CIRCUIT_OPEN -> recordCircuitDrop(id);
                case BACKPRESSURE -> recordBackpressureDrop(id);
                default -> recordDeliveryFailure(id, dropped.kind());
            }
        }
    }

    public StatsSnapshot snapshot() {
        Map<MediaKind, Long> mediaCounts = new EnumMap<>(MediaKind.class);
        media.forEach((kind, adder) -> mediaCounts.put(kind, adder.sum()));
        Map<String, DestinationStats> perDestination = new HashMap<>();
        destinations.forEach((id, c) -> perDestination.put(id, c.toStats(id)));
        Instant started = startedAt;
        Duration uptime = Duration.between(started, clock.instant());
        return new StatsSnapshot(
                seen.sum(),
                replicated.sum(),
                mediaCounts,
                watermarks.sum(),
                errors.sum(),
                retries.sum(),
                failures.sum(),
                circuitDrops.sum(),
                backpressureDrops.sum(),
                rateLimited.sum(),
                perDestination,
                started,
                uptime.isNegative() ? Duration.ZERO : uptime);
    }

    public void reset() {
        seen.reset();
        replicated.reset();
        media.values().forEach(LongAdder::reset);
        watermarks.reset();
        errors.reset();
        retries.reset();
        failures.reset();
        circuitDrops.reset();
        backpressureDrops.reset();
        rateLimited.reset();
        destinations.clear();
        startedAt = clock.instant();
    }

    private Counters counters(String destinationId) {
        return destinations.computeIfAbsent(destinationId, id -> new Counters());
    }

    private static final class Counters {
        final LongAdder delivered = new LongAdder();
        final LongAdder failed = new LongAdder();
        final LongAdder circuitDrops = new LongAdder();
        final LongAdder backpressureDrops = new LongAdder();
        final LongAdder retries = new LongAdder();
        final LongAdder rateLimited = new LongAdder();

        DestinationStats toStats(String id) {
            return new DestinationStats(id, delivered.sum(), failed.sum(), circuitDrops.sum(),
                    backpressureDrops.sum(), retries.sum(), rateLimited.sum());
        }
    }
}

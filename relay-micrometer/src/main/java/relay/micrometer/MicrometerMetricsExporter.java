package relay.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import relay.delivery.ErrorKind;
import relay.model.MediaKind;
import relay.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters, gauges and a distribution summary with a {@link MeterRegistry} for
 * export to Prometheus, Grafana, Datadog, and other monitoring backends. Destination ids are
 * not used as tags so that meter cardinality stays bounded.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code relay.messages.seen}: source messages observed</li>
 *   <li>{@code relay.messages.replicated}: deliveries accepted by a destination</li>
 *   <li>{@code relay.media.processed{kind}}: media attachments processed</li>
 *   <li>{@code relay.watermarks.applied}: payloads that received a watermark</li>
 *   <li>{@code relay.errors}: internal errors</li>
 *   <li>{@code relay.delivery.failure{kind}}: deliveries that ended without success</li>
 *   <li>{@code relay.delivery.retry}: scheduled retries</li>
 *   <li>{@code relay.delivery.dropped.circuit}: deliveries dropped by an open circuit</li>
 *   <li>{@code relay.delivery.dropped.backpressure}: deliveries dropped by a full queue</li>
 *   <li>{@code relay.delivery.rate_limited}: rate-limit responses</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code relay.queue.depth}: jobs waiting for their first attempt</li>
 *   <li>{@code relay.queue.retry.depth}: due retries waiting for a worker</li>
 * </ul>
 *
 * <h3>Summary</h3>
 * <ul>
 *   <li>{@code relay.delivery.latency.ms}: duration of each HTTP attempt</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter messagesSeen;
  private final Counter messagesReplicated;
  private final Map<MediaKind, Counter> mediaProcessed = new EnumMap<>(MediaKind.class);
  private final Counter watermarksApplied;
  private final Counter errors;
  private final Map<ErrorKind, Counter> deliveryFailures = new EnumMap<>(ErrorKind.class);
  private final Counter deliveryRetries;
  private final Counter circuitDropped;
  private final Counter backpressureDropped;
  private final Counter rateLimited;
  private final Gauge queueDepthGauge;
  private final Gauge retryDepthGauge;
  private final DistributionSummary latency;

  private final AtomicInteger queueDepth = new AtomicInteger();
  private final AtomicInteger retryDepth = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "relay"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "relay");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "news.relay"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.messagesSeen = Counter.builder(namePrefix + ".messages.seen")
        .description("Source messages observed")
        .register(registry);
    this.messagesReplicated = Counter.builder(namePrefix + ".messages.replicated")
        .description("Deliveries accepted by a destination")
        .register(registry);
    for (MediaKind kind : MediaKind.values()) {
      mediaProcessed.put(kind, Counter.builder(namePrefix + ".media.processed")
          .description("Media attachments processed")
          .tag("kind", tagValue(kind))
          .register(registry));
    }
    this.watermarksApplied = Counter.builder(namePrefix + ".watermarks.applied")
        .description("Payloads that received a watermark")
        .register(registry);
    this.errors = Counter.builder(namePrefix + ".errors")
        .description("Internal errors (transform failures, loop errors)")
        .register(registry);
    for (ErrorKind kind : ErrorKind.values()) {
      deliveryFailures.put(kind, Counter.builder(namePrefix + ".delivery.failure")
          .description("Deliveries that ended without success")
          .tag("kind", tagValue(kind))
          .register(registry));
    }
    this.deliveryRetries = Counter.builder(namePrefix + ".delivery.retry")
        .description("Scheduled delivery retries")
        .register(registry);
    this.circuitDropped = Counter.builder(namePrefix + ".delivery.dropped.circuit")
        .description("Deliveries dropped because the circuit was open")
        .register(registry);
    this.backpressureDropped = Counter.builder(namePrefix + ".delivery.dropped.backpressure")
        .description("Deliveries dropped because the queue was full")
        .register(registry);
    this.rateLimited = Counter.builder(namePrefix + ".delivery.rate_limited")
        .description("Rate-limit responses received")
        .register(registry);

    this.queueDepthGauge = Gauge.builder(namePrefix + ".queue.depth", queueDepth, AtomicInteger::get)
        .register(registry);
    this.retryDepthGauge = Gauge.builder(namePrefix + ".queue.retry.depth", retryDepth, AtomicInteger::get)
        .register(registry);
    this.latency = DistributionSummary.builder(namePrefix + ".delivery.latency.ms")
        .description("Duration of each webhook attempt")
        .baseUnit("milliseconds")
        .register(registry);
  }

  private static String tagValue(Enum<?> value) {
    return value.name().toLowerCase(Locale.ROOT);
  }

  @Override
  public void incrementMessagesSeen() {
    if (closed) return;
    messagesSeen.increment();
  }

  @Override
  public void incrementMessagesReplicated(String destinationId) {
    if (closed) return;
    messagesReplicated.increment();
  }

  @Override
  public void incrementMediaProcessed(MediaKind kind) {
    if (closed) return;
    mediaProcessed.get(kind).increment();
  }

  @Override
  public void incrementWatermarksApplied() {
    if (closed) return;
    watermarksApplied.increment();
  }

  @Override
  public void incrementErrors() {
    if (closed) return;
    errors.increment();
  }

  @Override
  public void incrementDeliveryFailure(String destinationId, ErrorKind kind) {
    if (closed) return;
    deliveryFailures.get(kind).increment();
  }

  @Override
  public void incrementDeliveryRetry() {
    if (closed) return;
    deliveryRetries.increment();
  }

  @Override
  public void incrementCircuitDropped() {
    if (closed) return;
    circuitDropped.increment();
  }

  @Override
  public void incrementBackpressureDropped() {
    if (closed) return;
    backpressureDropped.increment();
  }

  @Override
  public void incrementRateLimited() {
    if (closed) return;
    rateLimited.increment();
  }

  @Override
  public void recordQueueDepths(int mainDepth, int retryDepth) {
    if (closed) return;
    this.queueDepth.set(mainDepth);
    this.retryDepth.set(retryDepth);
  }

  @Override
  public void recordDeliveryLatencyMs(long latencyMs) {
    if (closed) return;
    latency.record(latencyMs);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Called by {@link relay.Relay#close()} so that stale gauges do not outlive the relay.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(messagesSeen, messagesReplicated, watermarksApplied,
        errors, deliveryRetries, circuitDropped, backpressureDropped, rateLimited,
        queueDepthGauge, retryDepthGauge, latency));
    meters.addAll(mediaProcessed.values());
    meters.addAll(deliveryFailures.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}

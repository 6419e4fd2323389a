package relay.spi;

import relay.delivery.ErrorKind;
import relay.model.MediaKind;

/**
 * Observability hook for exporting relay counters and gauges to a metrics backend.
 *
 * <p>{@link relay.stats.RelayStats} forwards every recorded event here, and the delivery
 * dispatcher reports its queue depths and per-attempt latency. The {@link #NOOP}
 * instance discards everything. Implement this interface to bridge into Micrometer
 * or another monitoring system.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of source messages observed by the ingestion loop.
     */
    void incrementMessagesSeen();

    /**
     * Increments the count of messages delivered to a destination.
     *
     * @param destinationId the destination that accepted the message
     */
    void incrementMessagesReplicated(String destinationId);

    /**
     * Increments the count of media attachments processed, by kind.
     *
     * @param kind the media kind
     */
    void incrementMediaProcessed(MediaKind kind);

    /**
     * Increments the count of payloads that received a watermark.
     */
    void incrementWatermarksApplied();

    /**
     * Increments the count of internal errors (transform failures, loop errors).
     */
    void incrementErrors();

    /**
     * Increments the count of deliveries that ended without success.
     *
     * @param destinationId the destination
     * @param kind          why the delivery ended
     */
    void incrementDeliveryFailure(String destinationId, ErrorKind kind);

    /**
     * Increments the count of scheduled delivery retries.
     */
    default void incrementDeliveryRetry() {
    }

    /**
     * Increments the count of deliveries dropped because the destination's circuit was open.
     */
    default void incrementCircuitDropped() {
    }

    /**
     * Increments the count of deliveries dropped because the delivery queue was full.
     */
    default void incrementBackpressureDropped() {
    }

    /**
     * Increments the count of rate-limit responses received from destinations.
     */
    default void incrementRateLimited() {
    }

    /**
     * Records the current depth of both delivery queues.
     *
     * @param mainDepth  number of jobs waiting for their first attempt
     * @param retryDepth number of due retries waiting for a worker
     */
    void recordQueueDepths(int mainDepth, int retryDepth);

    /**
     * Records the time spent on one HTTP attempt.
     *
     * @param latencyMs latency in milliseconds (always non-negative)
     */
    default void recordDeliveryLatencyMs(long latencyMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementMessagesSeen() {
        }

        @Override
        public void incrementMessagesReplicated(String destinationId) {
        }

        @Override
        public void incrementMediaProcessed(MediaKind kind) {
        }

        @Override
        public void incrementWatermarksApplied() {
        }

        @Override
        public void incrementErrors() {
        }

        @Override
        public void incrementDeliveryFailure(String destinationId, ErrorKind kind) {
        }

        @Override
        public void recordQueueDepths(int mainDepth, int retryDepth) {
        }
    }
}

package relay.stats;

/**
 * Delivery counters for one destination.
 *
 * @param delivered     jobs the destination accepted
 * @param failed        jobs that ended in a failure after attempts (or a local rejection)
 * @param circuitDrops  jobs dropped because the circuit was open
 * @param retries       retries scheduled
 * @param rateLimited   rate-limit answers received
 */
public record DestinationStats(String destinationId, long delivered, long failed, long circuitDrops,
                               long backpressureDrops, long retries, long rateLimited) {

    /**
     * Share of finished jobs that were delivered, in {@code [0, 1]}; 0 when nothing finished.
     */
    public double successRate() {
        long finished = delivered + failed + circuitDrops + backpressureDrops;
        return finished == 0 ? 0.0 : (double) delivered / finished;
    }
}

package relay.stats;

import relay.model.MediaKind;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time copy of the relay counters. Individual counters are read without locking,
 * so a snapshot taken under load is consistent per counter, not across counters.
 */
public record StatsSnapshot(
        long messagesSeen,
        long messagesReplicated,
        Map<MediaKind, Long> mediaProcessed,
        long watermarksApplied,
        long errors,
        long deliveryRetries,
        long deliveryFailures,
        long circuitDrops,
        long backpressureDrops,
        long rateLimited,
        Map<String, DestinationStats> destinations,
        Instant startedAt,
        Duration uptime) {

    public StatsSnapshot {
        mediaProcessed = Map.copyOf(mediaProcessed);
        destinations = Map.copyOf(destinations);
    }

    public long mediaProcessed(MediaKind kind) {
        return mediaProcessed.getOrDefault(kind, 0L);
    }

    public DestinationStats destination(String destinationId) {
        DestinationStats stats = destinations.get(destinationId);
        return stats != null ? stats : new DestinationStats(destinationId, 0, 0, 0, 0, 0, 0);
    }

    /**
     * Overall share of messages seen that reached at least one destination, in {@code [0, 1]}.
     */
    public double replicationRate() {
        return messagesSeen == 0 ? 0.0 : Math.min(1.0, (double) messagesReplicated / messagesSeen);
    }
}

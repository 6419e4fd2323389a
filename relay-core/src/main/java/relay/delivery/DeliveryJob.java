package relay.delivery;

import relay.model.DestinationConfig;
import relay.model.OutboundPayload;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * One payload bound for one destination, owned by the {@link DeliveryDispatcher} from
 * enqueue until its future completes. The destination is a snapshot taken at enqueue time.
 *
 * <p>Mutable fields are only touched by the worker currently holding the job.
 */
public final class DeliveryJob {
    private final String jobId;
    private final DestinationConfig destination;
    private final OutboundPayload payload;
    private final CompletableFuture<DeliveryOutcome> result = new CompletableFuture<>();

    private volatile int attempts;
    private volatile Instant notBefore;
    private volatile DeliveryState state = DeliveryState.PENDING;

    DeliveryJob(DestinationConfig destination, OutboundPayload payload) {
        this.jobId = UUID.randomUUID().toString();
        this.destination = Objects.requireNonNull(destination, "destination");
        this.payload = Objects.requireNonNull(payload, "payload");
    }

    public String jobId() {
        return jobId;
    }

    public DestinationConfig destination() {
        return destination;
    }

    public String destinationId() {
        return destination.destinationId();
    }

    public OutboundPayload payload() {
        return payload;
    }

    public int attempts() {
        return attempts;
    }

    public Instant notBefore() {
        return notBefore;
    }

    public DeliveryState state() {
        return state;
    }

    CompletableFuture<DeliveryOutcome> result() {
        return result;
    }

    int incrementAttempts() {
        return ++attempts;
    }

    void notBefore(Instant notBefore) {
        this.notBefore = notBefore;
    }

    /**
     * Completes the job. Only the first completion wins.
     *
     * @return {@code true} if this call completed the job
     */
    synchronized boolean complete(DeliveryOutcome outcome) {
        if (result.isDone()) {
            return false;
        }
        state = outcome.state();
        return result.complete(outcome);
    }

    @Override
    public String toString() {
        return "DeliveryJob{jobId=" + jobId + ", destinationId=" + destinationId()
                + ", attempts=" + attempts + ", state=" + state + '}';
    }
}

package relay.delivery;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Per-destination circuit breaker.
 *
 * <p>CLOSED until {@code failureThreshold} consecutive failures, then OPEN. While OPEN every
 * {@link #tryAcquire()} is refused until {@code recoveryTimeout} has elapsed since opening;
 * the first caller after that moves the breaker to HALF_OPEN and holds the only trial permit.
 * A successful trial closes the breaker, a failed one reopens it. {@link #recordNeutral()}
 * hands the trial permit back without changing state (used for 4xx and 429 answers).
 *
 * <p>All transitions happen under this object's monitor.
 */
public final class CircuitBreaker {
    private static final Logger logger = Logger.getLogger(CircuitBreaker.class.getName());

    private final String destinationId;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private Instant openedAt;
    private boolean trialInFlight;

    public CircuitBreaker(String destinationId, int failureThreshold, Duration recoveryTimeout, Clock clock) {
        this.destinationId = Objects.requireNonNull(destinationId, "destinationId");
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        Objects.requireNonNull(recoveryTimeout, "recoveryTimeout");
        if (recoveryTimeout.isNegative()) {
            throw new IllegalArgumentException("recoveryTimeout must be >= 0");
        }
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Asks for permission to send one request.
     *
     * @return {@code true} if the caller may send
     */
    public synchronized boolean tryAcquire() {
        switch (state) {
            case CLOSED:
                return true;
            case OPEN:
                if (Duration.between(openedAt, clock.instant()).compareTo(recoveryTimeout) < 0) {
                    return false;
                }
                state = CircuitState.HALF_OPEN;
                trialInFlight = true;
                logger.info("Circuit half-open for destination " + destinationId + "; sending trial request");
                return true;
            case HALF_OPEN:
                if (trialInFlight) {
                    return false;
                }
                trialInFlight = true;
                return true;
            default:
                throw new IllegalStateException("Unknown state " + state);
        }
    }

    public synchronized void recordSuccess() {
        if (state != CircuitState.CLOSED) {
            logger.info("Circuit closed for destination " + destinationId);
        }
        state = CircuitState.CLOSED;
        consecutiveFailures = 0;
        openedAt = null;
        trialInFlight = false;
    }

    public synchronized void recordFailure() {
        consecutiveFailures++;
        if (state == CircuitState.HALF_OPEN) {
            open();
        } else if (state == CircuitState.CLOSED && consecutiveFailures >= failureThreshold) {
            open();
        }
    }

    /** The endpoint answered but the answer says nothing about its health. */
    public synchronized void recordNeutral() {
        if (state == CircuitState.HALF_OPEN) {
            trialInFlight = false;
        }
    }

    private void open() {
        state = CircuitState.OPEN;
        openedAt = clock.instant();
        trialInFlight = false;
        logger.warning("Circuit opened for destination " + destinationId + " after "
                + consecutiveFailures + " consecutive failures; recovery in " + recoveryTimeout);
    }

    /**
     * Returns the current state. An OPEN breaker whose recovery timeout has elapsed is still
     * reported as OPEN until the next {@link #tryAcquire()}.
     */
    public synchronized CircuitState state() {
        return state;
    }

    public synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(destinationId, state, consecutiveFailures, openedAt);
    }

    public String destinationId() {
        return destinationId;
    }

    /**
     * Point-in-time view of a breaker.
     *
     * @param openedAt when the breaker last opened, or {@code null} when closed
     */
    public record Snapshot(String destinationId, CircuitState state, int consecutiveFailures, Instant openedAt) {

        public static Snapshot closed(String destinationId) {
            return new Snapshot(destinationId, CircuitState.CLOSED, 0, null);
        }
    }
}

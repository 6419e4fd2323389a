package relay.delivery;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Lazily creates one {@link CircuitBreaker} per destination. Breakers live in memory only.
 */
public final class CircuitBreakerRegistry {
    private final ConcurrentMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final Clock clock;

    public CircuitBreakerRegistry(int failureThreshold, Duration recoveryTimeout, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = Objects.requireNonNull(recoveryTimeout, "recoveryTimeout");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public CircuitBreakerRegistry(int failureThreshold, Duration recoveryTimeout) {
        this(failureThreshold, recoveryTimeout, Clock.systemUTC());
    }

    public CircuitBreaker forDestination(String destinationId) {
        return breakers.computeIfAbsent(destinationId,
                id -> new CircuitBreaker(id, failureThreshold, recoveryTimeout, clock));
    }

    public Optional<CircuitBreaker> find(String destinationId) {
        return Optional.ofNullable(breakers.get(destinationId));
    }

    /** Forgets a destination's breaker, e.g. after the destination was deleted. */
    public void remove(String destinationId) {
        breakers.remove(destinationId);
    }
}

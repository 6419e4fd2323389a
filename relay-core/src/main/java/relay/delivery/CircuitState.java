package relay.delivery;

/** States of a {@link CircuitBreaker}. */
public enum CircuitState {
    /** Requests flow; consecutive failures are counted. */
    CLOSED,
    /** Requests are refused until the recovery timeout elapses. */
    OPEN,
    /** One trial request is allowed through to test recovery. */
    HALF_OPEN
}

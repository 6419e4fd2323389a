package relay.delivery;

/** Lifecycle of a {@link DeliveryJob}. Every state except {@link #PENDING} is terminal. */
public enum DeliveryState {
    PENDING,
    DELIVERED,
    FAILED_PERMANENT,
    DROPPED_CIRCUIT_OPEN,
    DROPPED_BACKPRESSURE,
    DROPPED_SHUTDOWN;

    public boolean isTerminal() {
        return this != PENDING;
    }
}

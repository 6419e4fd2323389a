package relay;

import relay.delivery.CircuitState;

import java.time.Instant;

/**
 * Admin view of one destination's health.
 *
 * <p>{@code configured=false} means no stored config exists; {@code enabled=false} means the
 * destination is switched off. Both are independent of the circuit, so an open circuit on an
 * enabled destination reads differently from a disabled one.
 *
 * @param openedAt when the circuit last opened, or {@code null} if it never did
 * @param successRate share of finished deliveries that succeeded since the last stats reset
 */
public record DestinationHealth(
        String destinationId,
        boolean configured,
        boolean enabled,
        CircuitState circuitState,
        int consecutiveFailures,
        Instant openedAt,
        double successRate) {

    /** True when the destination is enabled and its circuit is not open. */
    public boolean accepting() {
        return configured && enabled && circuitState != CircuitState.OPEN;
    }

    public boolean circuitOpen() {
        return circuitState == CircuitState.OPEN;
    }
}

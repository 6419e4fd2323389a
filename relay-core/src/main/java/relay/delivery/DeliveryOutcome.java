package relay.delivery;

import java.util.Objects;

/**
 * Terminal result of one {@link DeliveryDispatcher#deliver} call.
 *
 * <ul>
 *   <li>{@link Delivered}: the destination accepted the payload (any 2xx).</li>
 *   <li>{@link Failed}: attempts were made (or the payload was rejected locally) and the job
 *       will not be retried.</li>
 *   <li>{@link Dropped}: the job was discarded without a final attempt (open circuit,
 *       full queue, shutdown).</li>
 * </ul>
 */
public sealed interface DeliveryOutcome
        permits DeliveryOutcome.Delivered, DeliveryOutcome.Failed, DeliveryOutcome.Dropped {

    String destinationId();

    /** Number of HTTP requests made for the job. */
    int attempts();

    DeliveryState state();

    default boolean isDelivered() {
        return this instanceof Delivered;
    }

    record Delivered(String destinationId, int attempts, int statusCode) implements DeliveryOutcome {
        public Delivered {
            Objects.requireNonNull(destinationId, "destinationId");
        }

        @Override
        public DeliveryState state() {
            return DeliveryState.DELIVERED;
        }
    }

    record Failed(String destinationId, ErrorKind kind, int attempts, String message)
            implements DeliveryOutcome {
        public Failed {
            Objects.requireNonNull(destinationId, "destinationId");
            Objects.requireNonNull(kind, "kind");
        }

        @Override
        public DeliveryState state() {
            return DeliveryState.FAILED_PERMANENT;
        }
    }

    record Dropped(String destinationId, ErrorKind kind, int attempts, String message)
            implements DeliveryOutcome {
        public Dropped {
            Objects.requireNonNull(destinationId, "destinationId");
            Objects.requireNonNull(kind, "kind");
        }

        @Override
        public DeliveryState state() {
            return switch (kind) {
                case CIRCUIT_OPEN -> DeliveryState.DROPPED_CIRCUIT_OPEN;
                case BACKPRESSURE -> DeliveryState.DROPPED_BACKPRESSURE;
                default -> DeliveryState.DROPPED_SHUTDOWN;
            };
        }
    }
}

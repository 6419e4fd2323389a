package relay.ingest;

/**
 * Lifecycle of an {@link IngestionLoop}: {@code IDLE -> LISTENING -> DISPATCHING -> LISTENING},
 * and {@code STOPPED} once stopped or when the source cannot be opened.
 */
public enum IngestionState {
    IDLE,
    LISTENING,
    DISPATCHING,
    STOPPED
}

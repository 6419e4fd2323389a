package relay.delivery;

/**
 * Why a delivery (or a step before it) did not succeed.
 */
public enum ErrorKind {
    /** Destination configuration is unusable (bad URL, missing overlay). */
    CONFIGURATION,
    /** Network error, timeout or 5xx; retried with backoff. */
    TRANSIENT,
    /** HTTP 429; retried no earlier than the indicated delay. */
    RATE_LIMITED,
    /** Non-429 4xx; never retried. */
    PERMANENT,
    /** Payload exceeds the destination's size ceiling; never sent. */
    PAYLOAD_TOO_LARGE,
    /** Media transform failed; the original payload was used instead. */
    TRANSFORM,
    /** Destination circuit was open; never sent. */
    CIRCUIT_OPEN,
    /** Delivery queue was full or closed. */
    BACKPRESSURE,
    /** Dispatcher shut down before the job finished. */
    SHUTDOWN
}

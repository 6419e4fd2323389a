package relay;

import java.time.Duration;
import java.util.Objects;

/**
 * Thrown by a {@link relay.webhook.WebhookTransport} when the destination answered with a
 * rate limit the transport recognized on its own, for example from a client library that
 * surfaces Discord's {@code retry_after} as an exception instead of a response.
 *
 * <p>The dispatcher handles it like an HTTP 429. The attempt counts against
 * {@code maxAttempts}, the circuit breaker is left alone, and {@link #retryAfter()}
 * replaces the backoff delay.
 */
public class RetryAfterException extends RuntimeException {

    private final Duration retryAfter;

    public RetryAfterException(Duration retryAfter) {
        this(retryAfter, null);
    }

    /**
     * @param retryAfter delay requested by the destination, zero or positive
     * @param reason     optional detail appended to the message
     */
    public RetryAfterException(Duration retryAfter, String reason) {
        super(describe(retryAfter, reason));
        this.retryAfter = retryAfter;
    }

    /**
     * Converts a fractional seconds value such as {@code 1.25} as sent in rate limit bodies.
     */
    public static RetryAfterException ofSeconds(double seconds) {
        if (Double.isNaN(seconds) || seconds < 0) {
            throw new IllegalArgumentException("retry delay must be zero or positive: " + seconds);
        }
        return new RetryAfterException(Duration.ofMillis(Math.round(seconds * 1000)));
    }

    public Duration retryAfter() {
        return retryAfter;
    }

    private static String describe(Duration retryAfter, String reason) {
        Objects.requireNonNull(retryAfter, "retryAfter");
        if (retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter must not be negative");
        }
        String message = "Rate limited, retry after " + retryAfter.toMillis() + " ms";
        return reason == null ? message : message + ": " + reason;
    }
}

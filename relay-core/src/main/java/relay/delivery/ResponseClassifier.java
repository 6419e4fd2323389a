package relay.delivery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import relay.webhook.WebhookResponse;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * Maps a webhook response onto what the dispatcher should do next.
 *
 * <p>2xx is delivered, 429 is rate limited, any other 4xx is permanent, everything else
 * (5xx, 1xx, 3xx) is transient. For 429 the delay is read from the {@code Retry-After}
 * header, then {@code X-RateLimit-Reset-After}, then the JSON body's {@code retry_after};
 * all three are in seconds and may carry a fraction.
 */
public final class ResponseClassifier {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** What to do with a response. */
    public enum Verdict {
        DELIVERED,
        RATE_LIMITED,
        PERMANENT,
        TRANSIENT
    }

    /**
     * @param retryAfter server-requested delay; only present for {@link Verdict#RATE_LIMITED}
     */
    public record Classification(Verdict verdict, Optional<Duration> retryAfter, String message) {
    }

    public Classification classify(WebhookResponse response) {
        int status = response.statusCode();
        if (response.isSuccess()) {
            return new Classification(Verdict.DELIVERED, Optional.empty(), "HTTP " + status);
        }
        if (status == 429) {
            return new Classification(Verdict.RATE_LIMITED, retryAfter(response), "HTTP 429");
        }
        if (status >= 400 && status < 500) {
            return new Classification(Verdict.PERMANENT, Optional.empty(), "HTTP " + status);
        }
        return new Classification(Verdict.TRANSIENT, Optional.empty(), "HTTP " + status);
    }

    static Optional<Duration> retryAfter(WebhookResponse response) {
        Optional<Duration> header = response.header("Retry-After").flatMap(ResponseClassifier::seconds);
        if (header.isPresent()) {
            return header;
        }
        Optional<Duration> reset = response.header("X-RateLimit-Reset-After").flatMap(ResponseClassifier::seconds);
        if (reset.isPresent()) {
            return reset;
        }
        return bodyRetryAfter(response.body());
    }

    private static Optional<Duration> bodyRetryAfter(String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = MAPPER.readTree(body).path("retry_after");
            if (node.isNumber()) {
                return ofSeconds(node.asDouble());
            }
            return Optional.empty();
        } catch (IOException e) {
            // not JSON; no hint
            return Optional.empty();
        }
    }

    private static Optional<Duration> seconds(String value) {
        try {
            return ofSeconds(Double.parseDouble(value.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Optional<Duration> ofSeconds(double seconds) {
        if (Double.isNaN(seconds) || seconds < 0) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofMillis((long) Math.ceil(seconds * 1000.0)));
    }
}

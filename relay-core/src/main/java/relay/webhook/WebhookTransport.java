package relay.webhook;

import relay.model.OutboundPayload;

import java.io.IOException;
import java.time.Duration;

/**
 * Sends one payload to one webhook endpoint. One call is exactly one HTTP request;
 * retrying is the caller's business.
 *
 * <p>Implementations must be thread-safe. A request that exceeds {@code timeout} fails with
 * {@link java.net.http.HttpTimeoutException} (an {@link IOException}). Implementations may
 * throw {@link relay.RetryAfterException} to ask the caller to back off.
 */
@FunctionalInterface
public interface WebhookTransport {

    /**
     * @param url      target webhook URL
     * @param payload  text and optional attachment
     * @param username display name override, or {@code null} to use the webhook's own
     * @param timeout  request timeout
     * @return the endpoint's response, whatever its status
     */
    WebhookResponse send(String url, OutboundPayload payload, String username, Duration timeout)
            throws IOException, InterruptedException;
}

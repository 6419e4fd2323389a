package relay.webhook;

/**
 * Result of probing a webhook URL.
 *
 * @param valid     true only when the endpoint answered HTTP 204
 * @param latencyMs round-trip time of the test message, or 0 when no request was sent
 * @param message   human-readable outcome
 */
public record WebhookValidation(boolean valid, long latencyMs, String message) {

    static WebhookValidation invalid(long latencyMs, String message) {
        return new WebhookValidation(false, latencyMs, message);
    }
}

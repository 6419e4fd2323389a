package relay.webhook;

import relay.ConfigValidationException;
import relay.model.OutboundPayload;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Checks a webhook URL before it is stored: shape check first, then one test message.
 *
 * <p>Only an HTTP 204 counts as valid. The validator never retries and is not used on the
 * delivery path.
 */
public final class WebhookValidator {
    private static final Logger logger = Logger.getLogger(WebhookValidator.class.getName());

    static final String TEST_MESSAGE_TEXT = "Webhook test from relay. This message confirms the destination is reachable.";
    static final String TEST_MESSAGE_USERNAME = "Relay Validator";

    private final WebhookTransport transport;
    private final WebhookUrlPolicy urlPolicy;
    private final Duration timeout;

    public WebhookValidator(WebhookTransport transport, WebhookUrlPolicy urlPolicy, Duration timeout) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.urlPolicy = Objects.requireNonNull(urlPolicy, "urlPolicy");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    public WebhookValidation validate(String url) {
        try {
            urlPolicy.check(url);
        } catch (ConfigValidationException e) {
            return WebhookValidation.invalid(0, e.getMessage());
        }

        long start = System.nanoTime();
        try {
            WebhookResponse response = transport.send(url, new OutboundPayload(TEST_MESSAGE_TEXT, null),
                    TEST_MESSAGE_USERNAME, timeout);
            long latencyMs = elapsedMs(start);
            if (response.statusCode() == 204) {
                return new WebhookValidation(true, latencyMs, "OK");
            }
            return WebhookValidation.invalid(latencyMs, "HTTP " + response.statusCode());
        } catch (HttpTimeoutException e) {
            return WebhookValidation.invalid(elapsedMs(start), "timed out after " + timeout.toSeconds() + "s");
        } catch (IOException e) {
            logger.log(Level.FINE, "Webhook validation request failed for " + WebhookUrls.redact(url), e);
            return WebhookValidation.invalid(elapsedMs(start), "connection failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return WebhookValidation.invalid(elapsedMs(start), "interrupted");
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Webhook validation request failed for " + WebhookUrls.redact(url), e);
            return WebhookValidation.invalid(elapsedMs(start), "test message failed: " + e.getMessage());
        }
    }

    private static long elapsedMs(long startNanos) {
        return Math.max(0L, (System.nanoTime() - startNanos) / 1_000_000L);
    }
}

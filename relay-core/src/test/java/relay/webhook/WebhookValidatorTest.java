package relay.webhook;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebhookValidatorTest {

    private static final String URL = "https://discord.com/api/webhooks/1/token";

    @Test
    void validOnlyOn204() {
        RecordingTransport transport = new RecordingTransport(204);
        WebhookValidator validator = new WebhookValidator(transport, WebhookUrlPolicy.discord(), Duration.ofSeconds(10));

        WebhookValidation result = validator.validate(URL);

        assertTrue(result.valid());
        assertEquals("OK", result.message());
        assertEquals(1, transport.callCount());
        assertEquals(WebhookValidator.TEST_MESSAGE_USERNAME, transport.calls().get(0).username());
        assertEquals(WebhookValidator.TEST_MESSAGE_TEXT, transport.calls().get(0).payload().text());
    }

    @Test
    void otherSuccessCodesAreNotValid() {
        WebhookValidator validator = new WebhookValidator(new RecordingTransport(200),
                WebhookUrlPolicy.discord(), Duration.ofSeconds(10));

        WebhookValidation result = validator.validate(URL);

        assertFalse(result.valid());
        assertEquals("HTTP 200", result.message());
    }

    @Test
    void errorStatusIsReported() {
        WebhookValidator validator = new WebhookValidator(new RecordingTransport(404),
                WebhookUrlPolicy.discord(), Duration.ofSeconds(10));

        assertEquals("HTTP 404", validator.validate(URL).message());
    }

    @Test
    void timeoutIsReportedWithConfiguredSeconds() {
        RecordingTransport transport = new RecordingTransport();
        transport.fallback(() -> {
            throw new HttpTimeoutException("request timed out");
        });
        WebhookValidator validator = new WebhookValidator(transport, WebhookUrlPolicy.discord(), Duration.ofSeconds(10));

        WebhookValidation result = validator.validate(URL);

        assertFalse(result.valid());
        assertEquals("timed out after 10s", result.message());
    }

    @Test
    void connectionFailureIsReported() {
        RecordingTransport transport = new RecordingTransport();
        transport.fallback(() -> {
            throw new IOException("connection refused");
        });
        WebhookValidator validator = new WebhookValidator(transport, WebhookUrlPolicy.discord(), Duration.ofSeconds(10));

        WebhookValidation result = validator.validate(URL);

        assertFalse(result.valid());
        assertTrue(result.message().contains("connection refused"));
    }

    @Test
    void malformedUrlIsRejectedWithoutRequest() {
        RecordingTransport transport = new RecordingTransport(204);
        WebhookValidator validator = new WebhookValidator(transport, WebhookUrlPolicy.discord(), Duration.ofSeconds(10));

        WebhookValidation result = validator.validate("https://example.com/hook");

        assertFalse(result.valid());
        assertEquals(0, result.latencyMs());
        assertEquals(0, transport.callCount());
    }
}

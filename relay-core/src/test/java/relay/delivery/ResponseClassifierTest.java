package relay.delivery;

import org.junit.jupiter.api.Test;
import relay.webhook.WebhookResponse;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ResponseClassifierTest {

    private final ResponseClassifier classifier = new ResponseClassifier();

    @Test
    void classifiesByStatus() {
        assertEquals(ResponseClassifier.Verdict.DELIVERED, classifier.classify(WebhookResponse.of(200)).verdict());
        assertEquals(ResponseClassifier.Verdict.DELIVERED, classifier.classify(WebhookResponse.of(204)).verdict());
        assertEquals(ResponseClassifier.Verdict.RATE_LIMITED, classifier.classify(WebhookResponse.of(429)).verdict());
        assertEquals(ResponseClassifier.Verdict.PERMANENT, classifier.classify(WebhookResponse.of(400)).verdict());
        assertEquals(ResponseClassifier.Verdict.PERMANENT, classifier.classify(WebhookResponse.of(404)).verdict());
        assertEquals(ResponseClassifier.Verdict.TRANSIENT, classifier.classify(WebhookResponse.of(500)).verdict());
        assertEquals(ResponseClassifier.Verdict.TRANSIENT, classifier.classify(WebhookResponse.of(503)).verdict());
    }

    @Test
    void retryAfterHeaderWins() {
        WebhookResponse response = new WebhookResponse(429,
                Map.of("Retry-After", List.of("2"), "X-RateLimit-Reset-After", List.of("5")),
                "{\"retry_after\": 9}");

        assertEquals(Optional.of(Duration.ofSeconds(2)), classifier.classify(response).retryAfter());
    }

    @Test
    void fallsBackToResetAfterHeader() {
        WebhookResponse response = new WebhookResponse(429,
                Map.of("X-RateLimit-Reset-After", List.of("1.25")), "");

        assertEquals(Optional.of(Duration.ofMillis(1250)), classifier.classify(response).retryAfter());
    }

    @Test
    void fallsBackToJsonBody() {
        WebhookResponse response = new WebhookResponse(429, Map.of(),
                "{\"message\": \"You are being rate limited.\", \"retry_after\": 0.5, \"global\": false}");

        assertEquals(Optional.of(Duration.ofMillis(500)), classifier.classify(response).retryAfter());
    }

    @Test
    void noHintWhenBodyIsNotJson() {
        WebhookResponse response = new WebhookResponse(429, Map.of("Retry-After", List.of("soon")), "<html>");

        assertEquals(Optional.empty(), classifier.classify(response).retryAfter());
    }
}

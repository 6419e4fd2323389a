package relay.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import relay.model.MediaAttachment;
import relay.model.OutboundPayload;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;

/**
 * {@link WebhookTransport} on top of {@link HttpClient}.
 *
 * <p>Text-only payloads are posted as {@code application/json} ({@code {"content": ...}}).
 * Payloads with an attachment are posted as {@code multipart/form-data} with a
 * {@code payload_json} part and a {@code files[0]} part.
 */
public final class HttpClientWebhookTransport implements WebhookTransport {
    public static final String USER_AGENT = "RelayBot (relay, 1.0)";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient httpClient;

    public HttpClientWebhookTransport() {
        this(HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build());
    }

    public HttpClientWebhookTransport(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    @Override
    public WebhookResponse send(String url, OutboundPayload payload, String username, Duration timeout)
            throws IOException, InterruptedException {
        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .header("User-Agent", USER_AGENT);

        String payloadJson = payloadJson(payload, username);
        if (payload.hasMedia()) {
            String boundary = "relay-" + UUID.randomUUID();
            request.header("Content-Type", "multipart/form-data; boundary=" + boundary)
                    .POST(HttpRequest.BodyPublishers.ofByteArray(
                            multipartBody(boundary, payloadJson, payload.media())));
        } else {
            request.header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(payloadJson, StandardCharsets.UTF_8));
        }

        HttpResponse<String> response = httpClient.send(request.build(),
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        return new WebhookResponse(response.statusCode(), response.headers().map(), response.body());
    }

    static String payloadJson(OutboundPayload payload, String username) throws JsonProcessingException {
        ObjectNode body = MAPPER.createObjectNode();
        if (payload.text() != null && !payload.text().isEmpty()) {
            body.put("content", payload.text());
        }
        if (username != null) {
            body.put("username", username);
        }
        return MAPPER.writeValueAsString(body);
    }

    static byte[] multipartBody(String boundary, String payloadJson, MediaAttachment media) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(media.size() + 512);
        String dash = "--" + boundary + "\r\n";

        write(out, dash);
        write(out, "Content-Disposition: form-data; name=\"payload_json\"\r\n");
        write(out, "Content-Type: application/json\r\n\r\n");
        write(out, payloadJson);
        write(out, "\r\n");

        write(out, dash);
        write(out, "Content-Disposition: form-data; name=\"files[0]\"; filename=\""
                + media.filename().replace("\"", "") + "\"\r\n");
        write(out, "Content-Type: " + media.contentType() + "\r\n\r\n");
        out.writeBytes(media.content());
        write(out, "\r\n");

        write(out, "--" + boundary + "--\r\n");
        return out.toByteArray();
    }

    private static void write(ByteArrayOutputStream out, String s) {
        out.writeBytes(s.getBytes(StandardCharsets.UTF_8));
    }
}

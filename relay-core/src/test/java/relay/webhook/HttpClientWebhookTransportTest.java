package relay.webhook;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import relay.model.MediaAttachment;
import relay.model.OutboundPayload;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpClientWebhookTransportTest {

    private HttpServer server;
    private final AtomicReference<String> contentType = new AtomicReference<>();
    private final AtomicReference<String> userAgent = new AtomicReference<>();
    private final AtomicReference<String> body = new AtomicReference<>();
    private volatile int status = 204;
    private volatile String retryAfter;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/webhooks/", exchange -> {
            contentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
            userAgent.set(exchange.getRequestHeaders().getFirst("User-Agent"));
            try (InputStream in = exchange.getRequestBody()) {
                body.set(new String(in.readAllBytes(), StandardCharsets.ISO_8859_1));
            }
            if (retryAfter != null) {
                exchange.getResponseHeaders().add("Retry-After", retryAfter);
            }
            if (status == 204) {
                exchange.sendResponseHeaders(204, -1);
            } else {
                byte[] reply = "{\"message\":\"nope\"}".getBytes(StandardCharsets.UTF_8);
                exchange.sendResponseHeaders(status, reply.length);
                try (OutputStream out = exchange.getResponseBody()) {
                    out.write(reply);
                }
            }
            exchange.close();
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private String url() {
        return "http://127.0.0.1:" + server.getAddress().getPort() + "/api/webhooks/1/token";
    }

    @Test
    void textPayloadIsPostedAsJson() throws Exception {
        HttpClientWebhookTransport transport = new HttpClientWebhookTransport();

        WebhookResponse response = transport.send(url(), new OutboundPayload("hello [relayed]", null),
                "Relay", Duration.ofSeconds(5));

        assertEquals(204, response.statusCode());
        assertEquals("application/json", contentType.get());
        assertEquals(HttpClientWebhookTransport.USER_AGENT, userAgent.get());
        assertEquals("{\"content\":\"hello [relayed]\",\"username\":\"Relay\"}", body.get());
    }

    @Test
    void mediaPayloadIsPostedAsMultipart() throws Exception {
        HttpClientWebhookTransport transport = new HttpClientWebhookTransport();
        MediaAttachment media = MediaAttachment.of("photo.jpg", new byte[] {1, 2, 3});

        transport.send(url(), new OutboundPayload("caption", media), null, Duration.ofSeconds(5));

        assertTrue(contentType.get().startsWith("multipart/form-data; boundary="));
        String received = body.get();
        assertTrue(received.contains("name=\"payload_json\""));
        assertTrue(received.contains("{\"content\":\"caption\"}"));
        assertTrue(received.contains("name=\"files[0]\"; filename=\"photo.jpg\""));
        assertTrue(received.contains("Content-Type: image/jpeg"));
    }

    @Test
    void errorResponsesAreReturnedNotThrown() throws Exception {
        status = 429;
        retryAfter = "3";
        HttpClientWebhookTransport transport = new HttpClientWebhookTransport();

        WebhookResponse response = transport.send(url(), new OutboundPayload("x", null), null, Duration.ofSeconds(5));

        assertEquals(429, response.statusCode());
        assertEquals("3", response.header("Retry-After").orElseThrow());
        assertTrue(response.body().contains("nope"));
    }

    @Test
    void payloadJsonOmitsMissingFields() throws Exception {
        MediaAttachment media = MediaAttachment.of("a.png", new byte[] {0});
        assertEquals("{}", HttpClientWebhookTransport.payloadJson(new OutboundPayload(null, media), null));
    }
}

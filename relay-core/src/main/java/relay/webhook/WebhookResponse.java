package relay.webhook;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Status, headers and body of one webhook response. Header lookup is case-insensitive.
 */
public record WebhookResponse(int statusCode, Map<String, List<String>> headers, String body) {

    public WebhookResponse {
        Objects.requireNonNull(headers, "headers");
        TreeMap<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.forEach((k, v) -> {
            if (k != null) {
                copy.put(k.toLowerCase(Locale.ROOT), List.copyOf(v));
            }
        });
        headers = copy;
        body = body == null ? "" : body;
    }

    public static WebhookResponse of(int statusCode) {
        return new WebhookResponse(statusCode, Map.of(), "");
    }

    public Optional<String> header(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}

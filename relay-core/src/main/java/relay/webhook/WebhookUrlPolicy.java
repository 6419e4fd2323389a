package relay.webhook;

import relay.ConfigValidationException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Objects;

/**
 * Shape check applied to every webhook URL before it is stored or validated.
 *
 * <p>A URL is accepted when it parses as an absolute URI with a host, starts with one of the
 * allowed prefixes, and carries a non-empty remainder (the webhook id and token) after it.
 */
public final class WebhookUrlPolicy {

    public static final List<String> DISCORD_PREFIXES = List.of(
            "https://discord.com/api/webhooks/",
            "https://discordapp.com/api/webhooks/",
            "https://ptb.discord.com/api/webhooks/",
            "https://canary.discord.com/api/webhooks/");

    private static final WebhookUrlPolicy DISCORD = new WebhookUrlPolicy(DISCORD_PREFIXES);

    private final List<String> allowedPrefixes;

    public WebhookUrlPolicy(List<String> allowedPrefixes) {
        Objects.requireNonNull(allowedPrefixes, "allowedPrefixes");
        if (allowedPrefixes.isEmpty()) {
            throw new IllegalArgumentException("allowedPrefixes must not be empty");
        }
        this.allowedPrefixes = List.copyOf(allowedPrefixes);
    }

    public static WebhookUrlPolicy discord() {
        return DISCORD;
    }

    public List<String> allowedPrefixes() {
        return allowedPrefixes;
    }

    public boolean isAllowed(String url) {
        return rejectionReason(url) == null;
    }

    /**
     * Verifies the URL shape.
     *
     * @throws ConfigValidationException with field {@code webhookUrl} if the URL is rejected
     */
    public void check(String url) {
        String reason = rejectionReason(url);
        if (reason != null) {
            throw new ConfigValidationException("webhookUrl", reason);
        }
    }

    private String rejectionReason(String url) {
        if (url == null || url.isBlank()) {
            return "webhook URL is required";
        }
        String trimmed = url.trim();
        URI uri;
        try {
            uri = new URI(trimmed);
        } catch (URISyntaxException e) {
            return "webhook URL is not a valid URI";
        }
        if (!uri.isAbsolute() || uri.getHost() == null) {
            return "webhook URL must be absolute";
        }
        for (String prefix : allowedPrefixes) {
            if (trimmed.startsWith(prefix)) {
                String rest = trimmed.substring(prefix.length());
                if (rest.isEmpty() || rest.equals("/")) {
                    return "webhook URL is missing the webhook id and token";
                }
                return null;
            }
        }
        return "webhook URL must start with one of " + allowedPrefixes;
    }
}

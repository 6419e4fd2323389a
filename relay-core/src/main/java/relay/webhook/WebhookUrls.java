package relay.webhook;

/**
 * Helpers for handling webhook URLs, which embed a secret token.
 */
public final class WebhookUrls {
    private static final String MASK = "****";

    private WebhookUrls() {
    }

    /**
     * Returns a loggable form of the URL: everything up to the webhook id is kept and the
     * trailing token segment is masked. URLs that do not look like {@code .../<id>/<token>}
     * keep only scheme and host.
     */
    public static String redact(String url) {
        if (url == null) {
            return "null";
        }
        int schemeEnd = url.indexOf("://");
        if (schemeEnd < 0) {
            return MASK;
        }
        int pathStart = url.indexOf('/', schemeEnd + 3);
        if (pathStart < 0) {
            return url;
        }
        String path = url.substring(pathStart);
        int marker = path.indexOf("/webhooks/");
        if (marker >= 0) {
            String rest = path.substring(marker + "/webhooks/".length());
            int slash = rest.indexOf('/');
            if (slash > 0) {
                return url.substring(0, pathStart) + path.substring(0, marker) + "/webhooks/"
                        + rest.substring(0, slash) + "/" + MASK;
            }
        }
        return url.substring(0, pathStart) + "/" + MASK;
    }
}

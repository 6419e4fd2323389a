package relay.store;

import relay.ConfigValidationException;
import relay.model.DestinationConfig;
import relay.webhook.WebhookUrlPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Reads bootstrap destinations from {@code WEBHOOK_<chatId>=<url>} variables.
 *
 * <p>Chat ids must be integers. Group ids on the source platform are negative, so an id
 * without a leading {@code -} gets one. Entries with a non-numeric id or a rejected URL are
 * skipped with a warning.
 */
public final class EnvironmentDestinations {
    private static final Logger logger = Logger.getLogger(EnvironmentDestinations.class.getName());

    public static final String PREFIX = "WEBHOOK_";

    private EnvironmentDestinations() {
    }

    public static List<DestinationConfig> load(Map<String, String> environment, WebhookUrlPolicy urlPolicy) {
        Objects.requireNonNull(environment, "environment");
        Objects.requireNonNull(urlPolicy, "urlPolicy");
        List<DestinationConfig> result = new ArrayList<>();
        for (Map.Entry<String, String> entry : new TreeMap<>(environment).entrySet()) {
            String key = entry.getKey();
            if (!key.startsWith(PREFIX)) {
                continue;
            }
            String chatId = normalizeChatId(key.substring(PREFIX.length()));
            if (chatId == null) {
                logger.warning("Ignoring " + key + ": chat id is not numeric");
                continue;
            }
            String url = entry.getValue() == null ? "" : entry.getValue().trim();
            try {
                urlPolicy.check(url);
            } catch (ConfigValidationException e) {
                logger.warning("Ignoring " + key + ": " + e.getMessage());
                continue;
            }
            result.add(DestinationConfig.builder(chatId, url).build());
        }
        return result;
    }

    static String normalizeChatId(String raw) {
        String id = raw.trim();
        String digits = id.startsWith("-") ? id.substring(1) : id;
        if (digits.isEmpty()) {
            return null;
        }
        for (int i = 0; i < digits.length(); i++) {
            if (!Character.isDigit(digits.charAt(i))) {
                return null;
            }
        }
        return "-" + digits;
    }
}

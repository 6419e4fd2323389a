package relay.store;

import org.junit.jupiter.api.Test;
import relay.model.DestinationConfig;
import relay.model.WatermarkMode;
import relay.webhook.WebhookUrlPolicy;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnvironmentDestinationsTest {

    @Test
    void loadsWebhookVariablesAsEnabledDestinations() {
        Map<String, String> env = Map.of(
                "WEBHOOK_1001", "https://discord.com/api/webhooks/1/a",
                "WEBHOOK_-2002", " https://discord.com/api/webhooks/2/b ",
                "PATH", "/usr/bin");

        List<DestinationConfig> destinations = EnvironmentDestinations.load(env, WebhookUrlPolicy.discord());

        assertEquals(2, destinations.size());
        DestinationConfig first = byId(destinations, "-1001");
        assertTrue(first.enabled());
        assertEquals(WatermarkMode.NONE, first.watermark().mode());
        assertEquals("https://discord.com/api/webhooks/2/b", byId(destinations, "-2002").webhookUrl());
    }

    private static DestinationConfig byId(List<DestinationConfig> destinations, String id) {
        return destinations.stream().filter(d -> d.destinationId().equals(id)).findFirst().orElseThrow();
    }

    @Test
    void skipsBadIdsAndUrls() {
        Map<String, String> env = Map.of(
                "WEBHOOK_abc", "https://discord.com/api/webhooks/1/a",
                "WEBHOOK_42", "https://example.com/hook");

        assertTrue(EnvironmentDestinations.load(env, WebhookUrlPolicy.discord()).isEmpty());
    }

    @Test
    void normalizesChatIds() {
        assertEquals("-123", EnvironmentDestinations.normalizeChatId("123"));
        assertEquals("-123", EnvironmentDestinations.normalizeChatId("-123"));
        assertNull(EnvironmentDestinations.normalizeChatId("-"));
        assertNull(EnvironmentDestinations.normalizeChatId("12a"));
    }
}

package relay.store;

import org.junit.jupiter.api.Test;
import relay.ConfigStoreException;
import relay.model.DestinationConfig;
import relay.model.WatermarkMode;
import relay.model.WatermarkPosition;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DestinationConfigJsonTest {

    @Test
    void minimalDocumentUsesDefaults() {
        DestinationConfig config = DestinationConfigJson.fromJson(
                "{\"destination_id\": \"-1\", \"webhook_url\": \"https://discord.com/api/webhooks/1/t\"}");

        assertTrue(config.enabled());
        assertEquals(DestinationConfig.DEFAULT_MAX_MEDIA_BYTES, config.maxMediaBytes());
        assertEquals(WatermarkMode.NONE, config.watermark().mode());
        assertEquals(0, config.filters().minLength());
    }

    @Test
    void readsNestedWatermarkAndLegacyModeCode() {
        String json = "{\"destination_id\": \"-1\", \"webhook_url\": \"https://discord.com/api/webhooks/1/t\","
                + " \"enabled\": false,"
                + " \"watermark\": {\"mode\": \"png\", \"overlay_path\": \"/logo.png\","
                + " \"overlay_position\": \"top_left\", \"overlay_opacity\": 4.0}}";

        DestinationConfig config = DestinationConfigJson.fromJson(json);

        assertFalse(config.enabled());
        assertEquals(WatermarkMode.IMAGE_OVERLAY, config.watermark().mode());
        assertEquals(WatermarkPosition.TOP_LEFT, config.watermark().overlayPosition());
        assertEquals(1.0, config.watermark().overlayOpacity(), 1e-9);
    }

    @Test
    void malformedDocumentsAreRejected() {
        assertThrows(ConfigStoreException.class, () -> DestinationConfigJson.fromJson("{"));
        assertThrows(ConfigStoreException.class, () -> DestinationConfigJson.fromJson("[]"));
        assertThrows(ConfigStoreException.class, () -> DestinationConfigJson.fromJson("{\"webhook_url\": \"x\"}"));
        assertThrows(ConfigStoreException.class, () -> DestinationConfigJson.fromJson(
                "{\"destination_id\": \"-1\", \"webhook_url\": \"x\", \"created_at\": \"yesterday\"}"));
        assertThrows(ConfigStoreException.class, () -> DestinationConfigJson.fromJson(
                "{\"destination_id\": \"-1\", \"webhook_url\": \"x\", \"watermark\": {\"mode\": \"sparkles\"}}"));
    }
}

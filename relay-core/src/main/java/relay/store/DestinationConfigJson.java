package relay.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import relay.ConfigStoreException;
import relay.model.DestinationConfig;
import relay.model.MessageFilters;
import relay.model.WatermarkConfig;
import relay.model.WatermarkMode;
import relay.model.WatermarkPosition;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Persisted document form of a {@link DestinationConfig}, shared by the file and JDBC stores.
 *
 * <p>Field names are snake_case. Missing optional fields fall back to the model defaults so
 * documents written by older versions keep loading.
 */
public final class DestinationConfigJson {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private DestinationConfigJson() {
    }

    public static String toJson(DestinationConfig config) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toTree(config));
        } catch (JsonProcessingException e) {
            throw new ConfigStoreException("Failed to encode destination " + config.destinationId(), e);
        }
    }

    /**
     * Parses a persisted document.
     *
     * @throws ConfigStoreException if the document is not valid JSON or lacks required fields
     */
    public static DestinationConfig fromJson(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConfigStoreException("Malformed destination document", e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigStoreException("Destination document must be a JSON object");
        }
        try {
            return fromTree(root);
        } catch (IllegalArgumentException | NullPointerException | DateTimeParseException e) {
            throw new ConfigStoreException("Invalid destination document: " + e.getMessage(), e);
        }
    }

    static ObjectNode toTree(DestinationConfig config) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("destination_id", config.destinationId());
        root.put("name", config.name());
        root.put("webhook_url", config.webhookUrl());
        root.put("enabled", config.enabled());
        root.put("max_media_bytes", config.maxMediaBytes());
        root.put("created_at", config.createdAt().toString());
        root.put("updated_at", config.updatedAt().toString());

        MessageFilters f = config.filters();
        ObjectNode filters = root.putObject("filters");
        filters.put("min_length", f.minLength());
        putStrings(filters.putArray("allow_words"), f.allowWords());
        putStrings(filters.putArray("deny_words"), f.denyWords());
        putStrings(filters.putArray("blocked_sender_ids"), f.blockedSenderIds().stream().sorted().toList());

        WatermarkConfig w = config.watermark();
        ObjectNode wm = root.putObject("watermark");
        wm.put("mode", w.mode().code());
        wm.put("text_content", w.textContent());
        if (w.textPrefix() != null) {
            wm.put("text_prefix", w.textPrefix());
        }
        wm.put("text_position", w.textPosition().code());
        wm.put("font_size", w.fontSize());
        wm.put("fill_color", w.fillColor());
        wm.put("outline_color", w.outlineColor());
        wm.put("outline_width", w.outlineWidth());
        wm.put("text_custom_x", w.textCustomX());
        wm.put("text_custom_y", w.textCustomY());
        if (w.overlayPath() != null) {
            wm.put("overlay_path", w.overlayPath());
        }
        wm.put("overlay_position", w.overlayPosition().code());
        wm.put("overlay_scale", w.overlayScale());
        wm.put("overlay_opacity", w.overlayOpacity());
        wm.put("overlay_custom_x", w.overlayCustomX());
        wm.put("overlay_custom_y", w.overlayCustomY());
        wm.put("images_enabled", w.imagesEnabled());
        wm.put("videos_enabled", w.videosEnabled());
        wm.put("max_media_bytes", w.maxMediaBytes());
        wm.put("video_timeout_seconds", w.videoTimeout().toSeconds());
        wm.put("video_compress", w.videoCompress());
        wm.put("video_quality", w.videoQuality());
        return root;
    }

    static DestinationConfig fromTree(JsonNode root) {
        String id = requiredText(root, "destination_id");
        String url = requiredText(root, "webhook_url");
        DestinationConfig.Builder builder = DestinationConfig.builder(id, url)
                .name(root.path("name").asText(""))
                .enabled(root.path("enabled").asBoolean(true))
                .maxMediaBytes(root.path("max_media_bytes").asLong(DestinationConfig.DEFAULT_MAX_MEDIA_BYTES));
        if (root.hasNonNull("created_at")) {
            builder.createdAt(Instant.parse(root.get("created_at").asText()));
        }
        if (root.hasNonNull("updated_at")) {
            builder.updatedAt(Instant.parse(root.get("updated_at").asText()));
        }

        JsonNode filters = root.path("filters");
        if (filters.isObject()) {
            builder.filters(new MessageFilters(
                    filters.path("min_length").asInt(0),
                    strings(filters.path("allow_words")),
                    strings(filters.path("deny_words")),
                    new LinkedHashSet<>(strings(filters.path("blocked_sender_ids")))));
        }

        JsonNode wm = root.path("watermark");
        if (wm.isObject()) {
            WatermarkConfig defaults = WatermarkConfig.DISABLED;
            builder.watermark(WatermarkConfig.builder()
                    .mode(WatermarkMode.fromCode(textOrNull(wm, "mode")))
                    .textContent(wm.path("text_content").asText(""))
                    .textPrefix(textOrNull(wm, "text_prefix"))
                    .textPosition(WatermarkPosition.fromCode(textOrNull(wm, "text_position")))
                    .fontSize(wm.path("font_size").asInt(defaults.fontSize()))
                    .fillColor(wm.path("fill_color").asText(defaults.fillColor()))
                    .outlineColor(wm.path("outline_color").asText(defaults.outlineColor()))
                    .outlineWidth(wm.path("outline_width").asInt(defaults.outlineWidth()))
                    .textCustomOffset(wm.path("text_custom_x").asInt(defaults.textCustomX()),
                            wm.path("text_custom_y").asInt(defaults.textCustomY()))
                    .overlayPath(textOrNull(wm, "overlay_path"))
                    .overlayPosition(WatermarkPosition.fromCode(textOrNull(wm, "overlay_position")))
                    .overlayScale(wm.path("overlay_scale").asDouble(defaults.overlayScale()))
                    .overlayOpacity(wm.path("overlay_opacity").asDouble(defaults.overlayOpacity()))
                    .overlayCustomOffset(wm.path("overlay_custom_x").asInt(defaults.overlayCustomX()),
                            wm.path("overlay_custom_y").asInt(defaults.overlayCustomY()))
                    .imagesEnabled(wm.path("images_enabled").asBoolean(defaults.imagesEnabled()))
                    .videosEnabled(wm.path("videos_enabled").asBoolean(defaults.videosEnabled()))
                    .maxMediaBytes(wm.path("max_media_bytes").asLong(defaults.maxMediaBytes()))
                    .videoTimeout(Duration.ofSeconds(
                            wm.path("video_timeout_seconds").asLong(defaults.videoTimeout().toSeconds())))
                    .videoCompress(wm.path("video_compress").asBoolean(defaults.videoCompress()))
                    .videoQuality(wm.path("video_quality").asInt(defaults.videoQuality()))
                    .build());
        }
        return builder.build();
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isEmpty()) {
            throw new IllegalArgumentException("missing field " + field);
        }
        return value.asText();
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static void putStrings(ArrayNode array, Collection<String> values) {
        for (String value : values) {
            array.add(value);
        }
    }

    private static List<String> strings(JsonNode array) {
        List<String> out = new ArrayList<>();
        if (array.isArray()) {
            for (JsonNode item : array) {
                out.add(item.asText());
            }
        }
        return out;
    }
}

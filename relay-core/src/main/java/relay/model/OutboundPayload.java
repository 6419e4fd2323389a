package relay.model;

import java.nio.charset.StandardCharsets;

/**
 * Transformed content ready to be posted to one destination.
 *
 * @param text  message text, may be {@code null} for media-only posts
 * @param media attachment, may be {@code null} for text-only posts
 */
public record OutboundPayload(String text, MediaAttachment media) {

    public OutboundPayload {
        if (text == null && media == null) {
            throw new IllegalArgumentException("payload must carry text or media");
        }
    }

    public static OutboundPayload of(InboundMessage message) {
        return new OutboundPayload(message.text().orElse(null), message.media().orElse(null));
    }

    public boolean hasMedia() {
        return media != null;
    }

    /**
     * Bytes that count against a destination's upload ceiling.
     */
    public long sizeBytes() {
        long size = media == null ? 0L : media.size();
        if (text != null) {
            size += text.getBytes(StandardCharsets.UTF_8).length;
        }
        return size;
    }
}

package relay.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One event observed on the source platform.
 *
 * <p>Instances are transient: the ingestion loop consumes each message once and never
 * persists it. At least one of text or media is present.
 */
public final class InboundMessage {
    private final String sourceMessageId;
    private final String chatId;
    private final String senderId;
    private final String text;
    private final MediaAttachment media;
    private final Instant receivedAt;

    private InboundMessage(Builder builder) {
        this.sourceMessageId = Objects.requireNonNull(builder.sourceMessageId, "sourceMessageId");
        this.chatId = Objects.requireNonNull(builder.chatId, "chatId");
        if (sourceMessageId.isEmpty() || chatId.isEmpty()) {
            throw new IllegalArgumentException("sourceMessageId and chatId cannot be empty");
        }
        this.senderId = builder.senderId;
        this.text = builder.text;
        this.media = builder.media;
        if (text == null && media == null) {
            throw new IllegalArgumentException("message must carry text or media");
        }
        this.receivedAt = builder.receivedAt == null ? Instant.now() : builder.receivedAt;
    }

    public static Builder builder(String chatId, String sourceMessageId) {
        return new Builder(chatId, sourceMessageId);
    }

    /**
     * Creates a text-only message.
     */
    public static InboundMessage text(String chatId, String sourceMessageId, String senderId, String text) {
        return builder(chatId, sourceMessageId).senderId(senderId).text(text).build();
    }

    public String sourceMessageId() {
        return sourceMessageId;
    }

    public String chatId() {
        return chatId;
    }

    public String senderId() {
        return senderId;
    }

    public Optional<String> text() {
        return Optional.ofNullable(text);
    }

    public Optional<MediaAttachment> media() {
        return Optional.ofNullable(media);
    }

    public Instant receivedAt() {
        return receivedAt;
    }

    @Override
    public String toString() {
        return "InboundMessage[chatId=" + chatId + ", sourceMessageId=" + sourceMessageId
                + ", senderId=" + senderId + ", hasText=" + (text != null) + ", media=" + media + "]";
    }

    public static final class Builder {
        private final String chatId;
        private final String sourceMessageId;
        private String senderId;
        private String text;
        private MediaAttachment media;
        private Instant receivedAt;

        private Builder(String chatId, String sourceMessageId) {
            this.chatId = chatId;
            this.sourceMessageId = sourceMessageId;
        }

        public Builder senderId(String senderId) {
            this.senderId = senderId;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder media(MediaAttachment media) {
            this.media = media;
            return this;
        }

        public Builder receivedAt(Instant receivedAt) {
            this.receivedAt = receivedAt;
            return this;
        }

        public InboundMessage build() {
            return new InboundMessage(this);
        }
    }
}

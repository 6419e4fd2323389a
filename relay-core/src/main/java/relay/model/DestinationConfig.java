package relay.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Settings for one delivery target, keyed by the source chat id it mirrors.
 *
 * <p>Immutable; updates build a new instance via {@link #toBuilder()}. The webhook URL is a
 * secret and is excluded from {@link #toString()}.
 */
public final class DestinationConfig {
    public static final long DEFAULT_MAX_MEDIA_BYTES = 25L * 1024 * 1024;

    private final String destinationId;
    private final String name;
    private final String webhookUrl;
    private final boolean enabled;
    private final MessageFilters filters;
    private final WatermarkConfig watermark;
    private final long maxMediaBytes;
    private final Instant createdAt;
    private final Instant updatedAt;

    private DestinationConfig(Builder b) {
        this.destinationId = Objects.requireNonNull(b.destinationId, "destinationId");
        if (destinationId.isBlank()) {
            throw new IllegalArgumentException("destinationId cannot be blank");
        }
        this.name = b.name == null ? "" : b.name;
        this.webhookUrl = Objects.requireNonNull(b.webhookUrl, "webhookUrl");
        this.enabled = b.enabled;
        this.filters = b.filters == null ? MessageFilters.NONE : b.filters;
        this.watermark = b.watermark == null ? WatermarkConfig.DISABLED : b.watermark;
        this.maxMediaBytes = b.maxMediaBytes;
        Instant now = Instant.now();
        this.createdAt = b.createdAt == null ? now : b.createdAt;
        this.updatedAt = b.updatedAt == null ? this.createdAt : b.updatedAt;
    }

    public static Builder builder(String destinationId, String webhookUrl) {
        return new Builder(destinationId, webhookUrl);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public String destinationId() {
        return destinationId;
    }

    public String name() {
        return name;
    }

    public String webhookUrl() {
        return webhookUrl;
    }

    public boolean enabled() {
        return enabled;
    }

    public MessageFilters filters() {
        return filters;
    }

    public WatermarkConfig watermark() {
        return watermark;
    }

    public long maxMediaBytes() {
        return maxMediaBytes;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DestinationConfig that)) return false;
        return enabled == that.enabled
                && maxMediaBytes == that.maxMediaBytes
                && destinationId.equals(that.destinationId)
                && name.equals(that.name)
                && webhookUrl.equals(that.webhookUrl)
                && filters.equals(that.filters)
                && watermark.equals(that.watermark)
                && createdAt.equals(that.createdAt)
                && updatedAt.equals(that.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(destinationId, webhookUrl, enabled, filters, watermark, updatedAt);
    }

    @Override
    public String toString() {
        return "DestinationConfig[id=" + destinationId + ", name=" + name + ", enabled=" + enabled
                + ", watermark=" + watermark.mode() + "]";
    }

    public static final class Builder {
        private final String destinationId;
        private String name;
        private String webhookUrl;
        private boolean enabled = true;
        private MessageFilters filters;
        private WatermarkConfig watermark;
        private long maxMediaBytes = DEFAULT_MAX_MEDIA_BYTES;
        private Instant createdAt;
        private Instant updatedAt;

        private Builder(String destinationId, String webhookUrl) {
            this.destinationId = destinationId;
            this.webhookUrl = webhookUrl;
        }

        private Builder(DestinationConfig c) {
            this.destinationId = c.destinationId;
            this.name = c.name;
            this.webhookUrl = c.webhookUrl;
            this.enabled = c.enabled;
            this.filters = c.filters;
            this.watermark = c.watermark;
            this.maxMediaBytes = c.maxMediaBytes;
            this.createdAt = c.createdAt;
            this.updatedAt = c.updatedAt;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder webhookUrl(String webhookUrl) {
            this.webhookUrl = webhookUrl;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder filters(MessageFilters filters) {
            this.filters = filters;
            return this;
        }

        public Builder watermark(WatermarkConfig watermark) {
            this.watermark = watermark;
            return this;
        }

        public Builder maxMediaBytes(long maxMediaBytes) {
            this.maxMediaBytes = maxMediaBytes;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public DestinationConfig build() {
            return new DestinationConfig(this);
        }
    }
}

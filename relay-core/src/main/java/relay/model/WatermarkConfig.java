package relay.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Watermark settings embedded in a {@link DestinationConfig}.
 *
 * <p>Immutable. The builder clamps {@code overlayScale} and {@code overlayOpacity} to
 * {@code [0, 1]}; all other range checks happen in the store's validator so that a
 * rejected update names the offending field.
 */
public final class WatermarkConfig {
    public static final WatermarkConfig DISABLED = builder().build();

    private final WatermarkMode mode;

    private final String textContent;
    private final String textPrefix;
    private final WatermarkPosition textPosition;
    private final int fontSize;
    private final String fillColor;
    private final String outlineColor;
    private final int outlineWidth;
    private final int textCustomX;
    private final int textCustomY;

    private final String overlayPath;
    private final WatermarkPosition overlayPosition;
    private final double overlayScale;
    private final double overlayOpacity;
    private final int overlayCustomX;
    private final int overlayCustomY;

    private final boolean imagesEnabled;
    private final boolean videosEnabled;
    private final long maxMediaBytes;
    private final Duration videoTimeout;
    private final boolean videoCompress;
    private final int videoQuality;

    private WatermarkConfig(Builder b) {
        this.mode = Objects.requireNonNull(b.mode, "mode");
        this.textContent = b.textContent == null ? "" : b.textContent;
        this.textPrefix = b.textPrefix;
        this.textPosition = Objects.requireNonNull(b.textPosition, "textPosition");
        this.fontSize = b.fontSize;
        this.fillColor = Objects.requireNonNull(b.fillColor, "fillColor");
        this.outlineColor = Objects.requireNonNull(b.outlineColor, "outlineColor");
        this.outlineWidth = b.outlineWidth;
        this.textCustomX = b.textCustomX;
        this.textCustomY = b.textCustomY;
        this.overlayPath = b.overlayPath;
        this.overlayPosition = Objects.requireNonNull(b.overlayPosition, "overlayPosition");
        this.overlayScale = clampUnit(b.overlayScale);
        this.overlayOpacity = clampUnit(b.overlayOpacity);
        this.overlayCustomX = b.overlayCustomX;
        this.overlayCustomY = b.overlayCustomY;
        this.imagesEnabled = b.imagesEnabled;
        this.videosEnabled = b.videosEnabled;
        this.maxMediaBytes = b.maxMediaBytes;
        this.videoTimeout = Objects.requireNonNull(b.videoTimeout, "videoTimeout");
        this.videoCompress = b.videoCompress;
        this.videoQuality = b.videoQuality;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    static double clampUnit(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    public WatermarkMode mode() {
        return mode;
    }

    public String textContent() {
        return textContent;
    }

    public String textPrefix() {
        return textPrefix;
    }

    public WatermarkPosition textPosition() {
        return textPosition;
    }

    public int fontSize() {
        return fontSize;
    }

    public String fillColor() {
        return fillColor;
    }

    public String outlineColor() {
        return outlineColor;
    }

    public int outlineWidth() {
        return outlineWidth;
    }

    public int textCustomX() {
        return textCustomX;
    }

    public int textCustomY() {
        return textCustomY;
    }

    public String overlayPath() {
        return overlayPath;
    }

    public WatermarkPosition overlayPosition() {
        return overlayPosition;
    }

    public double overlayScale() {
        return overlayScale;
    }

    public double overlayOpacity() {
        return overlayOpacity;
    }

    public int overlayCustomX() {
        return overlayCustomX;
    }

    public int overlayCustomY() {
        return overlayCustomY;
    }

    public boolean imagesEnabled() {
        return imagesEnabled;
    }

    public boolean videosEnabled() {
        return videosEnabled;
    }

    public long maxMediaBytes() {
        return maxMediaBytes;
    }

    public Duration videoTimeout() {
        return videoTimeout;
    }

    public boolean videoCompress() {
        return videoCompress;
    }

    public int videoQuality() {
        return videoQuality;
    }

    /** True when text watermarking is active and has something to write. */
    public boolean hasTextWatermark() {
        return mode.includesText() && !textContent.isBlank();
    }

    /** True when overlay watermarking is active and an asset is configured. */
    public boolean hasOverlayWatermark() {
        return mode.includesOverlay() && overlayPath != null && !overlayPath.isBlank();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WatermarkConfig that)) return false;
        return fontSize == that.fontSize
                && outlineWidth == that.outlineWidth
                && textCustomX == that.textCustomX
                && textCustomY == that.textCustomY
                && Double.compare(overlayScale, that.overlayScale) == 0
                && Double.compare(overlayOpacity, that.overlayOpacity) == 0
                && overlayCustomX == that.overlayCustomX
                && overlayCustomY == that.overlayCustomY
                && imagesEnabled == that.imagesEnabled
                && videosEnabled == that.videosEnabled
                && maxMediaBytes == that.maxMediaBytes
                && videoCompress == that.videoCompress
                && videoQuality == that.videoQuality
                && mode == that.mode
                && textContent.equals(that.textContent)
                && Objects.equals(textPrefix, that.textPrefix)
                && textPosition == that.textPosition
                && fillColor.equals(that.fillColor)
                && outlineColor.equals(that.outlineColor)
                && Objects.equals(overlayPath, that.overlayPath)
                && overlayPosition == that.overlayPosition
                && videoTimeout.equals(that.videoTimeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mode, textContent, textPrefix, textPosition, fontSize, fillColor,
                outlineColor, outlineWidth, overlayPath, overlayPosition, overlayScale, overlayOpacity,
                imagesEnabled, videosEnabled, maxMediaBytes);
    }

    @Override
    public String toString() {
        return "WatermarkConfig[mode=" + mode + ", text=" + textContent + ", overlay=" + overlayPath + "]";
    }

    public static final class Builder {
        private WatermarkMode mode = WatermarkMode.NONE;

        private String textContent = "";
        private String textPrefix;
        private WatermarkPosition textPosition = WatermarkPosition.BOTTOM_RIGHT;
        private int fontSize = 32;
        private String fillColor = "#FFFFFF";
        private String outlineColor = "#000000";
        private int outlineWidth = 2;
        private int textCustomX = 20;
        private int textCustomY = 60;

        private String overlayPath;
        private WatermarkPosition overlayPosition = WatermarkPosition.BOTTOM_RIGHT;
        private double overlayScale = 0.15;
        private double overlayOpacity = 0.7;
        private int overlayCustomX = 20;
        private int overlayCustomY = 20;

        private boolean imagesEnabled = true;
        private boolean videosEnabled = false;
        private long maxMediaBytes = 25L * 1024 * 1024;
        private Duration videoTimeout = Duration.ofSeconds(60);
        private boolean videoCompress = true;
        private int videoQuality = 23;

        private Builder() {}

        private Builder(WatermarkConfig c) {
            this.mode = c.mode;
            this.textContent = c.textContent;
            this.textPrefix = c.textPrefix;
            this.textPosition = c.textPosition;
            this.fontSize = c.fontSize;
            this.fillColor = c.fillColor;
            this.outlineColor = c.outlineColor;
            this.outlineWidth = c.outlineWidth;
            this.textCustomX = c.textCustomX;
            this.textCustomY = c.textCustomY;
            this.overlayPath = c.overlayPath;
            this.overlayPosition = c.overlayPosition;
            this.overlayScale = c.overlayScale;
            this.overlayOpacity = c.overlayOpacity;
            this.overlayCustomX = c.overlayCustomX;
            this.overlayCustomY = c.overlayCustomY;
            this.imagesEnabled = c.imagesEnabled;
            this.videosEnabled = c.videosEnabled;
            this.maxMediaBytes = c.maxMediaBytes;
            this.videoTimeout = c.videoTimeout;
            this.videoCompress = c.videoCompress;
            this.videoQuality = c.videoQuality;
        }

        public Builder mode(WatermarkMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder textContent(String textContent) {
            this.textContent = textContent;
            return this;
        }

        public Builder textPrefix(String textPrefix) {
            this.textPrefix = textPrefix;
            return this;
        }

        public Builder textPosition(WatermarkPosition textPosition) {
            this.textPosition = textPosition;
            return this;
        }

        public Builder fontSize(int fontSize) {
            this.fontSize = fontSize;
            return this;
        }

        public Builder fillColor(String fillColor) {
            this.fillColor = fillColor;
            return this;
        }

        public Builder outlineColor(String outlineColor) {
            this.outlineColor = outlineColor;
            return this;
        }

        public Builder outlineWidth(int outlineWidth) {
            this.outlineWidth = outlineWidth;
            return this;
        }

        public Builder textCustomOffset(int x, int y) {
            this.textCustomX = x;
            this.textCustomY = y;
            return this;
        }

        public Builder overlayPath(String overlayPath) {
            this.overlayPath = overlayPath;
            return this;
        }

        public Builder overlayPosition(WatermarkPosition overlayPosition) {
            this.overlayPosition = overlayPosition;
            return this;
        }

        public Builder overlayScale(double overlayScale) {
            this.overlayScale = overlayScale;
            return this;
        }

        public Builder overlayOpacity(double overlayOpacity) {
            this.overlayOpacity = overlayOpacity;
            return this;
        }

        public Builder overlayCustomOffset(int x, int y) {
            this.overlayCustomX = x;
            this.overlayCustomY = y;
            return this;
        }

        public Builder imagesEnabled(boolean imagesEnabled) {
            this.imagesEnabled = imagesEnabled;
            return this;
        }

        public Builder videosEnabled(boolean videosEnabled) {
            this.videosEnabled = videosEnabled;
            return this;
        }

        public Builder maxMediaBytes(long maxMediaBytes) {
            this.maxMediaBytes = maxMediaBytes;
            return this;
        }

        public Builder videoTimeout(Duration videoTimeout) {
            this.videoTimeout = videoTimeout;
            return this;
        }

        public Builder videoCompress(boolean videoCompress) {
            this.videoCompress = videoCompress;
            return this;
        }

        public Builder videoQuality(int videoQuality) {
            this.videoQuality = videoQuality;
            return this;
        }

        public WatermarkConfig build() {
            return new WatermarkConfig(this);
        }
    }
}

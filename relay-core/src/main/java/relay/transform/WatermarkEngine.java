package relay.transform;

import relay.model.DestinationConfig;
import relay.model.InboundMessage;
import relay.model.MediaAttachment;
import relay.model.OutboundPayload;
import relay.model.WatermarkConfig;
import relay.stats.RelayStats;

import java.io.IOException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies a destination's watermark settings to a message.
 *
 * <p>Captions get the text watermark and are shortened to the destination's content limit. Images are watermarked (and compressed when larger than
 * the size cap) through {@link ImageWatermarker}; videos through {@link VideoWatermarker} when
 * enabled and {@code ffmpeg} is installed. Audio and documents pass through.
 *
 * <p>A media transform that fails never fails the message: the original attachment is kept,
 * the error is logged and counted once in {@link RelayStats}. Thread-safe; the only shared
 * state is the {@link OverlayCache}.
 */
public final class WatermarkEngine {
    private static final Logger logger = Logger.getLogger(WatermarkEngine.class.getName());

    private final ImageWatermarker images;
    private final VideoWatermarker videos;
    private final RelayStats stats;
    private final int maxContentLength;

    public WatermarkEngine(OverlayCache overlays, VideoWatermarker videos, RelayStats stats) {
        this(overlays, videos, stats, TextWatermarker.DISCORD_CONTENT_LIMIT);
    }

    /**
     * @param maxContentLength longest text the destination accepts; longer text is shortened,
     *                         keeping the text watermark intact
     */
    public WatermarkEngine(OverlayCache overlays, VideoWatermarker videos, RelayStats stats, int maxContentLength) {
        if (maxContentLength <= 0) {
            throw new IllegalArgumentException("maxContentLength must be > 0");
        }
        this.maxContentLength = maxContentLength;
        this.images = new ImageWatermarker(Objects.requireNonNull(overlays, "overlays"));
        this.videos = Objects.requireNonNull(videos, "videos");
        this.stats = Objects.requireNonNull(stats, "stats");
    }

    public WatermarkEngine(RelayStats stats) {
        this(new OverlayCache(), new VideoWatermarker(), stats);
    }

    public TransformResult transform(InboundMessage message, DestinationConfig destination) {
        WatermarkConfig config = destination.watermark();
        boolean applied = false;
        boolean fellBack = false;

        String text = message.text().orElse(null);
        if (text != null && !text.isEmpty() && config.hasTextWatermark()) {
            text = TextWatermarker.caption(text, config, maxContentLength);
            applied = true;
        } else if (text != null) {
            text = TextWatermarker.truncate(text, maxContentLength);
        }

        MediaAttachment media = message.media().orElse(null);
        if (media != null) {
            long cap = Math.min(config.maxMediaBytes(), destination.maxMediaBytes());
            try {
                switch (media.kind()) {
                    case IMAGE -> {
                        if (shouldProcessImage(media, config, cap)) {
                            byte[] out = images.apply(media.content(), config, cap);
                            media = media.withContent(out, jpegName(media.filename()), "image/jpeg");
                            applied |= config.hasOverlayWatermark() || config.hasTextWatermark();
                        }
                    }
                    case VIDEO -> {
                        if (shouldProcessVideo(media, config)) {
                            byte[] out = videos.apply(media.content(), media.filename(), config);
                            media = media.withContent(out, mp4Name(media.filename()), "video/mp4");
                            applied = true;
                        }
                    }
                    default -> {
                        // audio and documents pass through
                    }
                }
            } catch (IOException | RuntimeException e) {
                logger.log(Level.WARNING, "Media transform failed for message " + message.sourceMessageId()
                        + " to destination " + destination.destinationId() + "; forwarding original", e);
                stats.recordError();
                media = message.media().orElse(null);
                fellBack = true;
            }
        }

        return new TransformResult(new OutboundPayload(text, media), applied, fellBack);
    }

    private static boolean shouldProcessImage(MediaAttachment media, WatermarkConfig config, long cap) {
        if (!config.imagesEnabled()) {
            return false;
        }
        return config.hasOverlayWatermark() || config.hasTextWatermark() || media.size() > cap;
    }

    private boolean shouldProcessVideo(MediaAttachment media, WatermarkConfig config) {
        if (!config.videosEnabled() || !(config.hasOverlayWatermark() || config.hasTextWatermark())) {
            return false;
        }
        if (media.size() > config.maxMediaBytes()) {
            logger.warning("Video " + media.filename() + " is " + media.size()
                    + " bytes, above the " + config.maxMediaBytes() + " byte limit; forwarding unchanged");
            return false;
        }
        return videos.isAvailable();
    }

    private static String jpegName(String filename) {
        return baseName(filename) + ".jpg";
    }

    private static String mp4Name(String filename) {
        return baseName(filename) + ".mp4";
    }

    private static String baseName(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }
}

package relay.transform;

import relay.model.WatermarkConfig;

import javax.imageio.ImageIO;
import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.Point;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Objects;

/**
 * Decodes a raster image, applies the overlay and text watermarks, and re-encodes it as JPEG
 * within a size cap. Transparent areas are flattened onto white.
 */
public final class ImageWatermarker {
    private final OverlayCache overlays;

    public ImageWatermarker(OverlayCache overlays) {
        this.overlays = Objects.requireNonNull(overlays, "overlays");
    }

    /**
     * @param input    encoded image
     * @param config   watermark settings
     * @param maxBytes size cap of the result; oversized inputs are first scaled down to
     *                 {@value JpegCompressor#MAX_WIDTH}x{@value JpegCompressor#MAX_HEIGHT}
     * @return JPEG bytes
     * @throws IOException if the input cannot be decoded, the overlay cannot be loaded, or
     *                     encoding fails
     */
    public byte[] apply(byte[] input, WatermarkConfig config, long maxBytes) throws IOException {
        BufferedImage source = ImageIO.read(new ByteArrayInputStream(input));
        if (source == null) {
            throw new IOException("Unsupported or corrupt image (" + input.length + " bytes)");
        }
        if (input.length > maxBytes) {
            source = JpegCompressor.downscale(source, JpegCompressor.MAX_WIDTH, JpegCompressor.MAX_HEIGHT);
        }

        int width = source.getWidth();
        int height = source.getHeight();
        BufferedImage canvas = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = canvas.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, width, height);
            g.drawImage(source, 0, 0, null);
            if (config.hasOverlayWatermark()) {
                drawOverlay(g, width, height, config);
            }
            if (config.hasTextWatermark()) {
                TextWatermarker.draw(g, width, height, config);
            }
        } finally {
            g.dispose();
        }
        return JpegCompressor.compress(canvas, maxBytes);
    }

    private void drawOverlay(Graphics2D g, int width, int height, WatermarkConfig config) throws IOException {
        BufferedImage overlay = overlays.load(config.overlayPath());
        int target = (int) Math.round(config.overlayScale() * Math.min(width, height));
        if (target <= 0 || config.overlayOpacity() <= 0.0) {
            return;
        }
        int ow = overlay.getWidth();
        int oh = overlay.getHeight();
        double ratio = (double) target / Math.max(ow, oh);
        int sw = Math.max(1, (int) Math.round(ow * ratio));
        int sh = Math.max(1, (int) Math.round(oh * ratio));

        Point at = PositionCalculator.position(width, height, sw, sh,
                config.overlayPosition(), config.overlayCustomX(), config.overlayCustomY());
        g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
        g.setComposite(AlphaComposite.getInstance(AlphaComposite.SRC_OVER, (float) config.overlayOpacity()));
        g.drawImage(overlay, at.x, at.y, sw, sh, null);
        g.setComposite(AlphaComposite.SrcOver);
    }
}

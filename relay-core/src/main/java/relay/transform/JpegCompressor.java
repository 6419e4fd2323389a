package relay.transform;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * JPEG encoding under a size cap.
 *
 * <p>Encodes at {@link #START_QUALITY} and steps down by {@link #QUALITY_STEP} until the result
 * fits or {@link #MIN_QUALITY} is reached; the last encoding is accepted either way.
 */
public final class JpegCompressor {
    static final float START_QUALITY = 0.85f;
    static final float QUALITY_STEP = 0.10f;
    static final float MIN_QUALITY = 0.35f;

    public static final int MAX_WIDTH = 1920;
    public static final int MAX_HEIGHT = 1080;

    private JpegCompressor() {
    }

    public static byte[] compress(BufferedImage image, long maxBytes) throws IOException {
        byte[] encoded = null;
        // integer steps avoid float drift around the floor
        int startSteps = Math.round(START_QUALITY * 100);
        int floorSteps = Math.round(MIN_QUALITY * 100);
        int stepSize = Math.round(QUALITY_STEP * 100);
        for (int q = startSteps; q >= floorSteps; q -= stepSize) {
            encoded = encode(image, q / 100f);
            if (encoded.length <= maxBytes) {
                break;
            }
        }
        return encoded;
    }

    static byte[] encode(BufferedImage image, float quality) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IOException("No JPEG writer available");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ImageOutputStream stream = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(stream);
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(quality);
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
        return out.toByteArray();
    }

    /**
     * Scales an image down to fit a {@code maxWidth x maxHeight} box, keeping its aspect ratio.
     * Images already inside the box are returned as is.
     */
    public static BufferedImage downscale(BufferedImage image, int maxWidth, int maxHeight) {
        int w = image.getWidth();
        int h = image.getHeight();
        double ratio = Math.min((double) maxWidth / w, (double) maxHeight / h);
        if (ratio >= 1.0) {
            return image;
        }
        int nw = Math.max(1, (int) Math.round(w * ratio));
        int nh = Math.max(1, (int) Math.round(h * ratio));
        BufferedImage scaled = new BufferedImage(nw, nh, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = scaled.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(image, 0, 0, nw, nh, null);
        } finally {
            g.dispose();
        }
        return scaled;
    }
}

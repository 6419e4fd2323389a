package relay.transform;

import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JpegCompressorTest {

    private static BufferedImage noise(int width, int height) {
        Random random = new Random(42);
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.setRGB(x, y, random.nextInt(0x1000000));
            }
        }
        return image;
    }

    private static BufferedImage solid(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        g.setColor(Color.GRAY);
        g.fillRect(0, 0, width, height);
        g.dispose();
        return image;
    }

    @Test
    void generousCapKeepsStartQuality() throws Exception {
        BufferedImage image = noise(64, 64);

        assertArrayEquals(JpegCompressor.encode(image, JpegCompressor.START_QUALITY),
                JpegCompressor.compress(image, Long.MAX_VALUE));
    }

    @Test
    void qualityStepsDownUntilResultFits() throws Exception {
        BufferedImage image = noise(200, 200);
        byte[] start = JpegCompressor.encode(image, JpegCompressor.START_QUALITY);
        long cap = JpegCompressor.encode(image, 0.55f).length;

        byte[] out = JpegCompressor.compress(image, cap);

        assertTrue(out.length <= cap, out.length + " > " + cap);
        assertTrue(out.length < start.length);
    }

    @Test
    void unreachableCapSettlesAtQualityFloor() throws Exception {
        BufferedImage image = noise(200, 200);

        byte[] out = JpegCompressor.compress(image, 1024);

        assertTrue(out.length > 1024);
        assertArrayEquals(JpegCompressor.encode(image, JpegCompressor.MIN_QUALITY), out);
    }

    @Test
    void downscaleFitsBoxAndKeepsAspect() {
        BufferedImage scaled = JpegCompressor.downscale(solid(3840, 1000),
                JpegCompressor.MAX_WIDTH, JpegCompressor.MAX_HEIGHT);

        assertEquals(1920, scaled.getWidth());
        assertEquals(500, scaled.getHeight());
    }

    @Test
    void downscaleLeavesSmallImagesAlone() {
        BufferedImage image = solid(800, 600);

        assertSame(image, JpegCompressor.downscale(image, JpegCompressor.MAX_WIDTH, JpegCompressor.MAX_HEIGHT));
    }
}

package relay.transform;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Read-through cache of decoded overlay assets keyed by normalized absolute path.
 *
 * <p>Cached images are shared between threads and must only be read. Failed loads are not
 * cached, so a fixed asset is picked up on the next transform.
 */
public final class OverlayCache {
    private final ConcurrentMap<String, BufferedImage> images = new ConcurrentHashMap<>();

    public BufferedImage load(String path) throws IOException {
        Path file = Path.of(path).toAbsolutePath().normalize();
        String key = file.toString();
        BufferedImage cached = images.get(key);
        if (cached != null) {
            return cached;
        }
        if (!Files.isRegularFile(file)) {
            throw new IOException("Overlay asset not found: " + file);
        }
        BufferedImage image = ImageIO.read(file.toFile());
        if (image == null) {
            throw new IOException("Overlay asset is not a supported image: " + file);
        }
        BufferedImage previous = images.putIfAbsent(key, image);
        return previous != null ? previous : image;
    }

    /** Drops a cached asset, e.g. after it was replaced on disk. */
    public void invalidate(String path) {
        images.remove(Path.of(path).toAbsolutePath().normalize().toString());
    }

    public int size() {
        return images.size();
    }
}

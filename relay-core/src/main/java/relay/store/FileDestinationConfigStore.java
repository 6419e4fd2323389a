package relay.store;

import relay.ConfigStoreException;
import relay.model.DestinationConfig;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Stores each destination as {@code destination_<id>.json} in one directory.
 *
 * <p>Writes go to a temporary file in the same directory which is then atomically moved over
 * the target, so a crash never leaves a half-written document behind.
 */
public final class FileDestinationConfigStore extends AbstractCachingConfigStore {
    private static final Logger logger = Logger.getLogger(FileDestinationConfigStore.class.getName());

    static final String FILE_PREFIX = "destination_";
    static final String FILE_SUFFIX = ".json";
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private final Path directory;

    public FileDestinationConfigStore(Path directory, DestinationConfigValidator validator) {
        this(directory, validator, Clock.systemUTC());
    }

    public FileDestinationConfigStore(Path directory, DestinationConfigValidator validator, Clock clock) {
        super(validator, clock);
        this.directory = Objects.requireNonNull(directory, "directory");
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new ConfigStoreException("Cannot create config directory " + directory, e);
        }
        reload();
    }

    public Path directory() {
        return directory;
    }

    /**
     * Lower-case letters, digits and {@code '-'} are kept; every other byte of the UTF-8 id is
     * written as {@code _XX}. The mapping is one-to-one even on case-insensitive file systems.
     */
    Path fileFor(String destinationId) {
        StringBuilder safe = new StringBuilder(destinationId.length());
        for (byte b : destinationId.getBytes(StandardCharsets.UTF_8)) {
            int c = b & 0xFF;
            if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '-') {
                safe.append((char) c);
            } else {
                safe.append('_').append(HEX[c >> 4]).append(HEX[c & 0xF]);
            }
        }
        return directory.resolve(FILE_PREFIX + safe + FILE_SUFFIX);
    }

    @Override
    protected void persist(DestinationConfig config) {
        Path target = fileFor(config.destinationId());
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, FILE_PREFIX, ".tmp");
            Files.writeString(temp, DestinationConfigJson.toJson(config), StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            temp = null;
        } catch (IOException e) {
            throw new ConfigStoreException("Failed to write " + target, e);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    @Override
    protected boolean remove(String destinationId) {
        Path target = fileFor(destinationId);
        try {
            return Files.deleteIfExists(target);
        } catch (IOException e) {
            throw new ConfigStoreException("Failed to delete " + target, e);
        }
    }

    @Override
    protected Map<String, DestinationConfig> loadAll() {
        Map<String, DestinationConfig> loaded = new HashMap<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, FILE_PREFIX + "*" + FILE_SUFFIX)) {
            for (Path file : files) {
                try {
                    DestinationConfig config = DestinationConfigJson.fromJson(Files.readString(file, StandardCharsets.UTF_8));
                    if (!file.getFileName().equals(fileFor(config.destinationId()).getFileName())) {
                        logger.warning("Skipping " + file + ": it holds destination " + config.destinationId());
                        continue;
                    }
                    loaded.put(config.destinationId(), config);
                } catch (IOException | ConfigStoreException e) {
                    logger.log(Level.SEVERE, "Skipping unreadable destination file " + file, e);
                }
            }
        } catch (IOException e) {
            throw new ConfigStoreException("Failed to list " + directory, e);
        }
        return loaded;
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to delete temporary file " + temp, e);
        }
    }
}

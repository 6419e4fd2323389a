package relay.store;

import relay.ConfigValidationException;
import relay.model.DestinationConfig;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Base class for stores that keep every destination in memory and write through to a
 * durable backend.
 *
 * <p>Reads hit an immutable-value {@link ConcurrentHashMap} only. Writes take a lock per
 * destination id, call {@link #persist} or {@link #remove}, and only then update the map, so
 * a failed durable write leaves the in-memory view unchanged.
 *
 * <p>Every write stamps its id with a store-wide sequence number. {@link #reload()} applies
 * its snapshot id by id under the same lock and skips ids written since the snapshot began,
 * so a write racing a reload is never undone by it.
 *
 * <p>Subclasses call {@link #reload()} once their backend is ready.
 */
public abstract class AbstractCachingConfigStore implements DestinationConfigStore {
    private static final Logger logger = Logger.getLogger(AbstractCachingConfigStore.class.getName());

    private final ConcurrentMap<String, DestinationConfig> cache = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, WriteSlot> writeSlots = new ConcurrentHashMap<>();
    private final AtomicLong writeSequence = new AtomicLong();
    private final DestinationConfigValidator validator;
    private final Clock clock;

    protected AbstractCachingConfigStore(DestinationConfigValidator validator, Clock clock) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Writes one record to durable storage, replacing any previous version.
     */
    protected abstract void persist(DestinationConfig config);

    /**
     * Removes one record from durable storage.
     *
     * @return {@code true} if a record was removed
     */
    protected abstract boolean remove(String destinationId);

    /**
     * Reads every record from durable storage, keyed by destination id. Unreadable individual
     * records should be skipped and logged rather than failing the whole load.
     */
    protected abstract Map<String, DestinationConfig> loadAll();

    @Override
    public Optional<DestinationConfig> get(String destinationId) {
        if (destinationId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(cache.get(destinationId));
    }

    @Override
    public DestinationConfig upsert(DestinationConfig config) {
        Objects.requireNonNull(config, "config");
        DestinationConfig validated = validator.validate(config);
        String id = validated.destinationId();
        WriteSlot slot = slotFor(id);
        synchronized (slot) {
            DestinationConfig existing = cache.get(id);
            Instant now = clock.instant();
            DestinationConfig stored = validated.toBuilder()
                    .createdAt(existing != null ? existing.createdAt() : now)
                    .updatedAt(now)
                    .build();
            persist(stored);
            cache.put(id, stored);
            slot.version = writeSequence.incrementAndGet();
            logger.fine(() -> (existing == null ? "Created" : "Updated") + " destination " + id);
            return stored;
        }
    }

    @Override
    public boolean delete(String destinationId) {
        if (destinationId == null || destinationId.isBlank()) {
            throw new ConfigValidationException("destinationId", "destination id is required");
        }
        WriteSlot slot = slotFor(destinationId);
        synchronized (slot) {
            boolean removed = remove(destinationId);
            boolean cached = cache.remove(destinationId) != null;
            slot.version = writeSequence.incrementAndGet();
            if (removed || cached) {
                logger.fine(() -> "Deleted destination " + destinationId);
            }
            return removed || cached;
        }
    }

    @Override
    public List<DestinationConfig> listAll() {
        return cache.values().stream()
                .sorted(Comparator.comparing(DestinationConfig::destinationId))
                .toList();
    }

    @Override
    public void reload() {
        long snapshotStart = writeSequence.get();
        Map<String, DestinationConfig> loaded = loadAll();
        Set<String> ids = new HashSet<>(loaded.keySet());
        ids.addAll(cache.keySet());
        int skipped = 0;
        for (String id : ids) {
            WriteSlot slot = slotFor(id);
            synchronized (slot) {
                if (slot.version > snapshotStart) {
                    skipped++;
                    continue;
                }
                DestinationConfig config = loaded.get(id);
                if (config != null) {
                    cache.put(id, config);
                } else {
                    cache.remove(id);
                }
            }
        }
        logger.info("Loaded " + loaded.size() + " destination(s)"
                + (skipped > 0 ? ", kept " + skipped + " written during the reload" : ""));
    }

    private WriteSlot slotFor(String destinationId) {
        return writeSlots.computeIfAbsent(destinationId, k -> new WriteSlot());
    }

    /** Per-id write lock; {@code version} is only touched while holding it. */
    private static final class WriteSlot {
        long version;
    }
}

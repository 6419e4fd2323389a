package relay.store;

import relay.model.DestinationConfig;

import java.util.List;
import java.util.Optional;

/**
 * Durable, concurrently readable registry of destinations keyed by destination id.
 *
 * <p>Writes are validated before anything is persisted, persisted before they become visible
 * to readers, and serialized per id. A lookup after a successful write returns the written
 * record without restarting anything.
 *
 * @see AbstractCachingConfigStore
 */
public interface DestinationConfigStore {

    /**
     * Looks up a destination.
     *
     * @param destinationId the destination (source chat) id
     * @return the stored config, or empty if none
     */
    Optional<DestinationConfig> get(String destinationId);

    /**
     * Validates, persists and publishes a destination.
     *
     * @param config the new or updated destination
     * @return the stored record: {@code createdAt} carried over from an existing record,
     *         {@code updatedAt} set to the write time
     * @throws relay.ConfigValidationException if the config is rejected; nothing is written
     * @throws relay.ConfigStoreException      if the durable write fails; readers still see the previous record
     */
    DestinationConfig upsert(DestinationConfig config);

    /**
     * Removes a destination.
     *
     * @return {@code false} if no such destination existed
     * @throws relay.ConfigStoreException if the durable delete fails
     */
    boolean delete(String destinationId);

    /**
     * Returns every destination, sorted by id.
     */
    List<DestinationConfig> listAll();

    /**
     * Re-reads durable storage and replaces the in-memory view entry by entry. Entries no
     * longer present in storage are removed. Safe to call while other threads read.
     *
     * @throws relay.ConfigStoreException if storage cannot be read at all
     */
    void reload();
}

/**
 * Destination configuration storage.
 *
 * <p>{@link relay.store.DestinationConfigStore} is the contract; {@link relay.store.AbstractCachingConfigStore}
 * provides the in-memory view and per-id write serialization shared by the file store here and the
 * JDBC stores in {@code relay-jdbc}. {@link relay.store.DestinationConfigJson} is the single
 * persisted document format.
 */
package relay.store;

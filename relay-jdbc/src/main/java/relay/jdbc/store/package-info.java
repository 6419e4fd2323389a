/**
 * JDBC implementation of {@link relay.store.DestinationConfigStore}.
 */
package relay.jdbc.store;

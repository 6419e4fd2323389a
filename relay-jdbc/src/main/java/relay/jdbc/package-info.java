/**
 * JDBC persistence for destination configs.
 *
 * <p>{@link relay.jdbc.store.JdbcDestinationConfigStore} keeps one row per destination with
 * the config as a JSON document. Database differences (upsert syntax, column types) live in
 * {@link relay.jdbc.spi.Dialect} implementations, auto-detected from the JDBC URL by
 * {@link relay.jdbc.dialect.Dialects}.
 *
 * @see relay.jdbc.store.JdbcDestinationConfigStore
 * @see relay.jdbc.dialect.Dialects
 */
package relay.jdbc;

/**
 * Built-in {@link relay.jdbc.spi.Dialect} implementations and the {@link relay.jdbc.dialect.Dialects}
 * registry.
 */
package relay.jdbc.dialect;

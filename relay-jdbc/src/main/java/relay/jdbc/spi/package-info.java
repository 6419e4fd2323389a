/**
 * Service provider interfaces of the JDBC store.
 */
package relay.jdbc.spi;

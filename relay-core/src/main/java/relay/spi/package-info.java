/**
 * Service provider interfaces implemented outside the core module.
 *
 * @see relay.spi.MetricsExporter
 */
package relay.spi;

/**
 * Micrometer bridge for exporting relay metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link relay.micrometer.MicrometerMetricsExporter} implements the
 * {@link relay.spi.MetricsExporter} SPI using Micrometer counters, gauges and a distribution
 * summary.
 *
 * @see relay.micrometer.MicrometerMetricsExporter
 */
package relay.micrometer;

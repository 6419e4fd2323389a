/**
 * Spring Boot auto-configuration for the relay.
 *
 * <p>{@link relay.spring.boot.RelayAutoConfiguration} builds and starts a
 * {@link relay.Relay} from {@code relay.*} properties;
 * {@link relay.spring.boot.RelayMicrometerAutoConfiguration} exports its counters through
 * Micrometer when a {@code MeterRegistry} is present.
 */
package relay.spring.boot;

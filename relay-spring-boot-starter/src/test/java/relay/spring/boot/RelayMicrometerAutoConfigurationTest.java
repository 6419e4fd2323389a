package relay.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import relay.micrometer.MicrometerMetricsExporter;
import relay.spi.MetricsExporter;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RelayMicrometerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(RelayMicrometerAutoConfiguration.class))
            .withUserConfiguration(MeterRegistryConfig.class);

    @Test
    void createsMicrometerExporterByDefault() {
        runner.run(ctx -> {
            assertTrue(ctx.containsBean("micrometerMetricsExporter"));
            assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
        });
    }

    @Test
    void respectsCustomNamePrefix() {
        runner.withPropertyValues("relay.metrics.name-prefix=news.relay").run(ctx -> {
            MeterRegistry registry = ctx.getBean(MeterRegistry.class);
            assertNotNull(registry.find("news.relay.messages.seen").counter());
        });
    }

    @Test
    void disabledWhenPropertyFalse() {
        runner.withPropertyValues("relay.metrics.enabled=false").run(ctx -> {
            assertFalse(ctx.containsBean("micrometerMetricsExporter"));
        });
    }

    @Test
    void skippedWithoutMeterRegistry(@TempDir Path dataDir) {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(
                        RelayMicrometerAutoConfiguration.class, RelayAutoConfiguration.class))
                .withPropertyValues("relay.store.directory=" + dataDir, "relay.auto-start=false")
                .run(ctx -> {
                    assertFalse(ctx.containsBean("micrometerMetricsExporter"));
                    assertSame(MetricsExporter.NOOP, ctx.getBean(relay.Relay.class).stats().metrics());
                });
    }

    @Test
    void backsOffWhenCustomMetricsExporterPresent() {
        runner.withUserConfiguration(CustomExporterConfig.class).run(ctx -> {
            MetricsExporter exporter = ctx.getBean(MetricsExporter.class);
            assertFalse(exporter instanceof MicrometerMetricsExporter);
        });
    }

    @Test
    void relayCountsReachTheRegistry(@TempDir Path dataDir) {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(
                        RelayMicrometerAutoConfiguration.class, RelayAutoConfiguration.class))
                .withBean(MeterRegistry.class, () -> registry)
                .withPropertyValues("relay.store.directory=" + dataDir, "relay.auto-start=false")
                .run(ctx -> {
                    ctx.getBean(relay.Relay.class).stats().recordSeen();
                    assertEquals(1.0, registry.find("relay.messages.seen").counter().count());
                });

        // closing the relay removes its meters
        assertNull(registry.find("relay.messages.seen").counter());
    }

    @Configuration
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration
    static class CustomExporterConfig {
        @Bean
        MetricsExporter customMetricsExporter() {
            return MetricsExporter.NOOP;
        }
    }
}

package relay.spring.boot;

import relay.Relay;
import relay.RelayAdmin;
import relay.RelayConfig;
import relay.ingest.QueueSourceEventStream;
import relay.ingest.SourceEventStream;
import relay.jdbc.store.JdbcDestinationConfigStore;
import relay.model.DestinationConfig;
import relay.spi.MetricsExporter;
import relay.store.DestinationConfigStore;
import relay.store.DestinationConfigValidator;
import relay.store.EnvironmentDestinations;
import relay.store.FileDestinationConfigStore;
import relay.webhook.HttpClientWebhookTransport;
import relay.webhook.WebhookTransport;
import relay.webhook.WebhookUrlPolicy;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.EnumerablePropertySource;
import org.springframework.core.env.Environment;
import org.springframework.core.env.PropertySource;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Auto-configuration for the relay.
 *
 * <p>Wires up a {@link Relay} composite from {@link RelayProperties}: a file or JDBC
 * destination store, an in-process {@link QueueSourceEventStream} unless the application
 * provides its own {@link SourceEventStream}, and the JDK HTTP client transport.
 *
 * @see RelayProperties
 * @see RelayMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(Relay.class)
@EnableConfigurationProperties(RelayProperties.class)
public class RelayAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public RelayConfig relayConfig(RelayProperties props) {
        return new RelayConfig()
                .setDeliveryWorkers(props.getDelivery().getWorkerCount())
                .setDeliveryQueueCapacity(props.getDelivery().getQueueCapacity())
                .setRetryQueueCapacity(props.getDelivery().getRetryQueueCapacity())
                .setMaxAttempts(props.getDelivery().getMaxAttempts())
                .setDrainTimeoutMs(props.getDelivery().getDrainTimeoutMs())
                .setRequestTimeout(props.getDelivery().getRequestTimeout())
                .setRetryBaseDelayMs(props.getRetry().getBaseDelayMs())
                .setRetryMaxDelayMs(props.getRetry().getMaxDelayMs())
                .setRetryJitter(props.getRetry().getJitter())
                .setCircuitFailureThreshold(props.getCircuitBreaker().getFailureThreshold())
                .setCircuitRecoveryTimeout(props.getCircuitBreaker().getRecoveryTimeout())
                .setDispatchThreads(props.getIngest().getDispatchThreads())
                .setDedupWindow(props.getIngest().getDedupWindow())
                .setDedupMaxPerChat(props.getIngest().getDedupMaxPerChat())
                .setValidatorTimeout(props.getValidator().getTimeout())
                .setAllowedWebhookPrefixes(props.getWebhook().getAllowedPrefixes());
    }

    @Bean
    @ConditionalOnMissingBean
    public DestinationConfigValidator destinationConfigValidator(RelayConfig relayConfig) {
        return new DestinationConfigValidator(new WebhookUrlPolicy(relayConfig.getAllowedWebhookPrefixes()));
    }

    @Bean
    @ConditionalOnMissingBean(DestinationConfigStore.class)
    public DestinationConfigStore destinationConfigStore(RelayProperties props,
            DestinationConfigValidator validator,
            ObjectProvider<DataSource> dataSourceProvider,
            Environment environment) {
        RelayProperties.Store storeProps = props.getStore();
        DestinationConfigStore store = switch (storeProps.getType()) {
            case FILE -> new FileDestinationConfigStore(Path.of(storeProps.getDirectory()), validator);
            case JDBC -> {
                DataSource dataSource = dataSourceProvider.getIfAvailable();
                if (dataSource == null) {
                    throw new IllegalStateException("relay.store.type=JDBC requires a DataSource bean");
                }
                yield JdbcDestinationConfigStore.builder()
                        .dataSource(dataSource)
                        .tableName(storeProps.getTableName())
                        .validator(validator)
                        .build();
            }
        };
        if (props.getBootstrap().isEnvWebhooks()) {
            for (DestinationConfig config : EnvironmentDestinations.load(
                    webhookVariables(environment), validator.urlPolicy())) {
                if (store.get(config.destinationId()).isEmpty()) {
                    store.upsert(config);
                }
            }
        }
        return store;
    }

    @Bean
    @ConditionalOnMissingBean(SourceEventStream.class)
    public QueueSourceEventStream sourceEventStream() {
        return new QueueSourceEventStream();
    }

    @Bean
    @ConditionalOnMissingBean(WebhookTransport.class)
    public HttpClientWebhookTransport webhookTransport() {
        return new HttpClientWebhookTransport();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public Relay relay(RelayProperties props,
            RelayConfig relayConfig,
            DestinationConfigStore store,
            SourceEventStream stream,
            WebhookTransport transport,
            ObjectProvider<MetricsExporter> metricsProvider) {

        Relay.Builder builder = Relay.builder()
                .config(relayConfig)
                .store(store)
                .stream(stream)
                .transport(transport);
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        Relay relay = builder.build();
        if (props.isAutoStart()) {
            try {
                relay.start();
            } catch (RuntimeException e) {
                try {
                    relay.close();
                } catch (RuntimeException closeFailure) {
                    e.addSuppressed(closeFailure);
                }
                throw e;
            }
        }
        return relay;
    }

    @Bean
    @ConditionalOnMissingBean
    public RelayAdmin relayAdmin(Relay relay) {
        return relay.admin();
    }

    /**
     * Collects {@code WEBHOOK_*} entries from every enumerable property source, the system
     * environment included. Higher-precedence sources win.
     */
    private static Map<String, String> webhookVariables(Environment environment) {
        Map<String, String> variables = new HashMap<>();
        if (!(environment instanceof ConfigurableEnvironment configurable)) {
            return variables;
        }
        for (PropertySource<?> source : configurable.getPropertySources()) {
            if (source instanceof EnumerablePropertySource<?> enumerable) {
                for (String name : enumerable.getPropertyNames()) {
                    Object value = enumerable.getProperty(name);
                    if (name.startsWith(EnvironmentDestinations.PREFIX) && value != null) {
                        variables.putIfAbsent(name, value.toString());
                    }
                }
            }
        }
        return variables;
    }
}

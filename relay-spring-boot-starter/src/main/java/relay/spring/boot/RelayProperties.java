package relay.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;
import relay.webhook.WebhookUrlPolicy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the relay.
 *
 * @see RelayAutoConfiguration
 */
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

    /**
     * Whether to start ingesting as soon as the relay bean is created.
     */
    private boolean autoStart = true;

    private final Delivery delivery = new Delivery();
    private final Retry retry = new Retry();
    private final CircuitBreaker circuitBreaker = new CircuitBreaker();
    private final Ingest ingest = new Ingest();
    private final Validator validator = new Validator();
    private final Webhook webhook = new Webhook();
    private final Store store = new Store();
    private final Bootstrap bootstrap = new Bootstrap();
    private final Metrics metrics = new Metrics();

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public Delivery getDelivery() {
        return delivery;
    }

    public Retry getRetry() {
        return retry;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public Ingest getIngest() {
        return ingest;
    }

    public Validator getValidator() {
        return validator;
    }

    public Webhook getWebhook() {
        return webhook;
    }

    public Store getStore() {
        return store;
    }

    public Bootstrap getBootstrap() {
        return bootstrap;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public enum StoreType {
        FILE,
        JDBC
    }

    public static class Delivery {
        private int workerCount = 3;
        private int queueCapacity = 1000;
        private int retryQueueCapacity = 1000;
        private int maxAttempts = 3;
        private long drainTimeoutMs = 5000;
        private Duration requestTimeout = Duration.ofSeconds(60);

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getRetryQueueCapacity() {
            return retryQueueCapacity;
        }

        public void setRetryQueueCapacity(int retryQueueCapacity) {
            this.retryQueueCapacity = retryQueueCapacity;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }
    }

    public static class Retry {
        private long baseDelayMs = 1000;
        private long maxDelayMs = 30000;
        private double jitter = 0.5;

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }
    }

    public static class CircuitBreaker {
        private int failureThreshold = 5;
        private Duration recoveryTimeout = Duration.ofSeconds(60);

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Duration getRecoveryTimeout() {
            return recoveryTimeout;
        }

        public void setRecoveryTimeout(Duration recoveryTimeout) {
            this.recoveryTimeout = recoveryTimeout;
        }
    }

    public static class Ingest {
        private int dispatchThreads = 4;
        private Duration dedupWindow = Duration.ofMinutes(10);
        private int dedupMaxPerChat = 1000;

        public int getDispatchThreads() {
            return dispatchThreads;
        }

        public void setDispatchThreads(int dispatchThreads) {
            this.dispatchThreads = dispatchThreads;
        }

        public Duration getDedupWindow() {
            return dedupWindow;
        }

        public void setDedupWindow(Duration dedupWindow) {
            this.dedupWindow = dedupWindow;
        }

        public int getDedupMaxPerChat() {
            return dedupMaxPerChat;
        }

        public void setDedupMaxPerChat(int dedupMaxPerChat) {
            this.dedupMaxPerChat = dedupMaxPerChat;
        }
    }

    public static class Validator {
        private Duration timeout = Duration.ofSeconds(10);

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Webhook {
        /**
         * URL prefixes a destination webhook must start with.
         */
        private List<String> allowedPrefixes = new ArrayList<>(WebhookUrlPolicy.DISCORD_PREFIXES);

        public List<String> getAllowedPrefixes() {
            return allowedPrefixes;
        }

        public void setAllowedPrefixes(List<String> allowedPrefixes) {
            this.allowedPrefixes = allowedPrefixes;
        }
    }

    public static class Store {
        private StoreType type = StoreType.FILE;

        /**
         * Directory of the file store.
         */
        private String directory = "relay-data/destinations";

        /**
         * Table of the JDBC store.
         */
        private String tableName = "relay_destination";

        public StoreType getType() {
            return type;
        }

        public void setType(StoreType type) {
            this.type = type;
        }

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public String getTableName() {
            return tableName;
        }

        public void setTableName(String tableName) {
            this.tableName = tableName;
        }
    }

    public static class Bootstrap {
        /**
         * Whether to create destinations from {@code WEBHOOK_<chatId>} variables at startup.
         * Destinations already in the store are left alone.
         */
        private boolean envWebhooks = false;

        public boolean isEnvWebhooks() {
            return envWebhooks;
        }

        public void setEnvWebhooks(boolean envWebhooks) {
            this.envWebhooks = envWebhooks;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "relay";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}

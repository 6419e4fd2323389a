package relay;

import relay.webhook.WebhookUrlPolicy;

import java.time.Duration;
import java.util.List;

/**
 * Plain settings holder for {@link Relay#builder()}. Every field has a working default.
 */
public final class RelayConfig {
    private int deliveryWorkers = 3;
    private int deliveryQueueCapacity = 1000;
    private int retryQueueCapacity = 1000;
    private int maxAttempts = 3;
    private long drainTimeoutMs = 5000L;
    private Duration requestTimeout = Duration.ofSeconds(60);

    private long retryBaseDelayMs = 1000L;
    private long retryMaxDelayMs = 30000L;
    private double retryJitter = 0.5;

    private int circuitFailureThreshold = 5;
    private Duration circuitRecoveryTimeout = Duration.ofSeconds(60);

    private int dispatchThreads = 4;
    private Duration dedupWindow = Duration.ofMinutes(10);
    private int dedupMaxPerChat = 1000;

    private Duration validatorTimeout = Duration.ofSeconds(10);
    private List<String> allowedWebhookPrefixes = WebhookUrlPolicy.DISCORD_PREFIXES;

    public int getDeliveryWorkers() {
        return deliveryWorkers;
    }

    public RelayConfig setDeliveryWorkers(int deliveryWorkers) {
        this.deliveryWorkers = deliveryWorkers;
        return this;
    }

    public int getDeliveryQueueCapacity() {
        return deliveryQueueCapacity;
    }

    public RelayConfig setDeliveryQueueCapacity(int deliveryQueueCapacity) {
        this.deliveryQueueCapacity = deliveryQueueCapacity;
        return this;
    }

    public int getRetryQueueCapacity() {
        return retryQueueCapacity;
    }

    public RelayConfig setRetryQueueCapacity(int retryQueueCapacity) {
        this.retryQueueCapacity = retryQueueCapacity;
        return this;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public RelayConfig setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
        return this;
    }

    public long getDrainTimeoutMs() {
        return drainTimeoutMs;
    }

    public RelayConfig setDrainTimeoutMs(long drainTimeoutMs) {
        this.drainTimeoutMs = drainTimeoutMs;
        return this;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public RelayConfig setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
        return this;
    }

    public long getRetryBaseDelayMs() {
        return retryBaseDelayMs;
    }

    public RelayConfig setRetryBaseDelayMs(long retryBaseDelayMs) {
        this.retryBaseDelayMs = retryBaseDelayMs;
        return this;
    }

    public long getRetryMaxDelayMs() {
        return retryMaxDelayMs;
    }

    public RelayConfig setRetryMaxDelayMs(long retryMaxDelayMs) {
        this.retryMaxDelayMs = retryMaxDelayMs;
        return this;
    }

    public double getRetryJitter() {
        return retryJitter;
    }

    public RelayConfig setRetryJitter(double retryJitter) {
        this.retryJitter = retryJitter;
        return this;
    }

    public int getCircuitFailureThreshold() {
        return circuitFailureThreshold;
    }

    public RelayConfig setCircuitFailureThreshold(int circuitFailureThreshold) {
        this.circuitFailureThreshold = circuitFailureThreshold;
        return this;
    }

    public Duration getCircuitRecoveryTimeout() {
        return circuitRecoveryTimeout;
    }

    public RelayConfig setCircuitRecoveryTimeout(Duration circuitRecoveryTimeout) {
        this.circuitRecoveryTimeout = circuitRecoveryTimeout;
        return this;
    }

    public int getDispatchThreads() {
        return dispatchThreads;
    }

    public RelayConfig setDispatchThreads(int dispatchThreads) {
        this.dispatchThreads = dispatchThreads;
        return this;
    }

    public Duration getDedupWindow() {
        return dedupWindow;
    }

    public RelayConfig setDedupWindow(Duration dedupWindow) {
        this.dedupWindow = dedupWindow;
        return this;
    }

    public int getDedupMaxPerChat() {
        return dedupMaxPerChat;
    }

    public RelayConfig setDedupMaxPerChat(int dedupMaxPerChat) {
        this.dedupMaxPerChat = dedupMaxPerChat;
        return this;
    }

    public Duration getValidatorTimeout() {
        return validatorTimeout;
    }

    public RelayConfig setValidatorTimeout(Duration validatorTimeout) {
        this.validatorTimeout = validatorTimeout;
        return this;
    }

    public List<String> getAllowedWebhookPrefixes() {
        return allowedWebhookPrefixes;
    }

    public RelayConfig setAllowedWebhookPrefixes(List<String> allowedWebhookPrefixes) {
        this.allowedWebhookPrefixes = List.copyOf(allowedWebhookPrefixes);
        return this;
    }
}

package relay;

import relay.delivery.CircuitBreaker;
import relay.delivery.DeliveryDispatcher;
import relay.model.DestinationConfig;
import relay.stats.RelayStats;
import relay.stats.StatsSnapshot;
import relay.store.DestinationConfigStore;
import relay.webhook.WebhookUrls;
import relay.webhook.WebhookValidation;
import relay.webhook.WebhookValidator;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Operations exposed to an administration layer (HTTP API, CLI, tests).
 *
 * <p>Writes go straight to the {@link DestinationConfigStore} and are visible to the next
 * message without a restart.
 */
public final class RelayAdmin {
    private static final Logger logger = Logger.getLogger(RelayAdmin.class.getName());

    private final DestinationConfigStore store;
    private final WebhookValidator validator;
    private final DeliveryDispatcher dispatcher;
    private final RelayStats stats;

    public RelayAdmin(DestinationConfigStore store, WebhookValidator validator,
                      DeliveryDispatcher dispatcher, RelayStats stats) {
        this.store = Objects.requireNonNull(store, "store");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.stats = Objects.requireNonNull(stats, "stats");
    }

    /**
     * Creates or replaces a destination.
     *
     * @param config the new configuration
     * @param verify when true, the webhook must answer a test message before anything is stored
     * @return the stored record
     * @throws ConfigValidationException if the config is invalid or the test message fails
     */
    public DestinationConfig upsertDestination(DestinationConfig config, boolean verify) {
        Objects.requireNonNull(config, "config");
        if (verify) {
            WebhookValidation validation = validator.validate(config.webhookUrl());
            if (!validation.valid()) {
                throw new ConfigValidationException("webhookUrl", "webhook test message failed: " + validation.message());
            }
        }
        DestinationConfig stored = store.upsert(config);
        logger.info("Destination " + stored.destinationId() + " saved (webhook "
                + WebhookUrls.redact(stored.webhookUrl()) + ", enabled=" + stored.enabled() + ")");
        return stored;
    }

    public DestinationConfig upsertDestination(DestinationConfig config) {
        return upsertDestination(config, false);
    }

    /**
     * Deletes a destination and forgets its circuit breaker.
     *
     * @return {@code false} if no such destination existed
     */
    public boolean deleteDestination(String destinationId) {
        boolean deleted = store.delete(destinationId);
        if (deleted) {
            dispatcher.forget(destinationId);
            logger.info("Destination " + destinationId + " deleted");
        }
        return deleted;
    }

    public Optional<DestinationConfig> destination(String destinationId) {
        return store.get(destinationId);
    }

    public List<DestinationConfig> listDestinations() {
        return store.listAll();
    }

    public WebhookValidation validateWebhook(String url) {
        return validator.validate(url);
    }

    public StatsSnapshot stats() {
        return stats.snapshot();
    }

    public void resetStats() {
        stats.reset();
        logger.info("Stats reset");
    }

    public DestinationHealth health(String destinationId) {
        Optional<DestinationConfig> config = store.get(destinationId);
        CircuitBreaker.Snapshot circuit = dispatcher.circuit(destinationId);
        return new DestinationHealth(
                destinationId,
                config.isPresent(),
                config.map(DestinationConfig::enabled).orElse(false),
                circuit.state(),
                circuit.consecutiveFailures(),
                circuit.openedAt(),
                stats.snapshot().destination(destinationId).successRate());
    }
}

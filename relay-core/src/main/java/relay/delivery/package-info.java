/**
 * Webhook delivery with bounded queues, retry with exponential backoff, rate-limit
 * handling, and a circuit breaker per destination.
 *
 * <p>{@link relay.delivery.DeliveryDispatcher} drains a main queue and a retry queue using a
 * 2:1 weighted round-robin. Results are values ({@link relay.delivery.DeliveryOutcome}), never
 * exceptions.
 *
 * @see relay.delivery.DeliveryDispatcher
 * @see relay.delivery.CircuitBreaker
 * @see relay.delivery.RetryPolicy
 */
package relay.delivery;

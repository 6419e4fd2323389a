package relay.delivery;

/**
 * Strategy for computing the delay before retrying a failed delivery attempt.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Computes the delay in milliseconds before the next retry attempt.
     *
     * @param attempts the number of attempts made so far (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int attempts);
}

package relay.delivery;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy using exponential backoff with optional jitter.
 *
 * <p>Delay formula: {@code baseDelay * 2^(attempt-1)}, capped at {@code maxDelay}, then
 * multiplied by a random factor in {@code [1 - jitter, 1 + jitter)} and capped again.
 * With {@code jitter = 0} the sequence is deterministic and non-decreasing.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitter;

    /**
     * @param baseDelayMs base delay for the first retry (milliseconds)
     * @param maxDelayMs  maximum delay cap (milliseconds)
     * @param jitter      jitter fraction in {@code [0, 1]}
     */
    public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, double jitter) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
        }
        if (!(jitter >= 0.0 && jitter <= 1.0)) {
            throw new IllegalArgumentException("jitter must be within [0, 1], got: " + jitter);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitter = jitter;
    }

    public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
        this(baseDelayMs, maxDelayMs, 0.5);
    }

    @Override
    public long computeDelayMs(int attempts) {
        if (attempts <= 0) {
            return 0L;
        }
        long expDelay;
        if (attempts >= 63) {
            expDelay = Long.MAX_VALUE;
        } else {
            long shift = 1L << (attempts - 1);
            // overflow guard
            expDelay = shift > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
        }
        long capped = Math.min(maxDelayMs, expDelay);
        if (jitter == 0.0) {
            return capped;
        }
        double factor = ThreadLocalRandom.current().nextDouble(1.0 - jitter, 1.0 + jitter);
        long withJitter = (long) (capped * factor);
        return Math.min(maxDelayMs, Math.max(0L, withJitter));
    }
}

package feedwatch.retry;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy using exponential backoff with additive jitter.
 *
 * <p>Delay formula: {@code min(baseDelay * 2^attempt, maxDelay)} plus a uniformly random
 * jitter of 0-30% of that value. The jitter may push the delay past {@code maxDelay}.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
    static final double MAX_JITTER_RATIO = 0.3;

    private final long baseDelayMs;
    private final long maxDelayMs;

    /**
     * @param baseDelayMs delay after the first failed attempt (milliseconds)
     * @param maxDelayMs  cap applied before jitter (milliseconds)
     */
    public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must be >= 0, got: " + baseDelayMs);
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                    "maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs + " < " + baseDelayMs);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    @Override
    public long computeDelayMs(int attempt) {
        if (attempt < 0 || baseDelayMs == 0) {
            return 0L;
        }
        long expDelay;
        if (attempt >= 62) {
            expDelay = Long.MAX_VALUE;
        } else {
            long shift = 1L << attempt;
            // Guard against overflow: if shift exceeds maxDelayMs/baseDelayMs, cap directly
            expDelay = shift > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
        }
        long capped = Math.min(maxDelayMs, expDelay);
        double jitter = ThreadLocalRandom.current().nextDouble() * MAX_JITTER_RATIO;
        return capped + (long) (capped * jitter);
    }
}

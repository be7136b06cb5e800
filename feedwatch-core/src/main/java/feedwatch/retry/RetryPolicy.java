package feedwatch.retry;

/**
 * Strategy for computing the delay before the next attempt of a failed operation.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Computes the delay in milliseconds to wait after a failed attempt.
     *
     * @param attempt index of the attempt that just failed (0-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int attempt);
}

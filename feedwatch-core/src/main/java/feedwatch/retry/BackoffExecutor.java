package feedwatch.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs an operation with bounded retries and exponential backoff.
 *
 * <p>A failure the classifier rejects is rethrown at once. Otherwise the executor sleeps for the
 * policy delay and tries again, up to {@code maxAttempts}; there is no sleep after the last
 * attempt, which rethrows its failure. If the thread is interrupted while sleeping, the interrupt
 * flag is restored and the last failure is rethrown.
 *
 * <p>This class is thread-safe.
 */
public final class BackoffExecutor {
    private static final Logger logger = Logger.getLogger(BackoffExecutor.class.getName());

    private final Sleeper sleeper;

    public BackoffExecutor() {
        this(Sleeper.SYSTEM);
    }

    public BackoffExecutor(Sleeper sleeper) {
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Executes {@code op} with the settings of a {@link RetrySpec}.
     */
    public <T> T execute(Callable<T> op, RetrySpec spec) throws Exception {
        Objects.requireNonNull(spec, "spec");
        return execute(op, spec.maxAttempts(), spec.policy(), spec.classifier());
    }

    /**
     * Executes {@code op} with exponential backoff between {@code baseDelay} and {@code maxDelay}.
     *
     * @throws IllegalArgumentException if {@code maxAttempts < 1}
     * @throws Exception                the last failure of {@code op}
     */
    public <T> T execute(Callable<T> op, int maxAttempts, Duration baseDelay, Duration maxDelay,
                         RetryClassifier isRetryable) throws Exception {
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        return execute(op, maxAttempts,
                new ExponentialBackoffRetryPolicy(baseDelay.toMillis(), maxDelay.toMillis()), isRetryable);
    }

    public <T> T execute(Callable<T> op, int maxAttempts, RetryPolicy policy,
                         RetryClassifier isRetryable) throws Exception {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(isRetryable, "isRetryable");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }

        for (int attempt = 0; ; attempt++) {
            try {
                return op.call();
            } catch (Exception e) {
                if (!isRetryable.isRetryable(e) || attempt + 1 >= maxAttempts) {
                    throw e;
                }
                long delayMs = policy.computeDelayMs(attempt);
                if (logger.isLoggable(Level.FINE)) {
                    logger.log(Level.FINE, "Attempt {0}/{1} failed ({2}), retrying in {3} ms",
                            new Object[]{attempt + 1, maxAttempts, e.getMessage(), delayMs});
                }
                try {
                    sleeper.sleep(Duration.ofMillis(delayMs));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    e.addSuppressed(ie);
                    throw e;
                }
            }
        }
    }
}

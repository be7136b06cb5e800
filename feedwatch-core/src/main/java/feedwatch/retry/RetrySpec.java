package feedwatch.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-strategy retry settings.
 *
 * @param maxAttempts total attempts including the first, at least 1
 * @param baseDelay   delay after the first failed attempt
 * @param maxDelay    cap for the exponential delay, before jitter
 * @param classifier  decides which failures are retried
 */
public record RetrySpec(int maxAttempts, Duration baseDelay, Duration maxDelay, RetryClassifier classifier) {

    /** 3 attempts, 1 s base delay, 10 s cap, {@link RetryClassifier#DEFAULT}. */
    public static final RetrySpec DEFAULT =
            new RetrySpec(3, Duration.ofSeconds(1), Duration.ofSeconds(10), RetryClassifier.DEFAULT);

    /** A single attempt without retries. */
    public static final RetrySpec NONE =
            new RetrySpec(1, Duration.ZERO, Duration.ZERO, RetryClassifier.DEFAULT);

    public RetrySpec {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        Objects.requireNonNull(classifier, "classifier");
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be >= 0");
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
    }

    public static RetrySpec of(int maxAttempts, Duration baseDelay, Duration maxDelay) {
        return new RetrySpec(maxAttempts, baseDelay, maxDelay, RetryClassifier.DEFAULT);
    }

    public RetryPolicy policy() {
        return new ExponentialBackoffRetryPolicy(baseDelay.toMillis(), maxDelay.toMillis());
    }
}

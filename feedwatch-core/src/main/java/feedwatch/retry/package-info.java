/**
 * Retry with exponential backoff around fetch operations.
 *
 * <p>{@link feedwatch.retry.BackoffExecutor} runs an operation up to a bounded number of
 * attempts, sleeping between attempts as computed by a {@link feedwatch.retry.RetryPolicy}.
 * A {@link feedwatch.retry.RetryClassifier} decides which failures are worth another attempt.
 */
package feedwatch.retry;

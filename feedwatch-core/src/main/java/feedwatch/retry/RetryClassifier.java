package feedwatch.retry;

import feedwatch.PermanentFetchException;
import feedwatch.TransientFetchException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a failure is worth another attempt.
 */
@FunctionalInterface
public interface RetryClassifier {

    /**
     * Retries transient fetch failures and I/O errors (connection failures, request timeouts).
     * Permanent fetch failures and anything unrecognized are not retried.
     */
    RetryClassifier DEFAULT = error -> {
        if (error instanceof PermanentFetchException) {
            return false;
        }
        return error instanceof TransientFetchException
                || error instanceof IOException
                || error instanceof UncheckedIOException
                || error instanceof TimeoutException;
    };

    /**
     * Retries every failure.
     */
    RetryClassifier ALWAYS = error -> true;

    boolean isRetryable(Throwable error);
}

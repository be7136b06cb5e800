package feedwatch.spi;

import feedwatch.Item;
import feedwatch.retry.RetrySpec;

import java.util.List;

/**
 * One way of obtaining the latest items of a source.
 *
 * <p>Strategies are combined by {@link feedwatch.fetch.FetchStrategyChain}, which wraps every
 * call with retries according to {@link #retrySpec()}.
 */
public interface FetchStrategy {

    /**
     * Stable name, used for metrics and for remembering the last successful strategy.
     */
    String name();

    /**
     * Fetches items for a handle. An empty list means the strategy found nothing usable.
     *
     * @throws Exception on failure; see {@link feedwatch.retry.RetryClassifier#DEFAULT} for which
     *                   failures are retried
     */
    List<Item> fetch(String handle) throws Exception;

    /**
     * Retry policy for this strategy. Defaults to {@link RetrySpec#DEFAULT}.
     */
    default RetrySpec retrySpec() {
        return RetrySpec.DEFAULT;
    }
}

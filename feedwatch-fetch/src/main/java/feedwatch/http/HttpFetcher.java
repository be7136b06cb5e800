package feedwatch.http;

import feedwatch.FetchException;

import java.net.URI;
import java.util.Map;

/**
 * Minimal GET transport used by the HTTP fetch strategies.
 *
 * <p>Implementations translate transport failures and non-2xx statuses into
 * {@link feedwatch.TransientFetchException} or {@link feedwatch.PermanentFetchException} so the
 * backoff executor can decide whether to retry.
 *
 * @see JdkHttpFetcher
 */
@FunctionalInterface
public interface HttpFetcher {

    /**
     * Performs a GET request and returns the response body.
     *
     * @param uri     target
     * @param headers extra request headers, added on top of the fetcher's defaults
     * @return response body of a 2xx response
     * @throws FetchException on transport failure, timeout or non-2xx status
     */
    String get(URI uri, Map<String, String> headers) throws FetchException;

    default String get(URI uri) throws FetchException {
        return get(uri, Map.of());
    }
}

package feedwatch.http;

import feedwatch.FetchException;
import feedwatch.TransientFetchException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link HttpFetcher} on top of {@link HttpClient}.
 *
 * <p>Every request carries a hard timeout. Timeouts and I/O errors surface as
 * {@link TransientFetchException}; statuses are classified by {@link HttpStatusClassifier}.
 *
 * <pre>{@code
 * HttpFetcher http = JdkHttpFetcher.builder()
 *     .requestTimeout(Duration.ofSeconds(20))
 *     .build();
 * }</pre>
 */
public final class JdkHttpFetcher implements HttpFetcher {
    private static final Logger logger = Logger.getLogger(JdkHttpFetcher.class.getName());

    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(20);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) "
                    + "Chrome/131.0.0.0 Safari/537.36";

    private final HttpClient client;
    private final Duration requestTimeout;
    private final Map<String, String> defaultHeaders;

    private JdkHttpFetcher(Builder builder) {
        this.requestTimeout = positive(builder.requestTimeout, "requestTimeout");
        Duration connectTimeout = positive(builder.connectTimeout, "connectTimeout");
        this.client = builder.client != null ? builder.client : HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("User-Agent", builder.userAgent);
        headers.put("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8");
        headers.put("Accept-Language", "en-US,en;q=0.9");
        headers.putAll(builder.headers);
        this.defaultHeaders = Map.copyOf(headers);
    }

    private static Duration positive(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a fetcher with default timeouts and browser-like headers.
     */
    public static JdkHttpFetcher withDefaults() {
        return builder().build();
    }

    @Override
    public String get(URI uri, Map<String, String> headers) throws FetchException {
        Objects.requireNonNull(uri, "uri");
        HttpRequest.Builder request = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .GET();
        defaultHeaders.forEach(request::header);
        headers.forEach(request::setHeader);

        HttpResponse<String> response;
        try {
            response = client.send(request.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new TransientFetchException("Timed out after " + requestTimeout.toMillis() + " ms: " + uri, e);
        } catch (IOException e) {
            throw new TransientFetchException("Request failed: " + uri, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientFetchException("Interrupted while requesting " + uri, e);
        }

        int status = response.statusCode();
        if (!HttpStatusClassifier.isSuccess(status)) {
            logger.log(Level.FINE, "HTTP {0} from {1}", new Object[]{status, uri});
            throw HttpStatusClassifier.toException(status, uri.toString());
        }
        return response.body();
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }

    /**
     * Builder for {@link JdkHttpFetcher}.
     */
    public static final class Builder {
        private HttpClient client;
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private String userAgent = DEFAULT_USER_AGENT;
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Uses a preconfigured client. The connect timeout setting is then ignored.
         *
         * <p>Optional. Defaults to a client following normal redirects.
         */
        public Builder client(HttpClient client) {
            this.client = Objects.requireNonNull(client, "client");
            return this;
        }

        /**
         * <p>Optional. Defaults to 20 seconds.
         */
        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        /**
         * <p>Optional. Defaults to 10 seconds.
         */
        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        /**
         * <p>Optional. Defaults to a desktop browser user agent.
         */
        public Builder userAgent(String userAgent) {
            this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
            return this;
        }

        /**
         * Adds a header sent with every request.
         */
        public Builder header(String name, String value) {
            headers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public JdkHttpFetcher build() {
            return new JdkHttpFetcher(this);
        }
    }
}

package feedwatch.strategy;

import feedwatch.http.HttpFetcher;
import feedwatch.spi.FetchStrategy;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Builds the HTTP strategies by name.
 */
public final class FetchStrategies {

    public static final List<String> DEFAULT_ORDER = List.of(
            ProfileApiStrategy.NAME, ProfilePageStrategy.NAME, FeedBridgeStrategy.NAME, FeedMirrorStrategy.NAME);

    private FetchStrategies() {
    }

    /**
     * All built-in strategies in preference order, with default endpoints.
     */
    public static List<FetchStrategy> defaults(HttpFetcher http) {
        return create(DEFAULT_ORDER, http, FeedBridgeStrategy.DEFAULT_BRIDGE_URL, FeedMirrorStrategy.DEFAULT_MIRRORS);
    }

    /**
     * Creates the named strategies in the given order.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static List<FetchStrategy> create(List<String> names, HttpFetcher http, String bridgeUrl,
            List<String> mirrors) {
        Objects.requireNonNull(names, "names");
        Objects.requireNonNull(http, "http");
        List<FetchStrategy> strategies = new ArrayList<>(names.size());
        for (String name : names) {
            switch (name.toLowerCase(Locale.ROOT)) {
                case ProfileApiStrategy.NAME -> strategies.add(new ProfileApiStrategy(http));
                case ProfilePageStrategy.NAME -> strategies.add(new ProfilePageStrategy(http));
                case FeedBridgeStrategy.NAME -> strategies.add(new FeedBridgeStrategy(http, bridgeUrl));
                case FeedMirrorStrategy.NAME -> strategies.add(new FeedMirrorStrategy(http, mirrors));
                default -> throw new IllegalArgumentException("Unknown fetch strategy: " + name
                        + ". Available: " + DEFAULT_ORDER);
            }
        }
        return strategies;
    }
}

package feedwatch.strategy;

import feedwatch.Item;
import feedwatch.dedup.ItemIdExtractor;
import feedwatch.http.HttpFetcher;
import feedwatch.spi.FetchStrategy;

import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads a profile through an RSS-Bridge instance rendering it as an Atom feed.
 *
 * <p>Bridges cache upstream pages, so this is the most dependable but least real-time strategy.
 */
public final class FeedBridgeStrategy implements FetchStrategy {
    private static final Logger logger = Logger.getLogger(FeedBridgeStrategy.class.getName());

    public static final String NAME = "rss-bridge";
    public static final String DEFAULT_BRIDGE_URL = "https://rss-bridge.org/bridge01";

    private final HttpFetcher http;
    private final String bridgeUrl;
    private final FeedParser parser;

    public FeedBridgeStrategy(HttpFetcher http) {
        this(http, DEFAULT_BRIDGE_URL);
    }

    public FeedBridgeStrategy(HttpFetcher http, String bridgeUrl) {
        this.http = Objects.requireNonNull(http, "http");
        this.bridgeUrl = ProfileUrls.trimTrailingSlash(Objects.requireNonNull(bridgeUrl, "bridgeUrl"));
        this.parser = new FeedParser(ItemIdExtractor.DEFAULT);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Item> fetch(String handle) throws Exception {
        URI uri = feedUri(handle);
        logger.log(Level.FINE, "Fetching {0} via {1}", new Object[]{handle, uri});
        List<Item> items = parser.parse(http.get(uri), UnaryOperator.identity());
        if (items.isEmpty()) {
            logger.log(Level.FINE, "Bridge returned no entries for {0}", handle);
        }
        return items;
    }

    URI feedUri(String handle) {
        return URI.create(bridgeUrl + "/?action=display&bridge=Instagram&context=Username&u="
                + ProfileUrls.encode(handle) + "&media_type=all&format=Atom");
    }
}

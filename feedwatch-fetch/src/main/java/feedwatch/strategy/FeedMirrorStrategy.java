package feedwatch.strategy;

import feedwatch.FetchException;
import feedwatch.Item;
import feedwatch.dedup.ItemIdExtractor;
import feedwatch.http.HttpFetcher;
import feedwatch.retry.RetrySpec;
import feedwatch.spi.FetchStrategy;

import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads a profile's RSS feed from community-run mirror front ends, trying each mirror in turn.
 *
 * <p>Mirror links are rewritten to canonical profile URLs so item ids and URLs match the other
 * strategies. The first mirror returning entries wins. The strategy iterates mirrors itself, so it
 * is not retried by the chain.
 */
public final class FeedMirrorStrategy implements FetchStrategy {
    private static final Logger logger = Logger.getLogger(FeedMirrorStrategy.class.getName());

    public static final String NAME = "feed-mirror";
    public static final List<String> DEFAULT_MIRRORS = List.of(
            "https://bibliogram.art",
            "https://bibliogram.snopyta.org",
            "https://bibliogram.pussthecat.org");

    private final HttpFetcher http;
    private final List<String> mirrors;
    private final FeedParser parser;

    public FeedMirrorStrategy(HttpFetcher http) {
        this(http, DEFAULT_MIRRORS);
    }

    public FeedMirrorStrategy(HttpFetcher http, List<String> mirrors) {
        this.http = Objects.requireNonNull(http, "http");
        Objects.requireNonNull(mirrors, "mirrors");
        if (mirrors.isEmpty()) {
            throw new IllegalArgumentException("mirrors must not be empty");
        }
        this.mirrors = mirrors.stream().map(ProfileUrls::trimTrailingSlash).toList();
        this.parser = new FeedParser(ItemIdExtractor.DEFAULT);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RetrySpec retrySpec() {
        return RetrySpec.NONE;
    }

    /**
     * @throws FetchException the last mirror failure, with earlier ones suppressed, when no mirror
     *                        answered at all
     */
    @Override
    public List<Item> fetch(String handle) throws Exception {
        FetchException failure = null;
        boolean answered = false;
        for (String mirror : mirrors) {
            URI uri = URI.create(mirror + "/u/" + ProfileUrls.encode(handle) + "/rss.xml");
            try {
                List<Item> items = parser.parse(http.get(uri),
                        link -> link.startsWith(mirror) ? ProfileUrls.CANONICAL_BASE + link.substring(mirror.length()) : link);
                answered = true;
                if (!items.isEmpty()) {
                    logger.log(Level.INFO, "Fetched {0} items for {1} from mirror {2}",
                            new Object[]{items.size(), handle, mirror});
                    return items;
                }
            } catch (FetchException e) {
                logger.log(Level.FINE, "Mirror " + mirror + " failed for " + handle, e);
                if (failure != null) {
                    e.addSuppressed(failure);
                }
                failure = e;
            }
        }
        if (!answered && failure != null) {
            throw failure;
        }
        return List.of();
    }

    public List<String> mirrors() {
        return mirrors;
    }
}

package feedwatch.strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import feedwatch.Item;
import feedwatch.http.HttpFetcher;
import feedwatch.spi.FetchStrategy;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scrapes the public profile page.
 *
 * <p>Reads the embedded shared-data JSON when present. Otherwise falls back to collecting post
 * shortcodes from links in the markup; those items have no timestamp or caption.
 */
public final class ProfilePageStrategy implements FetchStrategy {
    private static final Logger logger = Logger.getLogger(ProfilePageStrategy.class.getName());

    public static final String NAME = "profile-page";

    private static final Pattern SHARED_DATA = Pattern.compile("window\\._sharedData = (\\{.+?});</script>");
    private static final Pattern POST_LINK = Pattern.compile("/p/([A-Za-z0-9_-]+)/");

    private final HttpFetcher http;
    private final ObjectMapper mapper;
    private final String profileBaseUrl;

    public ProfilePageStrategy(HttpFetcher http) {
        this(http, new ObjectMapper(), ProfileUrls.CANONICAL_BASE);
    }

    public ProfilePageStrategy(HttpFetcher http, ObjectMapper mapper, String profileBaseUrl) {
        this.http = Objects.requireNonNull(http, "http");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.profileBaseUrl = ProfileUrls.trimTrailingSlash(Objects.requireNonNull(profileBaseUrl, "profileBaseUrl"));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Item> fetch(String handle) throws Exception {
        String html = http.get(URI.create(profileBaseUrl + "/" + ProfileUrls.encode(handle) + "/"));

        List<Item> shared = fromSharedData(html, handle);
        if (!shared.isEmpty()) {
            return shared;
        }

        Set<String> shortcodes = new LinkedHashSet<>();
        Matcher m = POST_LINK.matcher(html);
        while (m.find() && shortcodes.size() < ProfileTimeline.MAX_ITEMS) {
            shortcodes.add(m.group(1));
        }
        if (shortcodes.isEmpty()) {
            logger.log(Level.WARNING, "Could not extract items from profile page of {0}", handle);
            return List.of();
        }
        List<Item> items = new ArrayList<>(shortcodes.size());
        for (String shortcode : shortcodes) {
            items.add(Item.builder(shortcode).url(ProfileUrls.postUrl(shortcode)).build());
        }
        logger.log(Level.FINE, "Scraped {0} post links for {1} without metadata",
                new Object[]{items.size(), handle});
        return items;
    }

    private List<Item> fromSharedData(String html, String handle) {
        Matcher m = SHARED_DATA.matcher(html);
        if (!m.find()) {
            return List.of();
        }
        try {
            JsonNode user = mapper.readTree(m.group(1))
                    .path("entry_data").path("ProfilePage").path(0).path("graphql").path("user");
            return ProfileTimeline.items(user);
        } catch (JsonProcessingException e) {
            logger.log(Level.FINE, "Embedded shared data of {0} is not valid JSON", handle);
            return List.of();
        }
    }
}

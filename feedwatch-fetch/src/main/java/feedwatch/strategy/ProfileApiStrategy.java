package feedwatch.strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import feedwatch.Item;
import feedwatch.http.HttpFetcher;
import feedwatch.spi.FetchStrategy;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads the newest items from the public web profile JSON endpoint.
 *
 * <p>Real-time and carries the pinned flag, but rate limited aggressively. Answers that are not
 * JSON (login walls) count as "nothing found".
 */
public final class ProfileApiStrategy implements FetchStrategy {
    private static final Logger logger = Logger.getLogger(ProfileApiStrategy.class.getName());

    public static final String NAME = "profile-api";
    public static final String DEFAULT_API_URL = "https://www.instagram.com/api/v1/users/web_profile_info/";
    public static final String WEB_APP_ID = "936619743392459";

    private static final Map<String, String> API_HEADERS = Map.of(
            "X-IG-App-ID", WEB_APP_ID,
            "X-Requested-With", "XMLHttpRequest",
            "Accept", "application/json");

    private final HttpFetcher http;
    private final ObjectMapper mapper;
    private final String apiUrl;

    public ProfileApiStrategy(HttpFetcher http) {
        this(http, new ObjectMapper(), DEFAULT_API_URL);
    }

    public ProfileApiStrategy(HttpFetcher http, ObjectMapper mapper, String apiUrl) {
        this.http = Objects.requireNonNull(http, "http");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.apiUrl = Objects.requireNonNull(apiUrl, "apiUrl");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Item> fetch(String handle) throws Exception {
        URI uri = URI.create(apiUrl + "?username=" + ProfileUrls.encode(handle));
        String body = http.get(uri, API_HEADERS);

        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            logger.log(Level.FINE, "Profile API answered with non-JSON for {0}", handle);
            return List.of();
        }
        JsonNode user = root.path("data").path("user");
        if (!ProfileTimeline.hasTimeline(user)) {
            return List.of();
        }
        List<Item> items = ProfileTimeline.items(user);
        long pinned = items.stream().filter(Item::pinned).count();
        if (pinned > 0) {
            logger.log(Level.FINE, "Found {0} pinned item(s) for {1}", new Object[]{pinned, handle});
        }
        return items;
    }
}

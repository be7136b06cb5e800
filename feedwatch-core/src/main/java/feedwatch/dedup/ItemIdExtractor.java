package feedwatch.dedup;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives the stable item id from an item URL.
 */
@FunctionalInterface
public interface ItemIdExtractor {

    /**
     * Extracts the code following a {@code /p/} or {@code /reel/} path segment, falling back to
     * the URL itself.
     */
    ItemIdExtractor DEFAULT = new PathSegment();

    /**
     * @param url item URL, never {@code null}
     * @return the item id
     */
    String extract(String url);

    final class PathSegment implements ItemIdExtractor {
        private static final Pattern POST_PATH = Pattern.compile("/(?:p|reel)/([A-Za-z0-9_-]+)");

        @Override
        public String extract(String url) {
            Matcher m = POST_PATH.matcher(url);
            return m.find() ? m.group(1) : url;
        }
    }
}

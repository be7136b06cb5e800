package feedwatch.strategy;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Canonical profile and post URLs.
 */
public final class ProfileUrls {

    public static final String CANONICAL_BASE = "https://www.instagram.com";

    private ProfileUrls() {
    }

    public static String postUrl(String shortcode) {
        return CANONICAL_BASE + "/p/" + shortcode + "/";
    }

    static String encode(String handle) {
        return URLEncoder.encode(handle, StandardCharsets.UTF_8);
    }

    static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}

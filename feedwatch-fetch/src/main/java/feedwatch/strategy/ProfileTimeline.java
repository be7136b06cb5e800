package feedwatch.strategy;

import com.fasterxml.jackson.databind.JsonNode;
import feedwatch.Item;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the timeline edges of a profile's {@code user} object, as served by both the profile
 * API and the data embedded in the profile page.
 */
final class ProfileTimeline {

    static final int MAX_ITEMS = 12;

    private ProfileTimeline() {
    }

    /**
     * @param user the {@code user} node, may be missing
     * @return up to {@value #MAX_ITEMS} items in upstream order, empty if the node has no timeline
     */
    static List<Item> items(JsonNode user) {
        JsonNode edges = user.path("edge_owner_to_timeline_media").path("edges");
        List<Item> items = new ArrayList<>();
        for (JsonNode edge : edges) {
            if (items.size() >= MAX_ITEMS) {
                break;
            }
            JsonNode node = edge.path("node");
            String shortcode = node.path("shortcode").asText("");
            if (shortcode.isEmpty()) {
                continue;
            }
            items.add(Item.builder(shortcode)
                    .url(ProfileUrls.postUrl(shortcode))
                    .description(node.path("edge_media_to_caption").path("edges")
                            .path(0).path("node").path("text").asText(""))
                    .publishedAt(node.hasNonNull("taken_at_timestamp")
                            ? Instant.ofEpochSecond(node.get("taken_at_timestamp").asLong()) : null)
                    .thumbnailUrl(thumbnail(node))
                    .pinned(node.path("pinned_for_users").size() > 0)
                    .build());
        }
        return items;
    }

    static boolean hasTimeline(JsonNode user) {
        return user.path("edge_owner_to_timeline_media").path("edges").isArray();
    }

    private static String thumbnail(JsonNode node) {
        if (node.hasNonNull("thumbnail_src")) {
            return node.get("thumbnail_src").asText();
        }
        return node.hasNonNull("display_url") ? node.get("display_url").asText() : null;
    }
}

package feedwatch.strategy;

import feedwatch.Item;
import feedwatch.TransientFetchException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProfileApiStrategyTest {

    @Test
    void sendsAppIdHeaderAndEncodesHandle() throws Exception {
        RecordingHttpFetcher http = new RecordingHttpFetcher()
                .answer(ProfileApiStrategy.DEFAULT_API_URL, Fixtures.read("profile-api.json"));

        new ProfileApiStrategy(http).fetch("alice");

        assertEquals(ProfileApiStrategy.DEFAULT_API_URL + "?username=alice", http.requests.get(0).toString());
        assertEquals(ProfileApiStrategy.WEB_APP_ID, http.headers.get(0).get("X-IG-App-ID"));
    }

    @Test
    void mapsTimelineNodes() throws Exception {
        RecordingHttpFetcher http = new RecordingHttpFetcher()
                .answer(ProfileApiStrategy.DEFAULT_API_URL, Fixtures.read("profile-api.json"));

        List<Item> items = new ProfileApiStrategy(http).fetch("alice");

        assertEquals(List.of("PIN1", "NEW2", "OLD3"), items.stream().map(Item::id).toList());
        Item pinned = items.get(0);
        assertTrue(pinned.pinned());
        assertEquals("Pinned intro", pinned.description());
        assertEquals("https://cdn.example.com/pin1.jpg", pinned.thumbnailUrl());
        assertEquals(Instant.ofEpochSecond(1700000000L), pinned.publishedAt());

        Item newest = items.get(1);
        assertFalse(newest.pinned());
        assertEquals("", newest.description());
        assertEquals("https://cdn.example.com/new2.jpg", newest.thumbnailUrl());
        assertEquals("https://www.instagram.com/p/NEW2/", newest.url());

        assertNull(items.get(2).thumbnailUrl());
    }

    @Test
    void missingUserYieldsNoItems() throws Exception {
        RecordingHttpFetcher http = new RecordingHttpFetcher()
                .answer(ProfileApiStrategy.DEFAULT_API_URL, "{\"data\":{\"user\":null},\"status\":\"ok\"}");

        assertTrue(new ProfileApiStrategy(http).fetch("ghost").isEmpty());
    }

    @Test
    void nonJsonAnswerYieldsNoItems() throws Exception {
        RecordingHttpFetcher http = new RecordingHttpFetcher()
                .answer(ProfileApiStrategy.DEFAULT_API_URL, Fixtures.read("profile-page-login.html"));

        assertTrue(new ProfileApiStrategy(http).fetch("alice").isEmpty());
    }

    @Test
    void capsAtTwelveItems() throws Exception {
        StringBuilder edges = new StringBuilder();
        for (int i = 0; i < 20; i++) {
            if (i > 0) {
                edges.append(',');
            }
            edges.append("{\"node\":{\"shortcode\":\"S").append(i).append("\"}}");
        }
        String body = "{\"data\":{\"user\":{\"edge_owner_to_timeline_media\":{\"edges\":[" + edges + "]}}}}";
        RecordingHttpFetcher http = new RecordingHttpFetcher().answer(ProfileApiStrategy.DEFAULT_API_URL, body);

        List<Item> items = new ProfileApiStrategy(http).fetch("busy");

        assertEquals(12, items.size());
        assertNull(items.get(0).publishedAt());
    }

    @Test
    void rateLimitPropagates() {
        RecordingHttpFetcher http = new RecordingHttpFetcher()
                .answer(ProfileApiStrategy.DEFAULT_API_URL, new TransientFetchException("HTTP 429", 429));

        assertThrows(TransientFetchException.class, () -> new ProfileApiStrategy(http).fetch("alice"));
    }
}

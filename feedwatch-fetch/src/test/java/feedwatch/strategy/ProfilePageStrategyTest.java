package feedwatch.strategy;

import feedwatch.Item;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProfilePageStrategyTest {

    @Test
    void readsEmbeddedSharedData() throws Exception {
        RecordingHttpFetcher http = new RecordingHttpFetcher()
                .answer("https://www.instagram.com/alice/", Fixtures.read("profile-page-shared.html"));

        List<Item> items = new ProfilePageStrategy(http).fetch("alice");

        assertEquals(1, items.size());
        Item item = items.get(0);
        assertEquals("SD1", item.id());
        assertEquals("From shared data", item.description());
        assertEquals(Instant.ofEpochSecond(1714550000L), item.publishedAt());
        assertEquals("https://cdn.example.com/sd1.jpg", item.thumbnailUrl());
    }

    @Test
    void fallsBackToPostLinksWithoutTimestamps() throws Exception {
        RecordingHttpFetcher http = new RecordingHttpFetcher()
                .answer("https://www.instagram.com/alice/", Fixtures.read("profile-page-links.html"));

        List<Item> items = new ProfilePageStrategy(http).fetch("alice");

        assertEquals(List.of("L1aa", "L2bb"), items.stream().map(Item::id).toList());
        assertNull(items.get(0).publishedAt());
        assertEquals("https://www.instagram.com/p/L2bb/", items.get(1).url());
    }

    @Test
    void pageWithoutPostsYieldsNoItems() throws Exception {
        RecordingHttpFetcher http = new RecordingHttpFetcher()
                .answer("https://www.instagram.com/alice/", Fixtures.read("profile-page-login.html"));

        assertTrue(new ProfilePageStrategy(http).fetch("alice").isEmpty());
    }
}

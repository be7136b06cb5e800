package feedwatch.strategy;

import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEnclosure;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import feedwatch.Item;
import feedwatch.TransientFetchException;
import feedwatch.dedup.ItemIdExtractor;

import java.io.StringReader;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Turns an RSS or Atom document into items using Rome.
 */
final class FeedParser {
    private static final Logger logger = Logger.getLogger(FeedParser.class.getName());

    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final ItemIdExtractor idExtractor;

    FeedParser(ItemIdExtractor idExtractor) {
        this.idExtractor = idExtractor;
    }

    /**
     * @param xml         feed document
     * @param urlRewriter applied to every entry link before the id is derived
     * @throws TransientFetchException if the document is not a feed; bridges answer with error
     *                                 pages while overloaded
     */
    List<Item> parse(String xml, UnaryOperator<String> urlRewriter) throws TransientFetchException {
        SyndFeed feed;
        try {
            SyndFeedInput input = new SyndFeedInput();
            feed = input.build(new StringReader(xml));
        } catch (FeedException | IllegalArgumentException e) {
            throw new TransientFetchException("Unparseable feed: " + e.getMessage(), e);
        }

        List<Item> items = new ArrayList<>();
        for (SyndEntry entry : feed.getEntries()) {
            String link = entry.getLink() != null ? entry.getLink() : entry.getUri();
            if (link == null || link.isBlank()) {
                logger.log(Level.FINE, "Skipping feed entry without link: {0}", entry.getTitle());
                continue;
            }
            String url = urlRewriter.apply(link.trim());
            items.add(Item.builder(idExtractor.extract(url))
                    .url(url)
                    .title(entry.getTitle() == null ? "" : entry.getTitle().trim())
                    .description(description(entry))
                    .publishedAt(toInstant(entry.getPublishedDate() != null
                            ? entry.getPublishedDate() : entry.getUpdatedDate()))
                    .thumbnailUrl(thumbnail(entry))
                    .build());
        }
        return items;
    }

    private static String description(SyndEntry entry) {
        if (entry.getDescription() != null && entry.getDescription().getValue() != null) {
            return stripHtml(entry.getDescription().getValue());
        }
        List<SyndContent> contents = entry.getContents();
        if (contents != null && !contents.isEmpty() && contents.get(0).getValue() != null) {
            return stripHtml(contents.get(0).getValue());
        }
        return "";
    }

    private static String thumbnail(SyndEntry entry) {
        for (SyndEnclosure enclosure : entry.getEnclosures()) {
            String type = enclosure.getType();
            if (enclosure.getUrl() != null && (type == null || type.startsWith("image/"))) {
                return enclosure.getUrl();
            }
        }
        return null;
    }

    private static Instant toInstant(Date date) {
        return date == null ? null : date.toInstant();
    }

    static String stripHtml(String html) {
        String text = TAG.matcher(html).replaceAll(" ")
                .replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&amp;", "&");
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }
}

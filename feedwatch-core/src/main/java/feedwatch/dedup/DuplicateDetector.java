package feedwatch.dedup;

import feedwatch.Destination;
import feedwatch.Item;
import feedwatch.spi.HistoryStore;
import feedwatch.spi.RecentMessageScanner;
import feedwatch.spi.SourceRegistry;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides whether an item was already announced for a source.
 *
 * <p>Persisted history is checked first. When a {@link RecentMessageScanner} is configured, the
 * last few messages of every destination are then searched for the item URL or id, which catches
 * items announced outside the monitor.
 *
 * <p>Any error while checking yields {@code false}: a rare duplicate is preferred over a lost
 * notification.
 */
public final class DuplicateDetector {
    private static final Logger logger = Logger.getLogger(DuplicateDetector.class.getName());

    public static final int DEFAULT_SCAN_LIMIT = 4;

    private final HistoryStore historyStore;
    private final SourceRegistry sourceRegistry;
    private final RecentMessageScanner scanner;
    private final ItemIdExtractor idExtractor;
    private final int scanLimit;

    /**
     * Creates a detector that only consults persisted history.
     */
    public DuplicateDetector(HistoryStore historyStore) {
        this(historyStore, null, null, ItemIdExtractor.DEFAULT, DEFAULT_SCAN_LIMIT);
    }

    /**
     * @param historyStore   notification history
     * @param sourceRegistry used to list destinations for the message scan; may be {@code null}
     *                       only when {@code scanner} is {@code null}
     * @param scanner        recent message scanner, {@code null} to skip the scan
     * @param idExtractor    derives the item id from its URL
     * @param scanLimit      number of recent messages to scan per destination
     */
    public DuplicateDetector(HistoryStore historyStore, SourceRegistry sourceRegistry,
                             RecentMessageScanner scanner, ItemIdExtractor idExtractor, int scanLimit) {
        this.historyStore = Objects.requireNonNull(historyStore, "historyStore");
        this.idExtractor = Objects.requireNonNull(idExtractor, "idExtractor");
        if (scanner != null) {
            Objects.requireNonNull(sourceRegistry, "sourceRegistry");
        }
        if (scanLimit < 1) {
            throw new IllegalArgumentException("scanLimit must be >= 1");
        }
        this.sourceRegistry = sourceRegistry;
        this.scanner = scanner;
        this.scanLimit = scanLimit;
    }

    /**
     * Returns whether {@code item} was already announced for the source. History is looked up by
     * {@link Item#id()}, the same key the monitor records; the message scan matches the item URL,
     * its id, or the id derived from the URL by the configured {@link ItemIdExtractor}.
     */
    public boolean isAlreadyNotified(long sourceId, Item item) {
        Objects.requireNonNull(item, "item");
        try {
            if (historyStore.hasBeenNotified(sourceId, item.id())) {
                logger.log(Level.FINE, "Item {0} found in history of source {1}",
                        new Object[]{item.id(), sourceId});
                return true;
            }
            if (scanner == null) {
                return false;
            }
            Set<String> needles = new LinkedHashSet<>();
            needles.add(item.url());
            needles.add(item.id());
            needles.add(idExtractor.extract(item.url()));
            for (Destination destination : sourceRegistry.listDestinations(sourceId)) {
                if (foundInRecentMessages(destination, item.id(), needles)) {
                    return true;
                }
            }
            return false;
        } catch (Exception e) {
            logger.log(Level.WARNING, "Duplicate check failed for " + item.url() + ", treating as new", e);
            return false;
        }
    }

    private boolean foundInRecentMessages(Destination destination, String itemId, Set<String> needles)
            throws Exception {
        for (String message : scanner.recentMessages(destination, scanLimit)) {
            if (message == null) {
                continue;
            }
            for (String needle : needles) {
                if (message.contains(needle)) {
                    logger.log(Level.INFO, "Item {0} already posted in destination {1}",
                            new Object[]{itemId, destination.id()});
                    return true;
                }
            }
        }
        return false;
    }
}

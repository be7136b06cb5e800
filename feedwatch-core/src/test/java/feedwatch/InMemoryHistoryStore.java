package feedwatch;

import feedwatch.spi.HistoryStore;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Set-backed HistoryStore for unit tests.
 */
public class InMemoryHistoryStore implements HistoryStore {
    private final Set<String> notified = ConcurrentHashMap.newKeySet();
    public final List<String> recorded = new CopyOnWriteArrayList<>();
    public final AtomicInteger pruneCalls = new AtomicInteger();
    public volatile RuntimeException failOnRead;
    public volatile RuntimeException failOnPrune;

    public void markNotified(long sourceId, String itemId) {
        notified.add(key(sourceId, itemId));
    }

    @Override
    public boolean hasBeenNotified(long sourceId, String itemId) {
        if (failOnRead != null) {
            throw failOnRead;
        }
        return notified.contains(key(sourceId, itemId));
    }

    @Override
    public void recordNotified(long sourceId, String itemId, String url) {
        if (notified.add(key(sourceId, itemId))) {
            recorded.add(key(sourceId, itemId));
        }
    }

    @Override
    public int pruneOlderThan(Duration retention) {
        pruneCalls.incrementAndGet();
        if (failOnPrune != null) {
            throw failOnPrune;
        }
        return 0;
    }

    private static String key(long sourceId, String itemId) {
        return sourceId + ":" + itemId;
    }
}

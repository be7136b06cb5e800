package feedwatch.spi;

import java.time.Duration;

/**
 * Durable record of which items were already handed to delivery.
 */
public interface HistoryStore {

    boolean hasBeenNotified(long sourceId, String itemId);

    /**
     * Records a notification. Recording the same {@code (sourceId, itemId)} twice is a no-op.
     */
    void recordNotified(long sourceId, String itemId, String url);

    /**
     * Deletes records older than the retention window.
     *
     * @param retention age after which records are removed
     * @return number of records deleted
     */
    int pruneOlderThan(Duration retention);
}

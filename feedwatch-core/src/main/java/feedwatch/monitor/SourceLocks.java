package feedwatch.monitor;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks sources currently being checked so overlapping cycles never check the same source twice
 * at once.
 *
 * <p>This class is thread-safe.
 */
final class SourceLocks {
    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();

    /**
     * @return {@code true} if the caller now owns the source and must {@link #release} it
     */
    boolean tryAcquire(long sourceId) {
        return inFlight.add(sourceId);
    }

    void release(long sourceId) {
        inFlight.remove(sourceId);
    }

    int size() {
        return inFlight.size();
    }
}

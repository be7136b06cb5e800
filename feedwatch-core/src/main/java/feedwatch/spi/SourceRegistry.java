package feedwatch.spi;

import feedwatch.Destination;
import feedwatch.Source;

import java.util.List;
import java.util.Optional;

/**
 * Read/write view of the subscription registry.
 *
 * <p>The engine only reads sources and destinations and updates the two fields it owns:
 * {@code lastItemId} and {@code lastCheckedAt}. Implementations throw
 * {@link feedwatch.PersistenceException} on storage failure.
 */
public interface SourceRegistry {

    List<Source> listActiveSources();

    Optional<Source> findByHandle(String handle);

    /**
     * Lists the destinations subscribed to a source, in registration order.
     */
    List<Destination> listDestinations(long sourceId);

    /**
     * Sets the last seen item id and stamps {@code lastCheckedAt} with the current time.
     * A {@code null} item id clears the marker.
     */
    void updateLastItemId(long sourceId, String itemId);

    /**
     * Stamps {@code lastCheckedAt} with the current time.
     */
    void updateLastChecked(long sourceId);
}

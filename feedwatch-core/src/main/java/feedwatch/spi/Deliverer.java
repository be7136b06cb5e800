package feedwatch.spi;

import feedwatch.DeliveryResult;
import feedwatch.Destination;
import feedwatch.Item;
import feedwatch.Source;

import java.util.List;

/**
 * Sends a new-item notification to the destinations of a source.
 *
 * <p>Implementations report per-destination outcomes instead of throwing. If a deliverer does
 * throw, the monitor counts every destination as failed and still records history.
 */
@FunctionalInterface
public interface Deliverer {

    List<DeliveryResult> deliver(Item item, Source source, List<Destination> destinations);
}

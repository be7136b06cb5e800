package feedwatch.fetch;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers which strategy last produced items for each source handle.
 *
 * <p>Advisory only: it changes the order strategies are tried in, never the result.
 */
public final class FetchMethodMemory {
    private final Map<String, String> lastSuccessful = new ConcurrentHashMap<>();

    public Optional<String> get(String handle) {
        return Optional.ofNullable(lastSuccessful.get(handle));
    }

    public void remember(String handle, String strategyName) {
        lastSuccessful.put(handle, strategyName);
    }

    public void forget(String handle) {
        lastSuccessful.remove(handle);
    }

    public Map<String, String> snapshot() {
        return Map.copyOf(lastSuccessful);
    }
}

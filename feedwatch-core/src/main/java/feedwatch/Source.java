package feedwatch;

import java.time.Instant;
import java.util.Objects;

/**
 * A monitored content source as known to the {@link feedwatch.spi.SourceRegistry}.
 *
 * @param id            registry key
 * @param handle        upstream identifier, e.g. a profile name
 * @param displayName   human-readable name, may be {@code null}
 * @param lastItemId    id of the newest item seen, {@code null} before the first successful check
 * @param lastCheckedAt time of the last check attempt, {@code null} if never checked
 * @param active        whether the source is polled
 */
public record Source(
        long id,
        String handle,
        String displayName,
        String lastItemId,
        Instant lastCheckedAt,
        boolean active
) {
    public Source {
        Objects.requireNonNull(handle, "handle");
        if (handle.isEmpty()) {
            throw new IllegalArgumentException("handle must not be empty");
        }
    }

    /**
      * Creates an active source that has never been checked.
      */
    public static Source of(long id, String handle) {
        return new Source(id, handle, null, null, null, true);
    }

    public Source withLastItemId(String itemId) {
        return new Source(id, handle, displayName, itemId, lastCheckedAt, active);
    }

    public Source withLastCheckedAt(Instant checkedAt) {
        return new Source(id, handle, displayName, lastItemId, checkedAt, active);
    }

    /**
      * Returns the display name, falling back to the handle.
      */
    public String displayNameOrHandle() {
        return displayName == null || displayName.isEmpty() ? handle : displayName;
    }
}

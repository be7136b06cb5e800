package feedwatch;

import java.time.Instant;
import java.util.Objects;

/**
 * A persisted notification marker, unique per {@code (sourceId, itemId)}.
 */
public record HistoryRecord(long sourceId, String itemId, String url, Instant notifiedAt) {
    public HistoryRecord {
        Objects.requireNonNull(itemId, "itemId");
        Objects.requireNonNull(notifiedAt, "notifiedAt");
    }
}

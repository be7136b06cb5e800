package feedwatch;

import java.util.Objects;

/**
 * A delivery target subscribed to a source.
 *
 * @param id              destination identifier understood by the {@link feedwatch.spi.Deliverer}
 * @param messageTemplate custom message template, {@code null} for the default
 * @param mentionId       optional id to mention in the message
 */
public record Destination(String id, String messageTemplate, String mentionId) {
    public Destination {
        Objects.requireNonNull(id, "id");
    }

    public static Destination of(String id) {
        return new Destination(id, null, null);
    }
}

package feedwatch;

import java.util.Objects;

/**
 * Outcome of delivering one item to one destination.
 *
 * <p>Delivery failures never block history recording or item-id advancement; results are only
 * logged and counted.
 *
 * @param destinationId the destination the result belongs to
 * @param success       {@code true} if the message was sent
 * @param skipped       {@code true} if the destination was intentionally not contacted
 * @param error         failure description, {@code null} unless failed
 */
public record DeliveryResult(String destinationId, boolean success, boolean skipped, String error) {
    public DeliveryResult {
        Objects.requireNonNull(destinationId, "destinationId");
        if (success && skipped) {
            throw new IllegalArgumentException("a delivery cannot be both successful and skipped");
        }
    }

    public static DeliveryResult delivered(String destinationId) {
        return new DeliveryResult(destinationId, true, false, null);
    }

    public static DeliveryResult skipped(String destinationId, String reason) {
        return new DeliveryResult(destinationId, false, true, reason);
    }

    public static DeliveryResult failed(String destinationId, String error) {
        return new DeliveryResult(destinationId, false, false, error);
    }

    public boolean failed() {
        return !success && !skipped;
    }
}

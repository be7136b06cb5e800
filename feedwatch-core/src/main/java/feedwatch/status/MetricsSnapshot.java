package feedwatch.status;

import java.time.Duration;
import java.util.Map;

/**
 * Immutable view of {@link InMemoryMetrics} at one instant.
 */
public record MetricsSnapshot(
        long fetchAttempts,
        long fetchSuccesses,
        long fetchFailures,
        Map<String, Long> strategySuccesses,
        double averageFetchDurationMs,
        long itemsDetected,
        long duplicatesDetected,
        long deliveriesSent,
        long deliveriesFailed,
        long deliveriesSkipped,
        long checksCompleted,
        double averageCheckDurationMs,
        long circuitTrips,
        long cyclesCompleted,
        long cyclesSkipped,
        Map<String, Long> errorsByType,
        Duration uptime
) {
    public MetricsSnapshot {
        strategySuccesses = Map.copyOf(strategySuccesses);
        errorsByType = Map.copyOf(errorsByType);
    }

    /**
     * Share of fetch attempts that produced items, in percent. {@code 0} before any attempt.
     */
    public double fetchSuccessRate() {
        return fetchAttempts == 0 ? 0.0 : 100.0 * (fetchAttempts - fetchFailures) / fetchAttempts;
    }

    /**
     * Share of attempted deliveries that were sent, in percent. Skipped deliveries are excluded.
     */
    public double deliverySuccessRate() {
        long attempted = deliveriesSent + deliveriesFailed;
        return attempted == 0 ? 0.0 : 100.0 * deliveriesSent / attempted;
    }
}

package feedwatch.breaker;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of one circuit, for status reporting.
 *
 * @param key                the circuit key (source handle)
 * @param state              current state
 * @param failureCount       consecutive failures
 * @param lastFailureAt      time of the last failure, {@code null} if none
 * @param remainingResetTime time until an open circuit allows a trial, {@link Duration#ZERO} otherwise
 */
public record CircuitStatus(
        String key,
        CircuitState state,
        int failureCount,
        Instant lastFailureAt,
        Duration remainingResetTime
) {
}

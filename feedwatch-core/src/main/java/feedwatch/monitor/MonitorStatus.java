package feedwatch.monitor;

import feedwatch.breaker.CircuitStatus;
import feedwatch.status.MetricsSnapshot;

import java.time.Instant;
import java.util.List;

/**
 * Read-only snapshot returned by {@link FeedMonitor#getStatus()}.
 *
 * @param running              whether the periodic schedule is active
 * @param checkIntervalMinutes cycle period in minutes
 * @param sourcesMonitored     number of active sources
 * @param sources              active sources with their last check time
 * @param activeHours          active-hours configuration and current gate state
 * @param circuitBreakerStates every known circuit
 * @param metrics              counters since the monitor was built
 * @param lastCycleId          id of the most recent executed cycle, {@code null} before the first
 */
public record MonitorStatus(
        boolean running,
        long checkIntervalMinutes,
        int sourcesMonitored,
        List<SourceStatus> sources,
        ActiveHoursStatus activeHours,
        List<CircuitStatus> circuitBreakerStates,
        MetricsSnapshot metrics,
        String lastCycleId
) {
    public MonitorStatus {
        sources = List.copyOf(sources);
        circuitBreakerStates = List.copyOf(circuitBreakerStates);
    }

    public record SourceStatus(String handle, Instant lastCheckedAt) {
    }

    /**
     * @param configured whether an active-hours window is set; when {@code false} the other
     *                   fields are {@code null} and {@code activeNow} is {@code true}
     */
    public record ActiveHoursStatus(boolean configured, Integer startHour, Integer endHour,
                                    String zone, boolean activeNow) {
    }
}

package feedwatch.status;

import feedwatch.spi.MetricsExporter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * {@link MetricsExporter} that keeps counters in memory for status reporting.
 *
 * <p>Average durations cover the most recent {@value #WINDOW} samples.
 *
 * <p>This class is thread-safe.
 */
public final class InMemoryMetrics implements MetricsExporter {
    static final int WINDOW = 100;

    private final Clock clock;
    private final Instant startedAt;

    private final LongAdder fetchAttempts = new LongAdder();
    private final LongAdder fetchSuccesses = new LongAdder();
    private final LongAdder fetchFailures = new LongAdder();
    private final Map<String, LongAdder> strategySuccesses = new ConcurrentHashMap<>();
    private final LongAdder itemsDetected = new LongAdder();
    private final LongAdder duplicatesDetected = new LongAdder();
    private final LongAdder deliveriesSent = new LongAdder();
    private final LongAdder deliveriesFailed = new LongAdder();
    private final LongAdder deliveriesSkipped = new LongAdder();
    private final LongAdder checksCompleted = new LongAdder();
    private final LongAdder circuitTrips = new LongAdder();
    private final LongAdder cyclesCompleted = new LongAdder();
    private final LongAdder cyclesSkipped = new LongAdder();
    private final Map<String, LongAdder> errorsByType = new ConcurrentHashMap<>();

    private final Deque<Long> fetchDurations = new ArrayDeque<>();
    private final Deque<Long> checkDurations = new ArrayDeque<>();

    public InMemoryMetrics() {
        this(Clock.systemUTC());
    }

    public InMemoryMetrics(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.startedAt = clock.instant();
    }

    @Override
    public void incrementFetchAttempt(String handle) {
        fetchAttempts.increment();
    }

    @Override
    public void recordFetchSuccess(String handle, String strategy, long durationMs) {
        fetchSuccesses.increment();
        strategySuccesses.computeIfAbsent(strategy, k -> new LongAdder()).increment();
        addSample(fetchDurations, durationMs);
    }

    @Override
    public void incrementFetchFailure(String handle) {
        fetchFailures.increment();
    }

    @Override
    public void recordCheckDurationMs(long durationMs) {
        checksCompleted.increment();
        addSample(checkDurations, durationMs);
    }

    @Override
    public void incrementItemDetected(String handle) {
        itemsDetected.increment();
    }

    @Override
    public void incrementDuplicateDetected(String handle) {
        duplicatesDetected.increment();
    }

    @Override
    public void incrementDeliverySent() {
        deliveriesSent.increment();
    }

    @Override
    public void incrementDeliveryFailed() {
        deliveriesFailed.increment();
    }

    @Override
    public void incrementDeliverySkipped() {
        deliveriesSkipped.increment();
    }

    @Override
    public void incrementCircuitTrip(String handle) {
        circuitTrips.increment();
    }

    @Override
    public void incrementCycleCompleted() {
        cyclesCompleted.increment();
    }

    @Override
    public void incrementCycleSkipped() {
        cyclesSkipped.increment();
    }

    @Override
    public void incrementError(String type) {
        errorsByType.computeIfAbsent(type, k -> new LongAdder()).increment();
    }

    public MetricsSnapshot snapshot() {
        return new MetricsSnapshot(
                fetchAttempts.sum(),
                fetchSuccesses.sum(),
                fetchFailures.sum(),
                sums(strategySuccesses),
                average(fetchDurations),
                itemsDetected.sum(),
                duplicatesDetected.sum(),
                deliveriesSent.sum(),
                deliveriesFailed.sum(),
                deliveriesSkipped.sum(),
                checksCompleted.sum(),
                average(checkDurations),
                circuitTrips.sum(),
                cyclesCompleted.sum(),
                cyclesSkipped.sum(),
                sums(errorsByType),
                Duration.between(startedAt, clock.instant()));
    }

    private static void addSample(Deque<Long> window, long value) {
        synchronized (window) {
            window.addLast(value);
            if (window.size() > WINDOW) {
                window.removeFirst();
            }
        }
    }

    private static double average(Deque<Long> window) {
        synchronized (window) {
            if (window.isEmpty()) {
                return 0.0;
            }
            long total = 0;
            for (long v : window) {
                total += v;
            }
            return (double) total / window.size();
        }
    }

    private static Map<String, Long> sums(Map<String, LongAdder> counters) {
        Map<String, Long> result = new HashMap<>();
        counters.forEach((k, v) -> result.put(k, v.sum()));
        return result;
    }
}

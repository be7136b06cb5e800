package feedwatch.micrometer;

import feedwatch.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Source handles are never used as tags, so meter cardinality stays bounded by the number of
 * strategies and error types.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code feedwatch.fetch.attempts}: fetch chain invocations</li>
 *   <li>{@code feedwatch.fetch.successes}: successful fetches, tagged {@code strategy}</li>
 *   <li>{@code feedwatch.fetch.failures}: fetches where every strategy failed</li>
 *   <li>{@code feedwatch.items.detected}: candidate new items</li>
 *   <li>{@code feedwatch.items.duplicates}: candidates suppressed as already notified</li>
 *   <li>{@code feedwatch.delivery.sent}, {@code .failed}, {@code .skipped}: per-destination outcomes</li>
 *   <li>{@code feedwatch.circuit.trips}: circuit breaker trips</li>
 *   <li>{@code feedwatch.cycles.completed}, {@code feedwatch.cycles.skipped}: monitor cycles</li>
 *   <li>{@code feedwatch.errors}: unexpected errors, tagged {@code type}</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code feedwatch.check.duration}: per-source check duration</li>
 *   <li>{@code feedwatch.fetch.duration}: successful strategy duration, tagged {@code strategy}</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code feedwatch.check.last.duration.ms}: duration of the most recent check</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Counter fetchAttempts;
  private final Counter fetchFailures;
  private final Counter itemsDetected;
  private final Counter duplicatesDetected;
  private final Counter deliverySent;
  private final Counter deliveryFailed;
  private final Counter deliverySkipped;
  private final Counter circuitTrips;
  private final Counter cyclesCompleted;
  private final Counter cyclesSkipped;
  private final Timer checkDuration;
  private final Gauge lastCheckGauge;

  private final Map<String, Meter> taggedMeters = new ConcurrentHashMap<>();
  private final AtomicLong lastCheckMs = new AtomicLong();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "feedwatch"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "feedwatch");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "instagram.feedwatch"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.namePrefix = namePrefix;
    this.fetchAttempts = counter(".fetch.attempts", "Fetch chain invocations");
    this.fetchFailures = counter(".fetch.failures", "Fetches where every strategy failed");
    this.itemsDetected = counter(".items.detected", "Candidate new items");
    this.duplicatesDetected = counter(".items.duplicates", "Candidate items already notified");
    this.deliverySent = counter(".delivery.sent", "Notifications delivered");
    this.deliveryFailed = counter(".delivery.failed", "Notifications that failed");
    this.deliverySkipped = counter(".delivery.skipped", "Notifications skipped by the deliverer");
    this.circuitTrips = counter(".circuit.trips", "Circuit breaker trips");
    this.cyclesCompleted = counter(".cycles.completed", "Monitor cycles completed");
    this.cyclesSkipped = counter(".cycles.skipped", "Monitor cycles skipped outside active hours");
    this.checkDuration = Timer.builder(namePrefix + ".check.duration")
        .description("Per-source check duration")
        .register(registry);
    this.lastCheckGauge = Gauge.builder(namePrefix + ".check.last.duration.ms", lastCheckMs, AtomicLong::get)
        .description("Duration of the most recent source check")
        .register(registry);
  }

  private Counter counter(String suffix, String description) {
    return Counter.builder(namePrefix + suffix)
        .description(description)
        .register(registry);
  }

  @Override
  public void incrementFetchAttempt(String handle) {
    if (closed) return;
    fetchAttempts.increment();
  }

  @Override
  public void recordFetchSuccess(String handle, String strategy, long durationMs) {
    if (closed) return;
    ((Counter) taggedMeters.computeIfAbsent("success:" + strategy, k -> Counter.builder(namePrefix + ".fetch.successes")
        .description("Successful fetches per strategy")
        .tag("strategy", strategy)
        .register(registry))).increment();
    ((Timer) taggedMeters.computeIfAbsent("duration:" + strategy, k -> Timer.builder(namePrefix + ".fetch.duration")
        .description("Duration of successful strategy calls including retries")
        .tag("strategy", strategy)
        .register(registry))).record(Duration.ofMillis(durationMs));
  }

  @Override
  public void incrementFetchFailure(String handle) {
    if (closed) return;
    fetchFailures.increment();
  }

  @Override
  public void recordCheckDurationMs(long durationMs) {
    if (closed) return;
    checkDuration.record(durationMs, TimeUnit.MILLISECONDS);
    lastCheckMs.set(durationMs);
  }

  @Override
  public void incrementItemDetected(String handle) {
    if (closed) return;
    itemsDetected.increment();
  }

  @Override
  public void incrementDuplicateDetected(String handle) {
    if (closed) return;
    duplicatesDetected.increment();
  }

  @Override
  public void incrementDeliverySent() {
    if (closed) return;
    deliverySent.increment();
  }

  @Override
  public void incrementDeliveryFailed() {
    if (closed) return;
    deliveryFailed.increment();
  }

  @Override
  public void incrementDeliverySkipped() {
    if (closed) return;
    deliverySkipped.increment();
  }

  @Override
  public void incrementCircuitTrip(String handle) {
    if (closed) return;
    circuitTrips.increment();
  }

  @Override
  public void incrementCycleCompleted() {
    if (closed) return;
    cyclesCompleted.increment();
  }

  @Override
  public void incrementCycleSkipped() {
    if (closed) return;
    cyclesSkipped.increment();
  }

  @Override
  public void incrementError(String type) {
    if (closed) return;
    ((Counter) taggedMeters.computeIfAbsent("error:" + type, k -> Counter.builder(namePrefix + ".errors")
        .description("Unexpected errors by type")
        .tag("type", type)
        .register(registry))).increment();
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the exporter is no longer needed (e.g. when the
   * {@link feedwatch.monitor.FeedMonitor} is closed) to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(fetchAttempts, fetchFailures, itemsDetected,
        duplicatesDetected, deliverySent, deliveryFailed, deliverySkipped, circuitTrips,
        cyclesCompleted, cyclesSkipped, checkDuration, lastCheckGauge));
    meters.addAll(taggedMeters.values());
    taggedMeters.clear();
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}

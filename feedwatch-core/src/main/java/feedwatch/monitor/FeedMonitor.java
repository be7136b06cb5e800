package feedwatch.monitor;

import com.github.f4b6a3.ulid.UlidCreator;
import feedwatch.DeliveryResult;
import feedwatch.Destination;
import feedwatch.Item;
import feedwatch.PersistenceException;
import feedwatch.Source;
import feedwatch.SourceNotFoundException;
import feedwatch.breaker.CircuitBreaker;
import feedwatch.dedup.DuplicateDetector;
import feedwatch.fetch.FetchStrategyChain;
import feedwatch.retry.Sleeper;
import feedwatch.spi.Deliverer;
import feedwatch.spi.HistoryStore;
import feedwatch.spi.MetricsExporter;
import feedwatch.spi.SourceRegistry;
import feedwatch.status.CompositeMetricsExporter;
import feedwatch.status.InMemoryMetrics;
import feedwatch.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically checks every active source for a new item and notifies its destinations at most
 * once per item.
 *
 * <p>Each cycle lists the active sources and checks them on a bounded worker pool. After finishing
 * a source, a worker pauses for a random delay before taking the next one, to spread load on the
 * upstream. History older than the retention window is pruned at the end of every cycle. Cycles
 * are skipped entirely outside the configured {@link ActiveHours}.
 *
 * <p>A check ({@link #checkSource}) never affects other sources: fetch failures feed the
 * {@link CircuitBreaker}, storage failures are logged and reported as {@link CheckOutcome#ERROR}.
 * The very first successful check of a source only records the newest item id, so subscribing to
 * a source never replays its back catalogue.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * <p>This class is thread-safe. The {@link #start()}, {@link #stop()} and {@link #close()} methods
 * are synchronized to prevent concurrent lifecycle transitions.
 *
 * @see FeedMonitor.Builder
 */
public final class FeedMonitor implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(FeedMonitor.class.getName());

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final SourceRegistry sourceRegistry;
    private final HistoryStore historyStore;
    private final Deliverer deliverer;
    private final FetchStrategyChain fetchChain;
    private final CircuitBreaker circuitBreaker;
    private final DuplicateDetector duplicateDetector;
    private final InMemoryMetrics inMemoryMetrics;
    private final MetricsExporter metrics;
    private final Duration checkInterval;
    private final int concurrency;
    private final long sourceDelayMinMs;
    private final long sourceDelayMaxMs;
    private final Duration historyRetention;
    private final ActiveHours activeHours;
    private final Clock clock;
    private final Sleeper sleeper;

    private final SourceLocks sourceLocks = new SourceLocks();
    private final Semaphore permits;
    private final ExecutorService workers;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> cycleTask;
    private volatile boolean closed;
    private volatile String lastCycleId;

    private FeedMonitor(Builder builder) {
        this.sourceRegistry = Objects.requireNonNull(builder.sourceRegistry, "sourceRegistry");
        this.historyStore = Objects.requireNonNull(builder.historyStore, "historyStore");
        this.deliverer = Objects.requireNonNull(builder.deliverer, "deliverer");
        this.fetchChain = Objects.requireNonNull(builder.fetchChain, "fetchChain");
        Objects.requireNonNull(builder.checkInterval, "checkInterval");
        Objects.requireNonNull(builder.sourceDelayMin, "sourceDelayMin");
        Objects.requireNonNull(builder.sourceDelayMax, "sourceDelayMax");
        Objects.requireNonNull(builder.historyRetention, "historyRetention");

        if (builder.checkInterval.isNegative() || builder.checkInterval.isZero()) {
            throw new IllegalArgumentException("checkInterval must be > 0");
        }
        if (builder.concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be > 0");
        }
        if (builder.sourceDelayMin.isNegative()) {
            throw new IllegalArgumentException("sourceDelayMin must be >= 0");
        }
        if (builder.sourceDelayMax.compareTo(builder.sourceDelayMin) < 0) {
            throw new IllegalArgumentException("sourceDelayMax must be >= sourceDelayMin");
        }
        if (builder.historyRetention.isNegative()) {
            throw new IllegalArgumentException("historyRetention must be >= 0");
        }

        this.circuitBreaker = builder.circuitBreaker != null ? builder.circuitBreaker : CircuitBreaker.withDefaults();
        this.duplicateDetector = builder.duplicateDetector != null
                ? builder.duplicateDetector : new DuplicateDetector(historyStore);
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.inMemoryMetrics = builder.inMemoryMetrics != null ? builder.inMemoryMetrics : new InMemoryMetrics(clock);
        this.metrics = builder.metrics != null
                ? CompositeMetricsExporter.of(inMemoryMetrics, builder.metrics) : inMemoryMetrics;
        this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM;
        this.checkInterval = builder.checkInterval;
        this.concurrency = builder.concurrency;
        this.sourceDelayMinMs = builder.sourceDelayMin.toMillis();
        this.sourceDelayMaxMs = builder.sourceDelayMax.toMillis();
        this.historyRetention = builder.historyRetention;
        this.activeHours = builder.activeHours;

        this.permits = new Semaphore(concurrency);
        this.workers = Executors.newFixedThreadPool(concurrency, new DaemonThreadFactory("feedwatch-worker-"));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs a cycle right away and then every {@code checkInterval}. Subsequent calls are no-ops
     * while running.
     *
     * @throws IllegalStateException if the monitor has been closed
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("FeedMonitor has been closed");
        }
        if (cycleTask != null) {
            return;
        }
        if (scheduler == null) {
            scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("feedwatch-scheduler-"));
        }
        long intervalMs = checkInterval.toMillis();
        cycleTask = scheduler.scheduleAtFixedRate(this::runCycle, 0L, intervalMs, TimeUnit.MILLISECONDS);
        logger.log(Level.INFO, "Monitor started with {0} minute interval", checkInterval.toMinutes());
    }

    /**
     * Cancels the periodic schedule. A cycle already running finishes normally. Idempotent.
     */
    public synchronized void stop() {
        if (cycleTask != null) {
            cycleTask.cancel(false);
            cycleTask = null;
            logger.info("Monitor stopped");
        }
    }

    public boolean isRunning() {
        return cycleTask != null;
    }

    /**
     * Executes a single cycle. Called by the scheduler, but may also be invoked directly.
     */
    public void runCycle() {
        if (closed) {
            return;
        }
        try {
            if (activeHours != null && !activeHours.isActive(clock.instant())) {
                metrics.incrementCycleSkipped();
                logger.log(Level.FINE, "Outside active hours {0}, skipping cycle", activeHours);
                return;
            }

            List<Source> sources = sourceRegistry.listActiveSources();
            if (sources.isEmpty()) {
                logger.fine("No active sources to check");
                return;
            }

            String cycleId = UlidCreator.getMonotonicUlid().toString();
            lastCycleId = cycleId;
            logger.log(Level.INFO, "Cycle {0}: checking {1} sources", new Object[]{cycleId, sources.size()});

            Map<CheckOutcome, Integer> outcomes = checkAll(sources);
            pruneHistory(cycleId);
            metrics.incrementCycleCompleted();
            logger.log(Level.INFO, "Cycle {0} completed: {1}", new Object[]{cycleId, outcomes});
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Monitor cycle failed", t);
        }
    }

    private Map<CheckOutcome, Integer> checkAll(List<Source> sources) {
        List<Future<CheckOutcome>> futures = new ArrayList<>(sources.size());
        for (Source source : sources) {
            if (closed) {
                break;
            }
            try {
                permits.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                futures.add(workers.submit(() -> {
                    try {
                        return checkSource(source);
                    } finally {
                        pauseAfterSource();
                        permits.release();
                    }
                }));
            } catch (RejectedExecutionException e) {
                permits.release();
                logger.log(Level.FINE, "Worker pool shut down, abandoning remaining sources");
                break;
            }
        }

        Map<CheckOutcome, Integer> outcomes = new EnumMap<>(CheckOutcome.class);
        for (Future<CheckOutcome> future : futures) {
            try {
                outcomes.merge(future.get(), 1, Integer::sum);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ExecutionException e) {
                logger.log(Level.SEVERE, "Source check failed", e.getCause());
                outcomes.merge(CheckOutcome.ERROR, 1, Integer::sum);
            }
        }
        return outcomes;
    }

    private void pauseAfterSource() {
        long delayMs = sourceDelayMinMs == sourceDelayMaxMs
                ? sourceDelayMinMs
                : ThreadLocalRandom.current().nextLong(sourceDelayMinMs, sourceDelayMaxMs);
        if (delayMs <= 0) {
            return;
        }
        try {
            sleeper.sleep(Duration.ofMillis(delayMs));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void pruneHistory(String cycleId) {
        try {
            int deleted = historyStore.pruneOlderThan(historyRetention);
            if (deleted > 0) {
                logger.log(Level.INFO, "Cycle {0}: pruned {1} history records older than {2}",
                        new Object[]{cycleId, deleted, historyRetention});
            }
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Failed to prune notification history", e);
        }
    }

    /**
     * Checks one source for a new item.
     *
     * <p>If another check of the same source is running, returns
     * {@link CheckOutcome#SKIPPED_IN_FLIGHT} without doing anything.
     *
     * @param source the source as read from the registry
     * @return what the check did
     */
    public CheckOutcome checkSource(Source source) {
        return checkSource(source, false);
    }

    private CheckOutcome checkSource(Source source, boolean forced) {
        Objects.requireNonNull(source, "source");
        if (!sourceLocks.tryAcquire(source.id())) {
            logger.log(Level.FINE, "Source {0} is already being checked, skipping", source.handle());
            return CheckOutcome.SKIPPED_IN_FLIGHT;
        }
        long started = System.nanoTime();
        try {
            return doCheck(source, forced);
        } finally {
            sourceLocks.release(source.id());
            metrics.recordCheckDurationMs((System.nanoTime() - started) / 1_000_000L);
        }
    }

    private CheckOutcome doCheck(Source source, boolean forced) {
        String handle = source.handle();
        try {
            if (circuitBreaker.isOpen(handle)) {
                logger.log(Level.FINE, "Circuit open for {0}, skipping (retry in {1})",
                        new Object[]{handle, circuitBreaker.remainingResetTime(handle)});
                return CheckOutcome.SKIPPED_CIRCUIT_OPEN;
            }

            List<Item> items = fetch(handle);
            if (items.isEmpty()) {
                if (circuitBreaker.recordFailure(handle)) {
                    metrics.incrementCircuitTrip(handle);
                    logger.log(Level.WARNING, "Circuit opened for {0} after {1} consecutive failures",
                            new Object[]{handle, circuitBreaker.failureCount(handle)});
                }
                sourceRegistry.updateLastChecked(source.id());
                return CheckOutcome.FETCH_FAILED;
            }
            circuitBreaker.recordSuccess(handle);

            Item newest = items.get(0);
            if (source.lastItemId() == null) {
                sourceRegistry.updateLastItemId(source.id(), newest.id());
                logger.log(Level.INFO, "Baseline for {0} set to {1}", new Object[]{handle, newest.id()});
                return CheckOutcome.BASELINE_RECORDED;
            }
            if (!forced && newest.id().equals(source.lastItemId())) {
                sourceRegistry.updateLastChecked(source.id());
                return CheckOutcome.NO_NEW_ITEM;
            }

            CheckOutcome outcome = handleCandidate(source, newest);
            sourceRegistry.updateLastItemId(source.id(), newest.id());
            return outcome;
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Error checking " + handle, e);
            metrics.incrementError(e.getClass().getSimpleName());
            touchLastChecked(source);
            return CheckOutcome.ERROR;
        }
    }

    private List<Item> fetch(String handle) {
        try {
            return fetchChain.fetchLatestItems(handle);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Fetch failed for " + handle, e);
            return List.of();
        }
    }

    private CheckOutcome handleCandidate(Source source, Item item) {
        String handle = source.handle();
        metrics.incrementItemDetected(handle);
        logger.log(Level.INFO, "New item for {0}: {1}", new Object[]{handle, item.url()});

        if (duplicateDetector.isAlreadyNotified(source.id(), item)) {
            metrics.incrementDuplicateDetected(handle);
            logger.log(Level.INFO, "Item {0} already announced, skipping delivery", item.id());
            return CheckOutcome.DUPLICATE_SUPPRESSED;
        }

        List<Destination> destinations = sourceRegistry.listDestinations(source.id());
        if (destinations.isEmpty()) {
            logger.log(Level.INFO, "No destinations configured for {0}", handle);
            return CheckOutcome.NO_DESTINATIONS;
        }

        deliver(item, source, destinations);
        historyStore.recordNotified(source.id(), item.id(), item.url());
        return CheckOutcome.DELIVERED;
    }

    private void deliver(Item item, Source source, List<Destination> destinations) {
        List<DeliveryResult> results;
        try {
            results = deliverer.deliver(item, source, destinations);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Deliverer failed for " + source.handle(), e);
            results = new ArrayList<>(destinations.size());
            for (Destination destination : destinations) {
                results.add(DeliveryResult.failed(destination.id(), String.valueOf(e.getMessage())));
            }
        }
        if (results == null) {
            return;
        }
        int sent = 0;
        for (DeliveryResult result : results) {
            if (result.success()) {
                sent++;
                metrics.incrementDeliverySent();
            } else if (result.skipped()) {
                metrics.incrementDeliverySkipped();
            } else {
                metrics.incrementDeliveryFailed();
                logger.log(Level.WARNING, "Delivery of {0} to {1} failed: {2}",
                        new Object[]{item.id(), result.destinationId(), result.error()});
            }
        }
        logger.log(Level.INFO, "Delivered {0} for {1} to {2}/{3} destinations",
                new Object[]{item.id(), source.handle(), sent, destinations.size()});
    }

    private void touchLastChecked(Source source) {
        try {
            sourceRegistry.updateLastChecked(source.id());
        } catch (PersistenceException e) {
            logger.log(Level.WARNING, "Failed to update last check time of " + source.handle(), e);
        }
    }

    /**
     * Checks a source immediately, regardless of schedule and active hours.
     *
     * <p>The stored last item id is cleared for the duration of the check, so the newest item is
     * always run through duplicate detection and delivered if it was never announced. A source with
     * no known item gets its baseline recorded. When the check finds nothing and the marker is still
     * cleared afterwards, the original id is written back.
     *
     * @param handle the source handle
     * @return what the check did
     * @throws SourceNotFoundException if the registry has no source with that handle
     */
    public CheckOutcome forceCheck(String handle) {
        Objects.requireNonNull(handle, "handle");
        Source source = sourceRegistry.findByHandle(handle)
                .orElseThrow(() -> new SourceNotFoundException(handle));
        String originalItemId = source.lastItemId();
        logger.log(Level.INFO, "Forced check of {0}", handle);
        if (originalItemId != null) {
            sourceRegistry.updateLastItemId(source.id(), null);
        }

        CheckOutcome outcome = checkSource(source, true);

        if (originalItemId != null) {
            String current = sourceRegistry.findByHandle(handle).map(Source::lastItemId).orElse(null);
            if (current == null) {
                sourceRegistry.updateLastItemId(source.id(), originalItemId);
                logger.log(Level.INFO, "Restored last item id of {0} to {1}", new Object[]{handle, originalItemId});
            }
        }
        return outcome;
    }

    /**
     * Returns a read-only snapshot of the monitor state.
     */
    public MonitorStatus getStatus() {
        List<MonitorStatus.SourceStatus> sources = new ArrayList<>();
        try {
            for (Source source : sourceRegistry.listActiveSources()) {
                sources.add(new MonitorStatus.SourceStatus(source.handle(), source.lastCheckedAt()));
            }
        } catch (PersistenceException e) {
            logger.log(Level.WARNING, "Failed to list sources for status", e);
        }

        MonitorStatus.ActiveHoursStatus hours = activeHours == null
                ? new MonitorStatus.ActiveHoursStatus(false, null, null, null, true)
                : new MonitorStatus.ActiveHoursStatus(true, activeHours.startHour(), activeHours.endHour(),
                        activeHours.zone().getId(), activeHours.isActive(clock.instant()));

        return new MonitorStatus(
                isRunning(),
                checkInterval.toMinutes(),
                sources.size(),
                sources,
                hours,
                circuitBreaker.statuses(),
                inMemoryMetrics.snapshot(),
                lastCycleId);
    }

    public CircuitBreaker circuitBreaker() {
        return circuitBreaker;
    }

    public InMemoryMetrics inMemoryMetrics() {
        return inMemoryMetrics;
    }

    /**
     * Stops the schedule and shuts down the scheduler and worker threads, waiting up to
     * {@value #SHUTDOWN_TIMEOUT_SECONDS} seconds each for running checks to finish.
     */
    @Override
    public synchronized void close() {
        closed = true;
        stop();
        if (scheduler != null) {
            scheduler.shutdown();
            awaitTermination(scheduler);
        }
        workers.shutdown();
        awaitTermination(workers);
    }

    private static void awaitTermination(ExecutorService executor) {
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Builder for {@link FeedMonitor}.
     */
    public static final class Builder {
        private SourceRegistry sourceRegistry;
        private HistoryStore historyStore;
        private Deliverer deliverer;
        private FetchStrategyChain fetchChain;
        private CircuitBreaker circuitBreaker;
        private DuplicateDetector duplicateDetector;
        private InMemoryMetrics inMemoryMetrics;
        private MetricsExporter metrics;
        private Duration checkInterval = Duration.ofMinutes(5);
        private int concurrency = 5;
        private Duration sourceDelayMin = Duration.ofMillis(2000);
        private Duration sourceDelayMax = Duration.ofMillis(3000);
        private Duration historyRetention = Duration.ofDays(30);
        private ActiveHours activeHours;
        private Clock clock;
        private Sleeper sleeper;

        private Builder() {
        }

        /**
         * Sets the registry sources and destinations are read from.
         *
         * <p><b>Required.</b>
         *
         * @param sourceRegistry the subscription registry
         * @return this builder
         */
        public Builder sourceRegistry(SourceRegistry sourceRegistry) {
            this.sourceRegistry = sourceRegistry;
            return this;
        }

        /**
         * Sets the notification history store.
         *
         * <p><b>Required.</b>
         *
         * @param historyStore the history store
         * @return this builder
         */
        public Builder historyStore(HistoryStore historyStore) {
            this.historyStore = historyStore;
            return this;
        }

        /**
         * <p><b>Required.</b>
         *
         * @param deliverer sends notifications for new items
         * @return this builder
         */
        public Builder deliverer(Deliverer deliverer) {
            this.deliverer = deliverer;
            return this;
        }

        /**
         * <p><b>Required.</b>
         *
         * @param fetchChain fetches the latest items of a source
         * @return this builder
         */
        public Builder fetchChain(FetchStrategyChain fetchChain) {
            this.fetchChain = fetchChain;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link CircuitBreaker#withDefaults()}.
         */
        public Builder circuitBreaker(CircuitBreaker circuitBreaker) {
            this.circuitBreaker = circuitBreaker;
            return this;
        }

        /**
         * <p>Optional. Defaults to a detector that only consults the history store.
         */
        public Builder duplicateDetector(DuplicateDetector duplicateDetector) {
            this.duplicateDetector = duplicateDetector;
            return this;
        }

        /**
         * Sets the in-memory metrics backing {@link FeedMonitor#getStatus()}. Pass the same
         * instance to the fetch chain to include fetch counters in the status.
         *
         * <p>Optional. Defaults to a new instance.
         */
        public Builder inMemoryMetrics(InMemoryMetrics inMemoryMetrics) {
            this.inMemoryMetrics = inMemoryMetrics;
            return this;
        }

        /**
         * Sets an additional exporter that receives every monitor metric.
         *
         * <p>Optional.
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets the period between cycle starts.
         *
         * <p>Optional. Defaults to {@code 5 minutes}. Must be &gt; 0.
         */
        public Builder checkInterval(Duration checkInterval) {
            this.checkInterval = checkInterval;
            return this;
        }

        /**
         * Sets the maximum number of sources checked at the same time.
         *
         * <p>Optional. Defaults to {@code 5}. Must be &gt; 0.
         */
        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        /**
         * Sets the range of the random pause a worker takes after each source.
         *
         * <p>Optional. Defaults to {@code [2000, 3000)} ms. Both must be &ge; 0 with
         * {@code min <= max}; equal bounds give a fixed pause.
         */
        public Builder sourceDelay(Duration min, Duration max) {
            this.sourceDelayMin = min;
            this.sourceDelayMax = max;
            return this;
        }

        /**
         * Sets how long notification history is kept.
         *
         * <p>Optional. Defaults to {@code 30 days}. Must be &ge; 0.
         */
        public Builder historyRetention(Duration historyRetention) {
            this.historyRetention = historyRetention;
            return this;
        }

        /**
         * Restricts cycles to a daily window of hours.
         *
         * <p>Optional. Defaults to {@code null} (always active).
         */
        public Builder activeHours(ActiveHours activeHours) {
            this.activeHours = activeHours;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link Clock#systemUTC()}.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Sets the sleeper used for the pause between sources.
         *
         * <p>Optional. Defaults to {@link Sleeper#SYSTEM}.
         */
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        /**
         * Builds the monitor. Call {@link FeedMonitor#start()} to begin the schedule.
         *
         * @return a new {@link FeedMonitor}
         * @throws NullPointerException     if a required collaborator is missing
         * @throws IllegalArgumentException if an interval, delay or concurrency is out of range
         */
        public FeedMonitor build() {
            return new FeedMonitor(this);
        }
    }
}

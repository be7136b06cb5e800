package feedwatch.fetch;

import feedwatch.Item;
import feedwatch.retry.BackoffExecutor;
import feedwatch.retry.Sleeper;
import feedwatch.spi.FetchStrategy;
import feedwatch.spi.MetricsExporter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fetches the latest items of a source by trying several {@link FetchStrategy strategies}.
 *
 * <p>Strategies are tried in preference order, except that the strategy which last produced items
 * for the same handle is tried first. Each call is wrapped in a {@link BackoffExecutor} using the
 * strategy's {@link FetchStrategy#retrySpec() retry spec}, and a fixed delay separates successive
 * strategies.
 *
 * <p>By default every strategy is tried and their items are pooled: items sharing an id are
 * collapsed (the first one seen wins) and the result is sorted by {@code publishedAt}, newest
 * first, with undated items last. In {@linkplain Builder#firstSuccess first-success} mode the chain
 * stops at the first strategy that returns items.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 */
public final class FetchStrategyChain {
    private static final Logger logger = Logger.getLogger(FetchStrategyChain.class.getName());

    private static final Comparator<Item> NEWEST_FIRST = Comparator.comparing(
            Item::publishedAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private final List<FetchStrategy> strategies;
    private final BackoffExecutor backoffExecutor;
    private final Sleeper sleeper;
    private final Duration strategyDelay;
    private final boolean firstSuccess;
    private final MetricsExporter metrics;
    private final FetchMethodMemory memory;

    private FetchStrategyChain(Builder builder) {
        if (builder.strategies.isEmpty()) {
            throw new IllegalArgumentException("at least one strategy is required");
        }
        Map<String, FetchStrategy> byName = new LinkedHashMap<>();
        for (FetchStrategy strategy : builder.strategies) {
            if (byName.putIfAbsent(strategy.name(), strategy) != null) {
                throw new IllegalArgumentException("duplicate strategy name: " + strategy.name());
            }
        }
        Objects.requireNonNull(builder.strategyDelay, "strategyDelay");
        if (builder.strategyDelay.isNegative()) {
            throw new IllegalArgumentException("strategyDelay must be >= 0");
        }
        this.strategies = List.copyOf(builder.strategies);
        this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM;
        this.backoffExecutor = builder.backoffExecutor != null
                ? builder.backoffExecutor : new BackoffExecutor(this.sleeper);
        this.strategyDelay = builder.strategyDelay;
        this.firstSuccess = builder.firstSuccess;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.memory = builder.memory != null ? builder.memory : new FetchMethodMemory();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fetches the latest items for {@code handle}, newest first.
     *
     * @return pooled items, empty if every strategy failed or found nothing
     */
    public List<Item> fetchLatestItems(String handle) {
        return collect(handle).items;
    }

    /**
     * Like {@link #fetchLatestItems} but treats an empty result as a failure.
     *
     * @throws AllStrategiesExhaustedException if no strategy produced items
     */
    public List<Item> requireLatestItems(String handle) {
        Attempt attempt = collect(handle);
        if (attempt.items.isEmpty()) {
            AllStrategiesExhaustedException e = new AllStrategiesExhaustedException(handle);
            attempt.failures.forEach(e::addSuppressed);
            throw e;
        }
        return attempt.items;
    }

    /**
     * Returns the strategies in the order they would be tried for {@code handle}.
     */
    public List<FetchStrategy> attemptOrder(String handle) {
        Optional<String> remembered = memory.get(handle);
        if (remembered.isEmpty()) {
            return strategies;
        }
        List<FetchStrategy> ordered = new ArrayList<>(strategies.size());
        for (FetchStrategy s : strategies) {
            if (s.name().equals(remembered.get())) {
                ordered.add(0, s);
            } else {
                ordered.add(s);
            }
        }
        return ordered;
    }

    public Optional<String> rememberedStrategy(String handle) {
        return memory.get(handle);
    }

    public FetchMethodMemory memory() {
        return memory;
    }

    private Attempt collect(String handle) {
        Objects.requireNonNull(handle, "handle");
        metrics.incrementFetchAttempt(handle);

        Map<String, Item> pooled = new LinkedHashMap<>();
        List<Exception> failures = new ArrayList<>();
        String contributor = null;
        boolean first = true;

        for (FetchStrategy strategy : attemptOrder(handle)) {
            if (!first && !pause()) {
                break;
            }
            first = false;

            long started = System.nanoTime();
            List<Item> items;
            try {
                items = backoffExecutor.execute(() -> strategy.fetch(handle), strategy.retrySpec());
            } catch (Exception e) {
                logger.log(Level.FINE, "Strategy " + strategy.name() + " failed for " + handle, e);
                failures.add(e);
                if (e instanceof InterruptedException || Thread.currentThread().isInterrupted()) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }
            if (items == null || items.isEmpty()) {
                logger.log(Level.FINE, "Strategy {0} returned no items for {1}",
                        new Object[]{strategy.name(), handle});
                continue;
            }

            long durationMs = (System.nanoTime() - started) / 1_000_000L;
            metrics.recordFetchSuccess(handle, strategy.name(), durationMs);
            if (contributor == null) {
                contributor = strategy.name();
            }
            for (Item item : items) {
                pooled.putIfAbsent(item.id(), item);
            }
            if (firstSuccess) {
                break;
            }
        }

        if (pooled.isEmpty()) {
            metrics.incrementFetchFailure(handle);
            logger.log(Level.WARNING, "No fetch strategy produced items for {0} ({1} failed)",
                    new Object[]{handle, failures.size()});
            return new Attempt(List.of(), failures);
        }

        memory.remember(handle, contributor);
        List<Item> sorted = new ArrayList<>(pooled.values());
        sorted.sort(NEWEST_FIRST);
        return new Attempt(List.copyOf(sorted), failures);
    }

    private boolean pause() {
        if (strategyDelay.isZero()) {
            return true;
        }
        try {
            sleeper.sleep(strategyDelay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static final class Attempt {
        final List<Item> items;
        final List<Exception> failures;

        Attempt(List<Item> items, List<Exception> failures) {
            this.items = items;
            this.failures = failures;
        }
    }

    /**
     * Builder for {@link FetchStrategyChain}.
     */
    public static final class Builder {
        private final List<FetchStrategy> strategies = new ArrayList<>();
        private BackoffExecutor backoffExecutor;
        private Sleeper sleeper;
        private Duration strategyDelay = Duration.ofMillis(500);
        private boolean firstSuccess;
        private MetricsExporter metrics;
        private FetchMethodMemory memory;

        private Builder() {
        }

        /**
         * Appends a strategy. Strategies are tried in the order they are added.
         *
         * <p><b>Required:</b> at least one. Names must be unique.
         */
        public Builder strategy(FetchStrategy strategy) {
            this.strategies.add(Objects.requireNonNull(strategy, "strategy"));
            return this;
        }

        public Builder strategies(List<? extends FetchStrategy> strategies) {
            Objects.requireNonNull(strategies, "strategies");
            strategies.forEach(this::strategy);
            return this;
        }

        /**
         * <p>Optional. Defaults to an executor sleeping through {@link #sleeper}.
         */
        public Builder backoffExecutor(BackoffExecutor backoffExecutor) {
            this.backoffExecutor = backoffExecutor;
            return this;
        }

        /**
         * Sets the sleeper used for the inter-strategy delay and the default backoff executor.
         *
         * <p>Optional. Defaults to {@link Sleeper#SYSTEM}.
         */
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        /**
         * Sets the pause between successive strategies.
         *
         * <p>Optional. Defaults to {@code 500 ms}. Must be &ge; 0.
         */
        public Builder strategyDelay(Duration strategyDelay) {
            this.strategyDelay = strategyDelay;
            return this;
        }

        /**
         * Stops at the first strategy that returns items instead of pooling all of them.
         *
         * <p>Optional. Defaults to {@code false}.
         */
        public Builder firstSuccess(boolean firstSuccess) {
            this.firstSuccess = firstSuccess;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * <p>Optional. Defaults to a new, empty memory.
         */
        public Builder memory(FetchMethodMemory memory) {
            this.memory = memory;
            return this;
        }

        /**
         * @throws IllegalArgumentException if no strategy was added, names collide, or
         *                                  {@code strategyDelay} is negative
         */
        public FetchStrategyChain build() {
            return new FetchStrategyChain(this);
        }
    }
}

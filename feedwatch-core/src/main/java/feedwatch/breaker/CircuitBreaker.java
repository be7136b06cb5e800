package feedwatch.breaker;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keyed circuit breaker.
 *
 * <p>{@code failureThreshold} consecutive failures open the circuit for a key. Once
 * {@code resetTimeout} has passed since the last failure, the next {@link #isOpen} call moves the
 * circuit to {@link CircuitState#HALF_OPEN} and returns {@code false}, admitting one trial; further
 * calls return {@code true} until the trial is resolved by {@link #recordSuccess} (back to
 * {@link CircuitState#CLOSED}) or {@link #recordFailure} (back to {@link CircuitState#OPEN}).
 *
 * <p>Circuits are created lazily and live in memory only. Keys are independent of each other.
 *
 * <p>This class is thread-safe; every transition is a single atomic map update per key.
 */
public final class CircuitBreaker {
    private final int failureThreshold;
    private final Duration resetTimeout;
    private final Clock clock;
    private final Map<String, Circuit> circuits = new ConcurrentHashMap<>();

    private CircuitBreaker(Builder builder) {
        if (builder.failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        Objects.requireNonNull(builder.resetTimeout, "resetTimeout");
        if (builder.resetTimeout.isNegative()) {
            throw new IllegalArgumentException("resetTimeout must be >= 0");
        }
        this.failureThreshold = builder.failureThreshold;
        this.resetTimeout = builder.resetTimeout;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a breaker with the default threshold (5) and reset timeout (30 minutes).
     */
    public static CircuitBreaker withDefaults() {
        return builder().build();
    }

    /**
     * Returns whether calls for {@code key} are currently blocked, moving an expired open circuit
     * to half-open.
     */
    public boolean isOpen(String key) {
        Objects.requireNonNull(key, "key");
        Instant now = clock.instant();
        boolean[] open = new boolean[1];
        circuits.computeIfPresent(key, (k, c) -> {
            if (c.state == CircuitState.OPEN) {
                if (Duration.between(c.lastFailureAt, now).compareTo(resetTimeout) >= 0) {
                    return c.withState(CircuitState.HALF_OPEN);
                }
                open[0] = true;
            } else if (c.state == CircuitState.HALF_OPEN) {
                open[0] = true;
            }
            return c;
        });
        return open[0];
    }

    /**
     * Records a failed call.
     *
     * @return {@code true} if this failure moved the circuit into {@link CircuitState#OPEN}
     */
    public boolean recordFailure(String key) {
        Objects.requireNonNull(key, "key");
        Instant now = clock.instant();
        boolean[] tripped = new boolean[1];
        circuits.compute(key, (k, c) -> {
            CircuitState previous = c == null ? CircuitState.CLOSED : c.state;
            int failures = (c == null ? 0 : c.failureCount) + 1;
            CircuitState next = previous;
            if (previous == CircuitState.HALF_OPEN || failures >= failureThreshold) {
                next = CircuitState.OPEN;
            }
            tripped[0] = next == CircuitState.OPEN && previous != CircuitState.OPEN;
            return new Circuit(failures, now, next);
        });
        return tripped[0];
    }

    /**
     * Records a successful call, closing the circuit and clearing its failure count.
     */
    public void recordSuccess(String key) {
        Objects.requireNonNull(key, "key");
        circuits.computeIfPresent(key, (k, c) -> Circuit.CLOSED);
    }

    public CircuitState state(String key) {
        Circuit c = circuits.get(key);
        return c == null ? CircuitState.CLOSED : c.state;
    }

    public int failureCount(String key) {
        Circuit c = circuits.get(key);
        return c == null ? 0 : c.failureCount;
    }

    /**
     * Time left before an open circuit admits a trial call; {@link Duration#ZERO} if not open.
     */
    public Duration remainingResetTime(String key) {
        Circuit c = circuits.get(key);
        return c == null ? Duration.ZERO : remaining(c, clock.instant());
    }

    /**
     * Lists every known circuit, ordered by key.
     */
    public List<CircuitStatus> statuses() {
        Instant now = clock.instant();
        List<CircuitStatus> result = new ArrayList<>(circuits.size());
        circuits.forEach((key, c) ->
                result.add(new CircuitStatus(key, c.state, c.failureCount, c.lastFailureAt, remaining(c, now))));
        result.sort(Comparator.comparing(CircuitStatus::key));
        return result;
    }

    /**
     * Forgets the circuit for {@code key}, closing it.
     */
    public void reset(String key) {
        circuits.remove(key);
    }

    public void resetAll() {
        circuits.clear();
    }

    public int failureThreshold() {
        return failureThreshold;
    }

    public Duration resetTimeout() {
        return resetTimeout;
    }

    private Duration remaining(Circuit c, Instant now) {
        if (c.state != CircuitState.OPEN || c.lastFailureAt == null) {
            return Duration.ZERO;
        }
        Duration left = resetTimeout.minus(Duration.between(c.lastFailureAt, now));
        return left.isNegative() ? Duration.ZERO : left;
    }

    private static final class Circuit {
        static final Circuit CLOSED = new Circuit(0, null, CircuitState.CLOSED);

        final int failureCount;
        final Instant lastFailureAt;
        final CircuitState state;

        Circuit(int failureCount, Instant lastFailureAt, CircuitState state) {
            this.failureCount = failureCount;
            this.lastFailureAt = lastFailureAt;
            this.state = state;
        }

        Circuit withState(CircuitState newState) {
            return new Circuit(failureCount, lastFailureAt, newState);
        }
    }

    /**
     * Builder for {@link CircuitBreaker}.
     */
    public static final class Builder {
        private int failureThreshold = 5;
        private Duration resetTimeout = Duration.ofMinutes(30);
        private Clock clock;

        private Builder() {
        }

        /**
         * Sets the number of consecutive failures that opens a circuit.
         *
         * <p>Optional. Defaults to {@code 5}. Must be &ge; 1.
         */
        public Builder failureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
            return this;
        }

        /**
         * Sets how long an open circuit blocks calls after its last failure.
         *
         * <p>Optional. Defaults to {@code 30 minutes}. Must be &ge; 0.
         */
        public Builder resetTimeout(Duration resetTimeout) {
            this.resetTimeout = resetTimeout;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link Clock#systemUTC()}.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public CircuitBreaker build() {
            return new CircuitBreaker(this);
        }
    }
}

package feedwatch.spi;

/**
 * Observability hook for exporting monitor counters and timings to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of fetch chain invocations for a source.
     */
    void incrementFetchAttempt(String handle);

    /**
     * Records a strategy that returned items.
     *
     * @param handle     source handle
     * @param strategy   strategy name
     * @param durationMs time spent in the strategy including retries
     */
    void recordFetchSuccess(String handle, String strategy, long durationMs);

    /**
     * Increments the count of fetches where every strategy failed or returned nothing.
     */
    void incrementFetchFailure(String handle);

    /**
     * Records the duration of one per-source check.
     */
    void recordCheckDurationMs(long durationMs);

    /**
     * Increments the count of candidate new items.
     */
    void incrementItemDetected(String handle);

    /**
     * Increments the count of candidate items suppressed as already notified.
     */
    void incrementDuplicateDetected(String handle);

    void incrementDeliverySent();

    void incrementDeliveryFailed();

    void incrementDeliverySkipped();

    /**
     * Increments the count of circuit breaker trips.
     */
    void incrementCircuitTrip(String handle);

    /**
     * Increments the count of completed monitor cycles.
     */
    default void incrementCycleCompleted() {
    }

    /**
     * Increments the count of cycles skipped by the active-hours gate.
     */
    default void incrementCycleSkipped() {
    }

    /**
     * Increments the count of unexpected errors by exception type.
     */
    default void incrementError(String type) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementFetchAttempt(String handle) {
        }

        @Override
        public void recordFetchSuccess(String handle, String strategy, long durationMs) {
        }

        @Override
        public void incrementFetchFailure(String handle) {
        }

        @Override
        public void recordCheckDurationMs(long durationMs) {
        }

        @Override
        public void incrementItemDetected(String handle) {
        }

        @Override
        public void incrementDuplicateDetected(String handle) {
        }

        @Override
        public void incrementDeliverySent() {
        }

        @Override
        public void incrementDeliveryFailed() {
        }

        @Override
        public void incrementDeliverySkipped() {
        }

        @Override
        public void incrementCircuitTrip(String handle) {
        }
    }
}

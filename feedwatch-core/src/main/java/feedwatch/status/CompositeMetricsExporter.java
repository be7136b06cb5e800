package feedwatch.status;

import feedwatch.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans every metric out to several exporters. A failing exporter is logged and does not stop the
 * others.
 */
public final class CompositeMetricsExporter implements MetricsExporter {
    private static final Logger logger = Logger.getLogger(CompositeMetricsExporter.class.getName());

    private final List<MetricsExporter> delegates;

    public CompositeMetricsExporter(List<MetricsExporter> delegates) {
        Objects.requireNonNull(delegates, "delegates");
        this.delegates = List.copyOf(delegates);
    }

    public static MetricsExporter of(MetricsExporter... delegates) {
        return new CompositeMetricsExporter(List.of(delegates));
    }

    public List<MetricsExporter> delegates() {
        return delegates;
    }

    private void each(Consumer<MetricsExporter> call) {
        for (MetricsExporter delegate : delegates) {
            try {
                call.accept(delegate);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Metrics exporter " + delegate.getClass().getName() + " failed", e);
            }
        }
    }

    @Override
    public void incrementFetchAttempt(String handle) {
        each(m -> m.incrementFetchAttempt(handle));
    }

    @Override
    public void recordFetchSuccess(String handle, String strategy, long durationMs) {
        each(m -> m.recordFetchSuccess(handle, strategy, durationMs));
    }

    @Override
    public void incrementFetchFailure(String handle) {
        each(m -> m.incrementFetchFailure(handle));
    }

    @Override
    public void recordCheckDurationMs(long durationMs) {
        each(m -> m.recordCheckDurationMs(durationMs));
    }

    @Override
    public void incrementItemDetected(String handle) {
        each(m -> m.incrementItemDetected(handle));
    }

    @Override
    public void incrementDuplicateDetected(String handle) {
        each(m -> m.incrementDuplicateDetected(handle));
    }

    @Override
    public void incrementDeliverySent() {
        each(MetricsExporter::incrementDeliverySent);
    }

    @Override
    public void incrementDeliveryFailed() {
        each(MetricsExporter::incrementDeliveryFailed);
    }

    @Override
    public void incrementDeliverySkipped() {
        each(MetricsExporter::incrementDeliverySkipped);
    }

    @Override
    public void incrementCircuitTrip(String handle) {
        each(m -> m.incrementCircuitTrip(handle));
    }

    @Override
    public void incrementCycleCompleted() {
        each(MetricsExporter::incrementCycleCompleted);
    }

    @Override
    public void incrementCycleSkipped() {
        each(MetricsExporter::incrementCycleSkipped);
    }

    @Override
    public void incrementError(String type) {
        each(m -> m.incrementError(type));
    }
}

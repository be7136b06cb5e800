/**
 * Micrometer bridge for exporting monitor metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link feedwatch.micrometer.MicrometerMetricsExporter} implements the
 * {@link feedwatch.spi.MetricsExporter} SPI using Micrometer counters, timers and gauges.
 *
 * @see feedwatch.micrometer.MicrometerMetricsExporter
 */
package feedwatch.micrometer;

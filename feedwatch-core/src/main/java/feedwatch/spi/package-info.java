/**
 * Service Provider Interfaces (SPI) the monitoring engine depends on.
 *
 * <p>Integrators implement these to plug in the subscription registry, notification history,
 * message delivery, upstream fetching and metrics.
 *
 * @see feedwatch.spi.SourceRegistry
 * @see feedwatch.spi.HistoryStore
 * @see feedwatch.spi.Deliverer
 * @see feedwatch.spi.FetchStrategy
 * @see feedwatch.spi.MetricsExporter
 */
package feedwatch.spi;

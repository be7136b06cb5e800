/**
 * Spring Boot auto-configuration for the feed monitor.
 *
 * <p>{@link feedwatch.spring.boot.FeedWatchAutoConfiguration} wires a
 * {@link feedwatch.monitor.FeedMonitor} from {@code feedwatch.*} application properties once a
 * {@link javax.sql.DataSource} and a {@link feedwatch.spi.Deliverer} bean are present.
 * {@link feedwatch.spring.boot.FeedWatchMicrometerAutoConfiguration} adds Micrometer meters
 * when a {@code MeterRegistry} is available.
 *
 * @see feedwatch.spring.boot.FeedWatchProperties
 */
package feedwatch.spring.boot;

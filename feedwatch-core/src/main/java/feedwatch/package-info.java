/**
 * Core model and error types of the feedwatch monitoring engine.
 *
 * <p>A {@link feedwatch.Source} is polled through a {@link feedwatch.fetch.FetchStrategyChain};
 * the newest {@link feedwatch.Item} is compared with the source's last known item, checked
 * against notification history, and handed to a {@link feedwatch.spi.Deliverer}. The
 * {@link feedwatch.monitor.FeedMonitor} drives the whole loop.
 */
package feedwatch;

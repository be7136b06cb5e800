/**
 * Concrete {@link feedwatch.spi.FetchStrategy} implementations over HTTP.
 *
 * <p>In preference order: {@link feedwatch.strategy.ProfileApiStrategy} (real time, rate limited),
 * {@link feedwatch.strategy.ProfilePageStrategy} (scrape), {@link feedwatch.strategy.FeedBridgeStrategy}
 * (cached Atom feed) and {@link feedwatch.strategy.FeedMirrorStrategy} (community mirrors).
 * {@link feedwatch.strategy.FetchStrategies#defaults} builds that list.
 */
package feedwatch.strategy;

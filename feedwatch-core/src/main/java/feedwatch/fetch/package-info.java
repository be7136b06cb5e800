/**
 * Ordered fallback over {@link feedwatch.spi.FetchStrategy} implementations.
 *
 * @see feedwatch.fetch.FetchStrategyChain
 */
package feedwatch.fetch;

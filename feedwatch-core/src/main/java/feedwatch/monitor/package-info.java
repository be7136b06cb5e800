/**
 * Scheduling and per-source check logic.
 *
 * @see feedwatch.monitor.FeedMonitor
 */
package feedwatch.monitor;

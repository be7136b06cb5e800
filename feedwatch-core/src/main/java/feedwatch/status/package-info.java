/**
 * In-process metrics backing {@link feedwatch.monitor.FeedMonitor#getStatus()}.
 */
package feedwatch.status;

/**
 * HTTP transport for fetch strategies, with hard timeouts and status classification.
 */
package feedwatch.http;

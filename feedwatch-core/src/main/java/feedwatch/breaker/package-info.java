/**
 * Per-source circuit breaker that stops polling a source after repeated fetch failures.
 */
package feedwatch.breaker;

/**
 * Detection of items that were already announced.
 */
package feedwatch.dedup;

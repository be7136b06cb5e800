/**
 * Internal utilities.
 */
package feedwatch.util;

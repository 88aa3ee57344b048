/**
 * Retention-based deletion of old append log records.
 */
package fanout.trim;

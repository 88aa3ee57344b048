/**
 * Subscription lifecycle: attach a sink for one key, read it as a sequence, detach
 * exactly once on cancel, error, shutdown or lifetime expiry.
 */
package fanout.attach;

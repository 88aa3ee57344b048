/**
 * Per-key subscriber bookkeeping.
 *
 * <p>The registry maps each stream key to a {@link fanout.registry.StreamHandle}
 * holding the key's read cursor and its attached {@linkplain fanout.sink.Sink sinks}.
 * Handles exist only while at least one sink is attached.
 *
 * @see fanout.registry.SubscriptionRegistry
 * @see fanout.registry.DefaultSubscriptionRegistry
 */
package fanout.registry;

package fanout.sink;

/**
 * What a {@link Sink} does with a new record when its channel is already full.
 *
 * <p>None of the policies blocks the caller: dispatch runs on the single puller
 * thread, so waiting for one slow consumer would stall every other key.
 */
public enum OverflowPolicy {
  /** Evict the oldest queued record to make room. The consumer sees a gap. */
  DROP_OLDEST,
  /** Discard the incoming record. The consumer sees a gap. */
  DROP_NEWEST,
  /**
   * Terminate the sink with a {@link fanout.SinkSaturatedException}. The consumer
   * drains what is queued, then reconnects from its last processed offset.
   */
  DISCONNECT
}

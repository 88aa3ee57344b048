package fanout.sink;

/**
 * Outcome of {@link Sink#offer}.
 */
public enum OfferResult {
  /** Queued for the consumer. */
  ACCEPTED,
  /** Queued after evicting the oldest queued record ({@link OverflowPolicy#DROP_OLDEST}). */
  ACCEPTED_DROPPED_OLDEST,
  /** Not queued because the channel was full ({@link OverflowPolicy#DROP_NEWEST}). */
  DROPPED,
  /** Not queued; the sink was terminated as saturated ({@link OverflowPolicy#DISCONNECT}). */
  SATURATED,
  /** Not queued; the id is not newer than the last record this sink accepted. */
  DUPLICATE,
  /** Not queued; the sink is already terminated. */
  CLOSED;

  /** Whether the record reached the consumer's channel. */
  public boolean delivered() {
    return this == ACCEPTED || this == ACCEPTED_DROPPED_OLDEST;
  }

  /** Whether the channel was full when the record arrived. */
  public boolean overflowed() {
    return this == ACCEPTED_DROPPED_OLDEST || this == DROPPED || this == SATURATED;
  }
}

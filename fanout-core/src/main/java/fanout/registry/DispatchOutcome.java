package fanout.registry;

/**
 * Result of dispatching one record to every sink of its key.
 *
 * @param delivered sinks that queued the record
 * @param dropped   sinks that lost a record to a drop policy
 * @param saturated sinks terminated and detached because their channel was full
 */
public record DispatchOutcome(int delivered, int dropped, int saturated) {
  public static final DispatchOutcome NONE = new DispatchOutcome(0, 0, 0);
}

package fanout.puller;

/**
 * Summary of one puller cycle.
 *
 * @param status     how the cycle ended
 * @param keys       keys covered by the cycle's batched read
 * @param records    records returned by the read
 * @param deliveries records queued into sinks (one per sink per record)
 */
public record PullResult(Status status, int keys, int records, long deliveries) {

  static final PullResult IDLE = new PullResult(Status.IDLE, 0, 0, 0L);

  /** Outcome of a cycle. */
  public enum Status {
    /** No key had a subscriber; the append log was not read. */
    IDLE,
    /** The batched read succeeded (possibly with no new records). */
    PULLED,
    /** The batched read failed; every key of the batch was failed. */
    FAILED
  }

  static PullResult failed(int keys) {
    return new PullResult(Status.FAILED, keys, 0, 0L);
  }
}

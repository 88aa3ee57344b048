package fanout.sink;

/**
 * Why a {@link Sink} stopped accepting records.
 */
public enum CloseReason {
  /** The consumer cancelled its subscription. */
  CANCELLED,
  /** The subscription reached its maximum lifetime and was force-completed. */
  LIFETIME_EXCEEDED,
  /** A terminal error was delivered (store failure, saturation, attach after shutdown). */
  FAILED,
  /** The fan-out engine was closed. */
  SHUTDOWN
}

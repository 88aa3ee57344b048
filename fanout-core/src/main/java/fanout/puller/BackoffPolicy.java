package fanout.puller;

/**
 * Strategy for computing how long the puller waits after consecutive failed cycles.
 *
 * @see ExponentialBackoffPolicy
 */
public interface BackoffPolicy {

  /**
   * Computes the delay in milliseconds before the next cycle.
   *
   * @param failures the number of consecutive failed cycles so far (1-based)
   * @return delay in milliseconds (non-negative)
   */
  long computeDelayMs(int failures);
}

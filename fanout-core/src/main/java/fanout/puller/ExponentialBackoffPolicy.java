package fanout.puller;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Backoff using exponential growth with jitter.
 *
 * <p>Delay formula: {@code baseDelay * 2^(failures-1)}, capped at {@code maxDelay},
 * with random jitter in the range [0.5, 1.5), never above {@code maxDelay}.
 * A zero base delay disables backoff entirely.
 */
public final class ExponentialBackoffPolicy implements BackoffPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;

  /**
   * @param baseDelayMs delay after the first failure (milliseconds, &ge; 0)
   * @param maxDelayMs  ceiling (milliseconds, &ge; baseDelayMs)
   */
  public ExponentialBackoffPolicy(long baseDelayMs, long maxDelayMs) {
    if (baseDelayMs < 0) {
      throw new IllegalArgumentException("baseDelayMs must be >= 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException(
          "maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs + " < " + baseDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
  }

  @Override
  public long computeDelayMs(int failures) {
    if (failures <= 0 || baseDelayMs == 0) {
      return 0L;
    }
    long expDelay;
    if (failures >= 63) {
      expDelay = Long.MAX_VALUE;
    } else {
      long shift = 1L << (failures - 1);
      expDelay = shift > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
    }
    long capped = Math.min(maxDelayMs, expDelay);
    double jitter = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
    return Math.min(maxDelayMs, Math.max(0L, (long) (capped * jitter)));
  }

  public long baseDelayMs() {
    return baseDelayMs;
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }
}

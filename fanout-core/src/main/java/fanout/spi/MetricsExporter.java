package fanout.spi;

/**
 * Observability hook for exporting fan-out counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of batched reads issued against the append log.
   */
  void incrementBatchReads();

  /**
   * Increments the count of batched reads that failed.
   */
  void incrementBatchReadFailures();

  /**
   * Adds to the count of records handed to sinks (one per sink per record).
   *
   * @param deliveries number of sink deliveries
   */
  void incrementRecordsDispatched(long deliveries);

  /**
   * Increments the count of sinks that overflowed their channel.
   */
  void incrementSinksSaturated();

  /**
   * Increments the count of subscriptions opened.
   */
  void incrementAttached();

  /**
   * Increments the count of subscriptions detached, for any reason.
   */
  void incrementDetached();

  /**
   * Records the registry size after a puller cycle.
   *
   * @param activeKeys number of keys with at least one sink
   * @param sinks      number of attached sinks across all keys
   */
  void recordActive(int activeKeys, int sinks);

  /**
   * Records the duration of one batched read.
   *
   * @param latencyMs read time in milliseconds (always non-negative)
   */
  default void recordReadLatencyMs(long latencyMs) {
  }

  /**
   * Adds to the count of records appended through {@link fanout.RecordWriter}.
   *
   * @param count number of records appended
   */
  default void incrementRecordsAppended(int count) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementBatchReads() {
    }

    @Override
    public void incrementBatchReadFailures() {
    }

    @Override
    public void incrementRecordsDispatched(long deliveries) {
    }

    @Override
    public void incrementSinksSaturated() {
    }

    @Override
    public void incrementAttached() {
    }

    @Override
    public void incrementDetached() {
    }

    @Override
    public void recordActive(int activeKeys, int sinks) {
    }
  }
}

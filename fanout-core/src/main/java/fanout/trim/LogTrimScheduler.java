package fanout.trim;

import fanout.spi.LogTrimmer;
import fanout.util.DaemonThreadFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled component that deletes append log records older than a configurable
 * retention period.
 *
 * <p>Each cycle deletes in batches (default 500) until fewer than {@code batchSize}
 * records are deleted, then sleeps until the next interval. Subscribers reading a
 * key from an offset older than the retention simply start at the oldest record
 * still present.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see LogTrimScheduler.Builder
 * @see LogTrimmer
 */
public final class LogTrimScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(LogTrimScheduler.class.getName());

  private final LogTrimmer trimmer;
  private final Duration retention;
  private final int batchSize;
  private final long intervalSeconds;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> trimTask;
  private volatile boolean closed;

  private LogTrimScheduler(Builder builder) {
    this.trimmer = Objects.requireNonNull(builder.trimmer, "trimmer");

    if (builder.retention != null && builder.retention.isNegative()) {
      throw new IllegalArgumentException("retention must be >= 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.intervalSeconds <= 0L) {
      throw new IllegalArgumentException("intervalSeconds must be > 0");
    }

    this.retention = builder.retention != null ? builder.retention : Duration.ofDays(7);
    this.batchSize = builder.batchSize;
    this.intervalSeconds = builder.intervalSeconds;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled trim loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("LogTrimScheduler has been closed");
    }
    if (trimTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("fanout-trim-"));
    trimTask = scheduler.scheduleWithFixedDelay(
        this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
  }

  /**
   * Executes a single trim cycle. May be invoked directly for testing or one-off trims.
   *
   * @return the number of records deleted
   */
  public long runOnce() {
    if (closed) {
      return 0L;
    }
    long totalDeleted = 0L;
    try {
      Instant cutoff = Instant.now().minus(retention);
      int deleted;
      do {
        deleted = trimmer.trimBefore(cutoff, batchSize);
        totalDeleted += deleted;
      } while (deleted >= batchSize && !closed);
      if (totalDeleted > 0) {
        logger.log(Level.INFO, "Trimmed {0} records older than {1}",
            new Object[]{totalDeleted, cutoff});
      }
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Trim cycle failed", t);
    }
    return totalDeleted;
  }

  public Duration retention() {
    return retention;
  }

  /** Cancels the trim schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (trimTask != null) {
      trimTask.cancel(false);
      trimTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link LogTrimScheduler}. */
  public static final class Builder {
    private LogTrimmer trimmer;
    private Duration retention;
    private int batchSize = 500;
    private long intervalSeconds = 3600;

    private Builder() {}

    /**
     * Sets the trimmer that deletes old records.
     *
     * <p><b>Required.</b>
     *
     * @param trimmer the log trimmer
     * @return this builder
     */
    public Builder trimmer(LogTrimmer trimmer) {
      this.trimmer = trimmer;
      return this;
    }

    /**
     * Sets the retention period. Records appended longer ago than this are deleted.
     *
     * <p>Optional. Defaults to {@code 7 days}. Must be &ge; 0.
     *
     * @param retention the retention duration
     * @return this builder
     */
    public Builder retention(Duration retention) {
      this.retention = retention;
      return this;
    }

    /**
     * Sets the maximum number of records deleted per batch within a cycle.
     *
     * <p>Optional. Defaults to {@code 500}. Must be &gt; 0.
     *
     * @param batchSize max records per batch
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the interval in seconds between trim cycles.
     *
     * <p>Optional. Defaults to {@code 3600} (1 hour). Must be &gt; 0.
     *
     * @param intervalSeconds trim interval in seconds
     * @return this builder
     */
    public Builder intervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
      return this;
    }

    /**
     * Builds the scheduler. Call {@link LogTrimScheduler#start()} to begin.
     *
     * @return a new {@link LogTrimScheduler}
     * @throws NullPointerException     if {@code trimmer} is null
     * @throws IllegalArgumentException if {@code retention} is negative,
     *     {@code batchSize <= 0}, or {@code intervalSeconds <= 0}
     */
    public LogTrimScheduler build() {
      return new LogTrimScheduler(this);
    }
  }
}

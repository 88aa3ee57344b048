package fanout;

import fanout.attach.AttachmentPoint;
import fanout.attach.StreamSubscription;
import fanout.puller.BackoffPolicy;
import fanout.puller.ExponentialBackoffPolicy;
import fanout.puller.Puller;
import fanout.registry.DefaultSubscriptionRegistry;
import fanout.registry.SubscriptionRegistry;
import fanout.sink.OverflowPolicy;
import fanout.spi.AppendLog;
import fanout.spi.LogTrimmer;
import fanout.spi.MetricsExporter;
import fanout.trim.LogTrimScheduler;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Composite entry point that wires a {@link SubscriptionRegistry}, a {@link Puller},
 * an {@link AttachmentPoint} and a {@link RecordWriter} over one {@link AppendLog}
 * into a single {@link AutoCloseable} unit.
 *
 * <p>The puller starts when {@link Builder#build()} returns.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Fanout fanout = Fanout.builder()
 *     .appendLog(appendLog)
 *     .maxLifetime(Duration.ofMinutes(10))
 *     .build()) {
 *   fanout.writer().append("order-42", "{\"status\":\"PAID\"}");
 *
 *   try (StreamSubscription sub = fanout.openStream("order-42", 0L)) {
 *     for (Record record : (Iterable<Record>) () -> sub) {
 *       // write record to the transport...
 *     }
 *   }
 * }
 * }</pre>
 *
 * @see RecordWriter
 * @see Puller
 * @see AttachmentPoint
 */
public final class Fanout implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Fanout.class.getName());

  private final AppendLog appendLog;
  private final SubscriptionRegistry registry;
  private final Puller puller;
  private final AttachmentPoint attachmentPoint;
  private final RecordWriter writer;
  private final LogTrimScheduler trimScheduler;
  private final MetricsExporter metrics;

  private Fanout(AppendLog appendLog, SubscriptionRegistry registry, Puller puller,
      AttachmentPoint attachmentPoint, RecordWriter writer, LogTrimScheduler trimScheduler,
      MetricsExporter metrics) {
    this.appendLog = appendLog;
    this.registry = registry;
    this.puller = puller;
    this.attachmentPoint = attachmentPoint;
    this.writer = writer;
    this.trimScheduler = trimScheduler;
    this.metrics = metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the writer for appending records.
   *
   * @return the record writer
   */
  public RecordWriter writer() {
    return writer;
  }

  /**
   * Subscribes to {@code key} from {@code fromOffset} (inclusive).
   *
   * @see AttachmentPoint#open(String, RecordId)
   */
  public StreamSubscription open(String key, RecordId fromOffset) {
    return attachmentPoint.open(key, fromOffset);
  }

  /**
   * Subscribes to {@code key} from the first record at or after {@code fromOffsetMs}.
   *
   * @see AttachmentPoint#openStream(String, long)
   */
  public StreamSubscription openStream(String key, long fromOffsetMs) {
    return attachmentPoint.openStream(key, fromOffsetMs);
  }

  /**
   * Subscribes to {@code key} for records appended after the current newest one.
   *
   * <p>Relies on {@link AppendLog#lastId}; with an append log that cannot tell its
   * newest id, or a key with no records yet, the subscription starts at
   * {@link RecordId#ZERO}.
   *
   * @param key the stream key
   * @return the subscription
   */
  public StreamSubscription openFromLatest(String key) {
    RecordId from = appendLog.lastId(Record.requireKey(key))
        .map(RecordId::next)
        .orElse(RecordId.ZERO);
    return attachmentPoint.open(key, from);
  }

  public SubscriptionRegistry registry() {
    return registry;
  }

  public Puller puller() {
    return puller;
  }

  public AttachmentPoint attachmentPoint() {
    return attachmentPoint;
  }

  /**
   * Shuts down components in order: attachment point (completing every open
   * subscription with {@link fanout.sink.CloseReason#SHUTDOWN}), puller, trim
   * scheduler, then the metrics exporter if it is {@link AutoCloseable}.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    try {
      attachmentPoint.close();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      puller.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (trimScheduler != null) {
      try {
        trimScheduler.close();
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new FanoutException("Failed to close metrics", e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    logger.fine("Fanout closed");
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link Fanout}. */
  public static final class Builder {
    private AppendLog appendLog;
    private SubscriptionRegistry registry;
    private MetricsExporter metrics;
    private BackoffPolicy backoffPolicy;
    private long minCycleIntervalMs = 50;
    private long idleIntervalMs = 100;
    private int maxRecordsPerKey = 100;
    private Duration maxLifetime;
    private int sinkCapacity = DefaultSubscriptionRegistry.DEFAULT_SINK_CAPACITY;
    private OverflowPolicy overflowPolicy = OverflowPolicy.DISCONNECT;
    private LogTrimmer logTrimmer;
    private Duration retention;
    private long trimIntervalSeconds = 3600;
    private int trimBatchSize = 500;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {
    }

    /**
     * Sets the append log read by the puller and written by the writer.
     *
     * <p><b>Required.</b>
     *
     * @param appendLog the append log
     * @return this builder
     */
    public Builder appendLog(AppendLog appendLog) {
      this.appendLog = appendLog;
      return this;
    }

    /**
     * Sets a custom registry. When set, {@link #sinkCapacity} and
     * {@link #overflowPolicy} are ignored.
     *
     * <p>Optional. Defaults to a {@link DefaultSubscriptionRegistry}.
     *
     * @param registry the subscription registry
     * @return this builder
     */
    public Builder registry(SubscriptionRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Sets the metrics exporter shared by every component.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the backoff applied after failed batched reads.
     *
     * <p>Optional. Defaults to exponential backoff from 200 ms up to 30 s.
     *
     * @param backoffPolicy the backoff policy
     * @return this builder
     */
    public Builder backoffPolicy(BackoffPolicy backoffPolicy) {
      this.backoffPolicy = backoffPolicy;
      return this;
    }

    /**
     * Convenience for an {@link ExponentialBackoffPolicy} with the given bounds.
     *
     * @param base    delay after the first failure
     * @param ceiling maximum delay
     * @return this builder
     */
    public Builder backoff(Duration base, Duration ceiling) {
      this.backoffPolicy = new ExponentialBackoffPolicy(base.toMillis(), ceiling.toMillis());
      return this;
    }

    /**
     * Minimum time between the starts of two batched reads.
     *
     * <p>Optional. Defaults to {@code 50} ms.
     */
    public Builder minCycleIntervalMs(long minCycleIntervalMs) {
      this.minCycleIntervalMs = minCycleIntervalMs;
      return this;
    }

    /**
     * Wait before re-checking an empty registry.
     *
     * <p>Optional. Defaults to {@code 100} ms.
     */
    public Builder idleIntervalMs(long idleIntervalMs) {
      this.idleIntervalMs = idleIntervalMs;
      return this;
    }

    /**
     * Maximum records read per key per cycle.
     *
     * <p>Optional. Defaults to {@code 100}.
     */
    public Builder maxRecordsPerKey(int maxRecordsPerKey) {
      this.maxRecordsPerKey = maxRecordsPerKey;
      return this;
    }

    /**
     * Hard lifetime of every subscription.
     *
     * <p>Optional. Defaults to {@code 30 minutes}.
     */
    public Builder maxLifetime(Duration maxLifetime) {
      this.maxLifetime = maxLifetime;
      return this;
    }

    /**
     * Records each subscription can hold before its overflow policy applies.
     *
     * <p>Optional. Defaults to {@value DefaultSubscriptionRegistry#DEFAULT_SINK_CAPACITY}.
     */
    public Builder sinkCapacity(int sinkCapacity) {
      this.sinkCapacity = sinkCapacity;
      return this;
    }

    /**
     * What happens when a subscription's buffer is full.
     *
     * <p>Optional. Defaults to {@link OverflowPolicy#DISCONNECT}.
     */
    public Builder overflowPolicy(OverflowPolicy overflowPolicy) {
      this.overflowPolicy = overflowPolicy;
      return this;
    }

    /**
     * Enables retention-based trimming of the append log.
     *
     * <p>Optional. Trimming is off unless a trimmer is set.
     *
     * @param logTrimmer the trimmer
     * @param retention  records older than this are deleted; {@code null} for 7 days
     * @return this builder
     */
    public Builder logTrimmer(LogTrimmer logTrimmer, Duration retention) {
      this.logTrimmer = logTrimmer;
      this.retention = retention;
      return this;
    }

    /**
     * Interval between trim cycles.
     *
     * <p>Optional. Defaults to {@code 3600} seconds.
     */
    public Builder trimIntervalSeconds(long trimIntervalSeconds) {
      this.trimIntervalSeconds = trimIntervalSeconds;
      return this;
    }

    /**
     * Maximum records deleted per trim batch.
     *
     * <p>Optional. Defaults to {@code 500}.
     */
    public Builder trimBatchSize(int trimBatchSize) {
      this.trimBatchSize = trimBatchSize;
      return this;
    }

    /**
     * Builds the composite and starts the puller (and the trim scheduler if configured).
     *
     * @return a running {@link Fanout}
     * @throws NullPointerException     if {@code appendLog} is null
     * @throws IllegalArgumentException if any numeric setting is out of range
     * @throws IllegalStateException    if called twice on the same builder
     */
    public Fanout build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      Objects.requireNonNull(appendLog, "appendLog");
      MetricsExporter m = metrics != null ? metrics : MetricsExporter.NOOP;
      SubscriptionRegistry reg = registry != null
          ? registry
          : new DefaultSubscriptionRegistry(sinkCapacity, overflowPolicy);

      Puller puller = Puller.builder()
          .appendLog(appendLog)
          .registry(reg)
          .backoffPolicy(backoffPolicy)
          .metrics(m)
          .minCycleIntervalMs(minCycleIntervalMs)
          .idleIntervalMs(idleIntervalMs)
          .maxRecordsPerKey(maxRecordsPerKey)
          .build();
      AttachmentPoint attachmentPoint = AttachmentPoint.builder()
          .registry(reg)
          .metrics(m)
          .maxLifetime(maxLifetime)
          .build();
      LogTrimScheduler trimScheduler = null;
      if (logTrimmer != null) {
        trimScheduler = LogTrimScheduler.builder()
            .trimmer(logTrimmer)
            .retention(retention)
            .intervalSeconds(trimIntervalSeconds)
            .batchSize(trimBatchSize)
            .build();
      }

      Fanout fanout = new Fanout(appendLog, reg, puller, attachmentPoint,
          new RecordWriter(appendLog, m), trimScheduler, m);
      puller.start();
      if (trimScheduler != null) {
        trimScheduler.start();
      }
      return fanout;
    }
  }
}

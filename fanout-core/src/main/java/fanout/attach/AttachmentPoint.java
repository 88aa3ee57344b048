package fanout.attach;

import fanout.AttachAfterShutdownException;
import fanout.Record;
import fanout.RecordId;
import fanout.registry.SubscriptionRegistry;
import fanout.sink.OverflowPolicy;
import fanout.sink.Sink;
import fanout.spi.MetricsExporter;
import fanout.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Boundary a transport calls to subscribe to one key.
 *
 * <p>{@link #open} attaches a sink to the {@link SubscriptionRegistry} and wraps it
 * in a {@link StreamSubscription}. Every subscription is force-completed with
 * {@link fanout.sink.CloseReason#LIFETIME_EXCEEDED} once {@code maxLifetime} has
 * elapsed, so a client that never closes its side cannot pin a sink forever.
 *
 * <p>After {@link #close()}, {@code open} still returns a subscription, already
 * ended with an {@link AttachAfterShutdownException}, rather than registering a
 * sink nobody will serve.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see AttachmentPoint.Builder
 */
public final class AttachmentPoint implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(AttachmentPoint.class.getName());

  private final SubscriptionRegistry registry;
  private final MetricsExporter metrics;
  private final Duration maxLifetime;
  private final ScheduledExecutorService lifetimeScheduler;
  private volatile boolean closed;

  private AttachmentPoint(Builder builder) {
    this.registry = Objects.requireNonNull(builder.registry, "registry");
    if (builder.maxLifetime != null && (builder.maxLifetime.isNegative() || builder.maxLifetime.isZero())) {
      throw new IllegalArgumentException("maxLifetime must be > 0");
    }
    this.maxLifetime = builder.maxLifetime != null ? builder.maxLifetime : Duration.ofMinutes(30);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.lifetimeScheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("fanout-lifetime-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Subscribes to {@code key} starting at {@code fromOffset}.
   *
   * <p>If the key already has subscribers, the new subscription joins at the key's
   * current cursor and {@code fromOffset} is not used.
   *
   * @param key        the stream key
   * @param fromOffset first id to deliver (inclusive)
   * @return the subscription; ended with {@link AttachAfterShutdownException} if this
   *     attachment point is closed
   */
  public StreamSubscription open(String key, RecordId fromOffset) {
    Record.requireKey(key);
    Objects.requireNonNull(fromOffset, "fromOffset");
    if (closed) {
      return rejected(key);
    }
    Sink sink = registry.attach(key, fromOffset);
    if (closed) {
      // lost a race with close(); closeAll may already have run
      registry.detach(key, sink);
      sink.fail(new AttachAfterShutdownException(key));
      return StreamSubscription.unregistered(key, sink);
    }
    metrics.incrementAttached();
    StreamSubscription subscription = new StreamSubscription(key, sink, registry, metrics);
    scheduleExpiry(subscription);
    return subscription;
  }

  /**
   * Subscribes to {@code key} from the first record at or after {@code fromOffsetMs}.
   *
   * @param key          the stream key
   * @param fromOffsetMs epoch milliseconds, &ge; 0
   * @return the subscription
   */
  public StreamSubscription openStream(String key, long fromOffsetMs) {
    return open(key, RecordId.ofMillis(fromOffsetMs));
  }

  private StreamSubscription rejected(String key) {
    Sink sink = new Sink(key, 1, OverflowPolicy.DROP_NEWEST);
    sink.fail(new AttachAfterShutdownException(key));
    return StreamSubscription.unregistered(key, sink);
  }

  private void scheduleExpiry(StreamSubscription subscription) {
    try {
      ScheduledFuture<?> task = lifetimeScheduler.schedule(
          subscription::expire, maxLifetime.toMillis(), TimeUnit.MILLISECONDS);
      subscription.lifetimeTask(task);
    } catch (RejectedExecutionException e) {
      // scheduler already shut down by close()
      subscription.expire();
    }
  }

  public Duration maxLifetime() {
    return maxLifetime;
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Rejects further attaches and completes every attached sink with
   * {@link fanout.sink.CloseReason#SHUTDOWN}.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    int completed = registry.closeAll();
    lifetimeScheduler.shutdownNow();
    logger.log(Level.INFO, "Attachment point closed, {0} subscriptions completed", completed);
  }

  /** Builder for {@link AttachmentPoint}. */
  public static final class Builder {
    private SubscriptionRegistry registry;
    private MetricsExporter metrics;
    private Duration maxLifetime;

    private Builder() {
    }

    /**
     * Sets the registry sinks are attached to.
     *
     * <p><b>Required.</b>
     *
     * @param registry the subscription registry
     * @return this builder
     */
    public Builder registry(SubscriptionRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Sets the metrics exporter for attach and detach counts.
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
     * Sets the hard per-subscription lifetime.
     *
     * <p>Optional. Defaults to {@code 30 minutes}. Must be &gt; 0.
     *
     * @param maxLifetime the maximum lifetime
     * @return this builder
     */
    public Builder maxLifetime(Duration maxLifetime) {
      this.maxLifetime = maxLifetime;
      return this;
    }

    public AttachmentPoint build() {
      return new AttachmentPoint(this);
    }
  }
}

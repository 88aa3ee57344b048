package fanout.attach;

import fanout.FanoutException;
import fanout.Record;
import fanout.registry.SubscriptionRegistry;
import fanout.sink.CloseReason;
import fanout.sink.Sink;
import fanout.spi.MetricsExporter;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, cancellable sequence of the records of one key, as handed to a transport.
 *
 * <p>A subscription reads from its own {@link Sink}. It ends when the consumer
 * {@linkplain #close() closes} it, when the puller or registry ends the sink with
 * an error, when the engine shuts down, or when its maximum lifetime elapses.
 * Whichever happens first, the sink is detached from the registry exactly once.
 *
 * <p>Records queued before the end are still handed out. A terminal error is
 * thrown by {@link #poll} or {@link #hasNext} once the queue is drained; a normal
 * end ({@link CloseReason#CANCELLED}, {@link CloseReason#LIFETIME_EXCEEDED},
 * {@link CloseReason#SHUTDOWN}) just ends the sequence.
 *
 * <p>Not restartable: to resume, open a new subscription from the id after the
 * last record processed.
 *
 * <p>One consumer thread reads a subscription; {@link #close()} may be called from
 * any thread, including a timer or the consumer's own completion handler.
 */
public final class StreamSubscription implements Iterator<Record>, AutoCloseable {
  private final String key;
  private final Sink sink;
  private final SubscriptionRegistry registry;
  private final MetricsExporter metrics;
  private final AtomicBoolean released;
  private volatile ScheduledFuture<?> lifetimeTask;
  private Record lookahead;

  StreamSubscription(String key, Sink sink, SubscriptionRegistry registry, MetricsExporter metrics) {
    this.key = key;
    this.sink = sink;
    this.registry = registry;
    this.metrics = metrics;
    this.released = new AtomicBoolean(false);
  }

  /** Subscription that never reached the registry; it only reports its terminal state. */
  static StreamSubscription unregistered(String key, Sink sink) {
    StreamSubscription subscription = new StreamSubscription(key, sink, null, MetricsExporter.NOOP);
    subscription.released.set(true);
    return subscription;
  }

  /** ULID identifying this subscription; the same as its sink's id. */
  public String id() {
    return sink.id();
  }

  public String key() {
    return key;
  }

  /**
   * Waits up to {@code timeout} for the next record.
   *
   * <p>Returns {@code null} both when nothing arrived in time and when the
   * subscription has ended; use {@link #isClosed()} to tell them apart.
   *
   * @param timeout maximum wait
   * @return the next record, or {@code null}
   * @throws FanoutException      the terminal error, once every queued record was handed out
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public Record poll(Duration timeout) throws InterruptedException {
    if (lookahead != null) {
      Record record = lookahead;
      lookahead = null;
      return record;
    }
    Record record = sink.poll(timeout);
    if (record == null && sink.isDrained()) {
      release();
      throwFailure();
    }
    return record;
  }

  /**
   * Blocks until a record is available or the subscription ends. An interrupt
   * cancels the subscription and ends the sequence.
   *
   * @throws FanoutException the terminal error, once every queued record was handed out
   */
  @Override
  public boolean hasNext() {
    if (lookahead != null) {
      return true;
    }
    try {
      lookahead = sink.take();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      close();
      return false;
    }
    if (lookahead == null) {
      release();
      throwFailure();
      return false;
    }
    return true;
  }

  @Override
  public Record next() {
    if (!hasNext()) {
      throw new NoSuchElementException("subscription to '" + key + "' has ended");
    }
    Record record = lookahead;
    lookahead = null;
    return record;
  }

  /**
   * Returns the remaining records as a sequential stream. Closing the stream
   * closes this subscription.
   */
  public Stream<Record> stream() {
    Spliterator<Record> spliterator = Spliterators.spliteratorUnknownSize(
        this, Spliterator.ORDERED | Spliterator.NONNULL);
    return StreamSupport.stream(spliterator, false).onClose(this::close);
  }

  /** Whether the subscription has ended; queued records may still be readable. */
  public boolean isClosed() {
    return sink.isClosed();
  }

  /** Why the subscription ended, or {@code null} while it is open. */
  public CloseReason closeReason() {
    return sink.closeReason();
  }

  /** The terminal error, or {@code null} if open or ended normally. */
  public Throwable failure() {
    return sink.failure();
  }

  /**
   * Cancels the subscription and detaches its sink. Idempotent. Records already
   * queued stay readable.
   */
  @Override
  public void close() {
    sink.complete(CloseReason.CANCELLED);
    release();
  }

  /** Force-completes the subscription once its maximum lifetime has elapsed. */
  void expire() {
    sink.complete(CloseReason.LIFETIME_EXCEEDED);
    release();
  }

  void lifetimeTask(ScheduledFuture<?> task) {
    this.lifetimeTask = task;
    if (released.get()) {
      task.cancel(false);
    }
  }

  private void release() {
    if (!released.compareAndSet(false, true)) {
      return;
    }
    ScheduledFuture<?> task = lifetimeTask;
    if (task != null) {
      task.cancel(false);
    }
    registry.detach(key, sink);
    metrics.incrementDetached();
  }

  private void throwFailure() {
    Throwable failure = sink.failure();
    if (failure == null) {
      return;
    }
    if (failure instanceof RuntimeException runtime) {
      throw runtime;
    }
    throw new FanoutException("Subscription to '" + key + "' failed", failure);
  }

  @Override
  public String toString() {
    return "StreamSubscription{id=" + sink.id() + ", key=" + key + "}";
  }
}

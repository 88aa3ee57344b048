package fanout.sink;

import com.github.f4b6a3.ulid.UlidCreator;
import fanout.Record;
import fanout.RecordId;
import fanout.SinkSaturatedException;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded one-way channel between the puller (single producer) and one attached
 * consumer.
 *
 * <p>{@link #offer} never blocks: when the channel is full the configured
 * {@link OverflowPolicy} decides. A sink ends exactly once, through
 * {@link #complete} or {@link #fail}; records queued before the end are still
 * handed out by {@link #poll} before the consumer observes the terminal state.
 *
 * <p>A sink remembers the id of the last record it accepted and refuses anything
 * that is not strictly newer, so a record is never queued twice for the same
 * consumer even if the puller re-reads a batch boundary.
 *
 * <p>Each sink has its own lock; nothing here is shared between sinks.
 */
public final class Sink {
  private final String id;
  private final String key;
  private final int capacity;
  private final OverflowPolicy overflowPolicy;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private final ArrayDeque<Record> queue = new ArrayDeque<>();

  private RecordId lastAccepted;
  private CloseReason closeReason;
  private Throwable failure;
  private long accepted;
  private long dropped;

  /**
   * @param key            the stream key this sink is attached to
   * @param capacity       maximum queued records, must be &gt; 0
   * @param overflowPolicy what to do when the queue is full
   */
  public Sink(String key, int capacity, OverflowPolicy overflowPolicy) {
    this.key = Record.requireKey(key);
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
    }
    this.capacity = capacity;
    this.overflowPolicy = Objects.requireNonNull(overflowPolicy, "overflowPolicy");
    this.id = UlidCreator.getMonotonicUlid().toString();
  }

  public String id() {
    return id;
  }

  public String key() {
    return key;
  }

  public int capacity() {
    return capacity;
  }

  public OverflowPolicy overflowPolicy() {
    return overflowPolicy;
  }

  /**
   * Hands a record to the consumer without blocking.
   *
   * @param record a record of this sink's key
   * @return what happened to the record
   */
  public OfferResult offer(Record record) {
    Objects.requireNonNull(record, "record");
    lock.lock();
    try {
      if (closeReason != null) {
        return OfferResult.CLOSED;
      }
      if (lastAccepted != null && !lastAccepted.isBefore(record.id())) {
        return OfferResult.DUPLICATE;
      }
      OfferResult result = OfferResult.ACCEPTED;
      if (queue.size() >= capacity) {
        switch (overflowPolicy) {
          case DROP_OLDEST -> {
            queue.pollFirst();
            dropped++;
            result = OfferResult.ACCEPTED_DROPPED_OLDEST;
          }
          case DROP_NEWEST -> {
            dropped++;
            return OfferResult.DROPPED;
          }
          case DISCONNECT -> {
            terminate(CloseReason.FAILED, new SinkSaturatedException(key, capacity));
            return OfferResult.SATURATED;
          }
        }
      }
      queue.addLast(record);
      lastAccepted = record.id();
      accepted++;
      notEmpty.signal();
      return result;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Ends the sink normally. Queued records remain available to {@link #poll}.
   *
   * @param reason why the sink ends; {@link CloseReason#FAILED} requires {@link #fail}
   * @return {@code true} if this call ended the sink, {@code false} if it had already ended
   */
  public boolean complete(CloseReason reason) {
    Objects.requireNonNull(reason, "reason");
    if (reason == CloseReason.FAILED) {
      throw new IllegalArgumentException("use fail(Throwable) for FAILED");
    }
    lock.lock();
    try {
      return terminate(reason, null);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Ends the sink with a terminal error, surfaced to the consumer once the
   * queue is drained.
   *
   * @param error the terminal error
   * @return {@code true} if this call ended the sink, {@code false} if it had already ended
   */
  public boolean fail(Throwable error) {
    Objects.requireNonNull(error, "error");
    lock.lock();
    try {
      return terminate(CloseReason.FAILED, error);
    } finally {
      lock.unlock();
    }
  }

  // caller holds lock
  private boolean terminate(CloseReason reason, Throwable error) {
    if (closeReason != null) {
      return false;
    }
    closeReason = reason;
    failure = error;
    notEmpty.signalAll();
    return true;
  }

  /**
   * Waits up to {@code timeout} for the next record.
   *
   * @param timeout maximum wait; zero or negative returns immediately
   * @return the next record, or {@code null} if none arrived in time or the sink
   *     has ended and is drained (check {@link #isDrained()})
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public Record poll(Duration timeout) throws InterruptedException {
    long nanos = timeout.isNegative() ? 0L : timeout.toNanos();
    lock.lockInterruptibly();
    try {
      while (queue.isEmpty() && closeReason == null) {
        if (nanos <= 0L) {
          return null;
        }
        nanos = notEmpty.awaitNanos(nanos);
      }
      return queue.pollFirst();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Blocks until a record arrives or the sink ends and is drained.
   *
   * @return the next record, or {@code null} once the sink has ended and is drained
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public Record take() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (queue.isEmpty() && closeReason == null) {
        notEmpty.await();
      }
      return queue.pollFirst();
    } finally {
      lock.unlock();
    }
  }

  /** Whether the sink has ended and every queued record has been handed out. */
  public boolean isDrained() {
    lock.lock();
    try {
      return closeReason != null && queue.isEmpty();
    } finally {
      lock.unlock();
    }
  }

  public boolean isClosed() {
    lock.lock();
    try {
      return closeReason != null;
    } finally {
      lock.unlock();
    }
  }

  /** Why the sink ended, or {@code null} while it is open. */
  public CloseReason closeReason() {
    lock.lock();
    try {
      return closeReason;
    } finally {
      lock.unlock();
    }
  }

  /** The terminal error, or {@code null} if the sink is open or ended normally. */
  public Throwable failure() {
    lock.lock();
    try {
      return failure;
    } finally {
      lock.unlock();
    }
  }

  /** Number of records currently queued. */
  public int size() {
    lock.lock();
    try {
      return queue.size();
    } finally {
      lock.unlock();
    }
  }

  /** Total records accepted since the sink was created. */
  public long acceptedCount() {
    lock.lock();
    try {
      return accepted;
    } finally {
      lock.unlock();
    }
  }

  /** Total records lost to {@link OverflowPolicy#DROP_OLDEST} or {@link OverflowPolicy#DROP_NEWEST}. */
  public long droppedCount() {
    lock.lock();
    try {
      return dropped;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String toString() {
    return "Sink{id=" + id + ", key=" + key + "}";
  }
}

package fanout.registry;

import fanout.RecordId;
import fanout.sink.Sink;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Registry entry for one key: its read cursor and the sinks attached to it.
 *
 * <p>The sink set is mutated only inside the owning map's per-key compute
 * functions and may be iterated by the puller at any time without locking.
 * The cursor is written only by the puller.
 */
public final class StreamHandle {
  private final String key;
  private final Set<Sink> sinks = new CopyOnWriteArraySet<>();
  private volatile RecordId cursor;

  StreamHandle(String key, RecordId cursor) {
    this.key = Objects.requireNonNull(key, "key");
    this.cursor = Objects.requireNonNull(cursor, "cursor");
  }

  public String key() {
    return key;
  }

  public RecordId cursor() {
    return cursor;
  }

  /** Live, unmodifiable view of the attached sinks. */
  public Set<Sink> sinks() {
    return Collections.unmodifiableSet(sinks);
  }

  public int sinkCount() {
    return sinks.size();
  }

  void addSink(Sink sink) {
    sinks.add(sink);
  }

  boolean removeSink(Sink sink) {
    return sinks.remove(sink);
  }

  boolean isEmpty() {
    return sinks.isEmpty();
  }

  /**
   * Moves the cursor forward. A cursor never moves backwards.
   *
   * @return {@code true} if the cursor changed
   */
  boolean advanceTo(RecordId next) {
    if (cursor.isBefore(next)) {
      cursor = next;
      return true;
    }
    return false;
  }

  @Override
  public String toString() {
    return "StreamHandle{key=" + key + ", cursor=" + cursor + ", sinks=" + sinks.size() + "}";
  }
}

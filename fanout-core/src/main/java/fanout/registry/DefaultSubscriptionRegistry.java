package fanout.registry;

import fanout.Record;
import fanout.RecordId;
import fanout.sink.CloseReason;
import fanout.sink.OfferResult;
import fanout.sink.OverflowPolicy;
import fanout.sink.Sink;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe registry of stream handles keyed by stream key.
 *
 * <p>Every structural change to one key (creating a handle, adding or removing a
 * sink, dropping an empty handle) runs inside a {@link ConcurrentHashMap#compute}
 * style call, so it is serialized against other changes to the same key only.
 * There is no registry-wide lock: attach and detach cost the same with ten keys
 * or ten thousand.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * SubscriptionRegistry registry = new DefaultSubscriptionRegistry(256, OverflowPolicy.DISCONNECT);
 * Sink sink = registry.attach("order-42", RecordId.ZERO);
 * // ... puller dispatches into the sink ...
 * registry.detach("order-42", sink);
 * }</pre>
 *
 * <h2>Batch boundary</h2>
 * <p>A sink attached to a key that already has a handle joins at the handle's
 * current cursor, not at its own {@code fromOffset}. The puller advances the
 * cursor after each record, so a sink attaching while a batch for that key is
 * being dispatched receives the rest of that batch, starting at the cursor it
 * inherited. A handle re-created mid-cycle (last sink left, a new one arrived)
 * gets nothing from the in-flight batch; the next cycle reads from the
 * newcomer's offset.
 *
 * @see StreamHandle
 * @see fanout.puller.Puller
 */
public final class DefaultSubscriptionRegistry implements SubscriptionRegistry {
  private static final Logger logger = Logger.getLogger(DefaultSubscriptionRegistry.class.getName());

  public static final int DEFAULT_SINK_CAPACITY = 256;

  private final Map<String, StreamHandle> handles = new ConcurrentHashMap<>();
  private final int sinkCapacity;
  private final OverflowPolicy overflowPolicy;

  /**
   * Creates a registry whose sinks hold {@value #DEFAULT_SINK_CAPACITY} records and
   * disconnect on overflow.
   */
  public DefaultSubscriptionRegistry() {
    this(DEFAULT_SINK_CAPACITY, OverflowPolicy.DISCONNECT);
  }

  /**
   * @param sinkCapacity   per-sink channel capacity, must be &gt; 0
   * @param overflowPolicy policy applied when a sink's channel is full
   */
  public DefaultSubscriptionRegistry(int sinkCapacity, OverflowPolicy overflowPolicy) {
    if (sinkCapacity <= 0) {
      throw new IllegalArgumentException("sinkCapacity must be > 0, got: " + sinkCapacity);
    }
    this.sinkCapacity = sinkCapacity;
    this.overflowPolicy = Objects.requireNonNull(overflowPolicy, "overflowPolicy");
  }

  @Override
  public Sink attach(String key, RecordId fromOffset) {
    Record.requireKey(key);
    Objects.requireNonNull(fromOffset, "fromOffset");
    Sink sink = new Sink(key, sinkCapacity, overflowPolicy);
    handles.compute(key, (k, handle) -> {
      StreamHandle target = handle != null ? handle : new StreamHandle(k, fromOffset);
      target.addSink(sink);
      return target;
    });
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Attached " + sink + " at cursor " + cursor(key));
    }
    return sink;
  }

  @Override
  public boolean detach(String key, Sink sink) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(sink, "sink");
    boolean[] removed = new boolean[1];
    handles.computeIfPresent(key, (k, handle) -> {
      removed[0] = handle.removeSink(sink);
      return handle.isEmpty() ? null : handle;
    });
    if (removed[0] && logger.isLoggable(Level.FINE)) {
      logger.fine("Detached " + sink);
    }
    return removed[0];
  }

  @Override
  public List<ActiveStream> snapshotActive() {
    List<ActiveStream> active = new ArrayList<>(handles.size());
    for (StreamHandle handle : handles.values()) {
      if (!handle.isEmpty()) {
        active.add(new ActiveStream(handle.key(), handle.cursor()));
      }
    }
    return active;
  }

  @Override
  public DispatchOutcome dispatch(String key, Record record) {
    StreamHandle handle = handles.get(key);
    if (handle == null || record.id().isBefore(handle.cursor())) {
      return DispatchOutcome.NONE;
    }
    int delivered = 0;
    int dropped = 0;
    int saturated = 0;
    for (Sink sink : handle.sinks()) {
      OfferResult result = sink.offer(record);
      if (result.delivered()) {
        delivered++;
      }
      if (result == OfferResult.ACCEPTED_DROPPED_OLDEST || result == OfferResult.DROPPED) {
        dropped++;
      } else if (result == OfferResult.SATURATED) {
        saturated++;
        logger.log(Level.WARNING, "Disconnecting saturated subscriber {0} of key {1}",
            new Object[]{sink.id(), key});
        detach(key, sink);
      }
    }
    if (delivered == 0 && dropped == 0 && saturated == 0) {
      return DispatchOutcome.NONE;
    }
    return new DispatchOutcome(delivered, dropped, saturated);
  }

  @Override
  public void advance(String key, RecordId newCursor) {
    Objects.requireNonNull(newCursor, "newCursor");
    StreamHandle handle = handles.get(key);
    if (handle != null) {
      handle.advanceTo(newCursor);
    }
  }

  @Override
  public int fail(String key, Throwable error) {
    Objects.requireNonNull(error, "error");
    StreamHandle handle = handles.remove(key);
    if (handle == null) {
      return 0;
    }
    int failed = 0;
    for (Sink sink : handle.sinks()) {
      if (sink.fail(error)) {
        failed++;
      }
    }
    return failed;
  }

  @Override
  public int closeAll() {
    int completed = 0;
    for (String key : List.copyOf(handles.keySet())) {
      StreamHandle handle = handles.remove(key);
      if (handle == null) {
        continue;
      }
      for (Sink sink : handle.sinks()) {
        if (sink.complete(CloseReason.SHUTDOWN)) {
          completed++;
        }
      }
    }
    return completed;
  }

  @Override
  public Set<Sink> sinks(String key) {
    StreamHandle handle = handles.get(key);
    return handle == null ? Set.of() : handle.sinks();
  }

  @Override
  public RecordId cursor(String key) {
    StreamHandle handle = handles.get(key);
    return handle == null ? null : handle.cursor();
  }

  @Override
  public int activeKeyCount() {
    return handles.size();
  }

  @Override
  public int sinkCount() {
    int total = 0;
    for (StreamHandle handle : handles.values()) {
      total += handle.sinkCount();
    }
    return total;
  }

  public int sinkCapacity() {
    return sinkCapacity;
  }

  public OverflowPolicy overflowPolicy() {
    return overflowPolicy;
  }
}

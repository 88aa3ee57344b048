package fanout.registry;

import fanout.Record;
import fanout.RecordId;
import fanout.sink.Sink;

import java.util.List;
import java.util.Set;

/**
 * Concurrent map from stream key to the sinks listening on it.
 *
 * <p>Callers on any thread {@link #attach} and {@link #detach}; the puller is the
 * only caller of {@link #snapshotActive}, {@link #dispatch}, {@link #advance} and
 * {@link #fail}. No I/O happens inside a registry.
 *
 * @see DefaultSubscriptionRegistry
 */
public interface SubscriptionRegistry {

  /**
   * Attaches a new sink to {@code key}. If the key has no handle yet, one is created
   * with its cursor at {@code fromOffset}; otherwise the existing cursor is kept.
   * Never blocks.
   *
   * @param key        the stream key
   * @param fromOffset cursor for a newly created handle
   * @return the new sink
   */
  Sink attach(String key, RecordId fromOffset);

  /**
   * Removes {@code sink} from {@code key}; removes the handle once no sink is left.
   * Idempotent.
   *
   * @return {@code true} if the sink was attached
   */
  boolean detach(String key, Sink sink);

  /**
   * Returns the keys that currently have at least one sink, with their cursors.
   */
  List<ActiveStream> snapshotActive();

  /**
   * Hands {@code record} to every sink currently attached to its key. Records older
   * than the key's cursor are skipped.
   *
   * @return per-sink outcome counts
   */
  DispatchOutcome dispatch(String key, Record record);

  /**
   * Moves {@code key}'s cursor forward to {@code newCursor}. No-op if the key has no
   * handle or the cursor is already further.
   */
  void advance(String key, RecordId newCursor);

  /**
   * Sends a terminal error to every sink of {@code key} and removes its handle.
   *
   * @return the number of sinks failed
   */
  int fail(String key, Throwable error);

  /**
   * Completes every sink with {@link fanout.sink.CloseReason#SHUTDOWN} and clears the registry.
   *
   * @return the number of sinks completed
   */
  int closeAll();

  /** Sinks currently attached to {@code key}; empty if none. */
  Set<Sink> sinks(String key);

  /** Current cursor of {@code key}, or {@code null} if the key has no handle. */
  RecordId cursor(String key);

  int activeKeyCount();

  int sinkCount();
}

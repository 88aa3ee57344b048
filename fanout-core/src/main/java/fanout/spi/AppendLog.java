package fanout.spi;

import fanout.Record;
import fanout.RecordId;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Boundary to the durable, key-partitioned, append-only store that backs the
 * fan-out engine.
 *
 * <p>Producers call {@link #append}; the {@linkplain fanout.puller.Puller puller}
 * is the only caller of {@link #readBatch}, issuing one call per cycle for every
 * key that currently has a subscriber. Implementations live in the
 * {@code fanout-jdbc} module.
 */
public interface AppendLog {

  /**
   * Appends one record to the end of {@code key}'s sequence.
   *
   * @param key     the stream key
   * @param payload the opaque payload
   * @return the id assigned to the record; strictly greater than every id
   *     previously assigned for the same key
   */
  RecordId append(String key, byte[] payload);

  /**
   * Appends several records to {@code key} in order.
   *
   * <p>Default loops {@link #append}. JDBC implementations override to write the
   * whole batch in one transaction.
   *
   * @param key      the stream key
   * @param payloads the payloads, in delivery order
   * @return the assigned ids, in the same order
   */
  default List<RecordId> appendAll(String key, List<byte[]> payloads) {
    List<RecordId> ids = new ArrayList<>(payloads.size());
    for (byte[] payload : payloads) {
      ids.add(append(key, payload));
    }
    return ids;
  }

  /**
   * Reads the records of many keys in a single round trip.
   *
   * <p>For each entry, returns records of that key whose id is greater than or
   * equal to the cursor, oldest first, at most {@code maxPerKey} per key. A key
   * absent from the result has nothing new. The call is all-or-nothing: it either
   * returns results for every key or throws.
   *
   * @param cursors   next read position per key (inclusive)
   * @param maxPerKey maximum number of records returned per key
   * @return the records, grouped in any order across keys
   * @throws RuntimeException if the store cannot serve the read
   */
  List<Record> readBatch(Map<String, RecordId> cursors, int maxPerKey);

  /**
   * Returns the id of the newest record of {@code key}, if any.
   *
   * @param key the stream key
   * @return the newest id, or empty if the key has no records
   */
  default Optional<RecordId> lastId(String key) {
    return Optional.empty();
  }
}

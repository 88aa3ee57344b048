package fanout;

import fanout.spi.AppendLog;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory AppendLog for unit tests that don't need real JDBC.
 */
public final class InMemoryAppendLog implements AppendLog {
  public final AtomicInteger readCount = new AtomicInteger();
  public final AtomicInteger failuresToInject = new AtomicInteger();
  public volatile Map<String, RecordId> lastCursors = Map.of();

  private final Map<String, List<Record>> records = new HashMap<>();
  private final AtomicLong clock = new AtomicLong(1_000L);

  @Override
  public synchronized RecordId append(String key, byte[] payload) {
    RecordId id = RecordId.ofMillis(clock.incrementAndGet());
    records.computeIfAbsent(key, k -> new ArrayList<>()).add(new Record(key, id, payload));
    return id;
  }

  public RecordId append(String key, String payload) {
    return append(key, payload.getBytes(StandardCharsets.UTF_8));
  }

  @Override
  public synchronized List<Record> readBatch(Map<String, RecordId> cursors, int maxPerKey) {
    readCount.incrementAndGet();
    lastCursors = Map.copyOf(cursors);
    if (failuresToInject.get() > 0) {
      failuresToInject.decrementAndGet();
      throw new IllegalStateException("store down");
    }
    List<Record> result = new ArrayList<>();
    for (Map.Entry<String, RecordId> entry : cursors.entrySet()) {
      int taken = 0;
      for (Record record : records.getOrDefault(entry.getKey(), List.of())) {
        if (!record.id().isBefore(entry.getValue()) && taken < maxPerKey) {
          result.add(record);
          taken++;
        }
      }
    }
    // a store gives no ordering guarantee across keys
    Collections.reverse(result);
    return result;
  }

  @Override
  public synchronized Optional<RecordId> lastId(String key) {
    List<Record> list = records.getOrDefault(key, List.of());
    return list.isEmpty() ? Optional.empty() : Optional.of(list.get(list.size() - 1).id());
  }

  public synchronized int size() {
    return records.values().stream().mapToInt(List::size).sum();
  }
}

package fanout.jdbc;

import fanout.Record;
import fanout.RecordId;
import fanout.jdbc.store.AbstractJdbcLogStore;
import fanout.spi.AppendLog;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link AppendLog} over a relational table.
 *
 * <p>Ids are allocated from the wall clock: a record gets {@code (now, 0)}, or the
 * successor of the key's newest id when that id is not older than {@code now}.
 *
 * <p>Appends to one key are serialized within the JVM, from reading the key's
 * newest id through commit, so they commit in id order and a reader that has moved
 * past an id never sees a smaller one appear later. The lock is shared by every
 * instance writing the same table. Appenders in other processes are arbitrated only
 * by the primary key {@code (stream_key, ts, seq)}: the loser of a race sees a
 * constraint violation and retries with a fresh id.
 *
 * <p>{@link #readBatch} runs on one connection. Keys are split into statements of
 * at most {@code maxKeysPerStatement} to stay under driver parameter limits; if
 * any statement fails, the whole read fails.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see AbstractJdbcLogStore
 */
public final class JdbcAppendLog implements AppendLog {
  private static final Logger logger = Logger.getLogger(JdbcAppendLog.class.getName());

  private static final int APPEND_LOCK_STRIPES = 64;
  private static final ReentrantLock[] APPEND_LOCKS = new ReentrantLock[APPEND_LOCK_STRIPES];

  static {
    for (int i = 0; i < APPEND_LOCK_STRIPES; i++) {
      APPEND_LOCKS[i] = new ReentrantLock();
    }
  }

  private final ConnectionProvider connectionProvider;
  private final AbstractJdbcLogStore store;
  private final int readTimeoutSeconds;
  private final int maxKeysPerStatement;
  private final int maxAppendAttempts;
  private final Clock clock;

  private JdbcAppendLog(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(builder.store, "store");

    if (builder.readTimeout != null && builder.readTimeout.isNegative()) {
      throw new IllegalArgumentException("readTimeout must be >= 0");
    }
    if (builder.maxKeysPerStatement <= 0) {
      throw new IllegalArgumentException("maxKeysPerStatement must be > 0");
    }
    if (builder.maxAppendAttempts <= 0) {
      throw new IllegalArgumentException("maxAppendAttempts must be > 0");
    }

    Duration timeout = builder.readTimeout != null ? builder.readTimeout : Duration.ofSeconds(5);
    // JDBC timeouts are whole seconds; round up so a sub-second timeout is not "none"
    long seconds = timeout.isZero() ? 0L : (timeout.toMillis() + 999L) / 1000L;
    this.readTimeoutSeconds = (int) Math.min(seconds, Integer.MAX_VALUE);
    this.maxKeysPerStatement = builder.maxKeysPerStatement;
    this.maxAppendAttempts = builder.maxAppendAttempts;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public RecordId append(String key, byte[] payload) {
    return appendAll(key, List.of(payload)).get(0);
  }

  /**
   * Appends all payloads in one transaction; either every record is written or none.
   */
  @Override
  public List<RecordId> appendAll(String key, List<byte[]> payloads) {
    Record.requireKey(key);
    Objects.requireNonNull(payloads, "payloads");
    if (payloads.isEmpty()) {
      return List.of();
    }
    ReentrantLock lock = appendLock(key);
    for (int attempt = 1; ; attempt++) {
      lock.lock();
      try {
        return tryAppend(key, payloads);
      } catch (AppendLogException e) {
        if (!e.isConstraintViolation() || attempt >= maxAppendAttempts) {
          throw e;
        }
        logger.log(Level.FINE, "Id collision appending to {0}, retrying (attempt {1})",
            new Object[]{key, attempt});
      } finally {
        lock.unlock();
      }
    }
  }

  private ReentrantLock appendLock(String key) {
    int hash = (store.tableName() + ':' + key).hashCode();
    return APPEND_LOCKS[Math.floorMod(hash, APPEND_LOCK_STRIPES)];
  }

  private List<RecordId> tryAppend(String key, List<byte[]> payloads) {
    try (Connection conn = connectionProvider.getConnection()) {
      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      try {
        RecordId id = firstId(store.lastId(conn, key).orElse(null));
        List<RecordId> ids = new ArrayList<>(payloads.size());
        for (byte[] payload : payloads) {
          store.insert(conn, key, id, payload);
          ids.add(id);
          id = id.next();
        }
        conn.commit();
        return ids;
      } catch (RuntimeException e) {
        rollbackQuietly(conn, e);
        throw e;
      } finally {
        conn.setAutoCommit(autoCommit);
      }
    } catch (SQLException e) {
      throw new AppendLogException("Failed to append to key " + key, e);
    }
  }

  private RecordId firstId(RecordId last) {
    long now = clock.millis();
    if (last == null || last.timestampMs() < now) {
      return RecordId.ofMillis(now);
    }
    return last.next();
  }

  private static void rollbackQuietly(Connection conn, RuntimeException failure) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      failure.addSuppressed(e);
    }
  }

  @Override
  public List<Record> readBatch(Map<String, RecordId> cursors, int maxPerKey) {
    Objects.requireNonNull(cursors, "cursors");
    if (maxPerKey <= 0) {
      throw new IllegalArgumentException("maxPerKey must be > 0");
    }
    if (cursors.isEmpty()) {
      return List.of();
    }
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      if (cursors.size() <= maxKeysPerStatement) {
        return store.readBatch(conn, cursors, maxPerKey, readTimeoutSeconds);
      }
      List<Record> records = new ArrayList<>();
      Map<String, RecordId> chunk = new LinkedHashMap<>();
      for (Map.Entry<String, RecordId> entry : cursors.entrySet()) {
        chunk.put(entry.getKey(), entry.getValue());
        if (chunk.size() == maxKeysPerStatement) {
          records.addAll(store.readBatch(conn, chunk, maxPerKey, readTimeoutSeconds));
          chunk.clear();
        }
      }
      if (!chunk.isEmpty()) {
        records.addAll(store.readBatch(conn, chunk, maxPerKey, readTimeoutSeconds));
      }
      return records;
    } catch (SQLException e) {
      throw new AppendLogException("Failed to read batch of " + cursors.size() + " keys", e);
    }
  }

  @Override
  public Optional<RecordId> lastId(String key) {
    Record.requireKey(key);
    try (Connection conn = connectionProvider.getConnection()) {
      return store.lastId(conn, key);
    } catch (SQLException e) {
      throw new AppendLogException("Failed to read last id of key " + key, e);
    }
  }

  public AbstractJdbcLogStore store() {
    return store;
  }

  /** Builder for {@link JdbcAppendLog}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private AbstractJdbcLogStore store;
    private Duration readTimeout;
    private int maxKeysPerStatement = 1000;
    private int maxAppendAttempts = 5;
    private Clock clock;

    private Builder() {}

    /**
     * Sets the connection provider. Should be pooled.
     *
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the dialect-specific store, usually from {@link fanout.jdbc.store.JdbcLogStores#detect}.
     *
     * <p><b>Required.</b>
     *
     * @param store the log store
     * @return this builder
     */
    public Builder store(AbstractJdbcLogStore store) {
      this.store = store;
      return this;
    }

    /**
     * Sets the statement timeout of batched reads, rounded up to whole seconds.
     *
     * <p>Optional. Defaults to {@code 5 seconds}. {@link Duration#ZERO} disables it.
     *
     * @param readTimeout the read timeout
     * @return this builder
     */
    public Builder readTimeout(Duration readTimeout) {
      this.readTimeout = readTimeout;
      return this;
    }

    /**
     * Sets the maximum number of keys per read statement.
     *
     * <p>Optional. Defaults to {@code 1000}. Must be &gt; 0.
     *
     * @param maxKeysPerStatement keys per statement
     * @return this builder
     */
    public Builder maxKeysPerStatement(int maxKeysPerStatement) {
      this.maxKeysPerStatement = maxKeysPerStatement;
      return this;
    }

    /**
     * Sets how many times an append is tried when its id collides with a concurrent one.
     *
     * <p>Optional. Defaults to {@code 5}. Must be &gt; 0.
     *
     * @param maxAppendAttempts attempts per append
     * @return this builder
     */
    public Builder maxAppendAttempts(int maxAppendAttempts) {
      this.maxAppendAttempts = maxAppendAttempts;
      return this;
    }

    /**
     * Sets the clock ids are taken from.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public JdbcAppendLog build() {
      return new JdbcAppendLog(this);
    }
  }
}

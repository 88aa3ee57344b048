package fanout.jdbc.store;

import fanout.Record;
import fanout.RecordId;
import fanout.jdbc.ConnectionProvider;
import fanout.jdbc.JdbcTemplate;
import fanout.jdbc.TableNames;
import fanout.jdbc.trim.AbstractJdbcLogTrimmer;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Base JDBC log store with standard SQL implementations.
 *
 * <p>A store holds no connection: every operation runs on the connection it is
 * given, so one instance serves any number of threads. Records live in one table
 * keyed by {@code (stream_key, ts, seq)}; see {@code schema/*.sql} for the DDL.
 *
 * <p>The batched read is a single statement: one cursor predicate per key, OR'd
 * together, with {@code ROW_NUMBER() OVER (PARTITION BY stream_key ...)} capping
 * the rows per key. All three supported databases (H2 2.x, MySQL 8, PostgreSQL)
 * run it unchanged; subclasses contribute their name, URL prefixes and trimmer.
 *
 * <p>Register custom implementations via
 * {@code META-INF/services/fanout.jdbc.store.AbstractJdbcLogStore}.
 *
 * @see JdbcLogStores
 */
public abstract class AbstractJdbcLogStore {

  protected static final JdbcTemplate.RowMapper<Record> RECORD_ROW_MAPPER = rs -> new Record(
      rs.getString("stream_key"),
      new RecordId(rs.getLong("ts"), rs.getInt("seq")),
      rs.getBytes("payload"));

  private static final JdbcTemplate.RowMapper<RecordId> ID_ROW_MAPPER =
      rs -> new RecordId(rs.getLong("ts"), rs.getInt("seq"));

  private final String tableName;

  protected AbstractJdbcLogStore() {
    this(TableNames.DEFAULT_TABLE);
  }

  protected AbstractJdbcLogStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  /**
   * Unique identifier for this log store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this log store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same dialect bound to another table.
   */
  public abstract AbstractJdbcLogStore withTableName(String tableName);

  /**
   * Returns a trimmer of the same dialect and table.
   */
  public abstract AbstractJdbcLogTrimmer newTrimmer(ConnectionProvider connectionProvider);

  public String tableName() {
    return tableName;
  }

  /** Inserts one record. Fails with a constraint violation if the id is taken. */
  public void insert(Connection conn, String key, RecordId id, byte[] payload) {
    String sql = "INSERT INTO " + tableName() + " (stream_key, ts, seq, payload) VALUES (?,?,?,?)";
    JdbcTemplate.update(conn, sql, key, id.timestampMs(), id.sequence(), payload);
  }

  /** Returns the newest id of {@code key}, if it has any record. */
  public Optional<RecordId> lastId(Connection conn, String key) {
    String sql = "SELECT ts, seq FROM " + tableName() +
        " WHERE stream_key=? ORDER BY ts DESC, seq DESC LIMIT 1";
    List<RecordId> ids = JdbcTemplate.query(conn, sql, ID_ROW_MAPPER, key);
    return ids.isEmpty() ? Optional.empty() : Optional.of(ids.get(0));
  }

  /**
   * Reads, for every key, up to {@code maxPerKey} records at or after its cursor,
   * in one statement.
   *
   * @param conn           the connection
   * @param cursors        next read position per key (inclusive); must not be empty
   * @param maxPerKey      per-key row cap
   * @param timeoutSeconds statement timeout; 0 means none
   * @return records ordered by key, then id
   */
  public List<Record> readBatch(Connection conn, Map<String, RecordId> cursors, int maxPerKey,
      int timeoutSeconds) {
    if (cursors.isEmpty()) {
      throw new IllegalArgumentException("cursors cannot be empty");
    }
    StringBuilder where = new StringBuilder();
    List<Object> params = new ArrayList<>(cursors.size() * 4 + 1);
    for (Map.Entry<String, RecordId> entry : cursors.entrySet()) {
      if (where.length() > 0) {
        where.append(" OR ");
      }
      where.append("(stream_key=? AND (ts>? OR (ts=? AND seq>=?)))");
      RecordId cursor = entry.getValue();
      params.add(entry.getKey());
      params.add(cursor.timestampMs());
      params.add(cursor.timestampMs());
      params.add(cursor.sequence());
    }
    params.add(maxPerKey);
    String sql = "SELECT stream_key, ts, seq, payload FROM (" +
        "SELECT stream_key, ts, seq, payload, " +
        "ROW_NUMBER() OVER (PARTITION BY stream_key ORDER BY ts, seq) AS rn " +
        "FROM " + tableName() + " WHERE " + where +
        ") batch WHERE rn <= ? ORDER BY stream_key, ts, seq";
    return JdbcTemplate.query(conn, timeoutSeconds, sql, RECORD_ROW_MAPPER, params.toArray());
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{table=" + tableName + "}";
  }
}

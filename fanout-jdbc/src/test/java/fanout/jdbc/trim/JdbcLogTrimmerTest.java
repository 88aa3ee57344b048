package fanout.jdbc.trim;

import fanout.RecordId;
import fanout.jdbc.DataSourceConnectionProvider;
import fanout.jdbc.JdbcTestSupport;
import fanout.jdbc.store.H2LogStore;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class JdbcLogTrimmerTest {

  private JdbcDataSource dataSource;
  private DataSourceConnectionProvider connectionProvider;
  private final H2LogStore store = new H2LogStore();
  private final Instant now = Instant.now();

  @BeforeEach
  void setUp() throws Exception {
    dataSource = JdbcTestSupport.h2();
    connectionProvider = new DataSourceConnectionProvider(dataSource);
  }

  private void insert(String key, Instant at, int count) throws Exception {
    try (Connection conn = dataSource.getConnection()) {
      conn.setAutoCommit(true);
      for (int i = 0; i < count; i++) {
        store.insert(conn, key, new RecordId(at.toEpochMilli(), i), new byte[]{1});
      }
    }
  }

  @Test
  void deletesOnlyRecordsOlderThanCutoff() throws Exception {
    insert("k1", now.minus(Duration.ofDays(10)), 3);
    insert("k1", now, 2);

    int deleted = new H2LogTrimmer(connectionProvider).trimBefore(now.minus(Duration.ofDays(1)), 100);

    assertEquals(3, deleted);
    assertEquals(2, JdbcTestSupport.count(dataSource, "fanout_record"));
  }

  @Test
  void respectsLimit() throws Exception {
    insert("k1", now.minus(Duration.ofDays(10)), 5);

    H2LogTrimmer trimmer = new H2LogTrimmer(connectionProvider);

    assertEquals(2, trimmer.trimBefore(now, 2));
    assertEquals(2, trimmer.trimBefore(now, 2));
    assertEquals(1, trimmer.trimBefore(now, 2));
    assertEquals(0, trimmer.trimBefore(now, 2));
  }

  @Test
  void storeCreatesTrimmerForItsTable() throws Exception {
    JdbcTestSupport.execute(dataSource, "CREATE TABLE custom_record (" +
        "stream_key VARCHAR(255) NOT NULL, ts BIGINT NOT NULL, seq INT NOT NULL," +
        "payload VARBINARY(1024) NOT NULL, PRIMARY KEY (stream_key, ts, seq))");
    H2LogStore custom = store.withTableName("custom_record");
    try (Connection conn = dataSource.getConnection()) {
      custom.insert(conn, "k1", RecordId.ofMillis(1), new byte[]{1});
    }

    AbstractJdbcLogTrimmer trimmer = custom.newTrimmer(connectionProvider);

    assertEquals(1, trimmer.trimBefore(now, 10));
    assertEquals(0, JdbcTestSupport.count(dataSource, "custom_record"));
  }

  @Test
  void validatesArguments() {
    H2LogTrimmer trimmer = new H2LogTrimmer(connectionProvider);

    assertThrows(IllegalArgumentException.class, () -> trimmer.trimBefore(now, 0));
    assertThrows(NullPointerException.class, () -> trimmer.trimBefore(null, 10));
    assertThrows(IllegalArgumentException.class, () -> new H2LogTrimmer(connectionProvider, "bad-table"));
    assertThrows(NullPointerException.class, () -> new MySqlLogTrimmer(null));
  }
}

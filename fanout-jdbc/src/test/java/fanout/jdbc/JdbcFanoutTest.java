package fanout.jdbc;

import fanout.Fanout;
import fanout.Record;
import fanout.RecordId;
import fanout.RecordWriter;
import fanout.StoreUnavailableException;
import fanout.attach.StreamSubscription;
import fanout.jdbc.store.JdbcLogStores;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end behavior of the fan-out engine over an H2 append log.
 */
class JdbcFanoutTest {

  private JdbcDataSource dataSource;
  private Fanout fanout;
  private RecordWriter writer;

  @BeforeEach
  void setUp() throws Exception {
    dataSource = JdbcTestSupport.h2();
    JdbcAppendLog appendLog = JdbcAppendLog.builder()
        .connectionProvider(new DataSourceConnectionProvider(dataSource))
        .store(JdbcLogStores.detect(dataSource))
        .build();
    fanout = Fanout.builder()
        .appendLog(appendLog)
        .minCycleIntervalMs(10)
        .idleIntervalMs(10)
        .backoff(Duration.ofMillis(10), Duration.ofMillis(50))
        .build();
    writer = fanout.writer();
  }

  @AfterEach
  void tearDown() {
    fanout.close();
  }

  private static List<String> take(StreamSubscription sub, int n) throws InterruptedException {
    List<String> payloads = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      Record record = sub.poll(Duration.ofSeconds(5));
      assertNotNull(record, "expected " + n + " records, got " + payloads);
      payloads.add(record.payloadAsString());
    }
    return payloads;
  }

  @Test
  void keysAreServedIndependently() throws Exception {
    writer.append("k1", "a");
    writer.append("k1", "b");
    writer.append("k2", "x");

    StreamSubscription k1 = fanout.openStream("k1", 0L);
    StreamSubscription k2 = fanout.openStream("k2", 0L);

    assertEquals(List.of("a", "b"), take(k1, 2));
    assertEquals(List.of("x"), take(k2, 1));

    RecordId afterB = fanout.registry().cursor("k1");
    k1.close();
    writer.append("k1", "c");
    StreamSubscription fresh = fanout.open("k1", afterB);

    assertEquals(List.of("c"), take(fresh, 1));
    assertNull(k1.poll(Duration.ofMillis(100)));
    assertNull(k2.poll(Duration.ofMillis(100)));
  }

  @Test
  void subscribersOfOneKeySeeIdenticalSequences() throws Exception {
    List<StreamSubscription> subs = List.of(
        fanout.openStream("orders", 0L),
        fanout.openStream("orders", 0L),
        fanout.openStream("orders", 0L));
    List<String> expected = new ArrayList<>();
    for (int i = 0; i < 20; i++) {
      writer.append("orders", "v" + i);
      expected.add("v" + i);
    }

    for (StreamSubscription sub : subs) {
      assertEquals(expected, take(sub, 20));
    }
  }

  @Test
  void storeOutageFailsSubscribersAndReopenRecovers() throws Exception {
    RecordId first = writer.append("k1", "a");
    StreamSubscription sub = fanout.open("k1", first);
    assertEquals(List.of("a"), take(sub, 1));
    RecordId resumeFrom = fanout.registry().cursor("k1");

    JdbcTestSupport.execute(dataSource, "ALTER TABLE fanout_record RENAME TO fanout_record_offline");

    StoreUnavailableException error = assertThrows(StoreUnavailableException.class,
        () -> sub.poll(Duration.ofSeconds(5)));
    assertInstanceOf(AppendLogException.class, error.getCause());
    assertEquals(0, fanout.registry().activeKeyCount());

    JdbcTestSupport.execute(dataSource, "ALTER TABLE fanout_record_offline RENAME TO fanout_record");
    writer.append("k1", "b");
    StreamSubscription reopened = fanout.open("k1", resumeFrom);

    assertEquals(List.of("b"), take(reopened, 1));
  }

  @Test
  void openFromLatestSkipsHistory() throws Exception {
    writer.append("k1", "old");

    StreamSubscription sub = fanout.openFromLatest("k1");
    writer.append("k1", "new");

    assertEquals(List.of("new"), take(sub, 1));
  }
}

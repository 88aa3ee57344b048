package fanout.jdbc.store;

import fanout.jdbc.JdbcTestSupport;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JdbcLogStoresTest {

  @Test
  void allStoresAreDiscovered() {
    assertEquals(3, JdbcLogStores.all().size());
  }

  @Test
  void getByNameIsCaseInsensitive() {
    assertInstanceOf(H2LogStore.class, JdbcLogStores.get("h2"));
    assertInstanceOf(MySqlLogStore.class, JdbcLogStores.get("MySQL"));
    assertInstanceOf(PostgresLogStore.class, JdbcLogStores.get("postgresql"));
    assertThrows(IllegalArgumentException.class, () -> JdbcLogStores.get("oracle"));
  }

  @Test
  void detectsFromJdbcUrl() {
    assertInstanceOf(H2LogStore.class, JdbcLogStores.detect("jdbc:h2:mem:test"));
    assertInstanceOf(MySqlLogStore.class, JdbcLogStores.detect("jdbc:mysql://localhost:3306/app"));
    assertInstanceOf(MySqlLogStore.class, JdbcLogStores.detect("jdbc:tidb://localhost:4000/app"));
    assertInstanceOf(PostgresLogStore.class, JdbcLogStores.detect("JDBC:POSTGRESQL://localhost/app"));
  }

  @Test
  void unknownUrlThrows() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> JdbcLogStores.detect("jdbc:oracle:thin:@localhost"));
    assertTrue(e.getMessage().contains("jdbc:h2:"));
    assertThrows(IllegalArgumentException.class, () -> JdbcLogStores.detect(""));
    assertThrows(IllegalArgumentException.class, () -> JdbcLogStores.detect((String) null));
  }

  @Test
  void detectsFromDataSource() throws Exception {
    assertInstanceOf(H2LogStore.class, JdbcLogStores.detect(JdbcTestSupport.h2()));
  }

  @Test
  void withTableNameKeepsDialect() {
    AbstractJdbcLogStore store = JdbcLogStores.get("postgresql").withTableName("order_updates");

    assertInstanceOf(PostgresLogStore.class, store);
    assertEquals("order_updates", store.tableName());
    assertEquals("fanout_record", JdbcLogStores.get("postgresql").tableName());
    assertThrows(IllegalArgumentException.class, () -> new H2LogStore("bad name"));
  }
}

package fanout.jdbc;

import fanout.jdbc.store.AbstractJdbcLogStore;
import fanout.jdbc.store.MySqlLogStore;

import org.junit.jupiter.api.BeforeAll;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;

@DockerAvailable
@Testcontainers
class MySqlLogStoreIntegrationTest extends AbstractLogStoreIntegrationTest {

  @Container
  static final MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0")
      .withDatabaseName("fanout_test");

  private static SimpleDataSource dataSource;
  private final MySqlLogStore store = new MySqlLogStore();

  @BeforeAll
  static void initSchema() throws Exception {
    dataSource = new SimpleDataSource(mysql.getJdbcUrl(), mysql.getUsername(), mysql.getPassword());
    JdbcTestSupport.applySchema(dataSource, "/schema/mysql.sql");
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  AbstractJdbcLogStore store() {
    return store;
  }
}

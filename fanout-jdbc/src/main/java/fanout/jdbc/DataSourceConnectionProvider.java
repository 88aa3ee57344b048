package fanout.jdbc;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link ConnectionProvider} over a {@link DataSource}.
 *
 * <p>{@link JdbcAppendLog} borrows one connection per append and one per batched
 * read, and returns it before the call completes, so the puller never holds a
 * connection between cycles. Back it with a pool (HikariCP, or whatever Spring Boot
 * configured); a plain driver data source opens a physical connection every cycle.
 */
public final class DataSourceConnectionProvider implements ConnectionProvider {
  private final DataSource dataSource;

  public DataSourceConnectionProvider(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  @Override
  public Connection getConnection() throws SQLException {
    return dataSource.getConnection();
  }

  public DataSource dataSource() {
    return dataSource;
  }

  @Override
  public String toString() {
    return "DataSourceConnectionProvider{" + dataSource.getClass().getSimpleName() + "}";
  }
}

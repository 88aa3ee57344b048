package fanout.jdbc.store;

import fanout.jdbc.ConnectionProvider;
import fanout.jdbc.trim.AbstractJdbcLogTrimmer;
import fanout.jdbc.trim.PostgresLogTrimmer;

import java.util.List;

/**
 * PostgreSQL log store.
 */
public final class PostgresLogStore extends AbstractJdbcLogStore {

  public PostgresLogStore() {
    super();
  }

  public PostgresLogStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public PostgresLogStore withTableName(String tableName) {
    return new PostgresLogStore(tableName);
  }

  @Override
  public AbstractJdbcLogTrimmer newTrimmer(ConnectionProvider connectionProvider) {
    return new PostgresLogTrimmer(connectionProvider, tableName());
  }
}

package fanout.jdbc.store;

import fanout.jdbc.ConnectionProvider;
import fanout.jdbc.trim.AbstractJdbcLogTrimmer;
import fanout.jdbc.trim.MySqlLogTrimmer;

import java.util.List;

/**
 * MySQL log store. Requires MySQL 8 (window functions). Also compatible with TiDB.
 */
public final class MySqlLogStore extends AbstractJdbcLogStore {

  public MySqlLogStore() {
    super();
  }

  public MySqlLogStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  public MySqlLogStore withTableName(String tableName) {
    return new MySqlLogStore(tableName);
  }

  @Override
  public AbstractJdbcLogTrimmer newTrimmer(ConnectionProvider connectionProvider) {
    return new MySqlLogTrimmer(connectionProvider, tableName());
  }
}

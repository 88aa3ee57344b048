package fanout.jdbc.store;

import fanout.jdbc.ConnectionProvider;
import fanout.jdbc.trim.AbstractJdbcLogTrimmer;
import fanout.jdbc.trim.H2LogTrimmer;

import java.util.List;

/**
 * H2 log store. Primarily for testing.
 */
public final class H2LogStore extends AbstractJdbcLogStore {

  public H2LogStore() {
    super();
  }

  public H2LogStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public H2LogStore withTableName(String tableName) {
    return new H2LogStore(tableName);
  }

  @Override
  public AbstractJdbcLogTrimmer newTrimmer(ConnectionProvider connectionProvider) {
    return new H2LogTrimmer(connectionProvider, tableName());
  }
}

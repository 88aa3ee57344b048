package fanout.jdbc.trim;

import fanout.jdbc.ConnectionProvider;
import fanout.jdbc.TableNames;

/**
 * H2 log trimmer. Uses {@code DELETE ... FETCH FIRST n ROWS ONLY}.
 */
public final class H2LogTrimmer extends AbstractJdbcLogTrimmer {

  public H2LogTrimmer(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.DEFAULT_TABLE);
  }

  public H2LogTrimmer(ConnectionProvider connectionProvider, String tableName) {
    super(connectionProvider, tableName);
  }

  @Override
  protected String deleteSql() {
    return "DELETE FROM " + tableName() + " WHERE ts < ? FETCH FIRST ? ROWS ONLY";
  }
}

package fanout.jdbc.trim;

import fanout.jdbc.ConnectionProvider;
import fanout.jdbc.TableNames;

/**
 * MySQL log trimmer. Also compatible with TiDB.
 *
 * <p>Uses {@code DELETE ... ORDER BY ... LIMIT}, which MySQL supports natively and
 * avoids the self-referencing subquery.
 */
public final class MySqlLogTrimmer extends AbstractJdbcLogTrimmer {

  public MySqlLogTrimmer(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.DEFAULT_TABLE);
  }

  public MySqlLogTrimmer(ConnectionProvider connectionProvider, String tableName) {
    super(connectionProvider, tableName);
  }

  @Override
  protected String deleteSql() {
    return "DELETE FROM " + tableName() + " WHERE ts < ? ORDER BY ts LIMIT ?";
  }
}

package fanout.jdbc.trim;

import fanout.jdbc.ConnectionProvider;
import fanout.jdbc.TableNames;

/**
 * PostgreSQL log trimmer. Bounds the delete through a {@code ctid} subquery.
 */
public final class PostgresLogTrimmer extends AbstractJdbcLogTrimmer {

  public PostgresLogTrimmer(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.DEFAULT_TABLE);
  }

  public PostgresLogTrimmer(ConnectionProvider connectionProvider, String tableName) {
    super(connectionProvider, tableName);
  }

  @Override
  protected String deleteSql() {
    return "DELETE FROM " + tableName() + " WHERE ctid IN (" +
        "SELECT ctid FROM " + tableName() + " WHERE ts < ? ORDER BY ts LIMIT ?)";
  }
}

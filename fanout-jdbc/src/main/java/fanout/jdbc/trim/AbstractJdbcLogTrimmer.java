package fanout.jdbc.trim;

import fanout.jdbc.AppendLogException;
import fanout.jdbc.ConnectionProvider;
import fanout.jdbc.JdbcTemplate;
import fanout.jdbc.TableNames;
import fanout.spi.LogTrimmer;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Objects;

/**
 * Base JDBC log trimmer: deletes records whose timestamp is before a cutoff, at
 * most {@code limit} rows per call.
 *
 * <p>Each call uses its own auto-committed connection to limit lock duration.
 * Subclasses supply the dialect's bounded {@code DELETE}; it takes the cutoff in
 * epoch milliseconds and the row limit as its two parameters.
 *
 * @see fanout.trim.LogTrimScheduler
 */
public abstract class AbstractJdbcLogTrimmer implements LogTrimmer {
  private final ConnectionProvider connectionProvider;
  private final String tableName;

  protected AbstractJdbcLogTrimmer(ConnectionProvider connectionProvider, String tableName) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.tableName = TableNames.validate(tableName);
  }

  protected String tableName() {
    return tableName;
  }

  /** Bounded delete with parameters {@code (cutoffMs, limit)}. */
  protected abstract String deleteSql();

  @Override
  public int trimBefore(Instant cutoff, int limit) {
    Objects.requireNonNull(cutoff, "cutoff");
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return JdbcTemplate.update(conn, deleteSql(), cutoff.toEpochMilli(), limit);
    } catch (SQLException e) {
      throw new AppendLogException("Failed to obtain connection for trim", e);
    }
  }
}

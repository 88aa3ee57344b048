package fanout.jdbc;

import fanout.FanoutException;

import java.sql.SQLException;

/**
 * Unchecked exception wrapping JDBC errors raised by the JDBC append log, its stores
 * and trimmers.
 */
public final class AppendLogException extends FanoutException {

  public AppendLogException(String message, Throwable cause) {
    super(message, cause);
  }

  /** SQLState of the wrapped {@link SQLException}, or {@code null}. */
  public String sqlState() {
    return getCause() instanceof SQLException sql ? sql.getSQLState() : null;
  }

  /** Whether the wrapped error is an integrity constraint violation (SQLState class 23). */
  public boolean isConstraintViolation() {
    String state = sqlState();
    return state != null && state.startsWith("23");
  }
}

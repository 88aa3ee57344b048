package fanout.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Source of JDBC connections for the append log and trimmers.
 *
 * <p>Callers close every connection they obtain. Implementations are expected to
 * pool; the puller asks for one connection per cycle.
 *
 * @see DataSourceConnectionProvider
 */
@FunctionalInterface
public interface ConnectionProvider {

  Connection getConnection() throws SQLException;
}

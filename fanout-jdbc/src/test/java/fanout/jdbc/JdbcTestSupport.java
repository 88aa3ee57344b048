package fanout.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

/**
 * Schema and row-count helpers for JDBC tests, plus fresh in-memory H2 databases.
 */
public final class JdbcTestSupport {

  private JdbcTestSupport() {}

  public static JdbcDataSource h2() throws SQLException {
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1");
    applySchema(dataSource, "/schema/h2.sql");
    return dataSource;
  }

  public static void applySchema(DataSource dataSource, String resource) throws SQLException {
    String schema = loadResource(resource);
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      for (String sql : schema.split(";")) {
        String trimmed = sql.trim();
        if (!trimmed.isEmpty()) {
          stmt.execute(trimmed);
        }
      }
    }
  }

  public static void execute(DataSource dataSource, String sql) throws SQLException {
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      stmt.execute(sql);
    }
  }

  public static int count(DataSource dataSource, String table) throws SQLException {
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement();
         var rs = stmt.executeQuery("SELECT COUNT(*) FROM " + table)) {
      rs.next();
      return rs.getInt(1);
    }
  }

  static String loadResource(String path) {
    try (InputStream is = JdbcTestSupport.class.getResourceAsStream(path)) {
      if (is == null) {
        throw new IllegalStateException("Resource not found: " + path);
      }
      return new String(is.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to load " + path, e);
    }
  }
}

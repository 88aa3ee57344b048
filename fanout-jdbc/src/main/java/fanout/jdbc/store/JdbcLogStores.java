package fanout.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC log stores with auto-detection support.
 *
 * <p>Log stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/fanout.jdbc.store.AbstractJdbcLogStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcLogStore store = JdbcLogStores.detect(dataSource);
 *
 * // Auto-detect from JDBC URL, custom table
 * AbstractJdbcLogStore store = JdbcLogStores.detect("jdbc:mysql://localhost/mydb")
 *     .withTableName("order_updates");
 *
 * // Get by name
 * AbstractJdbcLogStore store = JdbcLogStores.get("postgresql");
 * }</pre>
 */
public final class JdbcLogStores {

  private static final List<AbstractJdbcLogStore> STORES;
  private static final Map<String, AbstractJdbcLogStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcLogStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcLogStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
    }
  }

  private JdbcLogStores() {
  }

  /**
   * Returns all registered log stores.
   */
  public static List<AbstractJdbcLogStore> all() {
    return STORES;
  }

  /**
   * Gets a log store by name.
   *
   * @param name log store name (case-insensitive)
   * @return the log store
   * @throws IllegalArgumentException if no log store found
   */
  public static AbstractJdbcLogStore get(String name) {
    Objects.requireNonNull(name, "name");
    AbstractJdbcLogStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (store == null) {
      throw new IllegalArgumentException("Unknown log store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects the log store from a DataSource.
   *
   * @param dataSource the data source
   * @return detected log store, bound to the default table
   * @throws IllegalStateException if detection fails or no matching log store
   */
  public static AbstractJdbcLogStore detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      String url = conn.getMetaData().getURL();
      return detect(url);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect log store from DataSource", e);
    }
  }

  /**
   * Auto-detects the log store from a JDBC URL.
   *
   * @param jdbcUrl the JDBC URL
   * @return detected log store, bound to the default table
   * @throws IllegalArgumentException if no matching log store found
   */
  public static AbstractJdbcLogStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }

    String lower = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcLogStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (lower.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return store;
        }
      }
    }

    throw new IllegalArgumentException("No log store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}

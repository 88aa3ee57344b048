package fanout.jdbc;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Validation of the append log table name, which is spliced into SQL text by the
 * log stores and trimmers.
 *
 * <p>A valid name is a plain unquoted identifier of at most {@value #MAX_LENGTH}
 * characters, the shortest limit among the supported databases (PostgreSQL).
 */
public final class TableNames {
  public static final String DEFAULT_TABLE = "fanout_record";
  public static final int MAX_LENGTH = 63;
  private static final Pattern IDENTIFIER = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

  private TableNames() {}

  /**
   * @param tableName candidate table name
   * @return {@code tableName}, unchanged
   * @throws IllegalArgumentException if it is not a plain identifier or is too long
   */
  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (tableName.length() > MAX_LENGTH) {
      throw new IllegalArgumentException(
          "Append log table name longer than " + MAX_LENGTH + " characters: " + tableName);
    }
    if (!IDENTIFIER.matcher(tableName).matches()) {
      throw new IllegalArgumentException("Invalid append log table name: " + tableName);
    }
    return tableName;
  }
}

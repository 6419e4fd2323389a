package relay.jdbc;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * The destination table name is spliced into every statement, so it must be a plain
 * identifier that all supported databases accept unquoted.
 */
public final class TableNames {
  public static final String DEFAULT_TABLE = "relay_destination";

  /** PostgreSQL truncates longer identifiers. */
  static final int MAX_LENGTH = 63;

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (tableName.length() > MAX_LENGTH || !IDENTIFIER.matcher(tableName).matches()) {
      throw new IllegalArgumentException("Table name must be a plain identifier of at most "
          + MAX_LENGTH + " characters: " + tableName);
    }
    return tableName;
  }
}

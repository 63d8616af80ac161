package supportbus.jdbc;

import java.util.Objects;

/**
 * Default table names and the identifier check applied to configured ones.
 */
public final class TableNames {
  public static final String DEFAULT_CONVERSATIONS_TABLE = "completed_conversations";
  public static final String DEFAULT_MESSAGES_TABLE = "completed_messages";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  /**
   * Returns the name unchanged if it is a plain SQL identifier.
   *
   * @throws IllegalArgumentException if the name could not be safely inlined into SQL
   */
  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}

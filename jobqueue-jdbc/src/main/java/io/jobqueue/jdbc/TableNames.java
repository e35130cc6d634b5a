package io.jobqueue.jdbc;

import java.util.Objects;

/**
 * Default queue table names and their validation.
 */
public final class TableNames {
  public static final String DEFAULT_MESSAGE_TABLE = "job_message";
  public static final String DEFAULT_DEDUPLICATION_TABLE = "job_dedup";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}

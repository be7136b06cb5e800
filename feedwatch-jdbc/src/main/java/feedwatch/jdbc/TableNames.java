package feedwatch.jdbc;

import java.util.Objects;

/**
 * The three table names used by the JDBC stores, validated against SQL injection.
 *
 * @param source      table of monitored sources
 * @param destination table of per-source destinations
 * @param history     table of notification markers
 */
public record TableNames(String source, String destination, String history) {
  public static final String DEFAULT_PREFIX = "feed_";
  public static final TableNames DEFAULT = withPrefix(DEFAULT_PREFIX);
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  public TableNames {
    validate(source);
    validate(destination);
    validate(history);
  }

  /**
   * Builds {@code <prefix>source}, {@code <prefix>destination} and {@code <prefix>history}.
   * An empty prefix yields the bare names.
   */
  public static TableNames withPrefix(String prefix) {
    Objects.requireNonNull(prefix, "prefix");
    return new TableNames(prefix + "source", prefix + "destination", prefix + "history");
  }

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}

package feedwatch.jdbc.store;

import java.util.List;

/**
 * H2 history store. Primarily for testing.
 *
 * <p>Uses the default insert with unique-violation detection from {@link AbstractJdbcHistoryStore}.
 */
public final class H2HistoryStore extends AbstractJdbcHistoryStore {

  public H2HistoryStore() {
    super();
  }

  public H2HistoryStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public H2HistoryStore withTableName(String tableName) {
    return new H2HistoryStore(tableName);
  }
}

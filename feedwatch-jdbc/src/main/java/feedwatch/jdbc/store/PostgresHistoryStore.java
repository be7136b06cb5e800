package feedwatch.jdbc.store;

import feedwatch.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * PostgreSQL history store.
 *
 * <p>Uses {@code ON CONFLICT DO NOTHING} so a repeated insert never aborts the surrounding
 * transaction.
 */
public final class PostgresHistoryStore extends AbstractJdbcHistoryStore {

  public PostgresHistoryStore() {
    super();
  }

  public PostgresHistoryStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public PostgresHistoryStore withTableName(String tableName) {
    return new PostgresHistoryStore(tableName);
  }

  @Override
  public boolean insertIfAbsent(Connection conn, long sourceId, String itemId, String url, Instant notifiedAt) {
    String sql = "INSERT INTO " + tableName() +
        " (source_id, item_id, url, notified_at) VALUES (?,?,?,?) ON CONFLICT DO NOTHING";
    return JdbcTemplate.update(conn, sql, sourceId, itemId, url, notifiedAt) > 0;
  }
}

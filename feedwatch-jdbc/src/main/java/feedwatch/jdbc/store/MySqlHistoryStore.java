package feedwatch.jdbc.store;

import feedwatch.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * MySQL history store. Also compatible with MariaDB and TiDB.
 */
public final class MySqlHistoryStore extends AbstractJdbcHistoryStore {

  public MySqlHistoryStore() {
    super();
  }

  public MySqlHistoryStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:", "jdbc:tidb:");
  }

  @Override
  public MySqlHistoryStore withTableName(String tableName) {
    return new MySqlHistoryStore(tableName);
  }

  @Override
  public boolean insertIfAbsent(Connection conn, long sourceId, String itemId, String url, Instant notifiedAt) {
    String sql = "INSERT IGNORE INTO " + tableName() +
        " (source_id, item_id, url, notified_at) VALUES (?,?,?,?)";
    return JdbcTemplate.update(conn, sql, sourceId, itemId, url, notifiedAt) > 0;
  }
}

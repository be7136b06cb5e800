package feedwatch.jdbc.store;

import feedwatch.HistoryRecord;
import feedwatch.jdbc.FeedStoreException;
import feedwatch.jdbc.JdbcTemplate;
import feedwatch.jdbc.TableNames;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC history store with standard SQL implementations.
 *
 * <p>Subclasses override {@link #insertIfAbsent} where the database offers a native
 * insert-or-ignore form. Register custom implementations via
 * {@code META-INF/services/feedwatch.jdbc.store.AbstractJdbcHistoryStore}.
 *
 * @see JdbcHistoryStores
 */
public abstract class AbstractJdbcHistoryStore {
  private static final String UNIQUE_VIOLATION_STATE = "23505";

  protected static final JdbcTemplate.RowMapper<HistoryRecord> RECORD_ROW_MAPPER = rs -> new HistoryRecord(
      rs.getLong("source_id"),
      rs.getString("item_id"),
      rs.getString("url"),
      rs.getTimestamp("notified_at").toInstant());

  private final String tableName;

  protected AbstractJdbcHistoryStore() {
    this(TableNames.DEFAULT.history());
  }

  protected AbstractJdbcHistoryStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  /**
   * Unique identifier for this history store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this history store handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same dialect bound to another table.
   */
  public abstract AbstractJdbcHistoryStore withTableName(String tableName);

  public String tableName() {
    return tableName;
  }

  public boolean exists(Connection conn, long sourceId, String itemId) {
    String sql = "SELECT 1 FROM " + tableName() + " WHERE source_id = ? AND item_id = ?";
    return JdbcTemplate.exists(conn, sql, sourceId, itemId);
  }

  public Optional<HistoryRecord> find(Connection conn, long sourceId, String itemId) {
    String sql = "SELECT source_id, item_id, url, notified_at FROM " + tableName() +
        " WHERE source_id = ? AND item_id = ?";
    return JdbcTemplate.queryFirst(conn, sql, RECORD_ROW_MAPPER, sourceId, itemId);
  }

  /**
   * Inserts a marker unless one exists for {@code (sourceId, itemId)}.
   *
   * <p>The default runs a plain insert and treats a unique-key violation as "already present".
   *
   * @return {@code true} if a row was inserted
   */
  public boolean insertIfAbsent(Connection conn, long sourceId, String itemId, String url, Instant notifiedAt) {
    Objects.requireNonNull(notifiedAt, "notifiedAt");
    String sql = "INSERT INTO " + tableName() + " (source_id, item_id, url, notified_at) VALUES (?,?,?,?)";
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setLong(1, sourceId);
      ps.setString(2, itemId);
      ps.setString(3, url);
      ps.setTimestamp(4, Timestamp.from(notifiedAt));
      return ps.executeUpdate() > 0;
    } catch (SQLException e) {
      if (isUniqueViolation(e)) {
        return false;
      }
      throw new FeedStoreException("Failed to insert history record", e);
    }
  }

  public int deleteOlderThan(Connection conn, Instant cutoff) {
    String sql = "DELETE FROM " + tableName() + " WHERE notified_at < ?";
    return JdbcTemplate.update(conn, sql, cutoff);
  }

  protected static boolean isUniqueViolation(SQLException e) {
    return e instanceof SQLIntegrityConstraintViolationException
        || UNIQUE_VIOLATION_STATE.equals(e.getSQLState());
  }
}

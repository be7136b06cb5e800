package feedwatch.jdbc;

import feedwatch.Destination;
import feedwatch.Source;
import feedwatch.spi.SourceRegistry;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link SourceRegistry} over the source and destination tables.
 *
 * <p>Each call borrows one connection from the {@link ConnectionProvider} and relies on
 * auto-commit. Rows are created and deactivated by whatever manages subscriptions; this class only
 * reads them and writes {@code last_item_id} and {@code last_checked_at}.
 */
public final class JdbcSourceRegistry implements SourceRegistry {
  private static final Logger logger = Logger.getLogger(JdbcSourceRegistry.class.getName());

  private static final JdbcTemplate.RowMapper<Source> SOURCE_ROW_MAPPER = rs -> {
    Timestamp checkedAt = rs.getTimestamp("last_checked_at");
    return new Source(
        rs.getLong("id"),
        rs.getString("handle"),
        rs.getString("display_name"),
        rs.getString("last_item_id"),
        checkedAt == null ? null : checkedAt.toInstant(),
        rs.getBoolean("active"));
  };

  private static final JdbcTemplate.RowMapper<Destination> DESTINATION_ROW_MAPPER = rs -> new Destination(
      rs.getString("destination_id"),
      rs.getString("message_template"),
      rs.getString("mention_id"));

  private final ConnectionProvider connectionProvider;
  private final TableNames tables;
  private final Clock clock;

  public JdbcSourceRegistry(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.DEFAULT, Clock.systemUTC());
  }

  public JdbcSourceRegistry(ConnectionProvider connectionProvider, TableNames tables, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.tables = Objects.requireNonNull(tables, "tables");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public List<Source> listActiveSources() {
    String sql = selectSources() + " WHERE active = TRUE ORDER BY id";
    try (Connection conn = connectionProvider.getConnection()) {
      return JdbcTemplate.query(conn, sql, SOURCE_ROW_MAPPER);
    } catch (SQLException e) {
      throw new FeedStoreException("Failed to list active sources", e);
    }
  }

  @Override
  public Optional<Source> findByHandle(String handle) {
    Objects.requireNonNull(handle, "handle");
    String sql = selectSources() + " WHERE handle = ?";
    try (Connection conn = connectionProvider.getConnection()) {
      return JdbcTemplate.queryFirst(conn, sql, SOURCE_ROW_MAPPER, handle);
    } catch (SQLException e) {
      throw new FeedStoreException("Failed to find source " + handle, e);
    }
  }

  @Override
  public List<Destination> listDestinations(long sourceId) {
    String sql = "SELECT destination_id, message_template, mention_id FROM " + tables.destination() +
        " WHERE source_id = ? ORDER BY id";
    try (Connection conn = connectionProvider.getConnection()) {
      return JdbcTemplate.query(conn, sql, DESTINATION_ROW_MAPPER, sourceId);
    } catch (SQLException e) {
      throw new FeedStoreException("Failed to list destinations for source " + sourceId, e);
    }
  }

  @Override
  public void updateLastItemId(long sourceId, String itemId) {
    String sql = "UPDATE " + tables.source() + " SET last_item_id = ?, last_checked_at = ? WHERE id = ?";
    executeUpdate(sql, "Failed to update last item of source " + sourceId,
        itemId, clock.instant(), sourceId);
  }

  @Override
  public void updateLastChecked(long sourceId) {
    String sql = "UPDATE " + tables.source() + " SET last_checked_at = ? WHERE id = ?";
    executeUpdate(sql, "Failed to update last check of source " + sourceId,
        clock.instant(), sourceId);
  }

  private void executeUpdate(String sql, String failureMessage, Object... params) {
    try (Connection conn = connectionProvider.getConnection()) {
      int updated = JdbcTemplate.update(conn, sql, params);
      if (updated == 0) {
        logger.log(Level.FINE, "No source row matched update: {0}", sql);
      }
    } catch (SQLException e) {
      throw new FeedStoreException(failureMessage, e);
    }
  }

  private String selectSources() {
    return "SELECT id, handle, display_name, last_item_id, last_checked_at, active FROM " + tables.source();
  }
}

package feedwatch.jdbc;

import feedwatch.HistoryRecord;
import feedwatch.jdbc.store.AbstractJdbcHistoryStore;
import feedwatch.spi.HistoryStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link HistoryStore} that runs a dialect-specific {@link AbstractJdbcHistoryStore} on connections
 * borrowed from a {@link ConnectionProvider}.
 *
 * <pre>{@code
 * DataSource ds = ...;
 * HistoryStore history = new JdbcHistoryRepository(
 *     new DataSourceConnectionProvider(ds), JdbcHistoryStores.detect(ds));
 * }</pre>
 */
public final class JdbcHistoryRepository implements HistoryStore {
  private static final Logger logger = Logger.getLogger(JdbcHistoryRepository.class.getName());

  private final ConnectionProvider connectionProvider;
  private final AbstractJdbcHistoryStore store;
  private final Clock clock;

  public JdbcHistoryRepository(ConnectionProvider connectionProvider, AbstractJdbcHistoryStore store) {
    this(connectionProvider, store, Clock.systemUTC());
  }

  public JdbcHistoryRepository(ConnectionProvider connectionProvider, AbstractJdbcHistoryStore store,
      Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(store, "store");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public boolean hasBeenNotified(long sourceId, String itemId) {
    Objects.requireNonNull(itemId, "itemId");
    try (Connection conn = connectionProvider.getConnection()) {
      return store.exists(conn, sourceId, itemId);
    } catch (SQLException e) {
      throw new FeedStoreException("Failed to read history for source " + sourceId, e);
    }
  }

  @Override
  public void recordNotified(long sourceId, String itemId, String url) {
    Objects.requireNonNull(itemId, "itemId");
    try (Connection conn = connectionProvider.getConnection()) {
      if (!store.insertIfAbsent(conn, sourceId, itemId, url, clock.instant())) {
        logger.log(Level.FINE, "Item {0} of source {1} already recorded",
            new Object[]{itemId, sourceId});
      }
    } catch (SQLException e) {
      throw new FeedStoreException("Failed to record history for source " + sourceId, e);
    }
  }

  @Override
  public int pruneOlderThan(Duration retention) {
    Objects.requireNonNull(retention, "retention");
    if (retention.isNegative()) {
      throw new IllegalArgumentException("retention must not be negative");
    }
    Instant cutoff = clock.instant().minus(retention);
    try (Connection conn = connectionProvider.getConnection()) {
      int deleted = store.deleteOlderThan(conn, cutoff);
      if (deleted > 0) {
        logger.log(Level.FINE, "Pruned {0} history records older than {1}",
            new Object[]{deleted, cutoff});
      }
      return deleted;
    } catch (SQLException e) {
      throw new FeedStoreException("Failed to prune history", e);
    }
  }

  /**
   * Looks up the stored marker for an item.
   */
  public Optional<HistoryRecord> find(long sourceId, String itemId) {
    Objects.requireNonNull(itemId, "itemId");
    try (Connection conn = connectionProvider.getConnection()) {
      return store.find(conn, sourceId, itemId);
    } catch (SQLException e) {
      throw new FeedStoreException("Failed to read history for source " + sourceId, e);
    }
  }

  public AbstractJdbcHistoryStore store() {
    return store;
  }
}

package feedwatch.jdbc.store;

import feedwatch.jdbc.ConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for history stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/feedwatch.jdbc.store.AbstractJdbcHistoryStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcHistoryStore store = JdbcHistoryStores.detect(dataSource);
 *
 * // Auto-detect from JDBC URL
 * AbstractJdbcHistoryStore store = JdbcHistoryStores.detect("jdbc:mysql://localhost/mydb");
 *
 * // Get by name
 * AbstractJdbcHistoryStore store = JdbcHistoryStores.get("postgresql");
 * }</pre>
 */
public final class JdbcHistoryStores {

  private static final List<AbstractJdbcHistoryStore> STORES;
  private static final Map<String, AbstractJdbcHistoryStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcHistoryStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcHistoryStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
    }
  }

  private JdbcHistoryStores() {
  }

  /**
   * Returns all registered history stores.
   */
  public static List<AbstractJdbcHistoryStore> all() {
    return STORES;
  }

  /**
   * Gets a history store by name.
   *
   * @param name store name (case-insensitive)
   * @return the history store
   * @throws IllegalArgumentException if no store found
   */
  public static AbstractJdbcHistoryStore get(String name) {
    AbstractJdbcHistoryStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (store == null) {
      throw new IllegalArgumentException("Unknown history store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  public static AbstractJdbcHistoryStore detect(DataSource dataSource) {
    return detect((ConnectionProvider) dataSource::getConnection);
  }

  /**
   * Auto-detects the history store from the URL reported by a live connection.
   *
   * @throws IllegalStateException    if no connection can be obtained
   * @throws IllegalArgumentException if no store matches the URL
   */
  public static AbstractJdbcHistoryStore detect(ConnectionProvider connectionProvider) {
    String url;
    try (Connection conn = connectionProvider.getConnection()) {
      url = conn.getMetaData().getURL();
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to read JDBC URL for history store detection", e);
    }
    return detect(url);
  }

  /**
   * Auto-detects the history store from a JDBC URL.
   *
   * @param jdbcUrl the JDBC URL
   * @return detected history store
   * @throws IllegalArgumentException if no matching store found
   */
  public static AbstractJdbcHistoryStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }

    String normalized = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcHistoryStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (normalized.startsWith(prefix)) {
          return store;
        }
      }
    }

    throw new IllegalArgumentException("No history store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}

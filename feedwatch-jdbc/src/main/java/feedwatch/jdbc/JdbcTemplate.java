package feedwatch.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Statement helpers shared by the registry and the history stores. Every {@link SQLException} is
 * rethrown as {@link FeedStoreException} naming the statement kind and table.
 *
 * <p>{@link Instant} parameters are bound as {@link Timestamp}.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** Runs an INSERT, UPDATE or DELETE and returns the affected row count. */
  public static int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bind(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new FeedStoreException(describe(sql) + " failed", e);
    }
  }

  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bind(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> rows = new ArrayList<>();
        while (rs.next()) {
          rows.add(mapper.map(rs));
        }
        return rows;
      }
    } catch (SQLException e) {
      throw new FeedStoreException(describe(sql) + " failed", e);
    }
  }

  /** Maps the first row only; later rows are not read. */
  public static <T> Optional<T> queryFirst(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bind(ps, params);
      ps.setMaxRows(1);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? Optional.of(mapper.map(rs)) : Optional.empty();
      }
    } catch (SQLException e) {
      throw new FeedStoreException(describe(sql) + " failed", e);
    }
  }

  public static boolean exists(Connection conn, String sql, Object... params) {
    return queryFirst(conn, sql, rs -> Boolean.TRUE, params).isPresent();
  }

  static void bind(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      int index = i + 1;
      Object param = params[i];
      if (param instanceof Instant instant) {
        ps.setTimestamp(index, Timestamp.from(instant));
      } else if (param instanceof String s) {
        ps.setString(index, s);
      } else if (param instanceof Long n) {
        ps.setLong(index, n);
      } else {
        ps.setObject(index, param);
      }
    }
  }

  /** "UPDATE feed_source" style label for error messages. */
  static String describe(String sql) {
    String[] words = sql.trim().split("\\s+");
    String verb = words[0].toUpperCase(Locale.ROOT);
    if (verb.equals("UPDATE") && words.length > 1) {
      return verb + " " + words[1];
    }
    for (int i = 1; i < words.length - 1; i++) {
      String w = words[i].toUpperCase(Locale.ROOT);
      if (w.equals("FROM") || w.equals("INTO")) {
        return verb + " " + words[i + 1];
      }
    }
    return verb;
  }

  private JdbcTemplate() {}
}

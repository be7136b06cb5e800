package feedwatch.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

final class H2Schema {

  private H2Schema() {}

  static JdbcDataSource dataSource(String mode) {
    JdbcDataSource dataSource = new JdbcDataSource();
    String url = "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
    if (mode != null) {
      url += ";MODE=" + mode;
    }
    dataSource.setURL(url);
    return dataSource;
  }

  static void create(JdbcDataSource dataSource, TableNames tables) throws SQLException {
    try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
      st.execute("CREATE TABLE " + tables.source() + " (" +
          "id BIGINT PRIMARY KEY," +
          "handle VARCHAR(255) NOT NULL UNIQUE," +
          "display_name VARCHAR(255)," +
          "last_item_id VARCHAR(255)," +
          "last_checked_at TIMESTAMP," +
          "active BOOLEAN DEFAULT TRUE NOT NULL" +
          ")");
      st.execute("CREATE TABLE " + tables.destination() + " (" +
          "id BIGINT PRIMARY KEY," +
          "source_id BIGINT NOT NULL," +
          "destination_id VARCHAR(255) NOT NULL," +
          "message_template VARCHAR(2000)," +
          "mention_id VARCHAR(255)" +
          ")");
      createHistory(st, tables.history());
    }
  }

  static void createHistory(JdbcDataSource dataSource, String table) throws SQLException {
    try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
      createHistory(st, table);
    }
  }

  private static void createHistory(Statement st, String table) throws SQLException {
    st.execute("CREATE TABLE " + table + " (" +
        "source_id BIGINT NOT NULL," +
        "item_id VARCHAR(255) NOT NULL," +
        "url VARCHAR(2048)," +
        "notified_at TIMESTAMP NOT NULL," +
        "PRIMARY KEY (source_id, item_id)" +
        ")");
  }

  static void execute(JdbcDataSource dataSource, String sql) throws SQLException {
    try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
      st.execute(sql);
    }
  }
}

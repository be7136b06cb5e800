package feedwatch.jdbc;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link ConnectionProvider} over a pooled {@link DataSource}, as wired by the Spring Boot starter.
 *
 * <p>Registry and history statements run one per connection and rely on auto-commit, so a
 * connection handed out with auto-commit disabled is switched back on.
 */
public final class DataSourceConnectionProvider implements ConnectionProvider {
  private final DataSource dataSource;

  public DataSourceConnectionProvider(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  @Override
  public Connection getConnection() throws SQLException {
    Connection conn = dataSource.getConnection();
    if (!conn.getAutoCommit()) {
      conn.setAutoCommit(true);
    }
    return conn;
  }

  public DataSource dataSource() {
    return dataSource;
  }
}

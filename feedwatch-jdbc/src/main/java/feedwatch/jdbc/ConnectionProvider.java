package feedwatch.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Source of JDBC connections for the registry and history store.
 *
 * <p>Callers close every connection they obtain.
 */
@FunctionalInterface
public interface ConnectionProvider {

  Connection getConnection() throws SQLException;
}

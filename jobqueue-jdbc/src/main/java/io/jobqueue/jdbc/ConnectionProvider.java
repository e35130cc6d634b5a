package io.jobqueue.jdbc;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Provides JDBC connections for queue operations.
 *
 * <p>Callers are responsible for closing the returned connection. The
 * transport takes one connection per operation, so the provider should pool.
 */
@FunctionalInterface
public interface ConnectionProvider {

  /**
   * Obtains a JDBC connection.
   *
   * @return an open connection; the caller must close it
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection() throws SQLException;

  /**
   * Returns a provider that borrows connections from {@code dataSource}.
   *
   * @param dataSource the data source, usually a connection pool
   * @return the provider
   */
  static ConnectionProvider of(DataSource dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    return dataSource::getConnection;
  }
}

package relay.jdbc;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Source of JDBC connections for the destination store. Each store operation opens one
 * connection, uses it in auto-commit mode and closes it before returning.
 */
@FunctionalInterface
public interface ConnectionProvider {

  /**
   * @return an open connection; the caller closes it
   * @throws SQLException if no connection can be obtained
   */
  Connection getConnection() throws SQLException;

  /** Borrows connections from a pooled or plain {@link DataSource}. */
  static ConnectionProvider of(DataSource dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    return dataSource::getConnection;
  }
}

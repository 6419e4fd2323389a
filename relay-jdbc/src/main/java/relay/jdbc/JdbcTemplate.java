package relay.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Single-statement helpers for the destination store. Each call opens its own connection;
 * {@link Instant} parameters are bound as {@link Timestamp}. Callers wrap the
 * {@link SQLException} with the destination or table they were working on.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  private JdbcTemplate() {}

  /** Runs DDL, an upsert or a delete and returns the update count. */
  public static int update(ConnectionProvider connections, String sql, Object... params)
      throws SQLException {
    try (Connection conn = connections.getConnection();
         PreparedStatement ps = prepare(conn, sql, params)) {
      return ps.executeUpdate();
    }
  }

  public static <T> List<T> query(ConnectionProvider connections, String sql, RowMapper<T> mapper,
      Object... params) throws SQLException {
    try (Connection conn = connections.getConnection();
         PreparedStatement ps = prepare(conn, sql, params);
         ResultSet rs = ps.executeQuery()) {
      List<T> rows = new ArrayList<>();
      while (rs.next()) {
        rows.add(mapper.map(rs));
      }
      return rows;
    }
  }

  private static PreparedStatement prepare(Connection conn, String sql, Object[] params)
      throws SQLException {
    PreparedStatement ps = conn.prepareStatement(sql);
    try {
      for (int i = 0; i < params.length; i++) {
        Object value = params[i] instanceof Instant instant ? Timestamp.from(instant) : params[i];
        ps.setObject(i + 1, value);
      }
      return ps;
    } catch (SQLException e) {
      try {
        ps.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
  }
}

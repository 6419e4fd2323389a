package relay.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionProviderTest {

  @Test
  void ofRejectsNullDataSource() {
    assertThrows(NullPointerException.class, () -> ConnectionProvider.of(null));
  }

  @Test
  void ofBorrowsFromDataSource() throws SQLException {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:connection_provider_test;DB_CLOSE_DELAY=-1");

    try (Connection conn = ConnectionProvider.of(ds).getConnection()) {
      assertFalse(conn.isClosed());
    }
  }

  @Test
  void templateBindsInstantsAsTimestamps() throws SQLException {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:jdbc_template_test;DB_CLOSE_DELAY=-1");
    ConnectionProvider connections = ConnectionProvider.of(ds);
    Instant at = Instant.parse("2024-05-01T10:15:30Z");

    JdbcTemplate.update(connections, "CREATE TABLE t (id VARCHAR(10), at TIMESTAMP WITH TIME ZONE)");
    assertEquals(1, JdbcTemplate.update(connections, "INSERT INTO t VALUES (?, ?)", "a", at));

    List<Instant> read = JdbcTemplate.query(connections, "SELECT at FROM t WHERE id = ?",
        rs -> rs.getTimestamp(1).toInstant(), "a");
    assertEquals(List.of(at), read);
  }

  @Test
  void templateClosesConnectionOnFailure() throws SQLException {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:jdbc_template_failure;DB_CLOSE_DELAY=-1");
    Connection[] opened = new Connection[1];
    ConnectionProvider tracking = () -> opened[0] = ds.getConnection();

    assertThrows(SQLException.class, () -> JdbcTemplate.update(tracking, "SELECT FROM nowhere"));
    assertTrue(opened[0].isClosed());
  }
}

package relay.jdbc.dialect;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;
import relay.jdbc.spi.Dialect;

import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DialectsTest {

  @Test
  void serviceLoaderFindsBuiltInDialects() {
    Set<String> names = Dialects.all().stream().map(Dialect::name).collect(Collectors.toSet());

    assertTrue(names.containsAll(Set.of("h2", "mysql", "postgresql")), names.toString());
  }

  @Test
  void lookupByNameIgnoresCase() {
    assertInstanceOf(MySqlDialect.class, Dialects.get("MySQL"));
    assertInstanceOf(PostgresDialect.class, Dialects.get("POSTGRESQL"));

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Dialects.get("oracle"));
    assertTrue(ex.getMessage().startsWith("Unknown dialect: oracle"));
  }

  @Test
  void urlPrefixSelectsDialect() {
    assertInstanceOf(MySqlDialect.class, Dialects.detect("jdbc:tidb://localhost:4000/relay"));
    assertInstanceOf(PostgresDialect.class, Dialects.detect("jdbc:postgresql://db:5432/relay"));
    assertInstanceOf(H2Dialect.class, Dialects.detect("jdbc:h2:file:./relay-data/db"));
    assertEquals("postgresql", Dialects.find("JDBC:POSTGRESQL://db/relay").orElseThrow().name());
    assertTrue(Dialects.find("jdbc:sqlite:relay.db").isEmpty());
  }

  @Test
  void unsupportedOrEmptyUrlIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Dialects.detect("jdbc:oracle:thin:@localhost:1521:xe"));
    assertTrue(ex.getMessage().contains("No dialect found"));
    assertTrue(ex.getMessage().contains("jdbc:h2:"));
    assertThrows(IllegalArgumentException.class, () -> Dialects.detect(""));
  }

  @Test
  void dataSourceUrlIsReadFromConnection() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:dialect_detect;DB_CLOSE_DELAY=-1");

    assertInstanceOf(H2Dialect.class, Dialects.detect(ds));
  }

  // ── SQL shape ──────────────────────────────────────────────

  @Test
  void upsertUsesEachDatabasesNativeSyntax() {
    assertTrue(new H2Dialect().upsertSql("t").startsWith("MERGE INTO t "));
    assertTrue(new PostgresDialect().upsertSql("t").contains("ON CONFLICT (destination_id) DO UPDATE"));
    assertTrue(new MySqlDialect().upsertSql("t").contains("ON DUPLICATE KEY UPDATE"));
  }

  @Test
  void documentColumnTypeFollowsDatabase() {
    assertTrue(new H2Dialect().createTableSql("t").contains("config_json CLOB"));
    assertTrue(new PostgresDialect().createTableSql("t").contains("updated_at TIMESTAMPTZ"));
    assertTrue(new MySqlDialect().createTableSql("t").contains("config_json LONGTEXT"));
  }
}

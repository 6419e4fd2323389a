package relay.jdbc.dialect;

import java.util.List;

/**
 * MySQL dialect. Also compatible with TiDB.
 */
public final class MySqlDialect extends AbstractDialect {

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  protected String documentType() {
    return "LONGTEXT";
  }

  @Override
  protected String timestampType() {
    return "DATETIME(3)";
  }

  @Override
  public String upsertSql(String table) {
    return "INSERT INTO " + table + " (destination_id, config_json, updated_at) VALUES (?,?,?) " +
        "ON DUPLICATE KEY UPDATE config_json=VALUES(config_json), updated_at=VALUES(updated_at)";
  }
}

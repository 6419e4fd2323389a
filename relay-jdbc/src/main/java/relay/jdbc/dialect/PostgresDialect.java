package relay.jdbc.dialect;

import java.util.List;

/**
 * PostgreSQL dialect. Upserts with {@code ON CONFLICT ... DO UPDATE}.
 */
public final class PostgresDialect extends AbstractDialect {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected String documentType() {
    return "TEXT";
  }

  @Override
  protected String timestampType() {
    return "TIMESTAMPTZ";
  }

  @Override
  public String upsertSql(String table) {
    return "INSERT INTO " + table + " (destination_id, config_json, updated_at) VALUES (?,?,?) " +
        "ON CONFLICT (destination_id) DO UPDATE SET " +
        "config_json=EXCLUDED.config_json, updated_at=EXCLUDED.updated_at";
  }
}

package relay.jdbc.dialect;

import relay.jdbc.spi.Dialect;

/**
 * Base dialect with standard SQL implementations.
 *
 * <p>Subclasses supply the upsert statement and override the DDL where column types differ.
 */
public abstract class AbstractDialect implements Dialect {

  /** Column type of the JSON document. */
  protected String documentType() {
    return "CLOB";
  }

  /** Column type of the update timestamp. */
  protected String timestampType() {
    return "TIMESTAMP";
  }

  @Override
  public String createTableSql(String table) {
    return "CREATE TABLE IF NOT EXISTS " + table + " (" +
        "destination_id VARCHAR(64) NOT NULL PRIMARY KEY, " +
        "config_json " + documentType() + " NOT NULL, " +
        "updated_at " + timestampType() + " NOT NULL)";
  }

  @Override
  public String deleteSql(String table) {
    return "DELETE FROM " + table + " WHERE destination_id=?";
  }

  @Override
  public String selectAllSql(String table) {
    return "SELECT destination_id, config_json FROM " + table + " ORDER BY destination_id";
  }
}

package relay.jdbc.spi;

import java.util.List;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations provide database-specific SQL for the destination table.
 * Register custom dialects via {@code META-INF/services/relay.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: MySQL (+ TiDB), PostgreSQL, H2.
 *
 * @see relay.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "mysql", "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * DDL creating the destination table if it does not exist. Columns:
   * {@code destination_id} (primary key), {@code config_json}, {@code updated_at}.
   */
  String createTableSql(String table);

  /**
   * SQL inserting or replacing one destination row.
   *
   * <p>Parameters (in order):
   * <ol>
   *   <li>destination_id (String)</li>
   *   <li>config_json (String)</li>
   *   <li>updated_at (Instant, bound as a timestamp)</li>
   * </ol>
   */
  String upsertSql(String table);

  /**
   * SQL deleting one destination row.
   *
   * <p>Parameters: destination_id (String)
   */
  String deleteSql(String table);

  /**
   * SQL selecting every destination row.
   *
   * <p>Returns columns: destination_id, config_json
   */
  String selectAllSql(String table);
}

package relay.jdbc.store;

import relay.ConfigStoreException;
import relay.jdbc.ConnectionProvider;
import relay.jdbc.JdbcTemplate;
import relay.jdbc.TableNames;
import relay.jdbc.dialect.Dialects;
import relay.jdbc.spi.Dialect;
import relay.model.DestinationConfig;
import relay.store.AbstractCachingConfigStore;
import relay.store.DestinationConfigJson;
import relay.store.DestinationConfigValidator;
import relay.webhook.WebhookUrlPolicy;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Destination config store backed by one table: one row per destination, the config
 * serialized as a JSON document by {@link DestinationConfigJson}.
 *
 * <p>Every operation borrows a connection from the {@link ConnectionProvider} in auto-commit
 * mode. Rows whose document cannot be parsed are skipped on load and logged.
 *
 * <pre>{@code
 * JdbcDestinationConfigStore store = JdbcDestinationConfigStore.builder()
 *     .dataSource(dataSource)        // dialect detected from the JDBC URL
 *     .tableName("relay_destination")
 *     .build();
 * }</pre>
 */
public final class JdbcDestinationConfigStore extends AbstractCachingConfigStore {
  private static final Logger logger = Logger.getLogger(JdbcDestinationConfigStore.class.getName());

  private final ConnectionProvider connectionProvider;
  private final Dialect dialect;
  private final String tableName;

  private JdbcDestinationConfigStore(Builder builder, Dialect dialect) {
    super(builder.validator != null
            ? builder.validator : new DestinationConfigValidator(WebhookUrlPolicy.discord()),
        builder.clock != null ? builder.clock : Clock.systemUTC());
    this.connectionProvider = builder.connectionProvider;
    this.dialect = dialect;
    this.tableName = TableNames.validate(builder.tableName);
    if (builder.createSchema) {
      createSchema();
    }
    reload();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Dialect dialect() {
    return dialect;
  }

  public String tableName() {
    return tableName;
  }

  private void createSchema() {
    try {
      JdbcTemplate.update(connectionProvider, dialect.createTableSql(tableName));
    } catch (SQLException e) {
      throw new ConfigStoreException("Failed to create table " + tableName, e);
    }
  }

  @Override
  protected void persist(DestinationConfig config) {
    String json = DestinationConfigJson.toJson(config);
    try {
      JdbcTemplate.update(connectionProvider, dialect.upsertSql(tableName),
          config.destinationId(), json, config.updatedAt());
    } catch (SQLException e) {
      throw new ConfigStoreException("Failed to write destination " + config.destinationId(), e);
    }
  }

  @Override
  protected boolean remove(String destinationId) {
    try {
      return JdbcTemplate.update(connectionProvider, dialect.deleteSql(tableName), destinationId) > 0;
    } catch (SQLException e) {
      throw new ConfigStoreException("Failed to delete destination " + destinationId, e);
    }
  }

  @Override
  protected Map<String, DestinationConfig> loadAll() {
    List<Row> rows;
    try {
      rows = JdbcTemplate.query(connectionProvider, dialect.selectAllSql(tableName),
          rs -> new Row(rs.getString("destination_id"), rs.getString("config_json")));
    } catch (SQLException e) {
      throw new ConfigStoreException("Failed to read table " + tableName, e);
    }
    Map<String, DestinationConfig> loaded = new HashMap<>();
    for (Row row : rows) {
      try {
        DestinationConfig config = DestinationConfigJson.fromJson(row.json());
        if (!row.destinationId().equals(config.destinationId())) {
          logger.warning("Skipping row " + row.destinationId() + ": document belongs to "
              + config.destinationId());
          continue;
        }
        loaded.put(config.destinationId(), config);
      } catch (ConfigStoreException e) {
        logger.log(Level.WARNING, "Skipping unreadable destination row " + row.destinationId(), e);
      }
    }
    return loaded;
  }

  private record Row(String destinationId, String json) {
  }

  /** Builder for {@link JdbcDestinationConfigStore}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private DataSource dataSource;
    private Dialect dialect;
    private String tableName = TableNames.DEFAULT_TABLE;
    private boolean createSchema = true;
    private DestinationConfigValidator validator;
    private Clock clock;

    private Builder() {
    }

    /**
     * Sets the data source. Also used to detect the dialect when none is set.
     *
     * <p><b>Required</b> unless {@link #connectionProvider} is set.
     */
    public Builder dataSource(DataSource dataSource) {
      this.dataSource = dataSource;
      return this;
    }

    /**
     * Sets the connection provider.
     *
     * <p>Takes precedence over {@link #dataSource}. Requires an explicit {@link #dialect}.
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the SQL dialect.
     *
     * <p>Optional. Defaults to detection from the data source's JDBC URL.
     */
    public Builder dialect(Dialect dialect) {
      this.dialect = dialect;
      return this;
    }

    /**
     * Sets the table name.
     *
     * <p>Optional. Defaults to {@code "relay_destination"}.
     */
    public Builder tableName(String tableName) {
      this.tableName = tableName;
      return this;
    }

    /**
     * Whether to create the table at build time if it does not exist.
     *
     * <p>Optional. Defaults to {@code true}.
     */
    public Builder createSchema(boolean createSchema) {
      this.createSchema = createSchema;
      return this;
    }

    /**
     * Sets the validator applied on every upsert.
     *
     * <p>Optional. Defaults to a validator accepting Discord webhook URLs.
     */
    public Builder validator(DestinationConfigValidator validator) {
      this.validator = validator;
      return this;
    }

    /**
     * Sets the clock used for {@code createdAt}/{@code updatedAt}.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Builds the store, creates the table if requested and loads every row.
     *
     * @throws NullPointerException     if neither a data source nor a connection provider is set,
     *                                  or a connection provider is set without a dialect
     * @throws IllegalArgumentException if the table name is not a plain identifier
     * @throws ConfigStoreException     if the table cannot be created or read
     */
    public JdbcDestinationConfigStore build() {
      if (connectionProvider == null) {
        Objects.requireNonNull(dataSource, "dataSource or connectionProvider");
        connectionProvider = ConnectionProvider.of(dataSource);
        if (dialect == null) {
          dialect = Dialects.detect(dataSource);
        }
      }
      return new JdbcDestinationConfigStore(this, Objects.requireNonNull(dialect, "dialect"));
    }
  }
}

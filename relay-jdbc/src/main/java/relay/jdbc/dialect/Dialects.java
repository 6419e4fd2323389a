package relay.jdbc.dialect;

import relay.ConfigStoreException;
import relay.jdbc.spi.Dialect;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Dialects registered under {@code META-INF/services/relay.jdbc.spi.Dialect}, looked up by
 * name or matched against a JDBC URL.
 *
 * <pre>{@code
 * Dialect dialect = Dialects.detect(dataSource);   // from the connection's URL
 * Dialect dialect = Dialects.get("postgresql");
 * }</pre>
 */
public final class Dialects {

  private static final Map<String, Dialect> REGISTERED = load();

  private Dialects() {
  }

  private static Map<String, Dialect> load() {
    Map<String, Dialect> byName = new LinkedHashMap<>();
    for (Dialect dialect : ServiceLoader.load(Dialect.class, Dialects.class.getClassLoader())) {
      byName.putIfAbsent(dialect.name().toLowerCase(Locale.ROOT), dialect);
    }
    return Map.copyOf(byName);
  }

  public static List<Dialect> all() {
    return List.copyOf(REGISTERED.values());
  }

  /**
   * @param name dialect name, any case
   * @throws IllegalArgumentException if no dialect has that name
   */
  public static Dialect get(String name) {
    Dialect dialect = REGISTERED.get(name.toLowerCase(Locale.ROOT));
    if (dialect == null) {
      throw new IllegalArgumentException("Unknown dialect: " + name + ". Available: "
          + REGISTERED.keySet());
    }
    return dialect;
  }

  /**
   * Opens one connection to read its URL.
   *
   * @throws ConfigStoreException     if no connection can be opened
   * @throws IllegalArgumentException if no dialect matches the URL
   */
  public static Dialect detect(DataSource dataSource) {
    String url;
    try (Connection conn = dataSource.getConnection()) {
      url = conn.getMetaData().getURL();
    } catch (SQLException e) {
      throw new ConfigStoreException("Cannot open a connection to detect the database dialect", e);
    }
    return detect(url);
  }

  /**
   * @throws IllegalArgumentException if the URL is empty or no dialect claims it
   */
  public static Dialect detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    return find(jdbcUrl).orElseThrow(() -> new IllegalArgumentException(
        "No dialect found for JDBC URL: " + jdbcUrl + ". Supported prefixes: "
            + REGISTERED.values().stream().flatMap(d -> d.jdbcUrlPrefixes().stream()).toList()));
  }

  public static Optional<Dialect> find(String jdbcUrl) {
    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    return REGISTERED.values().stream()
        .filter(d -> d.jdbcUrlPrefixes().stream()
            .anyMatch(prefix -> url.startsWith(prefix.toLowerCase(Locale.ROOT))))
        .findFirst();
  }
}

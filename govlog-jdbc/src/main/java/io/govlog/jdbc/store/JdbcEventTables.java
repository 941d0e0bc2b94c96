package io.govlog.jdbc.store;

import io.govlog.event.PayloadCodec;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC event table dialects with auto-detection support.
 *
 * <p>Dialects are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.govlog.jdbc.store.AbstractJdbcEventTable}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcEventTable table = JdbcEventTables.detect(dataSource);
 *
 * // Auto-detect from JDBC URL
 * AbstractJdbcEventTable table = JdbcEventTables.detect("jdbc:postgresql://localhost/gov");
 *
 * // Get by name, bound to a custom table
 * AbstractJdbcEventTable table = JdbcEventTables.get("mysql").withTableName("audit_event");
 * }</pre>
 */
public final class JdbcEventTables {

  private static final List<AbstractJdbcEventTable> TABLES;
  private static final Map<String, AbstractJdbcEventTable> BY_NAME = new ConcurrentHashMap<>();

  static {
    TABLES = ServiceLoader.load(AbstractJdbcEventTable.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcEventTable table : TABLES) {
      BY_NAME.put(table.name().toLowerCase(Locale.ROOT), table);
    }
  }

  private JdbcEventTables() {
  }

  /**
   * Returns all registered dialects.
   */
  public static List<AbstractJdbcEventTable> all() {
    return TABLES;
  }

  /**
   * Gets a dialect by name.
   *
   * @param name dialect name (case-insensitive)
   * @return the dialect, bound to the default table name
   * @throws IllegalArgumentException if no dialect is registered under {@code name}
   */
  public static AbstractJdbcEventTable get(String name) {
    Objects.requireNonNull(name, "name");
    AbstractJdbcEventTable table = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (table == null) {
      throw new IllegalArgumentException("Unknown event table dialect: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return table;
  }

  /**
   * Auto-detects the dialect from a DataSource.
   *
   * @param dataSource the data source
   * @return detected dialect
   * @throws IllegalStateException if the connection metadata cannot be read
   * @throws IllegalArgumentException if no dialect matches the URL
   */
  public static AbstractJdbcEventTable detect(DataSource dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    try (Connection conn = dataSource.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect event table dialect from DataSource", e);
    }
  }

  /**
   * Auto-detects the dialect from a DataSource and binds it to a table and codec.
   */
  public static AbstractJdbcEventTable detect(DataSource dataSource, String tableName,
      PayloadCodec payloadCodec) {
    Objects.requireNonNull(payloadCodec, "payloadCodec");
    return detect(dataSource).withTableName(tableName).withPayloadCodec(payloadCodec);
  }

  /**
   * Auto-detects the dialect from a JDBC URL.
   *
   * @param jdbcUrl the JDBC URL
   * @return detected dialect
   * @throws IllegalArgumentException if no dialect matches
   */
  public static AbstractJdbcEventTable detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }

    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcEventTable table : TABLES) {
      for (String prefix : table.jdbcUrlPrefixes()) {
        if (url.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return table;
        }
      }
    }

    throw new IllegalArgumentException("No event table dialect found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return TABLES.stream()
        .flatMap(t -> t.jdbcUrlPrefixes().stream())
        .toList();
  }
}

package io.jobqueue.jdbc.dialect;

import io.jobqueue.jdbc.ConnectionProvider;
import io.jobqueue.jdbc.spi.Dialect;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;

/**
 * Registry of queue table dialects, loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.jobqueue.jdbc.spi.Dialect}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Dialect fromDatabase = Dialects.detect(ConnectionProvider.of(dataSource));
 * Dialect fromUrl = Dialects.detect("jdbc:postgresql://db/jobs");
 * Dialect byName = Dialects.get("mysql");
 * }</pre>
 */
public final class Dialects {

  private static final List<Dialect> DIALECTS;
  private static final Map<String, Dialect> BY_NAME = new LinkedHashMap<>();

  static {
    DIALECTS = ServiceLoader.load(Dialect.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();
    for (Dialect dialect : DIALECTS) {
      BY_NAME.put(dialect.name().toLowerCase(Locale.ROOT), dialect);
    }
  }

  private Dialects() {
  }

  /**
   * Returns all registered dialects.
   */
  public static List<Dialect> all() {
    return DIALECTS;
  }

  /**
   * Gets a dialect by name, ignoring case.
   *
   * @throws IllegalArgumentException if no dialect has that name
   */
  public static Dialect get(String name) {
    Dialect dialect = name == null ? null : BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (dialect == null) {
      throw new IllegalArgumentException("Unknown dialect: " + name + ". Available: " + BY_NAME.keySet());
    }
    return dialect;
  }

  /**
   * Detects the dialect from the URL of a connection obtained from {@code connectionProvider}.
   *
   * @throws IllegalStateException if no connection can be obtained
   * @throws IllegalArgumentException if no dialect matches the URL
   */
  public static Dialect detect(ConnectionProvider connectionProvider) {
    try (Connection conn = connectionProvider.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect dialect from database connection", e);
    }
  }

  /**
   * Detects the dialect whose URL prefix matches {@code jdbcUrl}.
   *
   * @throws IllegalArgumentException if no dialect matches
   */
  public static Dialect detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    for (Dialect dialect : DIALECTS) {
      for (String prefix : dialect.jdbcUrlPrefixes()) {
        if (jdbcUrl.startsWith(prefix)) {
          return dialect;
        }
      }
    }
    throw new IllegalArgumentException("No dialect found for JDBC URL: " + jdbcUrl
        + ". Supported prefixes: " + DIALECTS.stream().flatMap(d -> d.jdbcUrlPrefixes().stream()).toList());
  }
}

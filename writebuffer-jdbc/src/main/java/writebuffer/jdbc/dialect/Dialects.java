package writebuffer.jdbc.dialect;

import writebuffer.jdbc.spi.Dialect;

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
 * Registry of SQL dialects, discovered through {@link ServiceLoader} from
 * {@code META-INF/services/writebuffer.jdbc.spi.Dialect}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Dialect dialect = Dialects.detect(dataSource);           // from the connection URL
 * Dialect dialect = Dialects.detect("jdbc:sqlite:events.db");
 * Dialect dialect = Dialects.get("h2");                    // by name
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
      BY_NAME.putIfAbsent(dialect.name().toLowerCase(Locale.ROOT), dialect);
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
   * Gets a dialect by name.
   *
   * @param name dialect name (case-insensitive)
   * @return the dialect
   * @throws IllegalArgumentException if no dialect has that name
   */
  public static Dialect get(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Dialect name cannot be null or blank");
    }
    Dialect dialect = BY_NAME.get(name.trim().toLowerCase(Locale.ROOT));
    if (dialect == null) {
      throw new IllegalArgumentException("Unknown dialect: " + name
          + ". Available: " + BY_NAME.keySet());
    }
    return dialect;
  }

  /**
   * Auto-detects the dialect of a DataSource from its connection URL.
   *
   * @throws IllegalStateException if no connection can be obtained or no dialect matches
   */
  public static Dialect detect(DataSource dataSource) {
    String url;
    try (Connection conn = dataSource.getConnection()) {
      url = conn.getMetaData().getURL();
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect dialect from DataSource", e);
    }
    return find(url).orElseThrow(() -> new IllegalStateException(
        "No dialect found for JDBC URL: " + url + ". Supported prefixes: " + allPrefixes()));
  }

  /**
   * Auto-detects a dialect from a JDBC URL.
   *
   * @throws IllegalArgumentException if the URL is empty or no dialect matches
   */
  public static Dialect detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    return find(jdbcUrl).orElseThrow(() -> new IllegalArgumentException(
        "No dialect found for JDBC URL: " + jdbcUrl + ". Supported prefixes: " + allPrefixes()));
  }

  /**
   * The dialect whose URL prefix matches, if any.
   */
  public static Optional<Dialect> find(String jdbcUrl) {
    if (jdbcUrl == null) {
      return Optional.empty();
    }
    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    for (Dialect dialect : DIALECTS) {
      for (String prefix : dialect.jdbcUrlPrefixes()) {
        if (url.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return Optional.of(dialect);
        }
      }
    }
    return Optional.empty();
  }

  private static List<String> allPrefixes() {
    return DIALECTS.stream()
        .flatMap(d -> d.jdbcUrlPrefixes().stream())
        .toList();
  }
}

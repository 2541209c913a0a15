package tenantdb.jdbc.dialect;

import tenantdb.spi.EngineDialect;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of engine dialects with detection by JDBC URL.
 *
 * <p>Dialects are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/tenantdb.spi.EngineDialect}. Unlike a lookup by name, detection never
 * fails: unknown engines get {@link EngineDialect#GENERIC}, which validates with
 * {@code SELECT 1}.
 *
 * <pre>{@code
 * EngineDialect dialect = Dialects.detect("jdbc:postgresql://db:5432/app");
 * EngineDialect h2 = Dialects.get("h2");
 * }</pre>
 */
public final class Dialects {

  private static final List<EngineDialect> DIALECTS;
  private static final Map<String, EngineDialect> BY_NAME = new ConcurrentHashMap<>();

  static {
    DIALECTS = ServiceLoader.load(EngineDialect.class, Dialects.class.getClassLoader())
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (EngineDialect dialect : DIALECTS) {
      BY_NAME.put(dialect.name().toLowerCase(Locale.ROOT), dialect);
    }
  }

  private Dialects() {
  }

  public static List<EngineDialect> all() {
    return DIALECTS;
  }

  /**
   * Gets a dialect by name.
   *
   * @param name dialect name (case-insensitive)
   * @throws IllegalArgumentException if no dialect has that name
   */
  public static EngineDialect get(String name) {
    EngineDialect dialect = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (dialect == null) {
      throw new IllegalArgumentException("Unknown dialect: " + name + ". Available: " + BY_NAME.keySet());
    }
    return dialect;
  }

  /**
   * Detects the dialect from a JDBC URL, falling back to {@link EngineDialect#GENERIC}.
   */
  public static EngineDialect detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      return EngineDialect.GENERIC;
    }
    for (EngineDialect dialect : DIALECTS) {
      for (String prefix : dialect.jdbcUrlPrefixes()) {
        if (jdbcUrl.startsWith(prefix)) {
          return dialect;
        }
      }
    }
    return EngineDialect.GENERIC;
  }
}

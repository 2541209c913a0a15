package tenantdb.config;

import tenantdb.ConfigurationException;
import tenantdb.spi.DatabaseTarget;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Typed view of a tenant's {@code database} settings section.
 *
 * <p>{@code client}, {@code host}, {@code port} and {@code database} are read from settings when
 * present and otherwise derived from {@code jdbcUrl}.
 */
public record DatabaseConfig(
    String client,
    String jdbcUrl,
    String host,
    String port,
    String database,
    String username,
    String password,
    int poolMin,
    int poolMax,
    boolean shared,
    int validationAttempts,
    long validationRetryDelayMs,
    Map<String, String> properties) {

  public DatabaseConfig {
    properties = properties == null ? Map.of() : Map.copyOf(properties);
  }

  /**
   * Reads the database section of {@code settings} (the tenant's merged settings).
   */
  public static DatabaseConfig from(Settings settings) {
    Settings db = settings.section("database");
    String jdbcUrl = db.getString("jdbcUrl", db.getString("url", null));
    UrlParts parts = UrlParts.parse(jdbcUrl);

    Map<String, String> properties = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : db.section("properties").asMap().entrySet()) {
      properties.put(entry.getKey(), String.valueOf(entry.getValue()));
    }

    boolean shared = db.getBoolean("shared", false) || db.getBoolean("reusable", false)
        || settings.getBoolean("shared", false) || settings.getBoolean("reusable", false);

    return new DatabaseConfig(
        db.getString("client", parts.client),
        jdbcUrl,
        db.getString("host", parts.host),
        db.getString("port", parts.port),
        db.getString("database", parts.database),
        db.getString("username", db.getString("user", null)),
        db.getString("password", null),
        db.getInt("pool.min", 2),
        db.getInt("pool.max", 10),
        shared,
        db.getInt("validation.attempts", 3),
        db.getLong("validation.retryDelay", 1_000L),
        properties);
  }

  public DatabaseTarget target() {
    return new DatabaseTarget(client == null ? null : client.toLowerCase(Locale.ROOT), host, port, database);
  }

  public boolean hasConnectionDetails() {
    return jdbcUrl != null && !jdbcUrl.isBlank();
  }

  /**
   * @throws ConfigurationException when the configuration cannot produce a handle
   */
  public DatabaseConfig validate(String tenantName) {
    if (!hasConnectionDetails()) {
      throw new ConfigurationException("Database configuration for '" + tenantName + "' requires a jdbcUrl",
          "configuration", tenantName);
    }
    if (poolMin < 0) {
      throw new ConfigurationException("database.pool.min must be >= 0", "configuration", tenantName);
    }
    if (poolMax < 1 || poolMax < poolMin) {
      throw new ConfigurationException("database.pool.max must be >= max(1, pool.min)", "configuration", tenantName);
    }
    if (validationAttempts < 1) {
      throw new ConfigurationException("database.validation.attempts must be > 0", "configuration", tenantName);
    }
    if (validationRetryDelayMs < 0) {
      throw new ConfigurationException("database.validation.retryDelay must be >= 0", "configuration", tenantName);
    }
    return this;
  }

  @Override
  public String toString() {
    return "DatabaseConfig[client=" + client + ", jdbcUrl=" + jdbcUrl + ", username=" + username
        + ", password=" + (password == null ? "null" : "****") + ", pool=" + poolMin + ".." + poolMax
        + ", shared=" + shared + "]";
  }

  private record UrlParts(String client, String host, String port, String database) {

    static UrlParts parse(String jdbcUrl) {
      if (jdbcUrl == null || !jdbcUrl.startsWith("jdbc:")) {
        return new UrlParts(null, null, null, null);
      }
      String rest = jdbcUrl.substring("jdbc:".length());
      int colon = rest.indexOf(':');
      if (colon < 0) {
        return new UrlParts(rest, null, null, null);
      }
      String client = rest.substring(0, colon);
      String remainder = rest.substring(colon + 1);
      if (!remainder.startsWith("//")) {
        String path = stripParameters(remainder);
        return new UrlParts(client, null, null, path != null ? path : databaseParameter(remainder));
      }
      String authority = remainder.substring(2);
      int slash = authority.indexOf('/');
      String database = slash < 0 ? null : stripParameters(authority.substring(slash + 1));
      if (database == null) {
        database = databaseParameter(authority);
      }
      String hostPort = stripParameters(slash < 0 ? authority : authority.substring(0, slash));
      int at = hostPort.lastIndexOf('@');
      if (at >= 0) {
        hostPort = hostPort.substring(at + 1);
      }
      int portSeparator = hostPort.lastIndexOf(':');
      if (portSeparator > 0 && !hostPort.endsWith("]")) {
        return new UrlParts(client, hostPort.substring(0, portSeparator), hostPort.substring(portSeparator + 1), database);
      }
      return new UrlParts(client, hostPort, null, database);
    }

    /**
     * Value of a {@code databaseName} or {@code database} parameter, as SQL Server puts the
     * database after {@code ;} rather than in the path.
     */
    private static String databaseParameter(String value) {
      for (String part : value.split("[;?&]")) {
        int equals = part.indexOf('=');
        if (equals <= 0) {
          continue;
        }
        String key = part.substring(0, equals).trim().toLowerCase(Locale.ROOT);
        String parameter = part.substring(equals + 1).trim();
        if ((key.equals("databasename") || key.equals("database")) && !parameter.isEmpty()) {
          return parameter;
        }
      }
      return null;
    }

    private static String stripParameters(String value) {
      int end = value.length();
      for (char separator : new char[] {';', '?'}) {
        int index = value.indexOf(separator);
        if (index >= 0 && index < end) {
          end = index;
        }
      }
      String result = value.substring(0, end);
      return result.isEmpty() ? null : result;
    }
  }
}

package tenantdb.spi;

/**
 * Identity of a database: engine, host, port and database name.
 *
 * <p>Two tenants whose targets share a {@link #fingerprint()} may share one handle.
 */
public record DatabaseTarget(String client, String host, String port, String database) {

  public DatabaseTarget {
    client = orDefault(client, "unknown");
    host = orDefault(host, "localhost");
    port = orDefault(port, "default");
    database = orDefault(database, "default");
  }

  /**
   * Deterministic key {@code client_host_port_database}.
   */
  public String fingerprint() {
    return client + "_" + host + "_" + port + "_" + database;
  }

  private static String orDefault(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value;
  }
}

package tenantdb.spi;

import java.sql.SQLException;
import java.util.List;

/**
 * Engine-specific SQL used to validate handles and classify errors.
 *
 * <p>Implementations are discovered by {@code tenantdb.jdbc.dialect.Dialects}; {@link #GENERIC}
 * covers unknown engines.
 */
public interface EngineDialect {

  /**
   * Fallback for engines without a registered dialect.
   */
  EngineDialect GENERIC = new Generic();

  /** Engine name, lower case, e.g. {@code postgresql}. */
  String name();

  /** JDBC URL prefixes this dialect recognizes. */
  List<String> jdbcUrlPrefixes();

  /** Trivial round-trip query. */
  default String pingSql() {
    return "SELECT 1";
  }

  /** Query proving the target schema is visible to the handle. */
  String schemaProbeSql();

  /**
   * Vendor-specific transient error check, consulted in addition to SQLState rules.
   */
  default boolean isTransient(SQLException e) {
    return false;
  }

  final class Generic implements EngineDialect {
    @Override
    public String name() {
      return "generic";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
      return List.of();
    }

    @Override
    public String schemaProbeSql() {
      return "SELECT 1";
    }
  }
}

package tenantdb.jdbc.dialect;

import java.util.List;
import java.util.Set;

/**
 * PostgreSQL dialect.
 */
public final class PostgresDialect extends AbstractDialect {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:", "jdbc:pg:");
  }

  @Override
  public String schemaProbeSql() {
    return "SELECT current_database(), current_schema()";
  }

  @Override
  protected Set<Integer> transientErrorCodes() {
    return Set.of();
  }

  // deadlock_detected, lock_not_available
  @Override
  protected Set<String> transientSqlStates() {
    return Set.of("40P01", "55P03");
  }
}

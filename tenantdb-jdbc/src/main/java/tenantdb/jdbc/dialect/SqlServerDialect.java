package tenantdb.jdbc.dialect;

import java.util.List;
import java.util.Set;

/**
 * Microsoft SQL Server dialect.
 */
public final class SqlServerDialect extends AbstractDialect {

  @Override
  public String name() {
    return "mssql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:sqlserver:", "jdbc:jtds:sqlserver:");
  }

  @Override
  public String schemaProbeSql() {
    return "SELECT DB_NAME()";
  }

  // deadlock victim, lock request timeout
  @Override
  protected Set<Integer> transientErrorCodes() {
    return Set.of(1205, 1222);
  }
}

package tenantdb.jdbc.dialect;

import java.util.List;
import java.util.Set;

/**
 * MySQL dialect. Also compatible with MariaDB and TiDB.
 */
public final class MySqlDialect extends AbstractDialect {

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:", "jdbc:tidb:");
  }

  @Override
  public String schemaProbeSql() {
    return "SELECT DATABASE()";
  }

  // ER_LOCK_DEADLOCK, ER_LOCK_WAIT_TIMEOUT
  @Override
  protected Set<Integer> transientErrorCodes() {
    return Set.of(1213, 1205);
  }
}

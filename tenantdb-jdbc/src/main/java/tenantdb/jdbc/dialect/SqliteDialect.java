package tenantdb.jdbc.dialect;

import java.util.List;
import java.util.Set;

/**
 * SQLite dialect.
 */
public final class SqliteDialect extends AbstractDialect {

  @Override
  public String name() {
    return "sqlite";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:sqlite:");
  }

  @Override
  public String schemaProbeSql() {
    return "PRAGMA database_list";
  }

  // SQLITE_BUSY, SQLITE_LOCKED
  @Override
  protected Set<Integer> transientErrorCodes() {
    return Set.of(5, 6);
  }
}

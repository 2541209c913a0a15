package tenantdb.jdbc.dialect;

import java.util.List;
import java.util.Set;

/**
 * H2 dialect.
 */
public final class H2Dialect extends AbstractDialect {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public String schemaProbeSql() {
    return "SELECT DATABASE()";
  }

  // 40001 deadlock, 50200 lock timeout
  @Override
  protected Set<Integer> transientErrorCodes() {
    return Set.of(40001, 50200);
  }
}

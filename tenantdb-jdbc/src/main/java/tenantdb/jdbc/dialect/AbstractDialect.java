package tenantdb.jdbc.dialect;

import tenantdb.spi.EngineDialect;

import java.sql.SQLException;
import java.util.Set;

/**
 * Base dialect that classifies errors by vendor error code.
 *
 * <p>Subclasses list the codes their engine reports for deadlocks, lock waits and busy
 * databases.
 */
public abstract class AbstractDialect implements EngineDialect {

  /** Vendor error codes that are worth retrying. */
  protected abstract Set<Integer> transientErrorCodes();

  /** Vendor SQLStates that are worth retrying in addition to the standard classes. */
  protected Set<String> transientSqlStates() {
    return Set.of();
  }

  @Override
  public boolean isTransient(SQLException e) {
    if (transientErrorCodes().contains(e.getErrorCode())) {
      return true;
    }
    String state = e.getSQLState();
    return state != null && transientSqlStates().contains(state);
  }

  @Override
  public String toString() {
    return name();
  }
}

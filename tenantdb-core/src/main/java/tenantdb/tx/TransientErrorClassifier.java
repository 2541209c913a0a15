package tenantdb.tx;

import tenantdb.OperationTimeoutException;
import tenantdb.TransientDatabaseException;
import tenantdb.spi.EngineDialect;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decides whether a failure is worth retrying: deadlocks, lock-wait timeouts, dropped
 * connections, serialization failures and deadline overruns.
 *
 * <p>The whole cause chain is inspected. A throwable matches when it is a
 * {@link SQLTransientException} or {@link SQLRecoverableException}, carries SQLState class
 * {@code 40} or {@code 08} (or {@code HYT00}/{@code HYT01}), is recognized by the engine dialect,
 * or its message mentions one of the known vendor error names.
 */
public final class TransientErrorClassifier {

  private static final List<String> MARKERS = List.of(
      "SQLITE_BUSY",
      "SQLITE_LOCKED",
      "SQLITE_PROTOCOL",
      "ECONNRESET",
      "ECONNREFUSED",
      "ETIMEDOUT",
      "CONNECTION_TERMINATED",
      "CONNECTION_LOST",
      "PROTOCOL_CONNECTION_LOST",
      "DEADLOCK",
      "LOCK_WAIT_TIMEOUT",
      "LOCK TIMEOUT",
      "SERIALIZATION_FAILURE",
      "SERIALIZATION FAILURE",
      "ER_LOCK_WAIT_TIMEOUT",
      "ER_LOCK_DEADLOCK",
      "DEADLOCK_DETECTED");

  private static final Set<String> SQL_STATES = Set.of("HYT00", "HYT01");

  private TransientErrorClassifier() {
  }

  public static boolean isTransient(Throwable error) {
    return isTransient(error, EngineDialect.GENERIC);
  }

  public static boolean isTransient(Throwable error, EngineDialect dialect) {
    Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    for (Throwable current = error; current != null && seen.add(current); current = current.getCause()) {
      if (current instanceof TransientDatabaseException
          || current instanceof OperationTimeoutException
          || current instanceof SQLTransientException
          || current instanceof SQLRecoverableException) {
        return true;
      }
      if (current instanceof SQLException sql && isTransientSql(sql, dialect)) {
        return true;
      }
      if (mentionsMarker(current.getMessage())) {
        return true;
      }
    }
    return false;
  }

  private static boolean isTransientSql(SQLException e, EngineDialect dialect) {
    String state = e.getSQLState();
    if (state != null) {
      String upper = state.toUpperCase(Locale.ROOT);
      if (upper.startsWith("40") || upper.startsWith("08") || SQL_STATES.contains(upper)) {
        return true;
      }
    }
    return dialect != null && dialect.isTransient(e);
  }

  private static boolean mentionsMarker(String message) {
    if (message == null || message.isEmpty()) {
      return false;
    }
    String upper = message.toUpperCase(Locale.ROOT);
    for (String marker : MARKERS) {
      if (upper.contains(marker)) {
        return true;
      }
    }
    return false;
  }
}

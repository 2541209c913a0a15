package tenantdb.tx;

import java.sql.Connection;

/**
 * Caller-supplied work executed inside a transaction. The connection is transaction-scoped:
 * do not commit, roll back or close it.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface UnitOfWork<T> {

  T execute(Connection connection) throws Exception;
}

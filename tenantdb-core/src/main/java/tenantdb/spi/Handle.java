package tenantdb.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * An underlying database connection source, usually a pool. Opaque to the orchestration layer
 * beyond borrowing connections, describing its target and closing.
 */
public interface Handle extends AutoCloseable {

  /**
   * Borrows a connection. Callers close it to return it.
   */
  Connection getConnection() throws SQLException;

  DatabaseTarget target();

  EngineDialect dialect();

  PoolStats poolStats();

  boolean isClosed();

  /**
   * Releases every connection held by the handle. Idempotent.
   */
  @Override
  void close();
}

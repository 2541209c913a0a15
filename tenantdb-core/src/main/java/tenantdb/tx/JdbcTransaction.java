package tenantdb.tx;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One database transaction on a borrowed connection. Supports explicit {@link #commit()} and
 * {@link #rollback()}; if neither is called, {@link #close()} rolls back.
 *
 * <p>Completion is guarded by a lock so that {@link #abort()}, called from a sweeper thread,
 * and the owning thread never both finalize the connection. After an abort, {@link #commit()}
 * fails instead of silently succeeding.
 */
final class JdbcTransaction implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(JdbcTransaction.class.getName());

  private final Connection connection;
  private final Object lock = new Object();
  private Integer previousIsolation;
  private boolean completed;
  private boolean aborted;

  private JdbcTransaction(Connection connection) {
    this.connection = connection;
  }

  /**
   * Disables auto-commit on {@code connection} and takes ownership of it.
   */
  static JdbcTransaction begin(Connection connection) throws SQLException {
    try {
      connection.setAutoCommit(false);
    } catch (SQLException e) {
      try {
        connection.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
    return new JdbcTransaction(connection);
  }

  Connection connection() {
    return connection;
  }

  void setIsolation(IsolationLevel level) throws SQLException {
    int current = connection.getTransactionIsolation();
    if (current != level.jdbcLevel()) {
      connection.setTransactionIsolation(level.jdbcLevel());
      previousIsolation = current;
    }
  }

  void commit() throws SQLException {
    synchronized (lock) {
      if (aborted) {
        throw new SQLException("Transaction was aborted before commit");
      }
      if (completed) {
        return;
      }
      boolean committed = false;
      try {
        connection.commit();
        committed = true;
      } catch (SQLException e) {
        safeRollback(e);
        throw e;
      } finally {
        finalizeTx(committed);
      }
    }
  }

  void rollback() throws SQLException {
    synchronized (lock) {
      if (completed) {
        return;
      }
      try {
        connection.rollback();
      } finally {
        finalizeTx(false);
      }
    }
  }

  /**
   * Rolls back from another thread. Failures are logged; the connection is closed regardless.
   */
  void abort() {
    synchronized (lock) {
      if (completed) {
        return;
      }
      aborted = true;
      try {
        rollback();
      } catch (SQLException e) {
        logger.log(Level.WARNING, "Rollback during abort failed", e);
      }
    }
  }

  boolean isCompleted() {
    synchronized (lock) {
      return completed;
    }
  }

  @Override
  public void close() throws SQLException {
    synchronized (lock) {
      if (!completed) {
        rollback();
      }
    }
  }

  private void finalizeTx(boolean committed) throws SQLException {
    completed = true;
    SQLException failure = null;
    try {
      if (previousIsolation != null) {
        connection.setTransactionIsolation(previousIsolation);
      }
      connection.setAutoCommit(true);
    } catch (SQLException e) {
      failure = e;
    } finally {
      try {
        connection.close();
      } catch (SQLException e) {
        if (failure == null) {
          failure = e;
        } else {
          failure.addSuppressed(e);
        }
      }
    }
    if (failure != null && committed) {
      // committed: a failed reset must not turn into a failed commit
      logger.log(Level.FINE, "Connection reset after commit failed", failure);
    } else if (failure != null) {
      throw failure;
    }
  }

  private void safeRollback(SQLException cause) {
    try {
      connection.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }
}

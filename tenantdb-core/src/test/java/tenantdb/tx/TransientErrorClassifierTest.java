package tenantdb.tx;

import tenantdb.OperationTimeoutException;
import tenantdb.TransientDatabaseException;
import tenantdb.spi.EngineDialect;
import tenantdb.timeout.TimeoutContext;

import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientConnectionException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TransientErrorClassifierTest {

  @Test
  void serializationAndConnectionStatesAreTransient() {
    assertTrue(TransientErrorClassifier.isTransient(new SQLException("serialization", "40001")));
    assertTrue(TransientErrorClassifier.isTransient(new SQLException("deadlock", "40P01")));
    assertTrue(TransientErrorClassifier.isTransient(new SQLException("link failure", "08S01")));
    assertTrue(TransientErrorClassifier.isTransient(new SQLException("timeout", "HYT00")));
  }

  @Test
  void jdbcTransientTypesAreTransient() {
    assertTrue(TransientErrorClassifier.isTransient(new SQLTransientConnectionException("pool exhausted")));
    assertTrue(TransientErrorClassifier.isTransient(new SQLRecoverableException("reconnect")));
    assertTrue(TransientErrorClassifier.isTransient(new TransientDatabaseException("busy")));
    assertTrue(TransientErrorClassifier.isTransient(
        new OperationTimeoutException(10, TimeoutContext.of("commit", "Test"))));
  }

  @Test
  void vendorMarkersInMessagesAreTransient() {
    assertTrue(TransientErrorClassifier.isTransient(new RuntimeException("SQLITE_BUSY: database is locked")));
    assertTrue(TransientErrorClassifier.isTransient(new RuntimeException("read ECONNRESET")));
    assertTrue(TransientErrorClassifier.isTransient(new RuntimeException("Deadlock found when trying to get lock")));
  }

  @Test
  void causeChainIsInspected() {
    RuntimeException wrapped = new RuntimeException("work failed", new SQLException("retry", "40001"));

    assertTrue(TransientErrorClassifier.isTransient(wrapped));
  }

  @Test
  void permanentErrorsAreNotTransient() {
    assertFalse(TransientErrorClassifier.isTransient(new SQLIntegrityConstraintViolationException("dup", "23505")));
    assertFalse(TransientErrorClassifier.isTransient(new SQLException("syntax error", "42000")));
    assertFalse(TransientErrorClassifier.isTransient(new IllegalArgumentException("bad input")));
    assertFalse(TransientErrorClassifier.isTransient(null));
  }

  @Test
  void dialectCanWidenClassification() {
    EngineDialect dialect = new EngineDialect() {
      @Override
      public String name() {
        return "custom";
      }

      @Override
      public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:custom:");
      }

      @Override
      public String schemaProbeSql() {
        return "SELECT 1";
      }

      @Override
      public boolean isTransient(SQLException e) {
        return e.getErrorCode() == 1205;
      }
    };
    SQLException lockTimeout = new SQLException("lock request timed out", "S0001", 1205);

    assertFalse(TransientErrorClassifier.isTransient(lockTimeout));
    assertTrue(TransientErrorClassifier.isTransient(lockTimeout, dialect));
  }
}

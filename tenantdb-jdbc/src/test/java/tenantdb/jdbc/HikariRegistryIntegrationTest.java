package tenantdb.jdbc;

import tenantdb.registry.HealthReport;
import tenantdb.registry.HealthStatus;
import tenantdb.registry.TenantRegistry;
import tenantdb.registry.UnregisterResult;
import tenantdb.supervisor.ConnectionSupervisor;
import tenantdb.supervisor.WarmPoolResult;
import tenantdb.tx.IsolationLevel;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class HikariRegistryIntegrationTest {
  private TenantRegistry registry;
  private String url;

  @BeforeEach
  void setup() {
    url = "jdbc:h2:mem:registry_" + UUID.randomUUID().toString().replace('-', '_') + ";DB_CLOSE_DELAY=-1";
    registry = TenantRegistry.builder()
        .handleFactory(HikariHandleFactory.builder().connectionTimeoutMs(2_000).build())
        .settings(Map.of("transactions.retryDelay", 10))
        .build();
    registry.initialize();
  }

  @AfterEach
  void teardown() {
    registry.close();
  }

  private Map<String, Object> tenant(boolean shared) {
    return Map.of(
        "database.jdbcUrl", url,
        "database.username", "sa",
        "database.password", "",
        "database.shared", shared,
        "database.pool.min", 2,
        "database.pool.max", 4);
  }

  @Test
  void sharedTenantsUseOnePool() {
    ConnectionSupervisor billing = registry.registerApp("billing", tenant(true));
    ConnectionSupervisor reports = registry.registerApp("reports", tenant(true));

    assertSame(billing, reports);
    HikariHandle handle = (HikariHandle) billing.handle();
    assertFalse(handle.isClosed());

    registry.unregisterApp("billing");
    assertFalse(handle.isClosed());

    UnregisterResult last = registry.unregisterApp("reports");
    assertTrue(last.shutdownPerformed());
    assertTrue(handle.isClosed());
  }

  @Test
  void transactionsCommitAndRollBackAgainstPool() throws SQLException {
    ConnectionSupervisor billing = registry.registerApp("billing", tenant(false));
    billing.withTransaction(conn -> {
      try (Statement st = conn.createStatement()) {
        return st.execute("CREATE TABLE invoice (id VARCHAR(36) PRIMARY KEY, amount INT)");
      }
    });

    billing.withTransaction(conn -> {
      try (PreparedStatement ps = conn.prepareStatement("INSERT INTO invoice VALUES (?, ?)")) {
        ps.setString(1, "inv-1");
        ps.setInt(2, 100);
        return ps.executeUpdate();
      }
    }, IsolationLevel.READ_COMMITTED, 5_000L);

    assertThrows(RuntimeException.class, () -> billing.withTransaction(conn -> {
      try (PreparedStatement ps = conn.prepareStatement("INSERT INTO invoice VALUES (?, ?)")) {
        ps.setString(1, "inv-2");
        ps.setInt(2, 200);
        ps.executeUpdate();
      }
      throw new IllegalStateException("payment declined");
    }));

    int rows = billing.withTransaction(conn -> {
      try (Statement st = conn.createStatement(); ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM invoice")) {
        rs.next();
        return rs.getInt(1);
      }
    });
    assertEquals(1, rows);
    assertEquals(1, billing.transactionMetrics().orElseThrow().failed());
  }

  @Test
  void warmPoolAndHealthCycleOverHikari() {
    ConnectionSupervisor billing = registry.registerApp("billing", tenant(false));

    WarmPoolResult warmed = billing.warmPool();
    HealthReport report = registry.runHealthCycle();

    assertTrue(warmed.success());
    assertEquals(2, warmed.connectionsWarmed());
    assertEquals(HealthStatus.HEALTHY, report.samples().get("billing").status());
    assertTrue(billing.status().pool().max() >= 4);
  }
}

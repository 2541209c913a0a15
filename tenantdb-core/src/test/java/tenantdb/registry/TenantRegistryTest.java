package tenantdb.registry;

import tenantdb.AlreadyRegisteredException;
import tenantdb.ComponentException;
import tenantdb.ConfigurationException;
import tenantdb.NotRegisteredException;
import tenantdb.TenantDbException;
import tenantdb.config.Settings;
import tenantdb.config.TenantConfig;
import tenantdb.event.LifecycleEvent;
import tenantdb.supervisor.ConnectionSupervisor;
import tenantdb.supervisor.SupervisorState;
import tenantdb.testing.StubComponents;
import tenantdb.testing.StubScripts;
import tenantdb.testing.TestHandle;
import tenantdb.testing.TestHandleFactory;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class TenantRegistryTest {

  private final TestHandleFactory handles = new TestHandleFactory();
  private final StubComponents stubs = new StubComponents();
  private final List<LifecycleEvent> events = new CopyOnWriteArrayList<>();
  private TenantRegistry registry;

  @BeforeEach
  void setUp() {
    registry = TenantRegistry.builder()
        .settings(Map.of("database.validation.retryDelay", 5))
        .factories(stubs.factories())
        .handleFactory(handles)
        .build();
    registry.addListener(events::add);
    registry.initialize();
  }

  @AfterEach
  void tearDown() {
    registry.close();
  }

  private static Map<String, Object> database(String databaseName, boolean shared) {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put("database.jdbcUrl", TestHandle.url(databaseName));
    config.put("database.shared", shared);
    return config;
  }

  private static String uniqueDb() {
    return "reg_" + UUID.randomUUID().toString().replace('-', '_');
  }

  private List<LifecycleEvent> eventsOf(String type) {
    List<LifecycleEvent> matching = new ArrayList<>();
    events.forEach(event -> {
      if (event.type().equals(type)) {
        matching.add(event);
      }
    });
    return matching;
  }

  private static String fingerprint(String databaseName) {
    return TenantConfig.of(database(databaseName, true)).database().target().fingerprint();
  }

  @Test
  void registerCreatesDedicatedSupervisor() {
    ConnectionSupervisor supervisor = registry.registerApp("billing", database(uniqueDb(), false));

    assertTrue(supervisor.isInitialized());
    assertTrue(registry.hasApp("billing"));
    assertSame(supervisor, registry.getApp("billing").orElseThrow());
    assertEquals(List.of("billing"), registry.appNames());
    assertEquals(1, eventsOf("connection-created").size());
    LifecycleEvent registered = eventsOf("app-registered").get(0);
    assertEquals("billing", registered.attribute("appName"));
    assertEquals("new", registered.attribute("reuseType"));
  }

  @Test
  void duplicateNameIsRejected() {
    String db = uniqueDb();
    registry.registerApp("billing", database(db, false));

    assertThrows(AlreadyRegisteredException.class, () -> registry.registerApp("billing", database(db, false)));
    assertEquals(1, handles.created().size());
  }

  @Test
  void blankNameIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> registry.registerApp(" ", database(uniqueDb(), false)));
  }

  @Test
  void missingDatabaseWithoutReuseFails() {
    assertThrows(ConfigurationException.class, () -> registry.registerApp("billing", Map.of("cwd", ".")));
    assertFalse(registry.hasApp("billing"));
  }

  @Test
  void sharedTenantsWithSameTargetShareOneSupervisor() {
    String db = uniqueDb();
    ConnectionSupervisor first = registry.registerApp("billing", database(db, true));
    ConnectionSupervisor second = registry.registerApp("invoices", database(db, true));

    assertSame(first, second);
    assertEquals(1, handles.created().size());
    assertEquals(2, registry.sharedReferences(fingerprint(db)));
    assertEquals(Map.of(fingerprint(db), Set.of("billing", "invoices")), registry.status().sharedReferences());
    LifecycleEvent reused = eventsOf("connection-reused").get(0);
    assertEquals("fingerprint-match", reused.attribute("reuseType"));
    assertEquals("billing", reused.attribute("sourceApp"));
  }

  @Test
  void explicitReuseBindsToNamedTenant() {
    ConnectionSupervisor billing = registry.registerApp("billing", database(uniqueDb(), true));

    ConnectionSupervisor reports = registry.registerApp("reports", Map.of("useConnection", "billing"));

    assertSame(billing, reports);
    assertEquals("explicit-app", eventsOf("connection-reused").get(0).attribute("reuseType"));
  }

  @Test
  void anyCompatibleReusePicksSharedTenant() {
    registry.registerApp("dedicated", database(uniqueDb(), false));
    ConnectionSupervisor shared = registry.registerApp("billing", database(uniqueDb(), true));

    ConnectionSupervisor reports = registry.registerApp("reports", Map.of("useConnection", true));

    assertSame(shared, reports);
    assertEquals("auto-compatible", eventsOf("connection-reused").get(0).attribute("reuseType"));
  }

  @Test
  void reuseOfDedicatedTenantFallsBackToNewConnection() {
    registry.registerApp("billing", database(uniqueDb(), false));
    Map<String, Object> config = database(uniqueDb(), false);
    config.put("useConnection", "billing");

    ConnectionSupervisor reports = registry.registerApp("reports", config);

    assertNotSame(registry.getApp("billing").orElseThrow(), reports);
    assertEquals(2, handles.created().size());
    LifecycleEvent warning = eventsOf("warning").get(0);
    assertEquals("connection-reuse", warning.attribute("phase"));
  }

  @Test
  void autoOperationsRunInOrder() {
    Map<String, Object> config = database(uniqueDb(), false);
    config.put("migrations.enabled", true);
    config.put("seeds.enabled", true);
    config.put("models.enabled", true);
    config.put("models.definitions", Map.of("Invoice", Map.of("table", "invoices")));

    ConnectionSupervisor supervisor = registry.registerApp("billing", config);

    assertEquals(List.of("migrations.migrate", "seeds.migrate", "models.register"),
        stubs.journal().entries().stream().filter(entry -> !entry.endsWith("initialize")).toList());
    assertTrue(supervisor.hasModel("Invoice"));
    assertEquals(1, eventsOf("auto-migration-completed").size());
    assertEquals(1, eventsOf("auto-seeding-completed").size());
    assertEquals(List.of("Invoice"), eventsOf("auto-models-registered").get(0).attribute("models"));
  }

  @Test
  void failedMigrationRollsBackOnlyAttemptedStepsAndLeavesNoEntry() {
    stubs.setFailMigrate(true);
    Map<String, Object> config = database(uniqueDb(), false);
    config.put("migrations.enabled", true);
    config.put("seeds.enabled", true);

    assertThrows(ComponentException.class, () -> registry.registerApp("billing", config));

    assertFalse(registry.hasApp("billing"));
    assertEquals(1, stubs.journal().count("migrations.rollback"));
    assertEquals(0, stubs.journal().count("seeds.migrate"));
    assertEquals(0, stubs.journal().count("seeds.rollback"));
    assertTrue(handles.last().isClosed());
    assertEquals(1, eventsOf("registration-rollback").size());
    assertTrue(eventsOf("app-registered").isEmpty());
  }

  @Test
  void failedNameCanBeRegisteredAgain() {
    stubs.setFailMigrate(true);
    Map<String, Object> config = database(uniqueDb(), false);
    config.put("migrations.enabled", true);
    assertThrows(TenantDbException.class, () -> registry.registerApp("billing", config));

    stubs.setFailMigrate(false);
    registry.registerApp("billing", config);

    assertTrue(registry.hasApp("billing"));
  }

  @Test
  void failedRegistrationOnSharedConnectionKeepsItAlive() {
    String db = uniqueDb();
    Map<String, Object> billingConfig = database(db, true);
    billingConfig.put("models.enabled", true);
    ConnectionSupervisor billing = registry.registerApp("billing", billingConfig);
    stubs.models().get(0).setFailRegister(true);

    assertThrows(ComponentException.class, () -> registry.registerApp("reports", Map.of(
        "useConnection", "billing",
        "models.enabled", true,
        "models.definitions", Map.of("Report", Map.of("table", "reports")))));

    assertFalse(registry.hasApp("reports"));
    assertTrue(billing.isInitialized());
    assertEquals(1, registry.sharedReferences(fingerprint(db)));
    assertEquals(1, stubs.journal().count("models.clear"));
    assertEquals(1, eventsOf("shared-connection-kept-alive").size());
  }

  @Test
  void unregisterRollsBackAndShutsDownDedicatedConnection() {
    Map<String, Object> config = database(uniqueDb(), false);
    config.put("migrations.enabled", true);
    ConnectionSupervisor supervisor = registry.registerApp("billing", config);

    UnregisterResult result = registry.unregisterApp("billing");

    assertTrue(result.shutdownPerformed());
    assertEquals(0, result.remainingReferences());
    assertEquals(List.of("001_init", "002_accounts"), result.rollback().migrationsRolledBack());
    assertEquals(SupervisorState.SHUTDOWN, supervisor.state());
    assertFalse(registry.hasApp("billing"));
    assertEquals(1, eventsOf("app-unregistered").size());
  }

  @Test
  void unregisterWithoutRollbackSkipsComponents() {
    Map<String, Object> config = database(uniqueDb(), false);
    config.put("migrations.enabled", true);
    registry.registerApp("billing", config);

    UnregisterResult result = registry.unregisterApp("billing", UnregisterOptions.defaults().withoutRollback());

    assertTrue(result.rollback().skipped());
    assertEquals(0, stubs.journal().count("migrations.rollback"));
  }

  @Test
  void componentOptionsNameTheTenantOnSharedConnection() {
    Map<String, Object> billingConfig = database(uniqueDb(), true);
    billingConfig.put("migrations.enabled", true);
    billingConfig.put("seeds.enabled", true);
    registry.registerApp("billing", billingConfig);
    registry.registerApp("reports", Map.of(
        "useConnection", "billing",
        "migrations.enabled", true,
        "seeds.enabled", true));

    registry.unregisterApp("reports");

    StubScripts.Migrations migrations = stubs.migrations().get(0);
    assertEquals(1, stubs.migrations().size());
    assertEquals(List.of("billing", "reports"),
        migrations.migrateOptions().stream().map(options -> options.getString("appName", null)).toList());
    Settings rollback = migrations.rollbackOptions().get(0);
    assertEquals("reports", rollback.getString("appName", null));
    assertEquals(1, rollback.getInt("step", 0));
    assertFalse(rollback.getBoolean("force", true));
    assertEquals("reports", stubs.seeds().get(0).rollbackOptions().get(0).getString("appName", null));
    assertEquals("reports", stubs.seeds().get(0).migrateOptions().get(1).getString("appName", null));
    assertTrue(registry.hasApp("billing"));
  }

  @Test
  void forceCleanupIsPassedToRollbacks() {
    Map<String, Object> config = database(uniqueDb(), false);
    config.put("migrations.enabled", true);
    config.put("seeds.enabled", true);
    registry.registerApp("billing", config);

    registry.unregisterApp("billing", UnregisterOptions.defaults().withForceCleanup());

    assertTrue(stubs.migrations().get(0).rollbackOptions().get(0).getBoolean("force", false));
    assertTrue(stubs.seeds().get(0).rollbackOptions().get(0).getBoolean("force", false));
  }

  @Test
  void failedRegistrationRollsBackWithForce() {
    stubs.setFailMigrate(true);
    Map<String, Object> config = database(uniqueDb(), false);
    config.put("migrations.enabled", true);

    assertThrows(ComponentException.class, () -> registry.registerApp("billing", config));

    Settings rollback = stubs.migrations().get(0).rollbackOptions().get(0);
    assertTrue(rollback.getBoolean("force", false));
    assertEquals("billing", rollback.getString("appName", null));
  }

  @Test
  void sharedConnectionSurvivesUntilLastReference() {
    String db = uniqueDb();
    ConnectionSupervisor supervisor = registry.registerApp("billing", database(db, true));
    registry.registerApp("invoices", database(db, true));
    registry.registerApp("reports", Map.of("useConnection", "billing"));

    UnregisterResult first = registry.unregisterApp("billing");
    UnregisterResult second = registry.unregisterApp("invoices");

    assertFalse(first.shutdownPerformed());
    assertEquals(2, first.remainingReferences());
    assertFalse(second.shutdownPerformed());
    assertTrue(supervisor.isInitialized());
    assertEquals(2, eventsOf("shared-connection-kept-alive").size());

    UnregisterResult last = registry.unregisterApp("reports");

    assertTrue(last.shutdownPerformed());
    assertFalse(supervisor.isInitialized());
    assertTrue(handles.last().isClosed());
    assertTrue(registry.status().sharedReferences().isEmpty());
  }

  @Test
  void unregisterUnknownTenantFails() {
    assertThrows(NotRegisteredException.class, () -> registry.unregisterApp("nobody"));
  }

  @Test
  void shutdownClosesEverySupervisorOnce() {
    String db = uniqueDb();
    ConnectionSupervisor shared = registry.registerApp("billing", database(db, true));
    registry.registerApp("invoices", database(db, true));
    ConnectionSupervisor dedicated = registry.registerApp("audit", database(uniqueDb(), false));

    RegistryShutdownResult result = registry.shutdown(Duration.ofSeconds(10));

    assertTrue(result.success());
    assertEquals(3, result.tenantsRemoved());
    assertEquals(2, result.supervisorsShutdown());
    assertEquals(SupervisorState.SHUTDOWN, shared.state());
    assertEquals(SupervisorState.SHUTDOWN, dedicated.state());
    assertEquals(RegistryState.SHUTDOWN, registry.state());
    assertTrue(registry.appNames().isEmpty());

    RegistryShutdownResult again = registry.shutdown(Duration.ofSeconds(10));
    assertEquals(0, again.supervisorsShutdown());
    assertEquals(1, eventsOf("shutdown-completed").size());
  }

  @Test
  void operationsAfterShutdownAreRejected() {
    registry.close();

    assertThrows(IllegalStateException.class, () -> registry.registerApp("billing", database(uniqueDb(), false)));
    assertThrows(IllegalStateException.class, () -> registry.unregisterApp("billing"));
  }

  @Test
  void registerBeforeInitializeIsRejected() {
    TenantRegistry fresh = TenantRegistry.builder().handleFactory(handles).build();
    try {
      assertThrows(IllegalStateException.class, () -> fresh.registerApp("billing", database(uniqueDb(), false)));
    } finally {
      fresh.close();
    }
  }

  @Test
  void enabledSlotWithoutFactoryFailsRegistration() {
    TenantRegistry plain = TenantRegistry.builder().handleFactory(handles).build();
    plain.initialize();
    try {
      Map<String, Object> config = database(uniqueDb(), false);
      config.put("seeds.enabled", true);

      assertThrows(ConfigurationException.class, () -> plain.registerApp("billing", config));
      assertFalse(plain.hasApp("billing"));
    } finally {
      plain.close();
    }
  }

  @Test
  void tenantSettingsOverrideRegistrySettings() {
    Map<String, Object> config = database(uniqueDb(), false);
    config.put("transactions.enabled", false);

    ConnectionSupervisor supervisor = registry.registerApp("billing", config);

    assertEquals(List.of("securityManager"), supervisor.componentNames());
    assertEquals(5L, supervisor.config().database().validationRetryDelayMs());
  }

  @Test
  void statusListsTenantsInRegistrationOrder() {
    registry.registerApp("zeta", database(uniqueDb(), false));
    registry.registerApp("alpha", database(uniqueDb(), false));

    RegistryStatus status = registry.status();

    assertEquals(RegistryState.INITIALIZED, status.state());
    assertEquals(List.of("zeta", "alpha"), status.tenants());
    assertFalse(status.healthMonitoring());
  }
}

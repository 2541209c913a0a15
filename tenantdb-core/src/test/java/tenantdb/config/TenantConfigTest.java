package tenantdb.config;

import tenantdb.ConfigurationException;
import tenantdb.spi.ComponentSlot;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TenantConfigTest {

  @Test
  void databaseDetailsAreDerivedFromUrl() {
    TenantConfig config = TenantConfig.of(Map.of(
        "database.jdbcUrl", "jdbc:postgresql://db.internal:5433/billing?ssl=true",
        "database.username", "app"));

    DatabaseConfig database = config.database();

    assertEquals("postgresql", database.client());
    assertEquals("db.internal", database.host());
    assertEquals("5433", database.port());
    assertEquals("billing", database.database());
    assertEquals("postgresql_db.internal_5433_billing", database.target().fingerprint());
  }

  @Test
  void h2UrlFingerprintUsesDefaults() {
    DatabaseConfig database = TenantConfig.of(Map.of("database.url", "jdbc:h2:mem:orders;DB_CLOSE_DELAY=-1"))
        .database();

    assertEquals("h2_localhost_default_mem:orders", database.target().fingerprint());
  }

  @Test
  void sameTargetGivesSameFingerprint() {
    String a = TenantConfig.of(Map.of("database.jdbcUrl", "jdbc:mysql://h:3306/app?useSSL=false"))
        .database().target().fingerprint();
    String b = TenantConfig.of(Map.of("database.jdbcUrl", "jdbc:mysql://h:3306/app"))
        .database().target().fingerprint();

    assertEquals(a, b);
  }

  @Test
  void sqlServerDatabaseNamePropertyIsPartOfFingerprint() {
    DatabaseConfig billing = TenantConfig.of(Map.of(
        "database.jdbcUrl", "jdbc:sqlserver://db.local:1433;databaseName=billing;encrypt=false")).database();
    DatabaseConfig payroll = TenantConfig.of(Map.of(
        "database.jdbcUrl", "jdbc:sqlserver://db.local:1433;encrypt=false;DatabaseName=payroll")).database();

    assertEquals("db.local", billing.host());
    assertEquals("1433", billing.port());
    assertEquals("billing", billing.database());
    assertEquals("payroll", payroll.database());
    assertEquals("sqlserver_db.local_1433_billing", billing.target().fingerprint());
    assertNotEquals(billing.target().fingerprint(), payroll.target().fingerprint());
  }

  @Test
  void sharedAcceptsAliases() {
    assertTrue(TenantConfig.of(Map.of("database.reusable", true)).isShared());
    assertTrue(TenantConfig.of(Map.of("shared", "true")).isShared());
    assertFalse(TenantConfig.of(Map.of()).isShared());
  }

  @Test
  void useConnectionValues() {
    assertEquals(Optional.empty(), TenantConfig.of(Map.of()).useConnection());
    assertEquals(Optional.empty(), TenantConfig.of(Map.of("useConnection", false)).useConnection());
    assertEquals(Optional.of(TenantConfig.ANY_COMPATIBLE), TenantConfig.of(Map.of("useConnection", true)).useConnection());
    assertEquals(Optional.of(TenantConfig.ANY_COMPATIBLE), TenantConfig.of(Map.of("useConnection", "global")).useConnection());
    assertEquals(Optional.of("billing"), TenantConfig.of(Map.of("useConnection", "billing")).useConnection());
  }

  @Test
  void withBaseLaysDefaultsUnderneath() {
    TenantConfig config = TenantConfig.of(Map.of("migrations.enabled", true)).withBase(Defaults.settings());

    assertTrue(config.isEnabled(ComponentSlot.MIGRATION));
    assertTrue(config.isEnabled(ComponentSlot.SECURITY));
    assertFalse(config.isEnabled(ComponentSlot.SEED));
    assertEquals(10, config.database().poolMax());
  }

  @Test
  void validateRejectsMissingUrl() {
    DatabaseConfig database = TenantConfig.of(Map.of("database.pool.max", 5)).database();

    ConfigurationException e = assertThrows(ConfigurationException.class, () -> database.validate("t1"));
    assertEquals("t1", e.tenantName());
  }

  @Test
  void validateRejectsInvertedPoolBounds() {
    DatabaseConfig database = TenantConfig.of(Map.of(
        "database.jdbcUrl", "jdbc:h2:mem:x", "database.pool.min", 5, "database.pool.max", 2)).database();

    assertThrows(ConfigurationException.class, () -> database.validate("t1"));
  }

  @Test
  void toStringMasksPassword() {
    DatabaseConfig database = TenantConfig.of(Map.of(
        "database.jdbcUrl", "jdbc:h2:mem:x", "database.password", "s3cret")).database();

    assertFalse(database.toString().contains("s3cret"));
  }
}

package tenantdb.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void tenantCounters() {
    exporter.incrementTenantRegistered();
    exporter.incrementTenantRegistered();
    exporter.incrementTenantRegistrationFailed();
    exporter.incrementTenantUnregistered();

    assertEquals(2.0, counter("tenantdb.tenants.registered").count());
    assertEquals(1.0, counter("tenantdb.tenants.registration.failed").count());
    assertEquals(1.0, counter("tenantdb.tenants.unregistered").count());
  }

  @Test
  void transactionCounters() {
    exporter.incrementTransactionCommitted();
    exporter.incrementTransactionFailed();
    exporter.incrementTransactionTimedOut();
    exporter.incrementTransactionRetried();
    exporter.incrementTransactionRetried();

    assertEquals(1.0, counter("tenantdb.transactions.committed").count());
    assertEquals(1.0, counter("tenantdb.transactions.failed").count());
    assertEquals(1.0, counter("tenantdb.transactions.timed.out").count());
    assertEquals(2.0, counter("tenantdb.transactions.retried").count());
  }

  @Test
  void transactionDurationIsTimed() {
    exporter.recordTransactionDurationMs(120);
    exporter.recordTransactionDurationMs(80);

    Timer timer = registry.find("tenantdb.transactions.duration").timer();
    assertNotNull(timer);
    assertEquals(2, timer.count());
    assertEquals(200.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
  }

  @Test
  void tenantCountGauge() {
    exporter.recordTenantCount(3);
    assertEquals(3.0, gauge("tenantdb.tenants.count").value());

    exporter.recordTenantCount(0);
    assertEquals(0.0, gauge("tenantdb.tenants.count").value());
  }

  @Test
  void healthScoreGaugePerTenant() {
    exporter.recordHealthScore("billing", 95);
    exporter.recordHealthScore("reports", 40);
    exporter.recordHealthScore("billing", 70);

    assertEquals(70.0, registry.find("tenantdb.health.score").tag("tenant", "billing").gauge().value());
    assertEquals(40.0, registry.find("tenantdb.health.score").tag("tenant", "reports").gauge().value());
  }

  @Test
  void customPrefix() {
    SimpleMeterRegistry custom = new SimpleMeterRegistry();
    MicrometerMetricsExporter prefixed = new MicrometerMetricsExporter(custom, "billing.db");
    prefixed.incrementTransactionCommitted();

    assertNotNull(custom.find("billing.db.transactions.committed").counter());
    assertNull(custom.find("tenantdb.transactions.committed").counter());
  }

  @Test
  void rejectsInvalidPrefix() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "tenantdb."));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterCalls() {
    exporter.recordHealthScore("billing", 90);
    exporter.close();

    assertNull(registry.find("tenantdb.tenants.registered").counter());
    assertNull(registry.find("tenantdb.health.score").gauge());

    exporter.incrementTenantRegistered();
    exporter.recordHealthScore("other", 10);
    assertNull(registry.find("tenantdb.health.score").gauge());
  }

  private Counter counter(String name) {
    Counter counter = registry.find(name).counter();
    assertNotNull(counter, "Counter not found: " + name);
    return counter;
  }

  private Gauge gauge(String name) {
    Gauge gauge = registry.find(name).gauge();
    assertNotNull(gauge, "Gauge not found: " + name);
    return gauge;
  }
}

package tenantdb.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tenantdb.micrometer.MicrometerMetricsExporter;
import tenantdb.registry.TenantRegistry;
import tenantdb.spi.MetricsExporter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TenantDbMicrometerAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(TenantDbMicrometerAutoConfiguration.class))
      .withUserConfiguration(MeterRegistryConfig.class);

  @Test
  void createsMicrometerExporterByDefault() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("micrometerMetricsExporter"));
      assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
    });
  }

  @Test
  void respectsCustomNamePrefix() {
    runner.withPropertyValues("tenantdb.metrics.name-prefix=my.tenants").run(ctx -> {
      assertNotNull(ctx.getBean(MicrometerMetricsExporter.class));
      var registry = ctx.getBean(MeterRegistry.class);
      assertNotNull(registry.find("my.tenants.tenants.registered").counter());
    });
  }

  @Test
  void disabledWhenPropertyFalse() {
    runner.withPropertyValues("tenantdb.metrics.enabled=false").run(ctx ->
        assertFalse(ctx.containsBean("micrometerMetricsExporter")));
  }

  @Test
  void backsOffWhenCustomMetricsExporterPresent() {
    runner.withUserConfiguration(CustomExporterConfig.class).run(ctx -> {
      var exporter = ctx.getBean(MetricsExporter.class);
      assertFalse(exporter instanceof MicrometerMetricsExporter);
    });
  }

  @Test
  void registryReportsRegistrationsToMeterRegistry() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(
            TenantDbMicrometerAutoConfiguration.class,
            TenantDbAutoConfiguration.class))
        .withUserConfiguration(MeterRegistryConfig.class)
        .withPropertyValues("tenantdb.tenants.metered.url=jdbc:h2:mem:starter_metered;DB_CLOSE_DELAY=-1")
        .run(ctx -> {
          assertTrue(ctx.getBean(TenantRegistry.class).hasApp("metered"));
          var registry = ctx.getBean(MeterRegistry.class);
          assertEquals(1.0, registry.get("tenantdb.tenants.registered").counter().count());
        });
  }

  @Configuration
  static class MeterRegistryConfig {
    @Bean
    MeterRegistry meterRegistry() {
      return new SimpleMeterRegistry();
    }
  }

  @Configuration
  static class CustomExporterConfig {
    @Bean
    MetricsExporter customExporter() {
      return MetricsExporter.NOOP;
    }
  }
}

package tenantdb.config;

import tenantdb.ConfigurationException;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RegistryConfigTest {

  @Test
  void defaultsComeFromDefaultsLayer() {
    RegistryConfig config = RegistryConfig.from(Defaults.settings());

    assertFalse(config.healthMonitoringEnabled());
    assertEquals(30_000L, config.healthCheckIntervalMs());
    assertEquals(2_000L, config.healthPerformanceThresholdMs());
    assertEquals(30_000L, config.shutdownTimeoutMs());
  }

  @Test
  void probeTimeoutIsHalfTheIntervalCappedAtFiveSeconds() {
    assertEquals(5_000L, RegistryConfig.from(Defaults.settings()).healthProbeTimeoutMs());
    RegistryConfig fast = RegistryConfig.from(Settings.of(Map.of("registry.healthCheckInterval", 2_000L)));
    assertEquals(1_000L, fast.healthProbeTimeoutMs());
  }

  @Test
  void rejectsIntervalBelowOneSecond() {
    Settings settings = Settings.of(Map.of("registry.healthCheckInterval", 500));

    assertThrows(ConfigurationException.class, () -> RegistryConfig.from(settings));
  }

  @Test
  void rejectsShutdownTimeoutBelowFiveSeconds() {
    Settings settings = Settings.of(Map.of("registry.shutdownTimeout", 1_000));

    assertThrows(ConfigurationException.class, () -> RegistryConfig.from(settings));
  }

  @Test
  void rejectsNonPositivePerformanceThreshold() {
    Settings settings = Settings.of(Map.of("registry.healthPerformanceThreshold", 0));

    assertThrows(ConfigurationException.class, () -> RegistryConfig.from(settings));
  }
}

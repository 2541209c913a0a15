package tenantdb.config;

import tenantdb.ConfigurationException;

/**
 * Registry-wide settings read from the {@code registry} section.
 *
 * @param healthMonitoringEnabled      whether the periodic health loop runs
 * @param healthCheckIntervalMs        delay between health cycles, at least 1000
 * @param healthPerformanceThresholdMs probe latency considered acceptable
 * @param shutdownTimeoutMs            per-tenant shutdown deadline, at least 5000
 */
public record RegistryConfig(
    boolean healthMonitoringEnabled,
    long healthCheckIntervalMs,
    long healthPerformanceThresholdMs,
    long shutdownTimeoutMs) {

  public static final long MIN_HEALTH_CHECK_INTERVAL_MS = 1_000L;
  public static final long MIN_SHUTDOWN_TIMEOUT_MS = 5_000L;
  private static final long MAX_PROBE_TIMEOUT_MS = 5_000L;

  public RegistryConfig {
    if (healthCheckIntervalMs < MIN_HEALTH_CHECK_INTERVAL_MS) {
      throw new ConfigurationException("registry.healthCheckInterval must be >= " + MIN_HEALTH_CHECK_INTERVAL_MS
          + "ms, got: " + healthCheckIntervalMs, "configuration", null);
    }
    if (healthPerformanceThresholdMs <= 0) {
      throw new ConfigurationException("registry.healthPerformanceThreshold must be > 0", "configuration", null);
    }
    if (shutdownTimeoutMs < MIN_SHUTDOWN_TIMEOUT_MS) {
      throw new ConfigurationException("registry.shutdownTimeout must be >= " + MIN_SHUTDOWN_TIMEOUT_MS
          + "ms, got: " + shutdownTimeoutMs, "configuration", null);
    }
  }

  public static RegistryConfig from(Settings settings) {
    Settings registry = settings.section("registry");
    return new RegistryConfig(
        registry.getBoolean("enableHealthMonitoring", false),
        registry.getLong("healthCheckInterval", 30_000L),
        registry.getLong("healthPerformanceThreshold", 2_000L),
        registry.getLong("shutdownTimeout", 30_000L));
  }

  /**
   * Deadline for one tenant's probe: half the interval, capped at five seconds.
   */
  public long healthProbeTimeoutMs() {
    return Math.min(healthCheckIntervalMs / 2, MAX_PROBE_TIMEOUT_MS);
  }
}

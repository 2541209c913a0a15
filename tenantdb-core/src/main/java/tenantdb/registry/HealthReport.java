package tenantdb.registry;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Result of one health cycle across all tenants.
 *
 * @param cycleId          {@code health-<n>}
 * @param samples          sample per tenant probed in this cycle
 * @param trends           trend per tenant with history
 * @param averageLatencyMs mean latency of probes that finished, 0 when none did
 * @param durationMs       wall time of the whole cycle
 * @param timestamp        when the cycle finished
 */
public record HealthReport(
    String cycleId,
    Map<String, HealthSample> samples,
    Map<String, HealthTrend> trends,
    double averageLatencyMs,
    long durationMs,
    Instant timestamp) {

  public HealthReport {
    samples = Map.copyOf(samples);
    trends = Map.copyOf(trends);
  }

  public List<String> tenantsWith(HealthStatus status) {
    return samples.values().stream()
        .filter(sample -> sample.status() == status)
        .map(HealthSample::tenantName)
        .sorted()
        .toList();
  }

  public boolean allHealthy() {
    return tenantsWith(HealthStatus.UNHEALTHY).isEmpty() && tenantsWith(HealthStatus.TIMEOUT).isEmpty();
  }
}

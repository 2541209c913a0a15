package tenantdb.registry;

import java.time.Instant;
import java.util.List;

/**
 * One tenant's result in one health cycle.
 *
 * @param tenantName tenant probed
 * @param score      0 to 100
 * @param status     category derived from the score, or {@link HealthStatus#TIMEOUT}
 * @param latencyMs  probe duration
 * @param issues     problems found, e.g. {@code slow-response}
 * @param timestamp  when the probe finished
 */
public record HealthSample(
    String tenantName,
    int score,
    HealthStatus status,
    long latencyMs,
    List<String> issues,
    Instant timestamp) {

  public HealthSample {
    issues = issues == null ? List.of() : List.copyOf(issues);
  }
}

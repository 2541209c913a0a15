package tenantdb.supervisor;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of {@link ConnectionSupervisor#checkHealth()}.
 *
 * @param healthy     the round trip (and revalidation, when needed) succeeded
 * @param tenantName  supervisor name
 * @param latencyMs   time spent on the check
 * @param revalidated full validation ran because the handle had been marked invalid
 * @param issues      problems found
 * @param timestamp   when the check finished
 */
public record HealthCheckResult(
    boolean healthy,
    String tenantName,
    long latencyMs,
    boolean revalidated,
    List<String> issues,
    Instant timestamp) {

  public HealthCheckResult {
    issues = issues == null ? List.of() : List.copyOf(issues);
  }
}

package tenantdb.supervisor;

import java.util.List;

/**
 * Outcome of {@link ConnectionSupervisor#warmPool()}.
 *
 * @param success           at least one connection was warmed
 * @param tenantName        supervisor name
 * @param connectionsWarmed successful warm-up queries
 * @param failedConnections failed warm-up queries
 * @param target            queries issued
 * @param successRate       {@code connectionsWarmed / target} in percent
 * @param errors            individual failure messages
 * @param durationMs        elapsed time
 * @param message           summary
 */
public record WarmPoolResult(
    boolean success,
    String tenantName,
    int connectionsWarmed,
    int failedConnections,
    int target,
    double successRate,
    List<String> errors,
    long durationMs,
    String message) {

  public WarmPoolResult {
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  static WarmPoolResult rejected(String tenantName, String message) {
    return new WarmPoolResult(false, tenantName, 0, 0, 0, 0.0, List.of(message), 0L, message);
  }
}

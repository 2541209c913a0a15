package tenantdb.registry;

import java.util.List;

/**
 * Outcome of {@link TenantRegistry#shutdown(java.time.Duration)}.
 *
 * @param success             every supervisor shut down without error
 * @param tenantsRemoved      tenants registered when shutdown began
 * @param supervisorsShutdown distinct supervisors shut down
 * @param errors              one message per supervisor that failed or timed out
 * @param durationMs          elapsed time
 */
public record RegistryShutdownResult(
    boolean success,
    int tenantsRemoved,
    int supervisorsShutdown,
    List<String> errors,
    long durationMs) {

  public RegistryShutdownResult {
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  static RegistryShutdownResult alreadyShutDown() {
    return new RegistryShutdownResult(true, 0, 0, List.of(), 0L);
  }
}

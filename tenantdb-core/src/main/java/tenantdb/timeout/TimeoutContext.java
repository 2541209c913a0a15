package tenantdb.timeout;

import java.util.Objects;

/**
 * Describes a single deadline-guarded call: what is being done, by which component, for which
 * tenant, and what to run if the deadline elapses first.
 *
 * @param operation  label of the guarded operation, e.g. {@code shutdown}
 * @param component  label of the component performing it, e.g. {@code TransactionCoordinator}
 * @param tenantName tenant the call belongs to, or {@code null}
 * @param cleanup    invoked once on timeout, or {@code null}; its failures are logged and dropped
 */
public record TimeoutContext(String operation, String component, String tenantName, Runnable cleanup) {

  public TimeoutContext {
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(component, "component");
  }

  public static TimeoutContext of(String operation, String component) {
    return new TimeoutContext(operation, component, null, null);
  }

  public TimeoutContext forTenant(String tenantName) {
    return new TimeoutContext(operation, component, tenantName, cleanup);
  }

  public TimeoutContext withCleanup(Runnable cleanup) {
    return new TimeoutContext(operation, component, tenantName, cleanup);
  }
}

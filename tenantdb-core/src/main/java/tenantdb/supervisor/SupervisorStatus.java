package tenantdb.supervisor;

import tenantdb.spi.ComponentStatus;
import tenantdb.spi.DatabaseTarget;
import tenantdb.spi.PoolStats;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot returned by {@link ConnectionSupervisor#status()}.
 *
 * @param name              supervisor name
 * @param state             lifecycle state
 * @param shared            whether other tenants may reuse the handle
 * @param connected         a handle exists and is open
 * @param components        status per enabled component, keyed by component name
 * @param healthyComponents components reporting healthy
 * @param totalComponents   enabled components
 * @param poolWarming       last pool warming progress
 * @param pool              pool statistics, or {@code null} without a handle
 * @param target            database target
 * @param timestamp         when the snapshot was taken
 */
public record SupervisorStatus(
    String name,
    SupervisorState state,
    boolean shared,
    boolean connected,
    Map<String, ComponentStatus> components,
    int healthyComponents,
    int totalComponents,
    PoolWarmingStatus poolWarming,
    PoolStats pool,
    DatabaseTarget target,
    Instant timestamp) {

  public SupervisorStatus {
    components = components == null ? Map.of() : Map.copyOf(components);
  }

  public boolean initialized() {
    return state == SupervisorState.INITIALIZED;
  }
}

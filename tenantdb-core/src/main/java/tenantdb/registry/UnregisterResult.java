package tenantdb.registry;

import tenantdb.supervisor.ConnectionSupervisor;

/**
 * Outcome of {@link TenantRegistry#unregisterApp(String)}.
 *
 * @param tenantName        tenant removed
 * @param supervisor        the supervisor the tenant was bound to
 * @param shutdownPerformed the supervisor was shut down (last reference or not shared)
 * @param remainingReferences tenants still sharing the handle
 * @param rollback          rollback outcome
 */
public record UnregisterResult(
    String tenantName,
    ConnectionSupervisor supervisor,
    boolean shutdownPerformed,
    int remainingReferences,
    RollbackReport rollback) {
}

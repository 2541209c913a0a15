/**
 * Per-tenant connection supervision.
 *
 * <p>{@link tenantdb.supervisor.ConnectionSupervisor} builds and validates one database handle,
 * creates the enabled sub-components from {@link tenantdb.supervisor.ComponentFactories}, warms
 * the pool and shuts everything down in reverse order.
 */
package tenantdb.supervisor;

/**
 * Multi-tenant database connection orchestration.
 *
 * <p>The entry point is {@link tenantdb.registry.TenantRegistry}, which creates one
 * {@link tenantdb.supervisor.ConnectionSupervisor} per tenant (or shares one between tenants
 * pointing at the same database), runs configured migrations, seeds and model registration,
 * and supervises health until shutdown.
 *
 * <p>All failures extend {@link tenantdb.TenantDbException}.
 */
package tenantdb;

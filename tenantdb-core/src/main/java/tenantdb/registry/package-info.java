/**
 * Tenant registry: registration with connection sharing and rollback, reference-counted shared
 * handles, periodic health scoring and parallel shutdown.
 *
 * @see tenantdb.registry.TenantRegistry
 */
package tenantdb.registry;

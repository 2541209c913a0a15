/**
 * Spring Boot auto-configuration for the tenant registry.
 *
 * <p>Tenants declared under {@code tenantdb.tenants.<name>} are registered when the
 * {@link tenantdb.registry.TenantRegistry} bean is created, in declaration order, and the
 * registry is shut down with the application context.
 */
package tenantdb.spring.boot;

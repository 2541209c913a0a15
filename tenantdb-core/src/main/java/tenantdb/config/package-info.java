/**
 * Layered configuration: {@link tenantdb.config.Settings} trees merged over
 * {@link tenantdb.config.Defaults}, read through typed views.
 */
package tenantdb.config;

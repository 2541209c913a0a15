/**
 * Engine dialects: schema probes and vendor transient error codes, discovered through
 * {@link java.util.ServiceLoader}.
 */
package tenantdb.jdbc.dialect;

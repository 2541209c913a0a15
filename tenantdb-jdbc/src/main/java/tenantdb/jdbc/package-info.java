/**
 * JDBC handles: a HikariCP-pooled {@link tenantdb.jdbc.HikariHandleFactory} and a
 * {@link tenantdb.jdbc.DataSourceHandle} for application-managed data sources.
 */
package tenantdb.jdbc;

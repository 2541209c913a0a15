/**
 * Service provider interfaces: database handles and dialects, the sub-component contracts a
 * connection supervisor composes, and the metrics hook.
 */
package tenantdb.spi;

/**
 * Deadline guards for blocking and asynchronous operations.
 *
 * @see tenantdb.timeout.TimeoutController
 */
package tenantdb.timeout;

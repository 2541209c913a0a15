/**
 * Transaction execution with per-attempt deadlines, transient-error retries and a sweep for
 * transactions that never finish.
 *
 * @see tenantdb.tx.TransactionCoordinator
 */
package tenantdb.tx;

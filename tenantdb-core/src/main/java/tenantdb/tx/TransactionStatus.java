package tenantdb.tx;

/**
 * Lifecycle status of a transaction record.
 */
public enum TransactionStatus {
  ACTIVE,
  COMMITTED,
  FAILED,
  TIMED_OUT
}

package tenantdb;

/**
 * Thrown when a transaction is refused because the concurrency ceiling is reached.
 */
public final class TransactionLimitExceededException extends TenantDbException {

  public TransactionLimitExceededException(String tenantName, int limit) {
    super("Maximum concurrent transactions reached (" + limit + ")", "transaction", tenantName);
  }
}

package tenantdb;

/**
 * Terminal failure of a transaction after its retry budget was spent, or on the first
 * non-transient error.
 */
public final class TransactionFailedException extends TenantDbException {
  private final String transactionId;
  private final int attempts;

  public TransactionFailedException(String transactionId, String tenantName, int attempts, Throwable cause) {
    super("Transaction failed for connection '" + tenantName + "' after " + attempts
        + (attempts == 1 ? " attempt: " : " attempts: ")
        + (cause == null ? "unknown error" : cause.getMessage()), "transaction", tenantName, cause);
    this.transactionId = transactionId;
    this.attempts = attempts;
  }

  public String transactionId() {
    return transactionId;
  }

  public int attempts() {
    return attempts;
  }
}

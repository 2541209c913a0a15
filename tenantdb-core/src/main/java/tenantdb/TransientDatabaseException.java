package tenantdb;

/**
 * Signals a database failure expected to clear up on retry: deadlocks, lock-wait timeouts,
 * dropped connections and serialization failures.
 *
 * <p>A unit of work may throw this directly to ask the transaction coordinator for another
 * attempt.
 */
public final class TransientDatabaseException extends TenantDbException {

  public TransientDatabaseException(String message, String tenantName, Throwable cause) {
    super(message, "transaction", tenantName, cause);
  }

  public TransientDatabaseException(String message) {
    this(message, null, null);
  }
}

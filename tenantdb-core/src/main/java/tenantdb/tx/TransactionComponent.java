package tenantdb.tx;

import tenantdb.spi.LifecycleComponent;

import java.util.List;

/**
 * Transaction slot of a connection supervisor.
 *
 * @see TransactionCoordinator
 */
public interface TransactionComponent extends LifecycleComponent {

  /**
   * Runs {@code work} in a transaction, retrying transient failures.
   *
   * @throws tenantdb.TransactionFailedException           when the work finally fails
   * @throws tenantdb.TransactionLimitExceededException    when the concurrency ceiling is reached
   */
  <T> T run(UnitOfWork<T> work, TransactionOptions options);

  /**
   * Force-rolls-back an active transaction.
   *
   * @return false if no active transaction has that id
   */
  boolean abortTransaction(String transactionId);

  TransactionMetrics metrics();

  List<TransactionRecord> activeTransactions();

  List<TransactionRecord> history();
}

package tenantdb.tx;

/**
 * Aggregate counters of a {@link TransactionCoordinator}.
 *
 * @param totalTransactions  transactions started
 * @param successful         committed
 * @param failed             failed terminally or aborted
 * @param timedOut           force-rolled-back by the sweep
 * @param totalAttempts      attempts across all transactions
 * @param retries            attempts that were retries
 * @param totalDurationMs    summed duration of finished transactions
 * @param longestDurationMs  longest finished transaction
 * @param active             currently active
 */
public record TransactionMetrics(
    long totalTransactions,
    long successful,
    long failed,
    long timedOut,
    long totalAttempts,
    long retries,
    long totalDurationMs,
    long longestDurationMs,
    int active) {

  public long finished() {
    return successful + failed + timedOut;
  }

  public double averageDurationMs() {
    long finished = finished();
    return finished == 0 ? 0.0 : (double) totalDurationMs / finished;
  }

  /**
   * Committed share of finished transactions, in percent. 100 when nothing finished yet.
   */
  public double successRate() {
    long finished = finished();
    return finished == 0 ? 100.0 : successful * 100.0 / finished;
  }
}

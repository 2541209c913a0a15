package tenantdb.tx;

/**
 * Strategy for the delay before retrying a failed transaction attempt.
 *
 * @see LinearBackoffRetryPolicy
 */
public interface RetryPolicy {

  /**
   * Computes the delay in milliseconds before the next attempt.
   *
   * @param attempts attempts made so far (1-based)
   * @return delay in milliseconds (non-negative)
   */
  long computeDelayMs(int attempts);
}

package tenantdb.spi;

/**
 * Observability hook for exporting registry, transaction and health metrics.
 *
 * <p>The {@link #NOOP} instance discards everything. {@code tenantdb-micrometer} bridges to a
 * Micrometer {@code MeterRegistry}.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of tenants registered successfully.
   */
  void incrementTenantRegistered();

  /**
   * Increments the count of registrations that failed and were rolled back.
   */
  void incrementTenantRegistrationFailed();

  /**
   * Increments the count of tenants unregistered.
   */
  void incrementTenantUnregistered();

  /**
   * Increments the count of committed transactions.
   */
  void incrementTransactionCommitted();

  /**
   * Increments the count of transactions that failed terminally.
   */
  void incrementTransactionFailed();

  /**
   * Increments the count of transactions force-rolled-back for exceeding their maximum age.
   */
  default void incrementTransactionTimedOut() {
  }

  /**
   * Increments the count of transaction attempts retried after a transient failure.
   */
  default void incrementTransactionRetried() {
  }

  /**
   * Records the duration of a finished transaction, all attempts included.
   *
   * @param durationMs duration in milliseconds (non-negative)
   */
  default void recordTransactionDurationMs(long durationMs) {
  }

  /**
   * Records the latest health score of a tenant.
   *
   * @param tenantName tenant name
   * @param score      score from 0 to 100
   */
  default void recordHealthScore(String tenantName, int score) {
  }

  /**
   * Records the number of registered tenants.
   */
  void recordTenantCount(int tenants);

  final class Noop implements MetricsExporter {
    @Override
    public void incrementTenantRegistered() {
    }

    @Override
    public void incrementTenantRegistrationFailed() {
    }

    @Override
    public void incrementTenantUnregistered() {
    }

    @Override
    public void incrementTransactionCommitted() {
    }

    @Override
    public void incrementTransactionFailed() {
    }

    @Override
    public void recordTenantCount(int tenants) {
    }
  }
}

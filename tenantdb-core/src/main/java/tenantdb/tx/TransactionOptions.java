package tenantdb.tx;

import tenantdb.spi.Handle;

import java.util.Objects;

/**
 * Per-call options of {@link TransactionCoordinator#run}.
 *
 * @param handle         handle to open the transaction on
 * @param isolationLevel isolation level, or {@code null} for the configured default
 * @param timeoutMs      per-attempt deadline, or {@code null} for the configured default
 */
public record TransactionOptions(Handle handle, IsolationLevel isolationLevel, Long timeoutMs) {

  public TransactionOptions {
    Objects.requireNonNull(handle, "handle");
    if (timeoutMs != null && timeoutMs <= 0) {
      throw new IllegalArgumentException("timeoutMs must be > 0, got: " + timeoutMs);
    }
  }

  public static TransactionOptions on(Handle handle) {
    return new TransactionOptions(handle, null, null);
  }

  public TransactionOptions withIsolation(IsolationLevel level) {
    return new TransactionOptions(handle, level, timeoutMs);
  }

  public TransactionOptions withTimeoutMs(long timeoutMs) {
    return new TransactionOptions(handle, isolationLevel, timeoutMs);
  }
}

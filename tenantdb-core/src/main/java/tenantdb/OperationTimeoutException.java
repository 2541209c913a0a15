package tenantdb;

import tenantdb.timeout.TimeoutContext;

/**
 * Thrown when an operation did not settle before its deadline.
 *
 * <p>The timed-out operation may still be running in the background unless it honored a
 * {@link tenantdb.timeout.CancellationSignal}.
 */
public final class OperationTimeoutException extends TenantDbException {
  private final long durationMs;
  private final transient TimeoutContext context;

  public OperationTimeoutException(long durationMs, TimeoutContext context) {
    super("Operation '" + context.operation() + "' in " + context.component()
        + " timed out after " + durationMs + "ms", context.operation(), context.tenantName());
    this.durationMs = durationMs;
    this.context = context;
  }

  public long durationMs() {
    return durationMs;
  }

  public TimeoutContext context() {
    return context;
  }
}

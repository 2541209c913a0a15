package tenantdb.registry;

import java.time.Duration;

/**
 * Options for {@link TenantRegistry#unregisterApp(String, UnregisterOptions)}.
 *
 * @param timeout      deadline for shutting the supervisor down, or {@code null} for the
 *                     registry's {@code shutdownTimeout}
 * @param skipRollback do not clear models or roll back seeds and migrations first
 * @param forceCleanup passed to the seed and migration rollbacks as {@code force}
 */
public record UnregisterOptions(Duration timeout, boolean skipRollback, boolean forceCleanup) {

  public UnregisterOptions {
    if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
      throw new IllegalArgumentException("timeout must be > 0");
    }
  }

  public static UnregisterOptions defaults() {
    return new UnregisterOptions(null, false, false);
  }

  public UnregisterOptions withTimeout(Duration timeout) {
    return new UnregisterOptions(timeout, skipRollback, forceCleanup);
  }

  public UnregisterOptions withoutRollback() {
    return new UnregisterOptions(timeout, true, forceCleanup);
  }

  public UnregisterOptions withForceCleanup() {
    return new UnregisterOptions(timeout, skipRollback, true);
  }
}

package tenantdb;

import java.time.Instant;

/**
 * Base class for every failure raised by tenantdb.
 *
 * <p>Each instance records the lifecycle phase that failed, the tenant (or connection) it
 * concerns when known, and the moment it was raised, so that callers can reconstruct which
 * step of a multi-step operation broke.
 */
public class TenantDbException extends RuntimeException {
  private final String phase;
  private final String tenantName;
  private final Instant timestamp;

  public TenantDbException(String message, String phase, String tenantName) {
    this(message, phase, tenantName, null);
  }

  public TenantDbException(String message, String phase, String tenantName, Throwable cause) {
    super(message, cause);
    this.phase = phase;
    this.tenantName = tenantName;
    this.timestamp = Instant.now();
  }

  /** Lifecycle phase in which the failure occurred, e.g. {@code initialize} or {@code auto-migrate}. */
  public String phase() {
    return phase;
  }

  /** Tenant or connection name, or {@code null} when the failure is not tenant-scoped. */
  public String tenantName() {
    return tenantName;
  }

  public Instant timestamp() {
    return timestamp;
  }
}

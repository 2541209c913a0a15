package tenantdb;

/**
 * Thrown when a database handle could not be created or did not pass validation
 * within the configured number of attempts.
 */
public final class ConnectionValidationException extends TenantDbException {
  private final int attempts;

  public ConnectionValidationException(String message, String tenantName, int attempts, Throwable cause) {
    super(message, "connection-validation", tenantName, cause);
    this.attempts = attempts;
  }

  public int attempts() {
    return attempts;
  }
}

package tenantdb;

/**
 * Thrown when required configuration is missing or invalid. Never retried.
 */
public final class ConfigurationException extends TenantDbException {

  public ConfigurationException(String message, String phase, String tenantName) {
    super(message, phase, tenantName);
  }

  public ConfigurationException(String message, String phase, String tenantName, Throwable cause) {
    super(message, phase, tenantName, cause);
  }
}

package tenantdb;

/**
 * Thrown when an operation names a tenant the registry does not know.
 */
public final class NotRegisteredException extends TenantDbException {

  public NotRegisteredException(String tenantName, String phase) {
    super("Tenant '" + tenantName + "' is not registered", phase, tenantName);
  }
}

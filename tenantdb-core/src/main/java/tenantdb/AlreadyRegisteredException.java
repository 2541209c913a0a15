package tenantdb;

/**
 * Thrown when a tenant name is registered twice.
 */
public final class AlreadyRegisteredException extends TenantDbException {

  public AlreadyRegisteredException(String tenantName) {
    super("Tenant '" + tenantName + "' is already registered", "register", tenantName);
  }
}
